package com.github.dimitryivaniuta.remotefirewall;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class RemoteFirewallApplication {

    public static void main(String[] args) {
        SpringApplication.run(RemoteFirewallApplication.class, args);
    }
}
