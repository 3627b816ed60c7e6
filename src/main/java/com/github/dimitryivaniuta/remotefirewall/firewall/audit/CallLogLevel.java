package com.github.dimitryivaniuta.remotefirewall.firewall.audit;

public enum CallLogLevel {
    INFO,
    ERROR
}
