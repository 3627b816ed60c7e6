package com.github.dimitryivaniuta.remotefirewall.firewall.dispatch;

/**
 * Invalid registration request (duplicate name, missing callback, bad annotated signature).
 */
public class EndpointRegistrationException extends RuntimeException {

    public EndpointRegistrationException(String message) {
        super(message);
    }
}
