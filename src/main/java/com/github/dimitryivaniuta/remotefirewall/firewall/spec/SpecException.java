package com.github.dimitryivaniuta.remotefirewall.firewall.spec;

import lombok.Getter;

/**
 * Malformed declarative parameter spec. Raised at registration time only.
 */
@Getter
public class SpecException extends RuntimeException {

    /**
     * Zero-based parameter position, or -1 when the problem is not tied to one parameter.
     */
    private final int position;
    private final String token;

    public SpecException(String message, int position, String token) {
        super(message + (position >= 0 ? " (param #" + position + ", token '" + token + "')" : ""));
        this.position = position;
        this.token = token;
    }

    public SpecException(String message) {
        this(message, -1, null);
    }
}
