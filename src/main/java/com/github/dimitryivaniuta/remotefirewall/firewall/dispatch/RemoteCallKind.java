package com.github.dimitryivaniuta.remotefirewall.firewall.dispatch;

public enum RemoteCallKind {
    /**
     * Fire-and-forget: the caller never sees a result.
     */
    EVENT,
    /**
     * Request/response: the caller receives the callback's value or a failure sentinel.
     */
    FUNCTION
}
