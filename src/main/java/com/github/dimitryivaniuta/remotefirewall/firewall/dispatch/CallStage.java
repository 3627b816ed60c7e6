package com.github.dimitryivaniuta.remotefirewall.firewall.dispatch;

/**
 * Pipeline stage at which a call terminated unsuccessfully.
 */
public enum CallStage {
    ROUTING,
    MIDDLEWARE,
    RATE_LIMIT,
    VALIDATION,
    CALLBACK
}
