package com.github.dimitryivaniuta.remotefirewall.firewall.audit;

import java.util.Locale;

/**
 * Terminal state of a logged call; PENDING until the dispatcher finishes it.
 */
public enum CallOutcome {
    PENDING,
    COMPLETED,
    REJECTED_MIDDLEWARE,
    REJECTED_RATE_LIMIT,
    REJECTED_VALIDATION,
    CALLBACK_ERROR;

    public boolean isRejection() {
        return this == REJECTED_MIDDLEWARE || this == REJECTED_RATE_LIMIT || this == REJECTED_VALIDATION;
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
