package com.github.dimitryivaniuta.remotefirewall.firewall.annotations;

import com.github.dimitryivaniuta.remotefirewall.firewall.dispatch.RemoteCallKind;

import java.lang.annotation.*;

/**
 * Registers a bean method as a remote endpoint behind the firewall pipeline.
 *
 * Typical usage:
 * <pre>
 *   @RemoteEndpoint(name = "PurchaseItem", params = {"itemId", "string", "qty", "range[1,10]"})
 *   public Object purchase(String callerId, long logIndex, List&lt;RemoteValue&gt; args) { ... }
 * </pre>
 *
 * Notes:
 * - The method signature must be exactly {@code (String, long, List<RemoteValue>)}.
 * - A malformed {@code params} declaration fails application startup.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface RemoteEndpoint {

    /**
     * Stable endpoint name the transport routes by.
     */
    String name();

    RemoteCallKind kind() default RemoteCallKind.FUNCTION;

    /**
     * Alternating parameter names and type tokens.
     */
    String[] params() default {};

    /**
     * Record a call log entry for every call, regardless of the sample rate.
     */
    boolean forceLogging() default false;
}
