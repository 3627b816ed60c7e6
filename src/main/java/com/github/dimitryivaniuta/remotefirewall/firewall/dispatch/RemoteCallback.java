package com.github.dimitryivaniuta.remotefirewall.firewall.dispatch;

import com.github.dimitryivaniuta.remotefirewall.firewall.value.RemoteValue;

import java.util.List;

/**
 * Application logic behind an endpoint. Only ever invoked with arguments that passed validation.
 *
 * <p>{@code args} is padded with absent values up to the declared parameter count.
 * Returning {@code null} (or an empty Optional) means "no data".
 */
@FunctionalInterface
public interface RemoteCallback {

    Object handle(String callerId, long logIndex, List<RemoteValue> args) throws Exception;
}
