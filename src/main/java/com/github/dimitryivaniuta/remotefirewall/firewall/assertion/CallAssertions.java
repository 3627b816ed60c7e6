package com.github.dimitryivaniuta.remotefirewall.firewall.assertion;

import com.github.dimitryivaniuta.remotefirewall.firewall.audit.CallLogService;
import com.github.dimitryivaniuta.remotefirewall.firewall.spec.SpecException;
import com.github.dimitryivaniuta.remotefirewall.firewall.spec.TypeDescriptor;
import com.github.dimitryivaniuta.remotefirewall.firewall.spec.TypeSpecCompiler;
import com.github.dimitryivaniuta.remotefirewall.firewall.value.RemoteValue;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks for use inside endpoint callbacks.
 *
 * <p>Each check returns whether it held. A failed check appends one ERROR event to the call's
 * log entry; a passing check appends nothing. Evicted or unsampled indices make logging a no-op.
 */
@Component
@RequiredArgsConstructor
public class CallAssertions {

    private final CallLogService callLog;

    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();
    private final Map<String, TypeDescriptor> types = new ConcurrentHashMap<>();

    public boolean assertInRange(long logIndex, RemoteValue value, double min, double max) {
        boolean ok = value != null && value.is(RemoteValue.Kind.NUMBER)
                && value.asNumber() >= min && value.asNumber() <= max;
        return check(logIndex, ok, "assertInRange", value + " not in [" + min + ", " + max + "]");
    }

    public boolean assertInRange(long logIndex, double value, double min, double max) {
        return assertInRange(logIndex, RemoteValue.of(value), min, max);
    }

    /**
     * Value must equal one of {@code allowed}; plain Java values are compared after wrapping.
     */
    public boolean assertInList(long logIndex, RemoteValue value, Collection<?> allowed) {
        boolean ok = false;
        if (value != null && allowed != null) {
            for (Object candidate : allowed) {
                if (RemoteValue.wrap(candidate).equals(value)) {
                    ok = true;
                    break;
                }
            }
        }
        return check(logIndex, ok, "assertInList", value + " not in " + allowed);
    }

    /**
     * Whole-string regex match.
     *
     * @throws IllegalArgumentException if {@code regex} does not compile; that is a programming error
     */
    public boolean assertStringPattern(long logIndex, RemoteValue value, String regex) {
        Pattern p = patterns.computeIfAbsent(regex, r -> {
            try {
                return Pattern.compile(r);
            } catch (PatternSyntaxException ex) {
                throw new IllegalArgumentException("Invalid assertion pattern: " + r, ex);
            }
        });
        boolean ok = value != null && value.is(RemoteValue.Kind.STRING) && p.matcher(value.asString()).matches();
        return check(logIndex, ok, "assertStringPattern", value + " does not match /" + regex + "/");
    }

    public boolean assertStringPattern(long logIndex, String value, String regex) {
        return assertStringPattern(logIndex, RemoteValue.of(value), regex);
    }

    public boolean assertStringLength(long logIndex, RemoteValue value, int minLength, int maxLength) {
        boolean ok = value != null && value.is(RemoteValue.Kind.STRING)
                && value.asString().length() >= minLength && value.asString().length() <= maxLength;
        return check(logIndex, ok, "assertStringLength",
                value + " length not in [" + minLength + ", " + maxLength + "]");
    }

    /**
     * Checks against a type token of the parameter grammar, e.g. {@code "integer"} or {@code "string|number"}.
     *
     * @throws SpecException if the token is malformed
     */
    public boolean assertType(long logIndex, RemoteValue value, String typeToken) {
        TypeDescriptor d = types.computeIfAbsent(typeToken, t -> TypeSpecCompiler.parse(t, -1));
        boolean ok = d.accepts(value == null ? RemoteValue.absent() : value);
        return check(logIndex, ok, "assertType", value + " is not " + d.describe());
    }

    public boolean assertNotAbsent(long logIndex, RemoteValue value, String what) {
        return check(logIndex, value != null && !value.isAbsent(), "assertNotAbsent", what + " is absent");
    }

    public boolean assertTrue(long logIndex, boolean condition, String message) {
        return check(logIndex, condition, "assertTrue", message);
    }

    private boolean check(long logIndex, boolean ok, String name, String detail) {
        if (!ok) {
            callLog.error(logIndex, name + " failed: " + detail);
        }
        return ok;
    }
}
