package info.isaksson.erland.templatereg.warnings;

import java.util.Map;

/**
 * Receives recoverable anomalies. Implementations must not throw; callers never branch on a warning.
 */
@FunctionalInterface
public interface WarningSink {

    void warn(String code, String message, Map<String, String> context);

    /** Sink that drops everything. */
    static WarningSink ignoring() {
        return (code, message, context) -> { };
    }
}
