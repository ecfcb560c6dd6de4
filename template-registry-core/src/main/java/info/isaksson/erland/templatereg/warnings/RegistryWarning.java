package info.isaksson.erland.templatereg.warnings;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A non-fatal warning produced while registering or auditing templates. */
public final class RegistryWarning {

    /** Unrecognized extension in a scanned template directory. */
    public static final String UNRECOGNIZED_EXTENSION = "UNRECOGNIZED_EXTENSION";
    /** Inline template that no view claimed. */
    public static final String UNASSOCIATED_INLINE_TEMPLATE = "UNASSOCIATED_INLINE_TEMPLATE";
    /** File template that no view claimed. */
    public static final String UNASSOCIATED_FILE_TEMPLATE = "UNASSOCIATED_FILE_TEMPLATE";

    /** Warning code stable across versions. */
    public final String code;

    /** Human-readable message. */
    public final String message;

    /** Optional structured context (stable keys recommended). */
    public final Map<String, String> context;

    public RegistryWarning(String code, String message, Map<String, String> context) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        if (context == null || context.isEmpty()) {
            this.context = Collections.emptyMap();
        } else {
            this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        }
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
