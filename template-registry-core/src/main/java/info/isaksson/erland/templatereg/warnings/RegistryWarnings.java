package info.isaksson.erland.templatereg.warnings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collecting {@link WarningSink}. Every warning is also logged.
 *
 * <p>{@link #all()} keeps arrival order.</p>
 */
public final class RegistryWarnings implements WarningSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(RegistryWarnings.class);

    private final List<RegistryWarning> warnings = new ArrayList<>();

    @Override
    public void warn(String code, String message, Map<String, String> context) {
        RegistryWarning w = new RegistryWarning(code, message, context == null ? Collections.emptyMap() : context);
        warnings.add(w);
        LOGGER.warn("{}", w);
    }

    public int size() {
        return warnings.size();
    }

    public List<RegistryWarning> all() {
        return Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public List<RegistryWarning> withCode(String code) {
        List<RegistryWarning> out = new ArrayList<>();
        for (RegistryWarning w : warnings) {
            if (w.code.equals(code)) out.add(w);
        }
        return out;
    }

    /** Warnings ordered by code, then message, then key-sorted context; used for reports. */
    public List<RegistryWarning> toDeterministicList() {
        List<RegistryWarning> out = new ArrayList<>(warnings);
        out.sort(Comparator
                .comparing((RegistryWarning w) -> w.code)
                .thenComparing(w -> w.message)
                .thenComparing(w -> new TreeMap<>(w.context).toString()));
        return Collections.unmodifiableList(out);
    }
}
