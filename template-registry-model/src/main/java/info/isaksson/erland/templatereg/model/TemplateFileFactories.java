package info.isaksson.erland.templatereg.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Extension to {@link TemplateFileFactory} table.
 *
 * <p>Extensions are stored without the leading dot and compared case-sensitively, so {@code pt}
 * and {@code PT} are different extensions.</p>
 */
public final class TemplateFileFactories {

    /** Extension registered by {@link #defaults()}. */
    public static final String PAGE_TEMPLATE_EXTENSION = "pt";

    private final Map<String, TemplateFileFactory> byExtension = new LinkedHashMap<>();

    /** Table with {@link FileTemplate} registered for {@code pt}. */
    public static TemplateFileFactories defaults() {
        return withPlainFileTemplates(List.of(PAGE_TEMPLATE_EXTENSION));
    }

    /** Table mapping every given extension to {@link FileTemplate}. */
    public static TemplateFileFactories withPlainFileTemplates(List<String> extensions) {
        TemplateFileFactories out = new TemplateFileFactories();
        for (String ext : extensions) {
            out.register(ext, FileTemplate::new);
        }
        return out;
    }

    public TemplateFileFactories register(String extension, TemplateFileFactory factory) {
        String ext = normalize(extension);
        if (ext.isEmpty()) {
            throw new IllegalArgumentException("extension must not be blank");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory must not be null for extension '" + ext + "'");
        }
        byExtension.put(ext, factory);
        return this;
    }

    public Optional<TemplateFileFactory> factoryFor(String extension) {
        if (extension == null) return Optional.empty();
        return Optional.ofNullable(byExtension.get(normalize(extension)));
    }

    public Set<String> extensions() {
        return Collections.unmodifiableSet(new TreeSet<>(byExtension.keySet()));
    }

    private static String normalize(String extension) {
        if (extension == null) return "";
        String s = extension.trim();
        if (s.startsWith(".")) s = s.substring(1);
        return s;
    }

    @Override
    public String toString() {
        return "TemplateFileFactories" + extensions();
    }
}
