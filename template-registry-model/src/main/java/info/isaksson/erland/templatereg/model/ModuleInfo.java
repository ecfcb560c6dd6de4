package info.isaksson.erland.templatereg.model;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Introspection facts about a module that owns templates.
 *
 * <p>Inline templates are keyed by {@link #dottedName()}; file templates are keyed by the resolved
 * template directory, so two modules pointing at the same directory share its templates.</p>
 */
public interface ModuleInfo {

    /** Suffix appended to {@link #name()} when no explicit template directory is configured. */
    String DEFAULT_TEMPLATE_DIR_SUFFIX = "_templates";

    /** Fully qualified dotted name, e.g. {@code app.views.mammoth}. */
    String dottedName();

    /** Last segment of the dotted name. */
    default String name() {
        String dotted = dottedName();
        int idx = dotted.lastIndexOf('.');
        return idx < 0 ? dotted : dotted.substring(idx + 1);
    }

    /** Packages never own a template directory of their own. */
    boolean isPackage();

    /** Resolve a resource located next to this module. The path may not exist. */
    Path resourcePath(String name);

    /** Explicitly configured template directory name, if any. */
    default Optional<String> templateDirName() {
        return Optional.empty();
    }

    /** The template directory name in effect: the explicit one, or {@code name() + "_templates"}. */
    default String effectiveTemplateDirName() {
        return templateDirName().orElse(name() + DEFAULT_TEMPLATE_DIR_SUFFIX);
    }
}
