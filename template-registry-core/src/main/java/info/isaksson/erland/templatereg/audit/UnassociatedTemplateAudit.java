package info.isaksson.erland.templatereg.audit;

import info.isaksson.erland.templatereg.registry.InlineTemplateKey;
import info.isaksson.erland.templatereg.registry.TemplateRegistries;
import info.isaksson.erland.templatereg.warnings.RegistryWarning;
import info.isaksson.erland.templatereg.warnings.WarningSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;

/**
 * Final phase of a run: reports templates that no view claimed.
 *
 * <p>Inline templates are reported per module; file templates are reported in a single warning.</p>
 */
public final class UnassociatedTemplateAudit {

    private static final Logger LOGGER = LoggerFactory.getLogger(UnassociatedTemplateAudit.class);

    private final WarningSink warnings;

    public UnassociatedTemplateAudit(WarningSink warnings) {
        this.warnings = Objects.requireNonNull(warnings, "warnings");
    }

    public AuditResult audit(TemplateRegistries registries) {
        SortedSet<InlineTemplateKey> inline = registries.unassociatedInlineTemplates();
        SortedSet<Path> files = registries.unassociatedFileTemplates();

        Map<String, List<String>> inlineByModule = new TreeMap<>();
        for (InlineTemplateKey key : inline) {
            inlineByModule.computeIfAbsent(key.module(), m -> new ArrayList<>()).add(key.name());
        }
        for (Map.Entry<String, List<String>> e : inlineByModule.entrySet()) {
            String names = String.join(", ", e.getValue());
            warnings.warn(RegistryWarning.UNASSOCIATED_INLINE_TEMPLATE,
                    "Found the following unassociated template(s) in module '" + e.getKey() + "': " + names
                            + ". Define views that use the template(s) or remove them.",
                    Map.of("module", e.getKey(), "templates", names));
        }

        if (!files.isEmpty()) {
            List<String> paths = new ArrayList<>(files.size());
            for (Path p : files) paths.add(p.toString());
            String joined = String.join(", ", paths);
            warnings.warn(RegistryWarning.UNASSOCIATED_FILE_TEMPLATE,
                    "Found the following unassociated template(s) when registering views: " + joined
                            + ". Define views that use the template(s) or remove them.",
                    Map.of("templates", joined));
        }

        AuditResult result = new AuditResult(files, inline);
        LOGGER.info("Template audit: {} unassociated file template(s), {} unassociated inline template(s)",
                files.size(), inline.size());
        return result;
    }
}
