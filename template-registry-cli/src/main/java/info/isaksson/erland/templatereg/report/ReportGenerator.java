package info.isaksson.erland.templatereg.report;

import info.isaksson.erland.templatereg.core.TemplateRegistryResult;
import info.isaksson.erland.templatereg.model.ModuleInfo;
import info.isaksson.erland.templatereg.registry.InlineTemplateKey;
import info.isaksson.erland.templatereg.warnings.RegistryWarning;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Human-readable markdown report of a registration run.
 *
 * NOTE: "unassociated" templates were registered but no declared view claimed them. They are
 * usually leftovers or views that were renamed without renaming their template.
 */
public final class ReportGenerator {

    private ReportGenerator() {}

    public static void writeMarkdown(Path reportPath,
                                     TemplateRegistryResult result,
                                     List<String> excludes,
                                     boolean failOnUnassociated) throws IOException {

        StringBuilder report = new StringBuilder();
        report.append("# template-registry report\n\n");

        report.append("## Summary\n\n");
        report.append("- Root: `").append(result.root).append("`\n");
        report.append("- Extensions: `").append(String.join("`, `", result.registries.factories().extensions())).append("`\n");
        report.append("- Modules: **").append(result.modules.size()).append("**\n");
        report.append("- Template directories registered: **")
                .append(result.registries.fileRegistry().registeredDirectories().size()).append("**\n");
        report.append("- File templates: **").append(result.fileTemplateCount()).append("**\n");
        report.append("- Inline templates: **").append(result.inlineTemplateCount()).append("**\n");
        report.append("- Views checked: **").append(result.viewsChecked).append("**\n");
        report.append("- Unassociated templates: **").append(result.audit.count()).append("**\n");
        report.append("- Fail on unassociated: **").append(failOnUnassociated).append("**\n");
        report.append("- Excludes: ").append(excludes.isEmpty() ? "_(none)_" : "`" + String.join("`, `", excludes) + "`").append("\n\n");

        report.append("## Modules\n\n");
        if (result.modules.isEmpty()) {
            report.append("_(none)_\n");
        }
        for (ModuleInfo m : result.modules) {
            Path dir = result.registries.fileRegistry().templateDir(m);
            report.append("- `").append(m.dottedName()).append("` → `")
                    .append(result.root.relativize(dir).toString().replace("\\", "/")).append("`");
            if (!Files.isDirectory(dir)) {
                report.append(" _(missing)_");
            }
            report.append("\n");
        }

        report.append("\n## Unassociated file templates\n\n");
        if (result.audit.unassociatedFileTemplates.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            for (Path p : result.audit.unassociatedFileTemplates) {
                report.append("- `").append(result.root.relativize(p).toString().replace("\\", "/")).append("`\n");
            }
        }

        report.append("\n## Unassociated inline templates\n\n");
        if (result.audit.unassociatedInlineTemplates.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            report.append("| Module | Template |\n");
            report.append("|---|---|\n");
            for (InlineTemplateKey k : result.audit.unassociatedInlineTemplates) {
                report.append("| `").append(k.module()).append("` | `").append(k.name()).append("` |\n");
            }
        }

        report.append("\n## Warnings\n\n");
        List<RegistryWarning> warnings = result.warnings;
        if (warnings.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            for (RegistryWarning w : warnings) {
                report.append("- **").append(w.code).append("** ").append(w.message).append("\n");
            }
        }

        Files.createDirectories(reportPath.toAbsolutePath().normalize().getParent());
        Files.writeString(reportPath, report.toString());
    }
}
