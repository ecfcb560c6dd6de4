package info.isaksson.erland.templatereg.core;

import info.isaksson.erland.templatereg.audit.AuditResult;
import info.isaksson.erland.templatereg.manifest.AuditReport;
import info.isaksson.erland.templatereg.model.ModuleInfo;
import info.isaksson.erland.templatereg.registry.InlineTemplateKey;
import info.isaksson.erland.templatereg.registry.TemplateRegistries;
import info.isaksson.erland.templatereg.warnings.RegistryWarning;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Outcome of {@link TemplateRegistryService#run}. */
public final class TemplateRegistryResult {

    public final Path root;
    public final List<ModuleInfo> modules;
    public final TemplateRegistries registries;
    public final int viewsChecked;
    public final AuditResult audit;
    public final List<RegistryWarning> warnings;
    public final boolean failOnUnassociated;

    TemplateRegistryResult(Path root,
                           List<ModuleInfo> modules,
                           TemplateRegistries registries,
                           int viewsChecked,
                           AuditResult audit,
                           List<RegistryWarning> warnings,
                           boolean failOnUnassociated) {
        this.root = root;
        this.modules = List.copyOf(modules);
        this.registries = registries;
        this.viewsChecked = viewsChecked;
        this.audit = audit;
        this.warnings = List.copyOf(warnings);
        this.failOnUnassociated = failOnUnassociated;
    }

    public int fileTemplateCount() {
        return registries.fileRegistry().size();
    }

    public int inlineTemplateCount() {
        return registries.inlineRegistry().size();
    }

    /** True when unassociated templates remain and the run was configured to fail on them. */
    public boolean isFailedByUnassociated() {
        return failOnUnassociated && !audit.isClean();
    }

    /** Snapshot for JSON output. */
    public AuditReport toAuditReport() {
        List<String> files = new ArrayList<>();
        for (Path p : audit.unassociatedFileTemplates) {
            files.add(p.toString());
        }
        List<AuditReport.InlineTemplateRef> inline = new ArrayList<>();
        for (InlineTemplateKey k : audit.unassociatedInlineTemplates) {
            inline.add(new AuditReport.InlineTemplateRef(k.module(), k.name()));
        }
        List<AuditReport.Warning> ws = new ArrayList<>();
        for (RegistryWarning w : warnings) {
            ws.add(new AuditReport.Warning(w.code, w.message, w.context));
        }
        return new AuditReport(
                root.toString(),
                new ArrayList<>(registries.factories().extensions()),
                modules.size(),
                fileTemplateCount(),
                inlineTemplateCount(),
                viewsChecked,
                files,
                inline,
                ws
        );
    }
}
