package info.isaksson.erland.templatereg.registry;

import info.isaksson.erland.templatereg.model.ModuleInfo;
import info.isaksson.erland.templatereg.model.Template;
import info.isaksson.erland.templatereg.model.TemplateFileFactories;
import info.isaksson.erland.templatereg.warnings.WarningSink;

import java.nio.file.Path;
import java.util.Objects;
import java.util.SortedSet;

/**
 * Owns one file registry and one inline registry wired to a shared conflict checker.
 *
 * <p>This is the API used by the three phases of a run: registration, lookup during view setup and
 * the final unassociated-template report. {@link #clearAll()} resets both registries between runs
 * or tests.</p>
 */
public final class TemplateRegistries {

    private final TemplateFileFactories factories;
    private final WarningSink warnings;
    private final FileTemplateRegistry fileRegistry;
    private final InlineTemplateRegistry inlineRegistry;
    private final UnifiedTemplateLookup lookup;

    public TemplateRegistries(TemplateFileFactories factories, WarningSink warnings) {
        this.factories = Objects.requireNonNull(factories, "factories");
        this.warnings = Objects.requireNonNull(warnings, "warnings");
        TemplateConflictChecker conflicts = new TemplateConflictChecker(this::fileRegistry, this::inlineRegistry);
        this.fileRegistry = new FileTemplateRegistry(factories, warnings, conflicts);
        this.inlineRegistry = new InlineTemplateRegistry(conflicts);
        this.lookup = new UnifiedTemplateLookup(this::fileRegistry, this::inlineRegistry);
    }

    public void registerDirectory(ModuleInfo moduleInfo) {
        fileRegistry.registerDirectory(moduleInfo);
    }

    public void registerDirectory(ModuleInfo moduleInfo, String templateDirName) {
        fileRegistry.registerDirectory(moduleInfo, templateDirName);
    }

    public void registerInlineTemplate(ModuleInfo moduleInfo, String templateName, Template template) {
        inlineRegistry.register(moduleInfo, templateName, template);
    }

    public Template lookup(ModuleInfo moduleInfo, String templateName) {
        return lookup.lookup(moduleInfo, templateName, false);
    }

    public Template lookup(ModuleInfo moduleInfo, String templateName, boolean markAsAssociated) {
        return lookup.lookup(moduleInfo, templateName, markAsAssociated);
    }

    public SortedSet<Path> unassociatedFileTemplates() {
        return fileRegistry.unassociated();
    }

    public SortedSet<InlineTemplateKey> unassociatedInlineTemplates() {
        return inlineRegistry.unassociated();
    }

    /** Forget every registered template and directory. */
    public void clearAll() {
        fileRegistry.clear();
        inlineRegistry.clear();
    }

    public FileTemplateRegistry fileRegistry() {
        return fileRegistry;
    }

    public InlineTemplateRegistry inlineRegistry() {
        return inlineRegistry;
    }

    public UnifiedTemplateLookup unifiedLookup() {
        return lookup;
    }

    public TemplateFileFactories factories() {
        return factories;
    }

    public WarningSink warnings() {
        return warnings;
    }
}
