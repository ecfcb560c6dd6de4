package info.isaksson.erland.templatereg.registry;

import info.isaksson.erland.templatereg.model.ModuleInfo;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Cross-registry check between inline and file templates.
 *
 * <p>Both registration paths call this before inserting anything. The file side matches any entry
 * with the given base name inside the module's template directory; the inline side matches the exact
 * (module, name) key.</p>
 */
public final class TemplateConflictChecker {

    private final Supplier<FileTemplateRegistry> fileRegistry;
    private final Supplier<InlineTemplateRegistry> inlineRegistry;

    public TemplateConflictChecker(Supplier<FileTemplateRegistry> fileRegistry,
                                   Supplier<InlineTemplateRegistry> inlineRegistry) {
        this.fileRegistry = Objects.requireNonNull(fileRegistry, "fileRegistry");
        this.inlineRegistry = Objects.requireNonNull(inlineRegistry, "inlineRegistry");
    }

    /** Called when registering an inline template: is there a file template with this name? */
    public Optional<TemplateConflict> findFileConflict(ModuleInfo moduleInfo, String templateName) {
        FileTemplateRegistry files = fileRegistry.get();
        Path templateDir = files.templateDir(moduleInfo);
        if (!files.contains(templateDir, templateName)) {
            return Optional.empty();
        }
        return Optional.of(new TemplateConflict(templateName, moduleInfo.dottedName(), templateDir));
    }

    /** Called when registering a file template found in {@code templateDir}: is there an inline one? */
    public Optional<TemplateConflict> findInlineConflict(ModuleInfo moduleInfo, String templateName, Path templateDir) {
        if (!inlineRegistry.get().contains(moduleInfo, templateName)) {
            return Optional.empty();
        }
        return Optional.of(new TemplateConflict(templateName, moduleInfo.dottedName(), templateDir));
    }
}
