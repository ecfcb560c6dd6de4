package info.isaksson.erland.templatereg.registry;

import info.isaksson.erland.templatereg.model.ModuleInfo;
import info.isaksson.erland.templatereg.model.Template;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Resolves a (module, name) pair against file templates first, then inline templates.
 */
public final class UnifiedTemplateLookup {

    private final Supplier<FileTemplateRegistry> fileRegistry;
    private final Supplier<InlineTemplateRegistry> inlineRegistry;

    public UnifiedTemplateLookup(Supplier<FileTemplateRegistry> fileRegistry,
                                 Supplier<InlineTemplateRegistry> inlineRegistry) {
        this.fileRegistry = Objects.requireNonNull(fileRegistry, "fileRegistry");
        this.inlineRegistry = Objects.requireNonNull(inlineRegistry, "inlineRegistry");
    }

    public Template lookup(ModuleInfo moduleInfo, String templateName) {
        return lookup(moduleInfo, templateName, false);
    }

    /**
     * @param markAsAssociated mark the winning entry as claimed by a view
     * @throws TemplateLookupException the file-side failure when neither registry has the template
     */
    public Template lookup(ModuleInfo moduleInfo, String templateName, boolean markAsAssociated) {
        Objects.requireNonNull(moduleInfo, "moduleInfo");
        FileTemplateRegistry files = fileRegistry.get();
        FileTemplateEntry fileEntry;
        try {
            fileEntry = files.lookupEntry(moduleInfo, templateName);
        } catch (TemplateLookupException fileMiss) {
            InlineTemplateRegistry inline = inlineRegistry.get();
            if (!inline.contains(moduleInfo, templateName)) {
                throw fileMiss;
            }
            if (markAsAssociated) {
                inline.associate(moduleInfo, templateName);
            }
            return inline.lookup(moduleInfo, templateName);
        }
        if (markAsAssociated) {
            files.associate(fileEntry.path());
        }
        return fileEntry.template();
    }

    /** True when {@link #lookup(ModuleInfo, String)} would succeed. Never associates. */
    public boolean exists(ModuleInfo moduleInfo, String templateName) {
        try {
            lookup(moduleInfo, templateName, false);
            return true;
        } catch (TemplateLookupException e) {
            return false;
        }
    }
}
