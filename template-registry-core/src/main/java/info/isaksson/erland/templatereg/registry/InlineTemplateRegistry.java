package info.isaksson.erland.templatereg.registry;

import info.isaksson.erland.templatereg.model.ModuleInfo;
import info.isaksson.erland.templatereg.model.Template;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Templates declared in code, keyed by (module dotted name, template name).
 */
public final class InlineTemplateRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(InlineTemplateRegistry.class);

    private final Map<InlineTemplateKey, InlineTemplateEntry> entries = new LinkedHashMap<>();
    private final TemplateConflictChecker conflicts;

    public InlineTemplateRegistry(TemplateConflictChecker conflicts) {
        this.conflicts = Objects.requireNonNull(conflicts, "conflicts");
    }

    /**
     * Register {@code template} under ({@code moduleInfo}, {@code templateName}).
     *
     * <p>Registering an existing key again is a no-op; the first template stays.</p>
     *
     * @throws TemplateConflictException if a file template with the same name lives in the module's
     *         template directory
     */
    public void register(ModuleInfo moduleInfo, String templateName, Template template) {
        Objects.requireNonNull(moduleInfo, "moduleInfo");
        requireName(templateName);
        Objects.requireNonNull(template, "template");

        InlineTemplateKey key = keyOf(moduleInfo, templateName);
        if (entries.containsKey(key)) {
            LOGGER.debug("Inline template {} already registered", key);
            return;
        }
        Optional<TemplateConflict> conflict = conflicts.findFileConflict(moduleInfo, templateName);
        if (conflict.isPresent()) {
            throw conflict.get().toException();
        }
        entries.put(key, new InlineTemplateEntry(key, template));
        LOGGER.debug("Registered inline template {}", key);
    }

    /** @throws TemplateLookupException if nothing is registered under the key */
    public Template lookup(ModuleInfo moduleInfo, String templateName) {
        return lookupEntry(moduleInfo, templateName).template();
    }

    public InlineTemplateEntry lookupEntry(ModuleInfo moduleInfo, String templateName) {
        InlineTemplateEntry entry = entries.get(keyOf(moduleInfo, templateName));
        if (entry == null) {
            throw new TemplateLookupException(templateName, "inline template '" + templateName + "' in '"
                    + moduleInfo.dottedName() + "' cannot be found");
        }
        return entry;
    }

    public boolean contains(ModuleInfo moduleInfo, String templateName) {
        return entries.containsKey(keyOf(moduleInfo, templateName));
    }

    /** Mark as associated. Several views may share one template, so repeated calls are fine. */
    public void associate(ModuleInfo moduleInfo, String templateName) {
        InlineTemplateEntry entry = entries.get(keyOf(moduleInfo, templateName));
        if (entry != null) {
            entry.markAssociated();
        }
    }

    public SortedSet<InlineTemplateKey> unassociated() {
        SortedSet<InlineTemplateKey> out = new TreeSet<>();
        for (InlineTemplateEntry e : entries.values()) {
            if (!e.isAssociated()) out.add(e.key());
        }
        return Collections.unmodifiableSortedSet(out);
    }

    public int size() {
        return entries.size();
    }

    void clear() {
        entries.clear();
    }

    private static InlineTemplateKey keyOf(ModuleInfo moduleInfo, String templateName) {
        return new InlineTemplateKey(moduleInfo.dottedName(), templateName);
    }

    private static void requireName(String templateName) {
        if (templateName == null || templateName.isBlank()) {
            throw new IllegalArgumentException("templateName must not be blank");
        }
    }
}
