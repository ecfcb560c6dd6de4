package info.isaksson.erland.templatereg.core;

import info.isaksson.erland.templatereg.audit.AuditResult;
import info.isaksson.erland.templatereg.audit.UnassociatedTemplateAudit;
import info.isaksson.erland.templatereg.io.ModuleScanner;
import info.isaksson.erland.templatereg.manifest.ManifestInlineTemplate;
import info.isaksson.erland.templatereg.manifest.ManifestTemplateDir;
import info.isaksson.erland.templatereg.manifest.ManifestView;
import info.isaksson.erland.templatereg.manifest.RegistryManifest;
import info.isaksson.erland.templatereg.model.DirectoryModuleInfo;
import info.isaksson.erland.templatereg.model.InlineTemplate;
import info.isaksson.erland.templatereg.model.ModuleInfo;
import info.isaksson.erland.templatereg.model.TemplateFileFactories;
import info.isaksson.erland.templatereg.registry.TemplateRegistries;
import info.isaksson.erland.templatereg.view.ViewDescriptor;
import info.isaksson.erland.templatereg.view.ViewTemplateChecker;
import info.isaksson.erland.templatereg.warnings.RegistryWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Runs the whole batch over a directory tree: register every template, claim templates for the
 * declared views, then report what nobody claimed.
 *
 * <p>CLI and other wrappers should use this class instead of re-implementing the phases.</p>
 */
public final class TemplateRegistryService {

    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateRegistryService.class);

    /**
     * @throws info.isaksson.erland.templatereg.registry.TemplateConfigurationException on the first
     *         conflict or view configuration error
     */
    public TemplateRegistryResult run(Path root, RegistryManifest manifest, TemplateRegistryOptions options) throws IOException {
        if (root == null) throw new IllegalArgumentException("root must not be null");
        if (manifest == null) manifest = RegistryManifest.empty();
        if (options == null) options = new TemplateRegistryOptions();
        final Path base = root.toAbsolutePath().normalize();

        RegistryWarnings warnings = new RegistryWarnings();
        TemplateRegistries registries = new TemplateRegistries(
                TemplateFileFactories.withPlainFileTemplates(options.extensions), warnings);

        Map<String, DirectoryModuleInfo> modules = resolveModules(base, manifest, options);
        LOGGER.info("Registering templates of {} module(s) under {}", modules.size(), base);

        for (DirectoryModuleInfo module : modules.values()) {
            registries.registerDirectory(module);
        }
        for (ManifestInlineTemplate t : manifest.inlineTemplates) {
            registries.registerInlineTemplate(module(base, modules, t.module), t.name, new InlineTemplate(t.source));
        }

        ViewTemplateChecker checker = new ViewTemplateChecker(registries.unifiedLookup());
        for (ManifestView v : manifest.views) {
            checker.check(new ViewDescriptor(module(base, modules, v.module), v.name, v.template,
                    v.hasRender, v.requiresRendering));
        }

        AuditResult audit = new UnassociatedTemplateAudit(warnings).audit(registries);
        return new TemplateRegistryResult(base, new ArrayList<>(modules.values()), registries,
                manifest.views.size(), audit, warnings.toDeterministicList(), options.failOnUnassociated);
    }

    /** Scanned modules plus modules named by the manifest's template directory overrides. */
    private static Map<String, DirectoryModuleInfo> resolveModules(Path base, RegistryManifest manifest,
                                                                   TemplateRegistryOptions options) throws IOException {
        Map<String, DirectoryModuleInfo> modules = new TreeMap<>();
        for (DirectoryModuleInfo m : ModuleScanner.scan(base, options.excludes)) {
            modules.put(m.dottedName(), m);
        }
        for (ManifestTemplateDir d : manifest.templateDirs) {
            DirectoryModuleInfo m = modules.containsKey(d.module)
                    ? modules.get(d.module)
                    : ModuleScanner.moduleFor(base, d.module);
            modules.put(m.dottedName(), m.withTemplateDirName(d.directory));
        }
        return modules;
    }

    private static ModuleInfo module(Path base, Map<String, DirectoryModuleInfo> modules, String dottedName) {
        DirectoryModuleInfo known = modules.get(dottedName);
        return known != null ? known : ModuleScanner.moduleFor(base, dottedName);
    }
}
