package info.isaksson.erland.templatereg.registry;

import info.isaksson.erland.templatereg.model.DirectoryModuleInfo;
import info.isaksson.erland.templatereg.model.InlineTemplate;
import info.isaksson.erland.templatereg.model.TemplateFileFactories;
import info.isaksson.erland.templatereg.warnings.RegistryWarnings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static info.isaksson.erland.templatereg.testutil.TemplateFixtures.module;
import static info.isaksson.erland.templatereg.testutil.TemplateFixtures.templates;
import static org.junit.jupiter.api.Assertions.*;

public class TemplateRegistriesTest {

    @Test
    void clearAllForgetsEverything(@TempDir Path tmp) throws Exception {
        TemplateRegistries registries = new TemplateRegistries(TemplateFileFactories.defaults(), new RegistryWarnings());
        DirectoryModuleInfo m = module(tmp, "app.cave");
        templates(m, "x.pt");
        registries.registerDirectory(m);
        registries.registerInlineTemplate(m, "y", new InlineTemplate("y"));

        registries.clearAll();

        assertTrue(registries.unassociatedFileTemplates().isEmpty());
        assertTrue(registries.unassociatedInlineTemplates().isEmpty());
        assertTrue(registries.fileRegistry().registeredDirectories().isEmpty());
        assertThrows(TemplateLookupException.class, () -> registries.lookup(m, "x"));

        // After a reset the same declarations can be made again, in either order.
        registries.registerInlineTemplate(m, "x", new InlineTemplate("now inline"));
        assertThrows(TemplateConflictException.class, () -> registries.registerDirectory(m));
    }

    @Test
    void conflictExceptionsAreConfigurationErrors() {
        assertInstanceOf(TemplateConfigurationException.class, new TemplateConflictException("x", "m"));
    }
}
