package info.isaksson.erland.templatereg.view;

import info.isaksson.erland.templatereg.model.DirectoryModuleInfo;
import info.isaksson.erland.templatereg.model.InlineTemplate;
import info.isaksson.erland.templatereg.model.Template;
import info.isaksson.erland.templatereg.model.TemplateFileFactories;
import info.isaksson.erland.templatereg.registry.TemplateRegistries;
import info.isaksson.erland.templatereg.warnings.WarningSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Optional;

import static info.isaksson.erland.templatereg.testutil.TemplateFixtures.module;
import static info.isaksson.erland.templatereg.testutil.TemplateFixtures.templates;
import static org.junit.jupiter.api.Assertions.*;

public class ViewTemplateCheckerTest {

    @TempDir
    Path tmp;

    private TemplateRegistries registries;
    private ViewTemplateChecker checker;
    private DirectoryModuleInfo cave;

    @BeforeEach
    void setUp() throws Exception {
        registries = new TemplateRegistries(TemplateFileFactories.defaults(), WarningSink.ignoring());
        checker = new ViewTemplateChecker(registries.unifiedLookup());
        cave = module(tmp, "app.cave");
        templates(cave, "index.pt", "food.pt", "cavepainting.pt");
        registries.registerDirectory(cave);
    }

    @Test
    void viewClaimsTemplateNamedAfterItself() {
        Optional<Template> t = checker.check(ViewDescriptor.of(cave, "Index"));

        assertTrue(t.isPresent());
        assertFalse(registries.unassociatedFileTemplates().stream()
                .anyMatch(p -> p.getFileName().toString().equals("index.pt")));
    }

    @Test
    void explicitTemplateIsClaimed() {
        Optional<Template> t = checker.check(new ViewDescriptor(cave, "Lunch", "food", false, true));
        assertTrue(t.isPresent());
        assertEquals(2, registries.unassociatedFileTemplates().size());
    }

    @Test
    void explicitTemplateAlongsideDefaultTemplateIsAmbiguous() {
        ViewConfigurationException ex = assertThrows(ViewConfigurationException.class,
                () -> checker.check(new ViewDescriptor(cave, "Index", "food", false, true)));
        assertTrue(ex.getMessage().startsWith("Multiple possible templates for view 'Index'"));
        assertEquals("Index", ex.getViewName());
        assertEquals(3, registries.unassociatedFileTemplates().size(), "nothing claimed on failure");
    }

    @Test
    void renderMethodPlusTemplateIsRejected() {
        ViewConfigurationException ex = assertThrows(ViewConfigurationException.class,
                () -> checker.check(new ViewDescriptor(cave, "CavePainting", null, true, true)));
        assertTrue(ex.getMessage().contains("both a 'render' method as well as an associated template"));
    }

    @Test
    void viewWithoutTemplateOrRenderIsRejected() {
        ViewConfigurationException ex = assertThrows(ViewConfigurationException.class,
                () -> checker.check(ViewDescriptor.of(cave, "Missing")));
        assertEquals("View 'Missing' in 'app.cave' has no associated template or 'render' method.", ex.getMessage());
    }

    @Test
    void renderingViewsAndFormsWithoutTemplateAreFine() {
        assertEquals(Optional.empty(), checker.check(new ViewDescriptor(cave, "Json", null, true, true)));
        assertEquals(Optional.empty(), checker.check(new ViewDescriptor(cave, "EditForm", null, false, false)));
    }

    @Test
    void inlineTemplatesAreClaimedToo() {
        DirectoryModuleInfo club = module(tmp, "app.club");
        registries.registerInlineTemplate(club, "club", new InlineTemplate("<h1>club</h1>"));

        assertTrue(checker.check(ViewDescriptor.of(club, "Club")).isPresent());
        assertTrue(registries.unassociatedInlineTemplates().isEmpty());
    }
}
