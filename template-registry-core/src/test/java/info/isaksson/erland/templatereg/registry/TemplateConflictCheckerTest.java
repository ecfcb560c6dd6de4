package info.isaksson.erland.templatereg.registry;

import info.isaksson.erland.templatereg.model.DirectoryModuleInfo;
import info.isaksson.erland.templatereg.model.InlineTemplate;
import info.isaksson.erland.templatereg.model.Template;
import info.isaksson.erland.templatereg.model.TemplateFileFactories;
import info.isaksson.erland.templatereg.warnings.WarningSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Optional;

import static info.isaksson.erland.templatereg.testutil.TemplateFixtures.module;
import static info.isaksson.erland.templatereg.testutil.TemplateFixtures.templates;
import static org.junit.jupiter.api.Assertions.*;

public class TemplateConflictCheckerTest {

    @TempDir
    Path tmp;

    private TemplateRegistries registries;

    @BeforeEach
    void setUp() {
        registries = new TemplateRegistries(TemplateFileFactories.defaults(), WarningSink.ignoring());
    }

    @Test
    void inlineFirstThenDirectoryConflicts() throws Exception {
        DirectoryModuleInfo m = module(tmp, "app.cave");
        Path dir = templates(m, "x.pt", "y.pt");
        InlineTemplate inline = new InlineTemplate("inline x");
        registries.registerInlineTemplate(m, "x", inline);

        TemplateConflictException ex = assertThrows(TemplateConflictException.class, () -> registries.registerDirectory(m));

        assertEquals("Conflicting templates found for name 'x': the inline template in module 'app.cave' "
                + "conflicts with the file template in directory '" + dir + "'", ex.getMessage());
        assertSame(inline, registries.lookup(m, "x"), "earlier inline entry stays lookupable");
        assertEquals(0, registries.fileRegistry().size(), "no partial directory registration");
    }

    @Test
    void directoryFirstThenInlineConflicts() throws Exception {
        DirectoryModuleInfo m = module(tmp, "app.cave");
        Path dir = templates(m, "x.pt");
        registries.registerDirectory(m);
        Template fileTemplate = registries.lookup(m, "x");

        TemplateConflictException ex = assertThrows(TemplateConflictException.class,
                () -> registries.registerInlineTemplate(m, "x", new InlineTemplate("inline x")));

        assertEquals("Conflicting templates found for name 'x': the inline template in module 'app.cave' "
                + "conflicts with the file template in directory '" + dir + "'", ex.getMessage());
        assertSame(fileTemplate, registries.lookup(m, "x"));
        assertEquals(0, registries.inlineRegistry().size());
    }

    @Test
    void differentNamesDoNotConflict() throws Exception {
        DirectoryModuleInfo m = module(tmp, "app.cave");
        templates(m, "x.pt");
        registries.registerInlineTemplate(m, "y", new InlineTemplate("y"));
        registries.registerDirectory(m);

        assertEquals(1, registries.fileRegistry().size());
        assertEquals(1, registries.inlineRegistry().size());
    }

    @Test
    void inlineInOtherModuleDoesNotConflict() throws Exception {
        DirectoryModuleInfo cave = module(tmp, "app.cave");
        DirectoryModuleInfo club = module(tmp, "app.club");
        templates(cave, "x.pt");
        registries.registerDirectory(cave);

        assertDoesNotThrow(() -> registries.registerInlineTemplate(club, "x", new InlineTemplate("x")));
    }

    @Test
    void checkerReportsContextForBothDirections() throws Exception {
        DirectoryModuleInfo m = module(tmp, "app.cave");
        Path dir = templates(m, "x.pt");
        registries.registerDirectory(m);
        TemplateConflictChecker checker = new TemplateConflictChecker(registries::fileRegistry, registries::inlineRegistry);

        Optional<TemplateConflict> fileSide = checker.findFileConflict(m, "x");
        assertTrue(fileSide.isPresent());
        assertEquals("app.cave", fileSide.get().moduleDottedName());
        assertEquals(dir, fileSide.get().templateDir());
        assertTrue(checker.findFileConflict(m, "other").isEmpty());

        assertTrue(checker.findInlineConflict(m, "z", dir).isEmpty());
        registries.registerInlineTemplate(m, "z", new InlineTemplate("z"));
        assertEquals("z", checker.findInlineConflict(m, "z", dir).orElseThrow().templateName());
    }
}
