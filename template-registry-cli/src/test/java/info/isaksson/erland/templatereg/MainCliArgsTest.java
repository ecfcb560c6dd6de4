package info.isaksson.erland.templatereg;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MainCliArgsTest {

    @Test
    void parsesBasicArgsAndRepeatableForms() {
        String[] args = new String[] {
                "--root", "app",
                "--manifest", "app/views.json",
                "--output", "target/out",
                "--exclude", "**/generated/**",
                "--exclude=legacy",
                "--extension", ".pt",
                "--extension=cpt",
                "--report", "target/out/report.md",
                "--json", "target/out/report.json",
                "--fail-on-unassociated", "true"
        };

        Main.CliArgs parsed = Main.CliArgs.parse(args);
        assertEquals("app", parsed.root);
        assertEquals("app/views.json", parsed.manifest);
        assertEquals("target/out", parsed.output);
        assertEquals("target/out/report.md", parsed.report);
        assertEquals("target/out/report.json", parsed.json);
        assertTrue(parsed.failOnUnassociated);
        assertEquals(List.of("pt", "cpt"), parsed.extensions);
        assertEquals(List.of("**/generated/**", "legacy"), parsed.excludes);
    }

    @Test
    void acceptsBarePathAsRootShorthand() {
        Main.CliArgs parsed = Main.CliArgs.parse(new String[] {"app"});
        assertEquals("app", parsed.root);
        assertFalse(parsed.failOnUnassociated);
        assertTrue(parsed.extensions.isEmpty());
    }

    @Test
    void parseBooleanRejectsInvalidValues() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> Main.CliArgs.parse(new String[] {"--root", "x", "--fail-on-unassociated", "maybe"}));
        assertTrue(ex.getMessage().contains("Invalid boolean"));
    }

    @Test
    void rejectsPathLikeExtensions() {
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--extension", "a/b"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--extension=."}));
    }

    @Test
    void unknownFlagThrows() {
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--nope"}));
    }

    @Test
    void missingValueThrows() {
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--root"}));
    }

    @Test
    void secondBarePathThrows() {
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"a", "b"}));
    }
}
