package info.isaksson.erland.templatereg;

import info.isaksson.erland.templatereg.manifest.AuditReport;
import info.isaksson.erland.templatereg.manifest.AuditReportJson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainSmokeTest {

    @TempDir
    Path tmp;

    private Path caveRoot() throws IOException {
        Path root = tmp.resolve("app");
        Path dir = root.resolve("cave_templates");
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("index.pt"), "<p>cave</p>");
        Files.writeString(dir.resolve("unused.pt"), "<p>unused</p>");
        return root;
    }

    private Path manifest(String json) throws IOException {
        Path p = tmp.resolve("views.json");
        Files.writeString(p, json);
        return p;
    }

    @Test
    void writesMarkdownAndJsonReports() throws IOException {
        Path root = caveRoot();
        Path views = manifest("{\"views\": [{\"module\": \"cave\", \"name\": \"Index\"}]}");
        Path report = tmp.resolve("out/report.md");
        Path json = tmp.resolve("out/report.json");

        int code = Main.run(new String[] {
                "--root", root.toString(),
                "--manifest", views.toString(),
                "--report", report.toString(),
                "--json", json.toString()
        });

        assertEquals(0, code);
        String md = Files.readString(report);
        assertTrue(md.contains("## Unassociated file templates"));
        assertTrue(md.contains("unused.pt"));

        AuditReport parsed = AuditReportJson.read(json);
        assertEquals(1, parsed.modulesScanned);
        assertEquals(2, parsed.fileTemplatesRegistered);
        assertEquals(1, parsed.viewsChecked);
        assertEquals(1, parsed.unassociatedFileTemplates.size());
        assertTrue(parsed.unassociatedFileTemplates.get(0).endsWith("unused.pt"));
    }

    @Test
    void failOnUnassociatedReturnsThree() throws IOException {
        Path root = caveRoot();

        int code = Main.run(new String[] {
                root.toString(),
                "--output", tmp.resolve("out").toString(),
                "--fail-on-unassociated", "true"
        });

        assertEquals(3, code);
        assertTrue(Files.exists(tmp.resolve("out/template-report.md")));
    }

    @Test
    void conflictingTemplatesReturnTwo() throws IOException {
        Path root = caveRoot();
        Path views = manifest("{\"inlineTemplates\": [{\"module\": \"cave\", \"name\": \"index\", \"source\": \"x\"}]}");

        int code = Main.run(new String[] {
                "--root", root.toString(),
                "--manifest", views.toString(),
                "--output", tmp.resolve("out").toString()
        });

        assertEquals(2, code);
    }

    @Test
    void missingRootIsUsageError() {
        assertEquals(1, Main.run(new String[] {}));
        assertEquals(1, Main.run(new String[] {"--root", tmp.resolve("nope").toString()}));
        assertEquals(0, Main.run(new String[] {"--help"}));
    }
}
