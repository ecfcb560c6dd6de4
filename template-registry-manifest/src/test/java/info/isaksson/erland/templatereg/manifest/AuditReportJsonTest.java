package info.isaksson.erland.templatereg.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AuditReportJsonTest {

    private static AuditReport sample() {
        return new AuditReport(
                "/srv/app",
                List.of("pt", "cpt"),
                2, 3, 1, 4,
                List.of("/srv/app/z_templates/b.pt", "/srv/app/a_templates/a.pt"),
                List.of(new AuditReport.InlineTemplateRef("m2", "x"), new AuditReport.InlineTemplateRef("m1", "y")),
                List.of(new AuditReport.Warning("UNRECOGNIZED_EXTENSION", "File 'x.bak'", Map.of("file", "x.bak", "directory", "/d")))
        );
    }

    @Test
    void writesSortedListsAndIsStable(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("nested/report.json");
        AuditReportJson.write(sample(), out);
        String first = Files.readString(out);
        AuditReportJson.write(sample(), out);
        assertEquals(first, Files.readString(out), "Writing twice must produce identical output.");
        assertTrue(first.endsWith("\n"));

        JsonNode node = new ObjectMapper().readTree(first);
        assertEquals("cpt", node.get("extensions").get(0).asText());
        assertEquals("/srv/app/a_templates/a.pt", node.get("unassociatedFileTemplates").get(0).asText());
        assertEquals("m1", node.get("unassociatedInlineTemplates").get(0).get("module").asText());
        assertEquals(3, node.get("fileTemplatesRegistered").asInt());
    }

    @Test
    void readsBackWhatItWrote(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("report.json");
        AuditReportJson.write(sample(), out);
        AuditReport back = AuditReportJson.read(out);
        assertEquals(4, back.viewsChecked);
        assertEquals(2, back.unassociatedInlineTemplates.size());
        assertEquals("x.bak", back.warnings.get(0).context.get("file"));
        assertEquals(AuditReportJson.toJsonString(sample()), AuditReportJson.toJsonString(back));
    }
}
