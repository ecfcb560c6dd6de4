package info.isaksson.erland.templatereg.manifest;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * JSON serialization of {@link AuditReport}.
 *
 * <p>Writing is deterministic: lists are sorted and map keys ordered before output.</p>
 */
public final class AuditReportJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private AuditReportJson() {}

    public static AuditReport read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, AuditReport.class);
        }
    }

    public static void write(AuditReport report, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        Files.createDirectories(path.toAbsolutePath().normalize().getParent());
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, normalize(report));
            out.write('\n');
        }
    }

    public static String toJsonString(AuditReport report) throws IOException {
        return MAPPER.writer(PRETTY).writeValueAsString(normalize(report)) + "\n";
    }

    static AuditReport normalize(AuditReport r) {
        if (r == null) throw new IllegalArgumentException("report is null");
        List<String> extensions = sorted(r.extensions, Comparator.naturalOrder());
        List<String> files = sorted(r.unassociatedFileTemplates, Comparator.naturalOrder());
        List<AuditReport.InlineTemplateRef> inline = sorted(r.unassociatedInlineTemplates,
                Comparator.comparing((AuditReport.InlineTemplateRef i) -> nullToEmpty(i.module))
                        .thenComparing(i -> nullToEmpty(i.name)));
        List<AuditReport.Warning> warnings = sorted(r.warnings,
                Comparator.comparing((AuditReport.Warning w) -> nullToEmpty(w.code))
                        .thenComparing(w -> nullToEmpty(w.message)));
        return new AuditReport(r.root, extensions, r.modulesScanned, r.fileTemplatesRegistered,
                r.inlineTemplatesRegistered, r.viewsChecked, files, inline, warnings);
    }

    private static <T> List<T> sorted(List<T> in, Comparator<? super T> cmp) {
        List<T> out = new ArrayList<>(in);
        out.sort(cmp);
        return out;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        // Prevent Jackson from closing the provided OutputStream/Writer.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
