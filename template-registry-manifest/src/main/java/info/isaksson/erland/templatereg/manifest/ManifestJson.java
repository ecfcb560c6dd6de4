package info.isaksson.erland.templatereg.manifest;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads {@link RegistryManifest} documents. */
public final class ManifestJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private ManifestJson() {}

    public static RegistryManifest read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return validate(MAPPER.readValue(in, RegistryManifest.class), path.toString());
        }
    }

    public static RegistryManifest readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return validate(MAPPER.readValue(json, RegistryManifest.class), "<string>");
    }

    private static RegistryManifest validate(RegistryManifest manifest, String origin) throws IOException {
        if (manifest == null) {
            return RegistryManifest.empty();
        }
        for (ManifestTemplateDir d : manifest.templateDirs) {
            requireText(d.module, "templateDirs[].module", origin);
            requireText(d.directory, "templateDirs[].directory", origin);
        }
        for (ManifestInlineTemplate t : manifest.inlineTemplates) {
            requireText(t.module, "inlineTemplates[].module", origin);
            requireText(t.name, "inlineTemplates[].name", origin);
        }
        for (ManifestView v : manifest.views) {
            requireText(v.module, "views[].module", origin);
            requireText(v.name, "views[].name", origin);
        }
        return manifest;
    }

    private static void requireText(String value, String field, String origin) throws IOException {
        if (value == null || value.isBlank()) {
            throw new IOException("Manifest " + origin + ": " + field + " must not be blank");
        }
    }
}
