package info.isaksson.erland.templatereg.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Declarations that cannot be discovered by scanning a directory tree: inline templates,
 * explicit template directories and the views that claim templates.
 */
@JsonPropertyOrder({"schemaVersion","templateDirs","inlineTemplates","views"})
public final class RegistryManifest {
    public final String schemaVersion;
    public final List<ManifestTemplateDir> templateDirs;
    public final List<ManifestInlineTemplate> inlineTemplates;
    public final List<ManifestView> views;

    @JsonCreator
    public RegistryManifest(
            @JsonProperty("schemaVersion") String schemaVersion,
            @JsonProperty("templateDirs") List<ManifestTemplateDir> templateDirs,
            @JsonProperty("inlineTemplates") List<ManifestInlineTemplate> inlineTemplates,
            @JsonProperty("views") List<ManifestView> views
    ) {
        this.schemaVersion = schemaVersion == null ? "1.0" : schemaVersion;
        this.templateDirs = templateDirs == null ? List.of() : List.copyOf(templateDirs);
        this.inlineTemplates = inlineTemplates == null ? List.of() : List.copyOf(inlineTemplates);
        this.views = views == null ? List.of() : List.copyOf(views);
    }

    public static RegistryManifest empty() {
        return new RegistryManifest("1.0", List.of(), List.of(), List.of());
    }
}
