package info.isaksson.erland.templatereg.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Overrides the template directory name of one module. */
@JsonPropertyOrder({"module","directory"})
public final class ManifestTemplateDir {
    public final String module;
    public final String directory;

    @JsonCreator
    public ManifestTemplateDir(
            @JsonProperty("module") String module,
            @JsonProperty("directory") String directory
    ) {
        this.module = module;
        this.directory = directory;
    }
}
