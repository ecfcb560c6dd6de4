package info.isaksson.erland.templatereg.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"module","name","source"})
public final class ManifestInlineTemplate {
    public final String module;
    public final String name;
    public final String source;

    @JsonCreator
    public ManifestInlineTemplate(
            @JsonProperty("module") String module,
            @JsonProperty("name") String name,
            @JsonProperty("source") String source
    ) {
        this.module = module;
        this.name = name;
        this.source = source == null ? "" : source;
    }
}
