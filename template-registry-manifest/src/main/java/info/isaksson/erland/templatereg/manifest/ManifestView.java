package info.isaksson.erland.templatereg.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A view declared in a module.
 *
 * <p>{@code template} is the explicitly requested template name (null means "named after the view").
 * {@code requiresRendering} defaults to true; forms and similar views that render themselves set it
 * to false.</p>
 */
@JsonPropertyOrder({"module","name","template","hasRender","requiresRendering"})
public final class ManifestView {
    public final String module;
    public final String name;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String template;

    public final boolean hasRender;
    public final boolean requiresRendering;

    @JsonCreator
    public ManifestView(
            @JsonProperty("module") String module,
            @JsonProperty("name") String name,
            @JsonProperty("template") String template,
            @JsonProperty("hasRender") Boolean hasRender,
            @JsonProperty("requiresRendering") Boolean requiresRendering
    ) {
        this.module = module;
        this.name = name;
        this.template = template == null || template.isBlank() ? null : template;
        this.hasRender = hasRender != null && hasRender;
        this.requiresRendering = requiresRendering == null || requiresRendering;
    }
}
