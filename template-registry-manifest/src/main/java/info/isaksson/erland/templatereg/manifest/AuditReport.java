package info.isaksson.erland.templatereg.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

/** Machine-readable outcome of a registration + audit run. */
@JsonPropertyOrder({"root","extensions","modulesScanned","fileTemplatesRegistered","inlineTemplatesRegistered",
        "viewsChecked","unassociatedFileTemplates","unassociatedInlineTemplates","warnings"})
public final class AuditReport {
    public final String root;
    public final List<String> extensions;
    public final int modulesScanned;
    public final int fileTemplatesRegistered;
    public final int inlineTemplatesRegistered;
    public final int viewsChecked;
    public final List<String> unassociatedFileTemplates;
    public final List<InlineTemplateRef> unassociatedInlineTemplates;
    public final List<Warning> warnings;

    @JsonCreator
    public AuditReport(
            @JsonProperty("root") String root,
            @JsonProperty("extensions") List<String> extensions,
            @JsonProperty("modulesScanned") int modulesScanned,
            @JsonProperty("fileTemplatesRegistered") int fileTemplatesRegistered,
            @JsonProperty("inlineTemplatesRegistered") int inlineTemplatesRegistered,
            @JsonProperty("viewsChecked") int viewsChecked,
            @JsonProperty("unassociatedFileTemplates") List<String> unassociatedFileTemplates,
            @JsonProperty("unassociatedInlineTemplates") List<InlineTemplateRef> unassociatedInlineTemplates,
            @JsonProperty("warnings") List<Warning> warnings
    ) {
        this.root = root;
        this.extensions = extensions == null ? List.of() : List.copyOf(extensions);
        this.modulesScanned = modulesScanned;
        this.fileTemplatesRegistered = fileTemplatesRegistered;
        this.inlineTemplatesRegistered = inlineTemplatesRegistered;
        this.viewsChecked = viewsChecked;
        this.unassociatedFileTemplates = unassociatedFileTemplates == null ? List.of() : List.copyOf(unassociatedFileTemplates);
        this.unassociatedInlineTemplates = unassociatedInlineTemplates == null ? List.of() : List.copyOf(unassociatedInlineTemplates);
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    @JsonPropertyOrder({"module","name"})
    public static final class InlineTemplateRef {
        public final String module;
        public final String name;

        @JsonCreator
        public InlineTemplateRef(@JsonProperty("module") String module, @JsonProperty("name") String name) {
            this.module = module;
            this.name = name;
        }
    }

    @JsonPropertyOrder({"code","message","context"})
    public static final class Warning {
        public final String code;
        public final String message;
        public final Map<String, String> context;

        @JsonCreator
        public Warning(
                @JsonProperty("code") String code,
                @JsonProperty("message") String message,
                @JsonProperty("context") Map<String, String> context
        ) {
            this.code = code;
            this.message = message;
            this.context = context == null ? Map.of() : Map.copyOf(context);
        }
    }
}
