package info.isaksson.erland.templatereg.registry;

import info.isaksson.erland.templatereg.model.Template;

import java.util.Objects;

/** A registered inline template. */
public final class InlineTemplateEntry {

    private final InlineTemplateKey key;
    private final Template template;
    private boolean associated;

    InlineTemplateEntry(InlineTemplateKey key, Template template) {
        this.key = Objects.requireNonNull(key, "key");
        this.template = Objects.requireNonNull(template, "template");
    }

    public InlineTemplateKey key() {
        return key;
    }

    public Template template() {
        return template;
    }

    public boolean isAssociated() {
        return associated;
    }

    void markAssociated() {
        associated = true;
    }

    @Override
    public String toString() {
        return "InlineTemplateEntry[" + key + (associated ? ", associated" : "") + "]";
    }
}
