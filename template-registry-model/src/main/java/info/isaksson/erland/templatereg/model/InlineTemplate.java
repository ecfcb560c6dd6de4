package info.isaksson.erland.templatereg.model;

import java.util.Objects;

/** A template whose source is declared in code rather than discovered on disk. */
public final class InlineTemplate implements Template {

    private final String source;

    public InlineTemplate(String source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public String source() {
        return source;
    }

    @Override
    public String describe() {
        return "inline template (" + source.length() + " chars)";
    }

    @Override
    public String toString() {
        return describe();
    }
}
