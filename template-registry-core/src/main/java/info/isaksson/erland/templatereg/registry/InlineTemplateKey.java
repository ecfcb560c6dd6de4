package info.isaksson.erland.templatereg.registry;

import java.util.Comparator;
import java.util.Objects;

/** (module dotted name, template name) key of an inline template. */
public record InlineTemplateKey(String module, String name) implements Comparable<InlineTemplateKey> {

    private static final Comparator<InlineTemplateKey> ORDER =
            Comparator.comparing(InlineTemplateKey::module).thenComparing(InlineTemplateKey::name);

    public InlineTemplateKey {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(name, "name");
    }

    @Override
    public int compareTo(InlineTemplateKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return module + ":" + name;
    }
}
