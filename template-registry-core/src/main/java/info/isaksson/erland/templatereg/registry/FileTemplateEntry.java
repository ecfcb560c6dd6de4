package info.isaksson.erland.templatereg.registry;

import info.isaksson.erland.templatereg.model.Template;

import java.nio.file.Path;
import java.util.Objects;

/** A registered file template. Only the associated flag changes after creation, and only to true. */
public final class FileTemplateEntry {

    private final Path path;
    private final Path templateDir;
    private final String templateName;
    private final Template template;
    private boolean associated;

    FileTemplateEntry(Path path, Path templateDir, String templateName, Template template) {
        this.path = Objects.requireNonNull(path, "path");
        this.templateDir = Objects.requireNonNull(templateDir, "templateDir");
        this.templateName = Objects.requireNonNull(templateName, "templateName");
        this.template = Objects.requireNonNull(template, "template");
    }

    public Path path() {
        return path;
    }

    public Path templateDir() {
        return templateDir;
    }

    public String templateName() {
        return templateName;
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
        return "FileTemplateEntry[" + path + (associated ? ", associated" : "") + "]";
    }
}
