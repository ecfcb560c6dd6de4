package info.isaksson.erland.templatereg.registry;

import java.nio.file.Path;
import java.util.Objects;

/**
 * An inline template and a file template that would both answer to the same module and name.
 */
public final class TemplateConflict {

    private final String templateName;
    private final String moduleDottedName;
    private final Path templateDir;

    TemplateConflict(String templateName, String moduleDottedName, Path templateDir) {
        this.templateName = Objects.requireNonNull(templateName, "templateName");
        this.moduleDottedName = Objects.requireNonNull(moduleDottedName, "moduleDottedName");
        this.templateDir = Objects.requireNonNull(templateDir, "templateDir");
    }

    public String templateName() {
        return templateName;
    }

    public String moduleDottedName() {
        return moduleDottedName;
    }

    public Path templateDir() {
        return templateDir;
    }

    /** Same message whichever side was registered first. */
    public String message() {
        return "Conflicting templates found for name '" + templateName + "': the inline template in module '"
                + moduleDottedName + "' conflicts with the file template in directory '" + templateDir + "'";
    }

    public TemplateConflictException toException() {
        return new TemplateConflictException(templateName, message());
    }

    @Override
    public String toString() {
        return message();
    }
}
