package info.isaksson.erland.templatereg.registry;

/**
 * Raised when a registration would make a template name ambiguous: two files with the same base
 * name in one directory, or an inline and a file template for the same module and name.
 */
public class TemplateConflictException extends TemplateConfigurationException {

    private final String templateName;

    public TemplateConflictException(String templateName, String message) {
        super(message);
        this.templateName = templateName;
    }

    public String getTemplateName() {
        return templateName;
    }
}
