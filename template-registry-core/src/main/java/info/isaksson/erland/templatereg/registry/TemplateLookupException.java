package info.isaksson.erland.templatereg.registry;

/** A template name could not be resolved. The message names the template and where it was searched. */
public class TemplateLookupException extends RuntimeException {

    private final String templateName;

    public TemplateLookupException(String templateName, String message) {
        super(message);
        this.templateName = templateName;
    }

    public String getTemplateName() {
        return templateName;
    }
}
