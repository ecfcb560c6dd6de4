package info.isaksson.erland.templatereg.registry;

/**
 * Configuration-time failure surfaced to the operator. Never recovered from inside the registry.
 */
public class TemplateConfigurationException extends RuntimeException {

    public TemplateConfigurationException(String message) {
        super(message);
    }

    public TemplateConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
