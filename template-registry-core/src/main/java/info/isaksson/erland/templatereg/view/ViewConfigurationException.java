package info.isaksson.erland.templatereg.view;

import info.isaksson.erland.templatereg.registry.TemplateConfigurationException;

/** A view has no way to render, or more than one. */
public class ViewConfigurationException extends TemplateConfigurationException {

    private final String viewName;

    public ViewConfigurationException(String viewName, String message) {
        super(message);
        this.viewName = viewName;
    }

    public String getViewName() {
        return viewName;
    }
}
