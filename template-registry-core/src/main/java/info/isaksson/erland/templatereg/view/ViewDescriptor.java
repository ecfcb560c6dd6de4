package info.isaksson.erland.templatereg.view;

import info.isaksson.erland.templatereg.model.ModuleInfo;

import java.util.Locale;
import java.util.Objects;

/**
 * What the view checker needs to know about a view.
 *
 * <p>{@code templateName} is the explicitly requested template (null when the view relies on the
 * template named after itself). {@code requiresRendering} is false for views that may legitimately
 * end up with neither a template nor a render method.</p>
 */
public final class ViewDescriptor {

    public final ModuleInfo module;
    public final String viewName;
    public final String templateName;
    public final boolean hasRender;
    public final boolean requiresRendering;

    public ViewDescriptor(ModuleInfo module, String viewName, String templateName,
                          boolean hasRender, boolean requiresRendering) {
        this.module = Objects.requireNonNull(module, "module");
        if (viewName == null || viewName.isBlank()) {
            throw new IllegalArgumentException("viewName must not be blank");
        }
        this.viewName = viewName;
        this.templateName = templateName == null || templateName.isBlank() ? null : templateName;
        this.hasRender = hasRender;
        this.requiresRendering = requiresRendering;
    }

    public static ViewDescriptor of(ModuleInfo module, String viewName) {
        return new ViewDescriptor(module, viewName, null, false, true);
    }

    /** Name of the template implied by the view itself. */
    public String defaultTemplateName() {
        return viewName.toLowerCase(Locale.ROOT);
    }

    public String effectiveTemplateName() {
        return templateName != null ? templateName : defaultTemplateName();
    }

    @Override
    public String toString() {
        return "view '" + viewName + "' in '" + module.dottedName() + "'";
    }
}
