package info.isaksson.erland.templatereg.view;

import info.isaksson.erland.templatereg.model.Template;
import info.isaksson.erland.templatereg.registry.TemplateLookupException;
import info.isaksson.erland.templatereg.registry.UnifiedTemplateLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Claims the template of a view during view setup and validates how the view renders.
 */
public final class ViewTemplateChecker {

    private static final Logger LOGGER = LoggerFactory.getLogger(ViewTemplateChecker.class);

    private final UnifiedTemplateLookup lookup;

    public ViewTemplateChecker(UnifiedTemplateLookup lookup) {
        this.lookup = Objects.requireNonNull(lookup, "lookup");
    }

    /**
     * Resolve and associate the template of {@code view}.
     *
     * @return the template, or empty when the view renders itself
     * @throws ViewConfigurationException if the view has two candidate templates, both a template and
     *         a render method, or no way to render at all
     */
    public Optional<Template> check(ViewDescriptor view) {
        Objects.requireNonNull(view, "view");
        String defaultName = view.defaultTemplateName();
        String templateName = view.effectiveTemplateName();

        if (!defaultName.equals(templateName) && lookup.exists(view.module, defaultName)) {
            throw new ViewConfigurationException(view.viewName, "Multiple possible templates for " + view
                    + ". It uses template '" + templateName + "', but there is also a template called '"
                    + defaultName + "'.");
        }

        Template template;
        try {
            template = lookup.lookup(view.module, templateName, true);
        } catch (TemplateLookupException e) {
            if (!view.hasRender && view.requiresRendering) {
                throw new ViewConfigurationException(view.viewName,
                        "View '" + view.viewName + "' in '" + view.module.dottedName()
                                + "' has no associated template or 'render' method.");
            }
            LOGGER.debug("{} renders without a template", view);
            return Optional.empty();
        }

        if (view.hasRender) {
            throw new ViewConfigurationException(view.viewName, "Multiple possible ways to render " + view
                    + ". It has both a 'render' method as well as an associated template.");
        }
        LOGGER.debug("{} uses {}", view, template.describe());
        return Optional.of(template);
    }
}
