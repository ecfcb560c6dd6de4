package info.isaksson.erland.templatereg.core;

import info.isaksson.erland.templatereg.model.TemplateFileFactories;

import java.util.ArrayList;
import java.util.List;

/**
 * Options for a registration run.
 *
 * <p>This mirrors the CLI flags in a structured form.</p>
 */
public final class TemplateRegistryOptions {

    /** Template file extensions (without dot) mapped to plain file templates. */
    public List<String> extensions = new ArrayList<>(List.of(TemplateFileFactories.PAGE_TEMPLATE_EXTENSION));

    /** Glob patterns, relative to the root, of template directories to skip. */
    public List<String> excludes = new ArrayList<>();

    /**
     * If true, a run that leaves templates unassociated is reported as failed
     * (see {@link TemplateRegistryResult#isFailedByUnassociated()}).
     */
    public boolean failOnUnassociated = false;
}
