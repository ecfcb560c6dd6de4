package info.isaksson.erland.templatereg.audit;

import info.isaksson.erland.templatereg.registry.InlineTemplateKey;

import java.nio.file.Path;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/** Templates nobody claimed at the end of a run. */
public final class AuditResult {

    public final SortedSet<Path> unassociatedFileTemplates;
    public final SortedSet<InlineTemplateKey> unassociatedInlineTemplates;

    AuditResult(SortedSet<Path> unassociatedFileTemplates, SortedSet<InlineTemplateKey> unassociatedInlineTemplates) {
        this.unassociatedFileTemplates = Collections.unmodifiableSortedSet(new TreeSet<>(unassociatedFileTemplates));
        this.unassociatedInlineTemplates = Collections.unmodifiableSortedSet(new TreeSet<>(unassociatedInlineTemplates));
    }

    public boolean isClean() {
        return unassociatedFileTemplates.isEmpty() && unassociatedInlineTemplates.isEmpty();
    }

    public int count() {
        return unassociatedFileTemplates.size() + unassociatedInlineTemplates.size();
    }
}
