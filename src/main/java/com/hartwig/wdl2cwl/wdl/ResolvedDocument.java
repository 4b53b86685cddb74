package com.hartwig.wdl2cwl.wdl;

import java.util.List;

import com.hartwig.wdl2cwl.diagnostic.Diagnostic;
import com.hartwig.wdl2cwl.ir.SourceDocument;

/**
 * A parsed document together with the namespace its imports were resolved into.
 */
public final class ResolvedDocument {
    private final SourceDocument root;
    private final TaskNamespace namespace;
    private final List<Diagnostic> warnings;

    public ResolvedDocument(SourceDocument root, TaskNamespace namespace, List<Diagnostic> warnings) {
        this.root = root;
        this.namespace = namespace;
        this.warnings = List.copyOf(warnings);
    }

    public SourceDocument root() {
        return root;
    }

    public TaskNamespace namespace() {
        return namespace;
    }

    /**
     * Warnings of the document and of every document it imports.
     */
    public List<Diagnostic> warnings() {
        return warnings;
    }
}
