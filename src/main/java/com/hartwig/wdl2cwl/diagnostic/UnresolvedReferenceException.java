package com.hartwig.wdl2cwl.diagnostic;

import java.util.List;

/**
 * A call, placeholder, scatter collection or output that does not match any declared entity.
 */
public class UnresolvedReferenceException extends ConversionException {
    public UnresolvedReferenceException(SourceLocation location, String message) {
        super(DiagnosticKind.UNRESOLVED_REFERENCE, location, message);
    }

    public UnresolvedReferenceException(List<Diagnostic> diagnostics) {
        super(diagnostics);
    }
}
