package com.hartwig.wdl2cwl.diagnostic;

import java.util.List;

/**
 * Two different definitions share a name in one namespace.
 */
public class AmbiguousDefinitionException extends ConversionException {
    public AmbiguousDefinitionException(SourceLocation location, String message) {
        super(DiagnosticKind.AMBIGUOUS_DEFINITION, location, message);
    }

    public AmbiguousDefinitionException(List<Diagnostic> diagnostics) {
        super(diagnostics);
    }
}
