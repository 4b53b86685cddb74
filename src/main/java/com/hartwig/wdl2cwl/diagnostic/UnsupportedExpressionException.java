package com.hartwig.wdl2cwl.diagnostic;

import java.util.List;

/**
 * An expression outside the set the translator knows how to express in CWL.
 */
public class UnsupportedExpressionException extends ConversionException {
    public UnsupportedExpressionException(SourceLocation location, String message) {
        super(DiagnosticKind.UNSUPPORTED_EXPRESSION, location, message);
    }

    public UnsupportedExpressionException(List<Diagnostic> diagnostics) {
        super(diagnostics);
    }
}
