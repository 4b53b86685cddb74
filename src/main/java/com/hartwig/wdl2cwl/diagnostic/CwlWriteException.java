package com.hartwig.wdl2cwl.diagnostic;

import java.util.List;

/**
 * Serializing a structurally valid IR failed, usually because of a type CWL has no mapping for.
 */
public class CwlWriteException extends ConversionException {
    public CwlWriteException(SourceLocation location, String message) {
        super(DiagnosticKind.WRITE_ERROR, location, message);
    }

    public CwlWriteException(List<Diagnostic> diagnostics) {
        super(diagnostics);
    }
}
