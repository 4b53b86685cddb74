package com.hartwig.wdl2cwl.diagnostic;

import java.util.List;

/**
 * Malformed or unrecognized WDL syntax.
 */
public class WdlParseException extends ConversionException {
    public WdlParseException(SourceLocation location, String message) {
        super(DiagnosticKind.PARSE_ERROR, location, message);
    }

    public WdlParseException(List<Diagnostic> diagnostics) {
        super(diagnostics);
    }
}
