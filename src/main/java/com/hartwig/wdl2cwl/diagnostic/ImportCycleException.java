package com.hartwig.wdl2cwl.diagnostic;

import java.util.List;

/**
 * The import graph of a document contains a cycle.
 */
public class ImportCycleException extends ConversionException {
    public ImportCycleException(SourceLocation location, String message) {
        super(DiagnosticKind.IMPORT_CYCLE, location, message);
    }

    public ImportCycleException(List<Diagnostic> diagnostics) {
        super(diagnostics);
    }
}
