package com.hartwig.wdl2cwl.diagnostic;

public enum DiagnosticKind {
    PARSE_ERROR,
    UNRESOLVED_REFERENCE,
    AMBIGUOUS_DEFINITION,
    UNSUPPORTED_EXPRESSION,
    IMPORT_CYCLE,
    WRITE_ERROR,
    IO_ERROR,
    UNRECOGNIZED_CONSTRUCT,
    PLATFORM_HINT,
    VALIDATION
}
