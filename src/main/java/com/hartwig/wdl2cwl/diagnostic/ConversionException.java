package com.hartwig.wdl2cwl.diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Base of all conversion failures. Carries the diagnostics that caused the failure, at least one of them an error.
 */
public class ConversionException extends Exception {
    private final List<Diagnostic> diagnostics;

    public ConversionException(List<Diagnostic> diagnostics) {
        super(summarize(diagnostics));
        if (diagnostics.isEmpty()) {
            throw new IllegalArgumentException("A conversion exception needs at least one diagnostic");
        }
        this.diagnostics = List.copyOf(diagnostics);
    }

    public ConversionException(DiagnosticKind kind, SourceLocation location, String message) {
        this(List.of(Diagnostic.error(kind, location, message)));
    }

    public ConversionException(DiagnosticKind kind, SourceLocation location, String message, Throwable cause) {
        this(List.of(Diagnostic.error(kind, location, message)));
        initCause(cause);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public DiagnosticKind getKind() {
        return diagnostics.get(0).kind();
    }

    private static String summarize(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::format).collect(Collectors.joining("; "));
    }
}
