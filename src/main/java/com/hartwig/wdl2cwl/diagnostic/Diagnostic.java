package com.hartwig.wdl2cwl.diagnostic;

import java.util.Optional;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

/**
 * A structured finding of the conversion: what went wrong (or looks suspicious), where, and how bad it is.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonSerialize(as = ImmutableDiagnostic.class)
public interface Diagnostic {
    DiagnosticKind kind();

    Severity severity();

    Optional<SourceLocation> location();

    String message();

    default boolean isError() {
        return severity() == Severity.ERROR;
    }

    default String format() {
        return location().map(l -> String.format("%s %s %s: %s", severity(), kind(), l.describe(), message()))
                .orElseGet(() -> String.format("%s %s: %s", severity(), kind(), message()));
    }

    static Diagnostic error(DiagnosticKind kind, SourceLocation location, String message) {
        return ImmutableDiagnostic.builder().kind(kind).severity(Severity.ERROR).location(Optional.ofNullable(location)).message(message).build();
    }

    static Diagnostic warning(DiagnosticKind kind, SourceLocation location, String message) {
        return ImmutableDiagnostic.builder()
                .kind(kind)
                .severity(Severity.WARNING)
                .location(Optional.ofNullable(location))
                .message(message)
                .build();
    }
}
