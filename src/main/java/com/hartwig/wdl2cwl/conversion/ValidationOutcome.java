package com.hartwig.wdl2cwl.conversion;

import java.util.List;

import com.hartwig.wdl2cwl.diagnostic.Diagnostic;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ValidationOutcome {
    @Value.Parameter
    ValidationStatus status();

    @Value.Parameter
    List<Diagnostic> diagnostics();

    static ValidationOutcome passed() {
        return ImmutableValidationOutcome.of(ValidationStatus.PASSED, List.of());
    }

    static ValidationOutcome of(ValidationStatus status, List<Diagnostic> diagnostics) {
        return ImmutableValidationOutcome.of(status, diagnostics);
    }
}
