package com.hartwig.wdl2cwl.conversion;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.hartwig.wdl2cwl.diagnostic.Diagnostic;

import org.immutables.value.Value;

/**
 * Outcome of converting one workflow or task.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonSerialize(as = ImmutableUnitResult.class)
public interface UnitResult {
    String unitName();

    UnitKind kind();

    String sourceFile();

    /**
     * Written document, relative to the output directory
     */
    Optional<String> outputPath();

    ConversionStatus status();

    @Value.Default
    default ValidationStatus validation() {
        return ValidationStatus.NOT_REQUESTED;
    }

    List<Diagnostic> diagnostics();

    default boolean success() {
        return status() == ConversionStatus.SUCCESS;
    }

    static ImmutableUnitResult.Builder builder() {
        return ImmutableUnitResult.builder();
    }
}
