package com.hartwig.wdl2cwl.conversion;

import java.util.List;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonSerialize(as = ImmutableConversionReport.class)
public interface ConversionReport {
    /**
     * Results ordered by source file, then by unit order within the file.
     */
    List<UnitResult> units();

    default long successes() {
        return units().stream().filter(UnitResult::success).count();
    }

    default long failures() {
        return units().stream().filter(unit -> unit.status() == ConversionStatus.FAILED).count();
    }

    /**
     * Every unit converted, and none was rejected by the validator
     */
    default boolean isSuccess() {
        return units().stream().allMatch(unit -> unit.success() && unit.validation() != ValidationStatus.FAILED);
    }

    static ImmutableConversionReport.Builder builder() {
        return ImmutableConversionReport.builder();
    }
}
