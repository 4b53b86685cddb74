package com.hartwig.wdl2cwl.ir;

import java.util.List;

import org.immutables.value.Value;

/**
 * The first candidate that has a value, {@code select_first([a, b, c])} in WDL.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface FirstDefined extends Expression {
    List<Expression> candidates();

    @Override
    default Kind kind() {
        return Kind.FIRST_DEFINED;
    }

    static ImmutableFirstDefined.Builder builder() {
        return ImmutableFirstDefined.builder();
    }
}
