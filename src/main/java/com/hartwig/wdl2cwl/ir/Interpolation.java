package com.hartwig.wdl2cwl.ir;

import java.util.List;

import org.immutables.value.Value;

/**
 * A string built from literal text and embedded expressions. String concatenations are normalized into this form, with
 * their operands marked by {@link Placeholder#propagatesUndefined()}.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Interpolation extends Expression {
    List<TemplatePart> parts();

    @Override
    default Kind kind() {
        return Kind.INTERPOLATION;
    }

    static ImmutableInterpolation.Builder builder() {
        return ImmutableInterpolation.builder();
    }
}
