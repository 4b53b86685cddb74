package com.hartwig.wdl2cwl.ir;

import java.util.Optional;

import org.immutables.value.Value;

/**
 * A resource quantity. The amount is a literal, a reference, or an {@link OverrideFallback}; the unit, when present,
 * is a memory unit such as {@code GiB} or {@code MB}.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ResourceSpec {
    Expression amount();

    Optional<String> unit();

    static ResourceSpec of(Expression amount) {
        return ImmutableResourceSpec.builder().amount(amount).build();
    }

    static ResourceSpec of(Expression amount, String unit) {
        return ImmutableResourceSpec.builder().amount(amount).unit(unit).build();
    }
}
