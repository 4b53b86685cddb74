package com.hartwig.wdl2cwl.ir;

import org.immutables.value.Value;

/**
 * Two-arm runtime value: the override when it is bound, the fallback otherwise. Exactly one arm is authoritative at
 * resolution time.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface OverrideFallback extends Expression {
    Reference override();

    Expression fallback();

    @Override
    default Kind kind() {
        return Kind.OVERRIDE_FALLBACK;
    }

    static OverrideFallback of(Reference override, Expression fallback) {
        return ImmutableOverrideFallback.builder().override(override).fallback(fallback).build();
    }
}
