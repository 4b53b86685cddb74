package com.hartwig.wdl2cwl.expression;

import java.util.Optional;

import com.hartwig.wdl2cwl.ir.ParameterType;

import org.immutables.value.Value;

/**
 * Where a referenced value lives in the CWL document, e.g. {@code inputs.sample} or {@code self}, and its declared
 * type when known.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ResolvedReference {
    @Value.Parameter
    String path();

    @Value.Parameter
    Optional<ParameterType> type();

    static ResolvedReference of(String path, ParameterType type) {
        return ImmutableResolvedReference.of(path, Optional.ofNullable(type));
    }
}
