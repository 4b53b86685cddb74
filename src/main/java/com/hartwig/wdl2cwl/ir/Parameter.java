package com.hartwig.wdl2cwl.ir;

import java.util.Optional;

import com.hartwig.wdl2cwl.diagnostic.SourceLocation;

import org.immutables.value.Value;

/**
 * A typed declaration: a task or workflow input (with an optional default), an output (with the expression that
 * produces it) or a private declaration.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Parameter {
    String name();

    ParameterType type();

    /**
     * Default value of an input, value of an output or of a private declaration. An optional input without one is
     * unset, which is not the same as any value.
     */
    Optional<Expression> expression();

    @Value.Auxiliary
    Optional<SourceLocation> location();

    static ImmutableParameter.Builder builder() {
        return ImmutableParameter.builder();
    }

    static Parameter of(String name, ParameterType type) {
        return builder().name(name).type(type).build();
    }
}
