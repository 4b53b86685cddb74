package com.hartwig.wdl2cwl.ir;

import java.util.List;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface FunctionCall extends Expression {
    String name();

    List<Expression> arguments();

    @Override
    default Kind kind() {
        return Kind.FUNCTION_CALL;
    }

    static ImmutableFunctionCall.Builder builder() {
        return ImmutableFunctionCall.builder();
    }
}
