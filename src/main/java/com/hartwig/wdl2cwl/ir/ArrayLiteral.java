package com.hartwig.wdl2cwl.ir;

import java.util.List;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ArrayLiteral extends Expression {
    List<Expression> elements();

    @Override
    default Kind kind() {
        return Kind.ARRAY_LITERAL;
    }
}
