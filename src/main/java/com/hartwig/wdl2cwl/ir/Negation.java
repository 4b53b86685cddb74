package com.hartwig.wdl2cwl.ir;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Negation extends Expression {
    Expression operand();

    @Override
    default Kind kind() {
        return Kind.NEGATION;
    }
}
