package com.hartwig.wdl2cwl.ir;

import java.util.Map;

import org.immutables.value.Value;

/**
 * {@code object { cpu_cores: 1, mem_gb: 3.75 }}, or a struct literal.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ObjectLiteral extends Expression {
    Map<String, Expression> members();

    @Override
    default Kind kind() {
        return Kind.OBJECT_LITERAL;
    }
}
