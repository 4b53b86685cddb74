package com.hartwig.wdl2cwl.ir;

import org.immutables.value.Value;

/**
 * Verbatim text of an expression the converter has no CWL template for.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface UnsupportedExpression extends Expression {
    String text();

    @Override
    default Kind kind() {
        return Kind.UNSUPPORTED;
    }
}
