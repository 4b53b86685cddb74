package com.hartwig.wdl2cwl.ir;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface LiteralText extends TemplatePart {
    @Value.Parameter
    String text();

    @Override
    default boolean isLiteral() {
        return true;
    }

    static LiteralText of(String text) {
        return ImmutableLiteralText.of(text);
    }
}
