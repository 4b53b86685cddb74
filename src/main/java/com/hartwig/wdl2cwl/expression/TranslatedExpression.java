package com.hartwig.wdl2cwl.expression;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface TranslatedExpression {
    /**
     * CWL text: a parameter reference, an expression, or a string with embedded references.
     */
    @Value.Parameter
    String text();

    /**
     * Whether evaluating the text needs {@code InlineJavascriptRequirement}.
     */
    @Value.Parameter
    boolean usesJavascript();

    static TranslatedExpression of(String text, boolean usesJavascript) {
        return ImmutableTranslatedExpression.of(text, usesJavascript);
    }
}
