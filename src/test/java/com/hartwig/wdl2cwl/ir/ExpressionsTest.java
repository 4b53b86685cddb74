package com.hartwig.wdl2cwl.ir;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

class ExpressionsTest {

    @Test
    void collectsReferencesInSourceOrder() {
        var expression = FunctionCall.builder()
                .name("select_first")
                .addArguments(ImmutableArrayLiteral.builder().addElements(Reference.to("override", "cpu"), Literal.integer(2)).build())
                .addArguments(interpolation(Reference.to("sample")))
                .build();

        assertThat(Expressions.references(expression)).containsExactly(Reference.to("override", "cpu"), Reference.to("sample"));
    }

    @Test
    void overrideFallbackReferencesBothSides() {
        var expression = OverrideFallback.of(Reference.to("threads"), Reference.to("default_threads"));
        assertThat(Expressions.references(expression)).containsExactly(Reference.to("threads"), Reference.to("default_threads"));
    }

    @Test
    void substituteReplacesNestedReferences() {
        var expression = negation(Reference.to("flag"));

        var substituted = Expressions.substitute(expression, reference -> reference.root().equals("flag") ? Literal.bool(true) : reference);

        assertThat(substituted).isEqualTo(negation(Literal.bool(true)));
        assertThat(Expressions.references(substituted)).isEmpty();
    }

    @Test
    void substituteKeepsPlaceholderOptions() {
        var parts = List.<TemplatePart>of(LiteralText.of("ls "),
                Placeholder.builder().expression(Reference.to("files")).putOptions("sep", " ").marker("~{sep=\" \" files}").build());

        var substituted = Expressions.substitute(parts, reference -> Reference.to("renamed"));

        assertThat(substituted.get(0)).isEqualTo(LiteralText.of("ls "));
        var placeholder = (Placeholder) substituted.get(1);
        assertThat(placeholder.expression()).isEqualTo(Reference.to("renamed"));
        assertThat(placeholder.option("sep")).contains(" ");
    }

    private static Expression negation(Expression candidate) {
        return ImmutableNegation.builder().operand(FirstDefined.builder().addCandidates(candidate, Literal.bool(false)).build()).build();
    }

    private static Interpolation interpolation(Expression expression) {
        return Interpolation.builder()
                .addParts(LiteralText.of("out_"))
                .addParts(Placeholder.builder().expression(expression).marker("~{sample}").build())
                .build();
    }
}
