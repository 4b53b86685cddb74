package com.hartwig.wdl2cwl.expression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import com.hartwig.wdl2cwl.diagnostic.UnsupportedExpressionException;
import com.hartwig.wdl2cwl.ir.FirstDefined;
import com.hartwig.wdl2cwl.ir.FunctionCall;
import com.hartwig.wdl2cwl.ir.ImmutableArrayLiteral;
import com.hartwig.wdl2cwl.ir.ImmutableNegation;
import com.hartwig.wdl2cwl.ir.ImmutableUnsupportedExpression;
import com.hartwig.wdl2cwl.ir.Interpolation;
import com.hartwig.wdl2cwl.ir.Literal;
import com.hartwig.wdl2cwl.ir.LiteralText;
import com.hartwig.wdl2cwl.ir.OverrideFallback;
import com.hartwig.wdl2cwl.ir.Placeholder;
import com.hartwig.wdl2cwl.ir.Reference;

import org.junit.jupiter.api.Test;

class ExpressionEvaluatorTest {
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

    @Test
    void literalsAndLiteralCollectionsAreConstant() {
        assertThat(evaluator.isConstant(Literal.integer(3))).isTrue();
        assertThat(evaluator.isConstant(ImmutableArrayLiteral.builder().addElements(Literal.string("a"), Literal.none()).build())).isTrue();
        assertThat(evaluator.isConstant(Reference.to("x"))).isFalse();
        assertThat(evaluator.isConstant(FunctionCall.builder().name("stdout").build())).isFalse();
    }

    @Test
    void overrideFallbackPrefersBoundOverride() throws UnsupportedExpressionException {
        var cpu = OverrideFallback.of(Reference.to("runtime_attr_override", "cpu"), Literal.integer(1));
        assertThat(evaluator.evaluate(cpu, Map.of("runtime_attr_override", Map.of("cpu", 8L)))).isEqualTo(8L);
        assertThat(evaluator.evaluate(cpu)).isEqualTo(1L);
    }

    @Test
    void firstDefinedSkipsUnsetCandidates() throws UnsupportedExpressionException {
        var value = FirstDefined.builder().addCandidates(Reference.to("a"), Reference.to("b"), Literal.string("c")).build();
        assertThat(evaluator.evaluate(value, Map.of("b", "bound"))).isEqualTo("bound");
        assertThat(evaluator.evaluate(value)).isEqualTo("c");
    }

    @Test
    void interpolatesTextAndDefined() throws UnsupportedExpressionException {
        var name = Interpolation.builder()
                .addParts(LiteralText.of("sample_"), Placeholder.builder().expression(Reference.to("id")).marker("~{id}").build())
                .build();
        assertThat(evaluator.evaluate(name, Map.of("id", 7L))).isEqualTo("sample_7");
        var defined = FunctionCall.builder().name("defined").addArguments(Reference.to("id")).build();
        assertThat(evaluator.evaluate(defined)).isEqualTo(false);
        assertThat(evaluator.evaluate(ImmutableNegation.builder().operand(defined).build())).isEqualTo(true);
        assertThat(evaluator.evaluate(ImmutableArrayLiteral.builder().addElements(Literal.integer(1), Literal.bool(true)).build()))
                .isEqualTo(List.of(1L, true));
    }

    @Test
    void rejectsWhatItCannotEvaluate() {
        var unsupported = ImmutableUnsupportedExpression.builder().text("a * 2").build();
        assertThrows(UnsupportedExpressionException.class, () -> evaluator.evaluate(unsupported));
        var glob = FunctionCall.builder().name("glob").addArguments(Literal.string("*.txt")).build();
        assertThrows(UnsupportedExpressionException.class, () -> evaluator.evaluate(glob));
        assertThrows(UnsupportedExpressionException.class,
                () -> evaluator.evaluate(ImmutableNegation.builder().operand(Literal.integer(1)).build()));
    }
}
