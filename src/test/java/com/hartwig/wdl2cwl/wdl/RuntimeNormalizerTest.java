package com.hartwig.wdl2cwl.wdl;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import com.hartwig.wdl2cwl.diagnostic.ConversionException;
import com.hartwig.wdl2cwl.expression.ExpressionEvaluator;
import com.hartwig.wdl2cwl.ir.Expression;
import com.hartwig.wdl2cwl.ir.Literal;
import com.hartwig.wdl2cwl.ir.OverrideFallback;
import com.hartwig.wdl2cwl.ir.Reference;
import com.hartwig.wdl2cwl.ir.RuntimeRequirement;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RuntimeNormalizerTest {
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();
    private RuntimeRequirement runtime;

    @BeforeEach
    void setUp() throws IOException, ConversionException {
        var stream = getClass().getClassLoader().getResourceAsStream("runtime/runtime_attr.wdl");
        var document = WdlParser.parse("runtime_attr.wdl", new String(stream.readAllBytes(), StandardCharsets.UTF_8));
        runtime = document.tasks().get(0).runtime();
    }

    @Test
    void recognizesStructOverridePattern() {
        var memory = runtime.memory().orElseThrow();
        assertThat(memory.amount()).isEqualTo(OverrideFallback.of(Reference.to("runtime_attr_override", "mem_gb"), Literal.floating("3.75")));
        assertThat(memory.unit()).contains("GiB");
        assertThat(runtime.overrideParameter()).contains("runtime_attr_override");
    }

    @Test
    void boundOverrideWins() throws ConversionException {
        var bindings = Map.of("runtime_attr_override", Map.of("cpu_cores", 8L, "mem_gb", 7.5));
        assertThat(evaluator.evaluate(runtime.cpu().orElseThrow().amount(), bindings)).isEqualTo(8L);
        assertThat(evaluator.evaluate(runtime.memory().orElseThrow().amount(), bindings)).isEqualTo(7.5);
    }

    @Test
    void unboundOverrideFallsBackToDefault() throws ConversionException {
        assertThat(evaluator.evaluate(runtime.cpu().orElseThrow().amount())).isEqualTo(1L);
        assertThat(evaluator.evaluate(runtime.memory().orElseThrow().amount())).isEqualTo(3.75);
        assertThat(evaluator.evaluate(runtime.disk().orElseThrow().amount())).isEqualTo(10L);
    }

    @Test
    void unsetMemberOfBoundOverrideFallsBack() throws ConversionException {
        var bindings = Map.of("runtime_attr_override", Map.of("mem_gb", 16.0));
        assertThat(evaluator.evaluate(runtime.cpu().orElseThrow().amount(), bindings)).isEqualTo(1L);
    }

    @Test
    void readsLocalDiskTemplateInGibibytes() {
        var disk = runtime.disk().orElseThrow();
        assertThat(disk.amount().kind()).isEqualTo(Expression.Kind.OVERRIDE_FALLBACK);
        assertThat(disk.unit()).contains("GiB");
    }

    @Test
    void keepsLiteralImage() {
        assertThat(runtime.image()).contains(Literal.string("quay.io/biocontainers/samtools:1.17"));
    }

    @Test
    void plainNumbersUseDefaultUnits() throws ConversionException {
        var document = WdlParser.parse("t.wdl", "task T {\n command <<< true >>>\n runtime {\n memory: 1000000\n disk: \"50 GB\"\n cpu: \"4\"\n }\n}");
        var plain = document.tasks().get(0).runtime();
        assertThat(plain.memory().orElseThrow().unit()).contains("B");
        assertThat(plain.disk().orElseThrow().amount()).isEqualTo(Literal.integer(50));
        assertThat(plain.disk().orElseThrow().unit()).contains("GB");
        assertThat(plain.cpu().orElseThrow().amount()).isEqualTo(Literal.integer(4));
        assertThat(plain.overrideParameter()).isEmpty();
    }

    @Test
    void unrecognizedQuantityIsUnsupported() throws ConversionException {
        var document = WdlParser.parse("t.wdl", "task T {\n input { Int n }\n command <<< true >>>\n runtime {\n memory: n * 2 + \" GiB\"\n }\n}");
        assertThat(document.tasks().get(0).runtime().memory().orElseThrow().amount().kind()).isEqualTo(Expression.Kind.UNSUPPORTED);
    }

    @Test
    void declarationCycleIsLeftUnresolved() throws ConversionException {
        var document = WdlParser.parse("t.wdl", "task T {\n Int a = b\n Int b = a\n command <<< true >>>\n runtime {\n cpu: a\n }\n}");
        var cpu = document.tasks().get(0).runtime().cpu().orElseThrow().amount();
        assertThat(cpu.kind()).isEqualTo(Expression.Kind.REFERENCE);
        assertThat(((Reference) cpu).root()).isEqualTo("a");
    }

    @Test
    void keepsQuantitiesBeyondLongRange() throws ConversionException {
        var document = WdlParser.parse("t.wdl", "task T {\n command <<< true >>>\n runtime {\n memory: \"99999999999999999999 GiB\"\n }\n}");
        var memory = document.tasks().get(0).runtime().memory().orElseThrow();
        assertThat(((Literal) memory.amount()).text()).isEqualTo("99999999999999999999");
        assertThat(((Literal) memory.amount()).value()).isEqualTo(new BigInteger("99999999999999999999"));
        assertThat(memory.unit()).contains("GiB");
    }
}
