package com.hartwig.wdl2cwl.wdl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.hartwig.wdl2cwl.diagnostic.DiagnosticKind;
import com.hartwig.wdl2cwl.diagnostic.WdlParseException;
import com.hartwig.wdl2cwl.ir.Expression;
import com.hartwig.wdl2cwl.ir.FirstDefined;
import com.hartwig.wdl2cwl.ir.Interpolation;
import com.hartwig.wdl2cwl.ir.Literal;
import com.hartwig.wdl2cwl.ir.LiteralText;
import com.hartwig.wdl2cwl.ir.OverrideFallback;
import com.hartwig.wdl2cwl.ir.ParameterType;
import com.hartwig.wdl2cwl.ir.Placeholder;
import com.hartwig.wdl2cwl.ir.Reference;
import com.hartwig.wdl2cwl.ir.SourceDocument;
import com.hartwig.wdl2cwl.ir.Task;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WdlParserTest {
    private SourceDocument matrix;

    @BeforeEach
    void setUp() throws IOException, WdlParseException {
        var stream = getClass().getClassLoader().getResourceAsStream("matrix/matrix.wdl");
        matrix = WdlParser.parse("matrix.wdl", new String(stream.readAllBytes(), StandardCharsets.UTF_8));
    }

    @Test
    void parsesWorkflowAndTasks() {
        assertThat(matrix.version()).contains("1.0");
        var workflow = matrix.workflow().orElseThrow();
        assertThat(workflow.name()).isEqualTo("Matrix");
        assertThat(workflow.inputs().keySet()).containsExactly("samples", "rows", "docker");
        assertThat(workflow.outputs().keySet()).containsExactly("matrix", "scores", "columns");
        assertThat(workflow.calls()).extracting(call -> call.name()).containsExactly("BuildMatrix", "ScoreMatrix");
        assertThat(workflow.calls().get(1).bindings().get("matrix")).isEqualTo(Reference.to("BuildMatrix", "matrix"));
        assertThat(matrix.tasks()).extracting(Task::name).containsExactly("BuildMatrix", "ScoreMatrix");
    }

    @Test
    void parsesTaskSections() {
        var task = matrix.tasks().get(0);
        assertThat(task.inputs()).extracting(input -> input.name()).containsExactly("samples", "rows", "docker", "cpu_override");
        assertThat(task.findInput("cpu_override").orElseThrow().type()).isEqualTo(ParameterType.optionalOf(ParameterType.integer()));
        assertThat(task.outputs()).hasSize(2);
        assertThat(task.placeholders()).extracting(Placeholder::expression).containsExactly(Reference.to("rows"), Reference.to("samples"));
        assertThat(task.runtime().image()).contains(Reference.to("docker"));
    }

    @Test
    void normalizesRuntimeResources() {
        var runtime = matrix.tasks().get(0).runtime();
        var cpu = runtime.cpu().orElseThrow().amount();
        assertThat(cpu).isEqualTo(OverrideFallback.of(Reference.to("cpu_override"), Literal.integer(2)));
        assertThat(runtime.overrideParameter()).contains("cpu_override");
        assertThat(runtime.memory().orElseThrow().amount()).isEqualTo(Literal.integer(4));
        assertThat(runtime.memory().orElseThrow().unit()).contains("GiB");
        assertThat(runtime.disk().orElseThrow().amount()).isEqualTo(Literal.integer(20));
        assertThat(runtime.disk().orElseThrow().unit()).contains("GiB");
        assertThat(runtime.platformHints()).containsOnlyKeys("preemptible");
    }

    @Test
    void warnsAboutRuntimeAttributesWithoutEquivalent() {
        assertThat(matrix.warnings()).hasSize(1);
        assertThat(matrix.warnings().get(0).kind()).isEqualTo(DiagnosticKind.PLATFORM_HINT);
        assertThat(matrix.warnings().get(0).message()).contains("preemptible");
    }

    @Test
    void concatenationBecomesInterpolation() {
        var placeholder = matrix.tasks().get(1).placeholders().get(1);
        assertThat(placeholder.marker()).isEqualTo("${\"--label \" + label}");
        var expression = placeholder.expression();
        assertThat(expression.kind()).isEqualTo(Expression.Kind.INTERPOLATION);
        var parts = ((Interpolation) expression).parts();
        assertThat(parts).hasSize(2);
        assertThat(parts.get(0)).isEqualTo(LiteralText.of("--label "));
        assertThat(((Placeholder) parts.get(1)).expression()).isEqualTo(Reference.to("label"));
        assertThat(((Placeholder) parts.get(1)).propagatesUndefined()).isTrue();
    }

    @Test
    void placeholderInsideStringLiteralRendersUnsetAsEmpty() throws WdlParseException {
        var document = WdlParser.parse("t.wdl", "task T {\n input { String? x\n String y = \"a ~{x}\" + \"b\" }\n command <<< true >>>\n}");
        var value = (Interpolation) document.tasks().get(0).findInput("y").orElseThrow().expression().orElseThrow();
        assertThat(value.parts()).hasSize(3);
        assertThat(value.parts().get(1)).isInstanceOf(Placeholder.class);
        assertThat(((Placeholder) value.parts().get(1)).propagatesUndefined()).isFalse();
        assertThat(value.parts().get(0)).isEqualTo(LiteralText.of("a "));
        assertThat(value.parts().get(2)).isEqualTo(LiteralText.of("b"));
    }

    @Test
    void keepsPlaceholderOptions() throws WdlParseException {
        var document = WdlParser.parse("t.wdl", "task T {\n input { Array[File] fs }\n command <<< ls ~{sep=\",\" fs} >>>\n}");
        var placeholder = document.tasks().get(0).placeholders().get(0);
        assertThat(placeholder.option("sep")).contains(",");
        assertThat(placeholder.expression()).isEqualTo(Reference.to("fs"));
    }

    @Test
    void selectFirstOfLiteralListIsFirstDefined() throws WdlParseException {
        var document = WdlParser.parse("t.wdl", "task T {\n input { Int? a\n Int b = select_first([a, 4]) }\n command <<< true >>>\n}");
        var value = document.tasks().get(0).findInput("b").orElseThrow().expression().orElseThrow();
        assertThat(value).isInstanceOf(FirstDefined.class);
        assertThat(((FirstDefined) value).candidates()).containsExactly(Reference.to("a"), Literal.integer(4));
    }

    @Test
    void keepsUntranslatableExpressionsAsUnsupported() throws WdlParseException {
        var document = WdlParser.parse("t.wdl", "task T {\n input { Int n\n Int m = if n > 1 then n else 1 }\n command <<< true >>>\n}");
        var value = document.tasks().get(0).findInput("m").orElseThrow().expression().orElseThrow();
        assertThat(value.kind()).isEqualTo(Expression.Kind.UNSUPPORTED);
    }

    @Test
    void skipsWorkflowDeclarationsWithWarning() throws WdlParseException {
        var document = WdlParser.parse("t.wdl", "version 1.0\nworkflow W {\n String greeting = \"hi\"\n}");
        assertThat(document.workflow().orElseThrow().body()).isEmpty();
        assertThat(document.warnings()).extracting(warning -> warning.kind()).containsExactly(DiagnosticKind.UNRECOGNIZED_CONSTRUCT);
    }

    @Test
    void taskWithoutCommandIsRejected() {
        var e = assertThrows(WdlParseException.class, () -> WdlParser.parse("t.wdl", "task T {\n input { Int n }\n}"));
        assertThat(e.getDiagnostics().get(0).message()).isEqualTo("Task 'T' has no command section");
    }

    @Test
    void secondWorkflowIsRejected() {
        var e = assertThrows(WdlParseException.class, () -> WdlParser.parse("t.wdl", "workflow A {\n}\nworkflow B {\n}"));
        assertThat(e.getDiagnostics().get(0).message()).contains("'A' is already defined");
    }

    @Test
    void outputWithoutValueIsRejected() {
        var e = assertThrows(WdlParseException.class,
                () -> WdlParser.parse("t.wdl", "task T {\n command <<< true >>>\n output { File f }\n}"));
        assertThat(e.getDiagnostics().get(0).message()).isEqualTo("Output 'f' has no expression");
    }

    @Test
    void integerBeyondLongRangeIsRejected() {
        var e = assertThrows(WdlParseException.class,
                () -> WdlParser.parse("t.wdl", "task T {\n input { Int n = 99999999999999999999 }\n command <<< true >>>\n}"));
        assertThat(e.getDiagnostics().get(0).message()).isEqualTo("Integer literal '99999999999999999999' is out of range");
        assertThat(e.getDiagnostics().get(0).location().orElseThrow().line()).isEqualTo(2);
    }
}
