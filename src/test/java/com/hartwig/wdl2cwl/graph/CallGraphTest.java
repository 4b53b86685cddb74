package com.hartwig.wdl2cwl.graph;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;

import com.hartwig.wdl2cwl.wdl.ResolvedDocument;
import com.hartwig.wdl2cwl.wdl.WdlReader;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CallGraphTest {

    @TempDir
    Path temporary;

    @Test
    void linearCallsRunOneAfterAnother() throws Exception {
        var graph = graph(read("matrix/matrix.wdl"));

        assertThat(graph.hasCycle()).isFalse();
        assertThat(graph.executionOrder()).containsExactly("BuildMatrix", "ScoreMatrix");
        assertThat(graph.maxParallelism()).isEqualTo(1);
        assertThat(graph.toDotFormat()).contains("label=\"BuildMatrix\"").contains("label=\"ScoreMatrix\"").contains("label=\"matrix\"");
    }

    @Test
    void blocksAddDependenciesOfTheirCollectionAndCondition() throws Exception {
        var graph = graph(read("scatter/scatter.wdl"));

        assertThat(graph.executionOrder()).containsExactly("Index", "Summarize");
        assertThat(graph.toDotFormat()).contains("label=\"index\"").contains("headlabel=\"indexes\"");
    }

    @Test
    void dependencyCarriesEveryOutputAndBindingBetweenTwoCalls() throws Exception {
        var graph = graph(readSource("version 1.0\n"
                + "workflow Pair {\n"
                + "  call Split\n"
                + "  if (Split.ok) {\n"
                + "    call Merge {\n"
                + "      input:\n"
                + "        a = Split.left,\n"
                + "        b = Split.right\n"
                + "    }\n"
                + "  }\n"
                + "}\n"
                + "task Split {\n"
                + "  command <<<\n"
                + "    split input.txt\n"
                + "  >>>\n"
                + "  output {\n"
                + "    Boolean ok = true\n"
                + "    File left = \"xaa\"\n"
                + "    File right = \"xab\"\n"
                + "  }\n"
                + "}\n"
                + "task Merge {\n"
                + "  input {\n"
                + "    File a\n"
                + "    File b\n"
                + "  }\n"
                + "  command <<<\n"
                + "    cat ~{a} ~{b}\n"
                + "  >>>\n"
                + "}\n"));

        assertThat(graph.executionOrder()).containsExactly("Split", "Merge");
        assertThat(graph.toDotFormat()).contains("label=\"ok,left,right\"").contains("headlabel=\"a,b\"");
    }

    @Test
    void independentCallsCanRunInParallel() throws Exception {
        var graph = graph(readSource("version 1.0\n"
                + "workflow Fan {\n"
                + "  call Echo as left\n"
                + "  call Echo as right\n"
                + "  call Echo as middle\n"
                + "  call Join {\n"
                + "    input:\n"
                + "      a = left.out,\n"
                + "      b = right.out\n"
                + "  }\n"
                + "}\n"
                + ECHO
                + "task Join {\n"
                + "  input {\n"
                + "    File a\n"
                + "    File b\n"
                + "  }\n"
                + "  command <<<\n"
                + "    cat ~{a} ~{b}\n"
                + "  >>>\n"
                + "}\n"));

        assertThat(graph.maxParallelism()).isEqualTo(3);
        var order = graph.executionOrder();
        assertThat(order).hasSize(4);
        assertThat(order.indexOf("Join")).isGreaterThan(order.indexOf("left")).isGreaterThan(order.indexOf("right"));
    }

    @Test
    void detectsCyclicCalls() throws Exception {
        var graph = graph(readSource("version 1.0\n"
                + "workflow Loop {\n"
                + "  call Copy as first {\n"
                + "    input:\n"
                + "      source = second.out\n"
                + "  }\n"
                + "  call Copy as second {\n"
                + "    input:\n"
                + "      source = first.out\n"
                + "  }\n"
                + "}\n"
                + "task Copy {\n"
                + "  input {\n"
                + "    File source\n"
                + "  }\n"
                + "  command <<<\n"
                + "    cp ~{source} out.txt\n"
                + "  >>>\n"
                + "  output {\n"
                + "    File out = \"out.txt\"\n"
                + "  }\n"
                + "}\n"));

        assertThat(graph.hasCycle()).isTrue();
        assertThat(graph.executionOrder()).isEmpty();
        assertThat(graph.maxParallelism()).isZero();
    }

    @Test
    void analysisSummarizesWorkflow() throws Exception {
        var analysis = graph(read("matrix/matrix.wdl")).analyze();

        assertThat(analysis.workflowName()).isEqualTo("Matrix");
        assertThat(analysis.inputCount()).isEqualTo(3);
        assertThat(analysis.outputCount()).isEqualTo(3);
        assertThat(analysis.taskCount()).isEqualTo(2);
        assertThat(analysis.callCount()).isEqualTo(2);
        assertThat(analysis.hasCycle()).isFalse();
        assertThat(analysis.executionOrder()).containsExactly("BuildMatrix", "ScoreMatrix");
        assertThat(analysis.dot()).contains("digraph");
    }

    private static final String ECHO = "task Echo {\n"
            + "  command <<<\n"
            + "    echo hi > out.txt\n"
            + "  >>>\n"
            + "  output {\n"
            + "    File out = \"out.txt\"\n"
            + "  }\n"
            + "}\n";

    private CallGraph graph(ResolvedDocument resolved) {
        return new CallGraph(resolved.root().workflow().orElseThrow(), resolved.namespace());
    }

    private ResolvedDocument read(String resource) throws Exception {
        return new WdlReader().read(Path.of(getClass().getClassLoader().getResource(resource).toURI()));
    }

    private ResolvedDocument readSource(String source) throws Exception {
        var file = temporary.resolve("workflow.wdl");
        Files.writeString(file, source);
        return new WdlReader().read(file);
    }
}
