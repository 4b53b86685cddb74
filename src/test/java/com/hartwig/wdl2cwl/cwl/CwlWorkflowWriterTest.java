package com.hartwig.wdl2cwl.cwl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

import com.fasterxml.jackson.databind.JsonNode;
import com.hartwig.wdl2cwl.config.ConverterConfig;
import com.hartwig.wdl2cwl.diagnostic.ConversionException;
import com.hartwig.wdl2cwl.diagnostic.UnsupportedExpressionException;
import com.hartwig.wdl2cwl.wdl.ResolvedDocument;
import com.hartwig.wdl2cwl.wdl.WdlReader;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CwlWorkflowWriterTest {
    private final ConverterConfig config = ConverterConfig.defaults();

    @TempDir
    Path temporary;

    @Test
    void callsBecomeStepsRunningToolDocuments() throws Exception {
        var document = write(read("matrix/matrix.wdl"));
        var workflow = document.content();

        assertThat(document.relativePath()).isEqualTo("Matrix.cwl");
        assertThat(workflow.get("class").asText()).isEqualTo("Workflow");
        assertThat(workflow.get("id").asText()).isEqualTo("Matrix");
        assertThat(workflow.has("requirements")).isFalse();
        assertThat(names(workflow.get("inputs"))).containsExactly("samples", "rows", "docker");
        assertThat(workflow.at("/inputs/rows/default").asInt()).isEqualTo(10);
        assertThat(workflow.at("/inputs/docker/default").asText()).isEqualTo("ubuntu:22.04");

        var build = workflow.at("/steps/BuildMatrix");
        assertThat(build.get("run").asText()).isEqualTo("tools/BuildMatrix.cwl");
        assertThat(build.at("/in/samples/source").asText()).isEqualTo("samples");
        assertThat(build.at("/in/rows/source").asText()).isEqualTo("rows");
        assertThat(build.at("/in/docker/source").asText()).isEqualTo("docker");
        assertThat(build.at("/out/0").asText()).isEqualTo("matrix");
        assertThat(build.at("/out/1").asText()).isEqualTo("columns");

        var score = workflow.at("/steps/ScoreMatrix");
        assertThat(score.at("/in/matrix/source").asText()).isEqualTo("BuildMatrix/matrix");
        assertThat(score.get("out").size()).isEqualTo(2);
    }

    @Test
    void outputsPointAtStepOutputs() throws Exception {
        var workflow = write(read("matrix/matrix.wdl")).content();

        assertThat(workflow.at("/outputs/matrix/outputSource").asText()).isEqualTo("BuildMatrix/matrix");
        assertThat(workflow.at("/outputs/scores/outputSource").asText()).isEqualTo("ScoreMatrix/scores");
        assertThat(workflow.at("/outputs/columns/type").asText()).isEqualTo("int");
        assertThat(workflow.at("/outputs/columns/outputSource").asText()).isEqualTo("BuildMatrix/columns");
    }

    @Test
    void scatterBecomesInlineWorkflowStep() throws Exception {
        var workflow = write(read("scatter/scatter.wdl")).content();

        var scatter = workflow.at("/steps/scatter_bam");
        assertThat(scatter.get("scatter").asText()).isEqualTo("bam");
        assertThat(scatter.at("/in/bam/source").asText()).isEqualTo("bams");
        assertThat(scatter.at("/run/class").asText()).isEqualTo("Workflow");
        assertThat(scatter.at("/run/inputs/bam/type").asText()).isEqualTo("File");
        assertThat(scatter.at("/run/steps/Index/run").asText()).isEqualTo("tools/Index.cwl");
        assertThat(scatter.at("/run/steps/Index/in/bam/source").asText()).isEqualTo("bam");
        assertThat(scatter.at("/run/outputs/Index_index/outputSource").asText()).isEqualTo("Index/index");
        assertThat(scatter.at("/out/0").asText()).isEqualTo("Index_index");

        assertThat(workflow.at("/requirements/ScatterFeatureRequirement").isObject()).isTrue();
        assertThat(workflow.at("/requirements/SubworkflowFeatureRequirement").isObject()).isTrue();
        assertThat(workflow.at("/outputs/indexes/outputSource").asText()).isEqualTo("scatter_bam/Index_index");
    }

    @Test
    void conditionalBecomesStepWithWhen() throws Exception {
        var workflow = write(read("scatter/scatter.wdl")).content();

        var conditional = workflow.at("/steps/if_1");
        assertThat(conditional.get("when").asText()).isEqualTo("$(inputs.summarize)");
        assertThat(conditional.at("/in/summarize/source").asText()).isEqualTo("summarize");
        assertThat(conditional.at("/in/Index_index/source").asText()).isEqualTo("scatter_bam/Index_index");
        assertThat(conditional.at("/run/steps/Summarize/in/indexes/source").asText()).isEqualTo("Index_index");
        assertThat(workflow.at("/outputs/summary/type").asText()).isEqualTo("File?");
        assertThat(workflow.at("/outputs/summary/outputSource").asText()).isEqualTo("if_1/Summarize_summary");
    }

    @Test
    void exposesImagesOfCalledTasksAsWorkflowInputs() throws Exception {
        var workflow = write(read("scatter/scatter.wdl")).content();

        assertThat(workflow.at("/inputs/Index_docker_image/type").asText()).isEqualTo("string");
        assertThat(workflow.at("/inputs/Index_docker_image/default").asText()).isEqualTo("quay.io/biocontainers/samtools:1.17");
        var scatter = workflow.at("/steps/scatter_bam");
        assertThat(scatter.at("/in/Index_docker_image/source").asText()).isEqualTo("Index_docker_image");
        assertThat(scatter.at("/run/steps/Index/in/docker_image/source").asText()).isEqualTo("Index_docker_image");
    }

    @Test
    void exposesUnboundRequiredInputs() throws Exception {
        var resolved = readSource("version 1.0\n"
                + "workflow Wrap {\n"
                + "  call Echo\n"
                + "}\n"
                + "task Echo {\n"
                + "  input {\n"
                + "    String message\n"
                + "    Int? repeat\n"
                + "  }\n"
                + "  command <<<\n"
                + "    echo ~{message}\n"
                + "  >>>\n"
                + "}\n");
        var workflow = write(resolved).content();

        assertThat(names(workflow.get("inputs"))).containsExactly("Echo_message");
        assertThat(workflow.at("/steps/Echo/in/message/source").asText()).isEqualTo("Echo_message");
        assertThat(workflow.at("/steps/Echo/in").has("repeat")).isFalse();
    }

    @Test
    void blockIdsAvoidNamesAlreadyTaken() throws Exception {
        var resolved = readSource("version 1.0\n"
                + "workflow Collide {\n"
                + "  input {\n"
                + "    Array[String] names\n"
                + "    String scatter_n\n"
                + "    Boolean if_1 = true\n"
                + "  }\n"
                + "  scatter (n in names) {\n"
                + "    call Echo { input: message = n, prefix = scatter_n }\n"
                + "  }\n"
                + "  if (if_1) {\n"
                + "    call Echo as first { input: message = scatter_n }\n"
                + "    call Echo as first_out { input: message = scatter_n }\n"
                + "  }\n"
                + "  output {\n"
                + "    Array[File] echoed = Echo.out\n"
                + "    File? picked = first.out\n"
                + "  }\n"
                + "}\n"
                + "task Echo {\n"
                + "  input {\n"
                + "    String message\n"
                + "    String? prefix\n"
                + "  }\n"
                + "  command <<<\n"
                + "    echo ~{message}\n"
                + "  >>>\n"
                + "  output {\n"
                + "    File out = stdout()\n"
                + "  }\n"
                + "}\n");
        var workflow = write(resolved).content();

        assertThat(names(workflow.get("steps"))).containsExactly("scatter_n_2", "if_1_2");
        assertThat(workflow.at("/steps/scatter_n_2/in/scatter_n/source").asText()).isEqualTo("scatter_n");
        assertThat(workflow.at("/outputs/echoed/outputSource").asText()).isEqualTo("scatter_n_2/Echo_out");

        var conditional = workflow.at("/steps/if_1_2");
        assertThat(conditional.at("/in/if_1/source").asText()).isEqualTo("if_1");
        assertThat(conditional.at("/run/outputs/first_out_2/outputSource").asText()).isEqualTo("first/out");
        assertThat(conditional.at("/run/outputs/first_out_out/outputSource").asText()).isEqualTo("first_out/out");
        assertThat(workflow.at("/outputs/picked/outputSource").asText()).isEqualTo("if_1_2/first_out_2");
    }

    @Test
    void computedBindingsBecomeValueFrom() throws Exception {
        var resolved = readSource("version 1.0\n"
                + "workflow Prefix {\n"
                + "  input {\n"
                + "    String sample\n"
                + "  }\n"
                + "  call Echo {\n"
                + "    input:\n"
                + "      message = \"sample_\" + sample\n"
                + "  }\n"
                + "}\n"
                + "task Echo {\n"
                + "  input {\n"
                + "    String message\n"
                + "  }\n"
                + "  command <<<\n"
                + "    echo ~{message}\n"
                + "  >>>\n"
                + "}\n");
        var workflow = write(resolved).content();

        var message = workflow.at("/steps/Echo/in/message");
        assertThat(message.get("source").asText()).isEqualTo("sample");
        assertThat(message.get("valueFrom").asText()).contains("self");
        assertThat(workflow.at("/requirements/StepInputExpressionRequirement").isObject()).isTrue();
    }

    @Test
    void rejectsComputedWorkflowOutputs() throws Exception {
        var resolved = readSource("version 1.0\n"
                + "workflow Count {\n"
                + "  input {\n"
                + "    Int n\n"
                + "  }\n"
                + "  output {\n"
                + "    Int doubled = n * 2\n"
                + "  }\n"
                + "}\n");
        var e = assertThrows(UnsupportedExpressionException.class, () -> write(resolved));
        assertThat(e.getDiagnostics().get(0).message()).isEqualTo("Output 'doubled' of workflow 'Count' must reference a call output or input");
    }

    @Test
    void writesInputTemplateFromWorkflowInputs() throws Exception {
        var template = new InputTemplateWriter().write(write(read("matrix/matrix.wdl")));

        assertThat(template.relativePath()).isEqualTo("Matrix.inputs.yml");
        assertThat(names(template.content())).containsExactly("samples", "rows", "docker");
        assertThat(template.content().get("samples").isNull()).isTrue();
        assertThat(template.content().get("rows").asInt()).isEqualTo(10);
        assertThat(template.content().get("docker").asText()).isEqualTo("ubuntu:22.04");
    }

    @Test
    void callOrderListsTasksInOrderOfFirstUse() throws Exception {
        var resolved = read("scatter/scatter.wdl");
        var order = CallOrder.of(resolved.root().workflow().orElseThrow(), resolved.namespace());

        assertThat(order.tasks()).extracting(task -> task.name()).containsExactly("Index", "Summarize");
        assertThat(order.workflows()).isEmpty();
    }

    private CwlDocument write(ResolvedDocument resolved) throws ConversionException {
        return new CwlWorkflowWriter(config, resolved.namespace()).write(resolved.root().workflow().orElseThrow());
    }

    private ResolvedDocument read(String resource) throws Exception {
        return new WdlReader().read(Path.of(getClass().getClassLoader().getResource(resource).toURI()));
    }

    private ResolvedDocument readSource(String source) throws Exception {
        var file = temporary.resolve("workflow.wdl");
        Files.writeString(file, source);
        return new WdlReader().read(file);
    }

    private static ArrayList<String> names(JsonNode node) {
        var names = new ArrayList<String>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
