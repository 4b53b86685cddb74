package com.hartwig.wdl2cwl;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

class Wdl2CwlMainTest {

    @TempDir
    Path output;

    @Test
    void convertsAndWritesReport() throws Exception {
        var exitCode = execute(resource("matrix/matrix.wdl").toString(), "-o", output.toString());

        assertThat(exitCode).isZero();
        assertThat(output.resolve("Matrix.cwl")).exists();
        var report = new ObjectMapper().readTree(output.resolve(Wdl2CwlMain.REPORT_FILE).toFile());
        assertThat(report.get("units").size()).isEqualTo(3);
        assertThat(report.at("/units/0/unitName").asText()).isEqualTo("Matrix");
        assertThat(report.at("/units/0/status").asText()).isEqualTo("SUCCESS");
        assertThat(report.at("/units/0/validation").asText()).isEqualTo("NOT_REQUESTED");
    }

    @Test
    void failedUnitGivesNonZeroExitCode() throws Exception {
        var exitCode = execute(resource("batch").toString(), "-o", output.toString(), "--threads", "2");

        assertThat(exitCode).isEqualTo(1);
        var report = new ObjectMapper().readTree(output.resolve(Wdl2CwlMain.REPORT_FILE).toFile());
        assertThat(report.get("units").size()).isEqualTo(10);
        assertThat(report.at("/units/9/status").asText()).isEqualTo("FAILED");
        assertThat(report.at("/units/9/diagnostics/0/kind").asText()).isEqualTo("PARSE_ERROR");
        assertThat(report.at("/units/9/diagnostics/0/location/line").asInt()).isPositive();
    }

    @Test
    void moduleOptionLimitsConversion() throws Exception {
        var exitCode = execute(resource("matrix/matrix.wdl").toString(), "-o", output.toString(), "-m", "BuildMatrix");

        assertThat(exitCode).isZero();
        assertThat(output.resolve("tools/BuildMatrix.cwl")).exists();
        assertThat(output.resolve("Matrix.cwl")).doesNotExist();
    }

    @Test
    void analyzeWritesCallGraph() throws Exception {
        var exitCode = execute(resource("matrix/matrix.wdl").toString(), "-o", output.toString(), "--analyze");

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output.resolve("Matrix.dot"))).contains("label=\"matrix\"");
        assertThat(output.resolve("Matrix.cwl")).doesNotExist();
    }

    @Test
    void configFileIsRead() throws Exception {
        var exitCode = execute(resource("matrix/matrix.wdl").toString(),
                "-o",
                output.toString(),
                "--config",
                resource("converter-config.yaml").toString());

        assertThat(exitCode).isZero();
        assertThat(output.resolve("cwl-tools/ScoreMatrix.cwl")).exists();
    }

    @Test
    void missingInputFails() {
        assertThat(execute(output.resolve("absent.wdl").toString(), "-o", output.toString())).isEqualTo(1);
    }

    @Test
    void missingOutputOptionIsUsageError() throws Exception {
        assertThat(execute(resource("matrix/matrix.wdl").toString())).isEqualTo(2);
    }

    private static int execute(String... args) {
        return new CommandLine(new Wdl2CwlMain()).execute(args);
    }

    private Path resource(String name) throws URISyntaxException {
        return Path.of(getClass().getClassLoader().getResource(name).toURI());
    }
}
