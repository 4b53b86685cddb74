package com.hartwig.wdl2cwl.conversion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import com.hartwig.wdl2cwl.diagnostic.Diagnostic;
import com.hartwig.wdl2cwl.diagnostic.DiagnosticKind;
import com.hartwig.wdl2cwl.diagnostic.Severity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

@Timeout(10)
class CwltoolValidatorTest {

    @TempDir
    Path temporary;

    private Path document;

    @BeforeEach
    void setUp() throws Exception {
        document = temporary.resolve("Tool.cwl");
        Files.writeString(document, "cwlVersion: v1.2\nclass: CommandLineTool\n");
    }

    @Test
    void cleanExitPasses() {
        var outcome = new CwltoolValidator(List.of("sh", "-c", "echo \"$0 is valid CWL\""), Duration.ofSeconds(5)).validate(document);
        assertThat(outcome.status()).isEqualTo(ValidationStatus.PASSED);
        assertThat(outcome.diagnostics()).isEmpty();
    }

    @Test
    void errorLinesAndExitCodeBecomeDiagnostics() {
        var outcome = new CwltoolValidator(List.of("sh", "-c", "echo 'ERROR Tool definition failed validation'; exit 1"),
                Duration.ofSeconds(5)).validate(document);

        assertThat(outcome.status()).isEqualTo(ValidationStatus.FAILED);
        assertThat(outcome.diagnostics()).extracting(Diagnostic::message)
                .containsExactly("ERROR Tool definition failed validation", "Validator 'sh' exited with code 1");
        assertThat(outcome.diagnostics()).allSatisfy(diagnostic -> {
            assertThat(diagnostic.kind()).isEqualTo(DiagnosticKind.VALIDATION);
            assertThat(diagnostic.severity()).isEqualTo(Severity.ERROR);
        });
    }

    @Test
    void warningsFailEvenOnCleanExit() {
        var outcome = new CwltoolValidator(List.of("sh", "-c", "echo 'WARNING Workflow checker warning: unknown hint'"), Duration.ofSeconds(5))
                .validate(document);
        assertThat(outcome.status()).isEqualTo(ValidationStatus.FAILED);
        assertThat(outcome.diagnostics()).extracting(Diagnostic::message).containsExactly("WARNING Workflow checker warning: unknown hint");
    }

    @Test
    void unitNamesMentioningErrorsDoNotFail() {
        var command = List.of("sh", "-c", "echo 'INFO Resolved ErrorRateWarning.cwl'; echo 'ErrorRateWarning.cwl is valid CWL.'");
        var outcome = new CwltoolValidator(command, Duration.ofSeconds(5)).validate(document);
        assertThat(outcome.status()).isEqualTo(ValidationStatus.PASSED);
        assertThat(outcome.diagnostics()).isEmpty();
    }

    @Test
    void slowValidatorTimesOut() {
        var outcome = new CwltoolValidator(List.of("sh", "-c", "exec sleep 10"), Duration.ofSeconds(1)).validate(document);
        assertThat(outcome.status()).isEqualTo(ValidationStatus.FAILED);
        assertThat(outcome.diagnostics()).extracting(Diagnostic::message).containsExactly("Validator 'sh' timed out after 1 second(s)");
    }

    @Test
    void missingValidatorIsSkipped() {
        var outcome = new CwltoolValidator(List.of("wdl2cwl-no-such-validator", "--validate"), Duration.ofSeconds(5)).validate(document);
        assertThat(outcome.status()).isEqualTo(ValidationStatus.SKIPPED);
        assertThat(outcome.diagnostics()).hasSize(1);
        assertThat(outcome.diagnostics().get(0).severity()).isEqualTo(Severity.WARNING);
        assertThat(outcome.diagnostics().get(0).message()).startsWith("Validator 'wdl2cwl-no-such-validator' could not be started");
    }

    @Test
    void emptyCommandIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CwltoolValidator(List.of(), Duration.ofSeconds(5)));
    }
}
