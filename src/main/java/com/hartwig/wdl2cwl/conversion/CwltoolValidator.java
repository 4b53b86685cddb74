package com.hartwig.wdl2cwl.conversion;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

import com.hartwig.wdl2cwl.ExecutorUtil;
import com.hartwig.wdl2cwl.diagnostic.Diagnostic;
import com.hartwig.wdl2cwl.diagnostic.DiagnosticKind;
import com.hartwig.wdl2cwl.diagnostic.SourceLocation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an external validator, {@code cwltool --validate} by default, with the document path as last argument. Exit
 * code 0 without {@code ERROR} or {@code WARNING} log lines in the output is a pass; a validator that cannot be started
 * is skipped.
 */
public class CwltoolValidator implements ExternalValidator {
    private static final Logger LOGGER = LoggerFactory.getLogger(CwltoolValidator.class);
    // cwltool prefixes log lines with their level
    private static final Pattern DIAGNOSTIC_LINE = Pattern.compile("^\\s*(ERROR|WARNING)\\b.*");
    private static final ExecutorService OUTPUT_READERS = ExecutorUtil.createUnboundedExecutorService("wdl2cwl-validator-output-%d");

    private final List<String> command;
    private final Duration timeout;

    public CwltoolValidator(List<String> command, Duration timeout) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Validator command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    @Override
    public ValidationOutcome validate(Path document) {
        var arguments = new ArrayList<>(command);
        arguments.add(document.toString());
        var location = SourceLocation.of(document.toString(), 1, 1);
        Process process;
        try {
            process = new ProcessBuilder(arguments).redirectErrorStream(true).start();
        } catch (IOException e) {
            LOGGER.warn("[{}] Validator '{}' could not be started, validation skipped: {}", document.getFileName(), command.get(0), e.getMessage());
            return ValidationOutcome.of(ValidationStatus.SKIPPED,
                    List.of(Diagnostic.warning(DiagnosticKind.VALIDATION,
                            location,
                            String.format("Validator '%s' could not be started: %s", command.get(0), e.getMessage()))));
        }
        var output = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()), OUTPUT_READERS);
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                LOGGER.warn("[{}] Validator timed out after {} second(s)", document.getFileName(), timeout.toSeconds());
                return failed(location, String.format("Validator '%s' timed out after %d second(s)", command.get(0), timeout.toSeconds()));
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return failed(location, "Validation was interrupted");
        }
        var diagnostics = new ArrayList<Diagnostic>();
        for (String line : output.join().split("\\R")) {
            if (DIAGNOSTIC_LINE.matcher(line).matches()) {
                diagnostics.add(Diagnostic.error(DiagnosticKind.VALIDATION, location, line.trim()));
            }
        }
        var exitCode = process.exitValue();
        if (exitCode == 0 && diagnostics.isEmpty()) {
            LOGGER.debug("[{}] Validation passed", document.getFileName());
            return ValidationOutcome.passed();
        }
        if (exitCode != 0) {
            diagnostics.add(Diagnostic.error(DiagnosticKind.VALIDATION, location, String.format("Validator '%s' exited with code %d", command.get(0), exitCode)));
        }
        LOGGER.info("[{}] Validation failed with {} diagnostic(s)", document.getFileName(), diagnostics.size());
        return ValidationOutcome.of(ValidationStatus.FAILED, diagnostics);
    }

    private static ValidationOutcome failed(SourceLocation location, String message) {
        return ValidationOutcome.of(ValidationStatus.FAILED, List.of(Diagnostic.error(DiagnosticKind.VALIDATION, location, message)));
    }

    private static String readAll(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "ERROR could not read validator output: " + e.getMessage();
        }
    }
}
