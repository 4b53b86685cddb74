package com.hartwig.wdl2cwl.conversion;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

import com.hartwig.wdl2cwl.config.ConverterConfig;
import com.hartwig.wdl2cwl.cwl.CallOrder;
import com.hartwig.wdl2cwl.cwl.CwlDocument;
import com.hartwig.wdl2cwl.cwl.CwlToolWriter;
import com.hartwig.wdl2cwl.cwl.CwlWorkflowWriter;
import com.hartwig.wdl2cwl.cwl.InputTemplateWriter;
import com.hartwig.wdl2cwl.diagnostic.ConversionException;
import com.hartwig.wdl2cwl.diagnostic.Diagnostic;
import com.hartwig.wdl2cwl.diagnostic.DiagnosticKind;
import com.hartwig.wdl2cwl.diagnostic.SourceLocation;
import com.hartwig.wdl2cwl.ir.Task;
import com.hartwig.wdl2cwl.ir.Workflow;
import com.hartwig.wdl2cwl.wdl.ReferenceValidator;
import com.hartwig.wdl2cwl.wdl.ResolvedDocument;
import com.hartwig.wdl2cwl.wdl.WdlReader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts the units of a single WDL file. A unit that fails does not stop the others, except that a workflow fails
 * when one of the tasks it calls does.
 */
class FileConversion {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileConversion.class);

    private final ConverterConfig config;
    private final ConversionRequest request;
    private final ExternalValidator validator;
    private final OutputRegistry outputs;
    private final Path file;
    private final String sourceFile;

    FileConversion(ConverterConfig config, ConversionRequest request, ExternalValidator validator, OutputRegistry outputs, Path file,
            String sourceFile) {
        this.config = config;
        this.request = request;
        this.validator = validator;
        this.outputs = outputs;
        this.file = file;
        this.sourceFile = sourceFile;
    }

    List<UnitResult> run() {
        LOGGER.info("[{}] Converting", sourceFile);
        ResolvedDocument resolved;
        try {
            resolved = new WdlReader().read(file);
        } catch (ConversionException e) {
            LOGGER.warn("[{}] Could not be read: {}", sourceFile, e.getMessage());
            return List.of(fileResult(ConversionStatus.FAILED, e.getDiagnostics()));
        }
        var results = new ArrayList<UnitResult>();
        var references = new ReferenceValidator(resolved.namespace());
        var toolWriter = new CwlToolWriter(config, resolved.namespace());
        var root = resolved.root();
        if (root.workflow().isPresent()) {
            var workflow = root.workflow().get();
            var order = CallOrder.of(workflow, resolved.namespace());
            var convertWorkflow = selected(workflow.name());
            var taskResults = new ArrayList<UnitResult>();
            for (Task task : order.tasks()) {
                if (convertWorkflow || selected(task.name())) {
                    taskResults.add(convertTask(task, toolWriter, references));
                }
            }
            if (convertWorkflow) {
                results.add(convertWorkflow(workflow, order, resolved, references, taskResults));
            }
            results.addAll(taskResults);
        } else {
            for (Task task : root.tasks()) {
                if (selected(task.name())) {
                    results.add(convertTask(task, toolWriter, references));
                }
            }
        }
        if (results.isEmpty()) {
            LOGGER.info("[{}] Nothing matches the unit filter", sourceFile);
            return results;
        }
        if (!resolved.warnings().isEmpty()) {
            var first = results.get(0);
            var diagnostics = new ArrayList<>(resolved.warnings());
            diagnostics.addAll(first.diagnostics());
            results.set(0, ImmutableUnitResult.copyOf(first).withDiagnostics(diagnostics));
        }
        return results;
    }

    static UnitResult cancelled(String sourceFile) {
        return UnitResult.builder()
                .unitName(sourceFile)
                .kind(UnitKind.FILE)
                .sourceFile(sourceFile)
                .status(ConversionStatus.CANCELLED)
                .build();
    }

    static UnitResult unexpectedFailure(String sourceFile, Throwable cause) {
        return UnitResult.builder()
                .unitName(sourceFile)
                .kind(UnitKind.FILE)
                .sourceFile(sourceFile)
                .status(ConversionStatus.FAILED)
                .addDiagnostics(Diagnostic.error(DiagnosticKind.WRITE_ERROR,
                        SourceLocation.of(sourceFile, 1, 1),
                        String.format("Unexpected error: %s", cause.getMessage())))
                .build();
    }

    private boolean selected(String unitName) {
        return request.unitFilter().isEmpty() || request.unitFilter().contains(unitName);
    }

    private UnitResult convertTask(Task task, CwlToolWriter toolWriter, ReferenceValidator references) {
        try {
            references.validateTask(task);
            var document = toolWriter.write(task);
            var path = writeDocument(document, task.name());
            var validation = validate(path);
            LOGGER.info("[{}] Task '{}' written to {}", sourceFile, task.name(), document.relativePath());
            return unitResult(task.name(), UnitKind.TASK, document.relativePath(), validation);
        } catch (ConversionException e) {
            LOGGER.warn("[{}] Task '{}' failed: {}", sourceFile, task.name(), e.getMessage());
            return failure(task.name(), UnitKind.TASK, e.getDiagnostics());
        } catch (IOException e) {
            LOGGER.warn("[{}] Task '{}' could not be written: {}", sourceFile, task.name(), e.getMessage());
            return failure(task.name(), UnitKind.TASK, List.of(ioError(e)));
        }
    }

    private UnitResult convertWorkflow(Workflow workflow, CallOrder order, ResolvedDocument resolved, ReferenceValidator references,
            List<UnitResult> taskResults) {
        var location = workflow.location().orElse(null);
        var diagnostics = new ArrayList<Diagnostic>();
        try {
            references.validateWorkflow(workflow);
        } catch (ConversionException e) {
            diagnostics.addAll(e.getDiagnostics());
        }
        for (UnitResult task : taskResults) {
            if (!task.success()) {
                diagnostics.add(Diagnostic.error(DiagnosticKind.WRITE_ERROR,
                        location,
                        String.format("Workflow '%s' uses task '%s', which failed to convert", workflow.name(), task.unitName())));
            }
        }
        if (!diagnostics.isEmpty()) {
            LOGGER.warn("[{}] Workflow '{}' failed with {} error(s)", sourceFile, workflow.name(), diagnostics.size());
            return failure(workflow.name(), UnitKind.WORKFLOW, diagnostics);
        }
        try {
            var writer = new CwlWorkflowWriter(config, resolved.namespace());
            for (Workflow subworkflow : order.workflows()) {
                writeDocument(writer.write(subworkflow), workflow.name());
            }
            var document = writer.write(workflow);
            var path = writeDocument(document, workflow.name());
            if (config.writeInputTemplates()) {
                writeDocument(new InputTemplateWriter().write(document), workflow.name());
            }
            var validation = validate(path);
            LOGGER.info("[{}] Workflow '{}' written to {}", sourceFile, workflow.name(), document.relativePath());
            return unitResult(workflow.name(), UnitKind.WORKFLOW, document.relativePath(), validation);
        } catch (ConversionException e) {
            LOGGER.warn("[{}] Workflow '{}' failed: {}", sourceFile, workflow.name(), e.getMessage());
            return failure(workflow.name(), UnitKind.WORKFLOW, e.getDiagnostics());
        } catch (IOException e) {
            LOGGER.warn("[{}] Workflow '{}' could not be written: {}", sourceFile, workflow.name(), e.getMessage());
            return failure(workflow.name(), UnitKind.WORKFLOW, List.of(ioError(e)));
        }
    }

    private Path writeDocument(CwlDocument document, String unitName) throws IOException {
        var target = request.outputDirectory().resolve(document.relativePath());
        outputs.write(document.relativePath(), document.render(), sourceFile, unitName, content -> writeAtomically(target, content));
        return target;
    }

    /**
     * Writes to a temporary file next to the target and moves it in place, so readers never see a partial document.
     */
    private static void writeAtomically(Path target, String content) throws IOException {
        var directory = target.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        var temporary = Files.createTempFile(directory, "." + target.getFileName(), ".tmp");
        try {
            Files.writeString(temporary, content, StandardCharsets.UTF_8);
            try {
                Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temporary);
        }
    }

    private ValidationOutcome validate(Path document) {
        if (!request.validate()) {
            return ValidationOutcome.of(ValidationStatus.NOT_REQUESTED, List.of());
        }
        return validator.validate(document);
    }

    private UnitResult unitResult(String name, UnitKind kind, String outputPath, ValidationOutcome validation) {
        return UnitResult.builder()
                .unitName(name)
                .kind(kind)
                .sourceFile(sourceFile)
                .outputPath(outputPath)
                .status(ConversionStatus.SUCCESS)
                .validation(validation.status())
                .diagnostics(validation.diagnostics())
                .build();
    }

    private UnitResult failure(String name, UnitKind kind, List<Diagnostic> diagnostics) {
        return UnitResult.builder()
                .unitName(name)
                .kind(kind)
                .sourceFile(sourceFile)
                .status(ConversionStatus.FAILED)
                .diagnostics(diagnostics)
                .build();
    }

    private UnitResult fileResult(ConversionStatus status, List<Diagnostic> diagnostics) {
        return UnitResult.builder()
                .unitName(sourceFile)
                .kind(UnitKind.FILE)
                .sourceFile(sourceFile)
                .status(status)
                .diagnostics(diagnostics)
                .build();
    }

    private Diagnostic ioError(IOException e) {
        return Diagnostic.error(DiagnosticKind.IO_ERROR, SourceLocation.of(sourceFile, 1, 1), String.format("Could not write output: %s", e.getMessage()));
    }
}
