package com.hartwig.wdl2cwl.conversion;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import com.hartwig.wdl2cwl.ExecutorUtil;
import com.hartwig.wdl2cwl.config.ConverterConfig;
import com.hartwig.wdl2cwl.diagnostic.ConversionException;
import com.hartwig.wdl2cwl.diagnostic.DiagnosticKind;
import com.hartwig.wdl2cwl.diagnostic.SourceLocation;
import com.hartwig.wdl2cwl.graph.CallGraph;
import com.hartwig.wdl2cwl.graph.WorkflowAnalysis;
import com.hartwig.wdl2cwl.wdl.WdlReader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of a conversion run: finds the WDL files of a request, converts them on a worker pool and collects the
 * results into one report.
 */
public class ConversionOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConversionOrchestrator.class);

    private final ConverterConfig config;
    private final ExternalValidator validator;

    public ConversionOrchestrator(ConverterConfig config) {
        this(config, new CwltoolValidator(config.validatorCommand(), Duration.ofSeconds(config.validatorTimeoutSeconds())));
    }

    public ConversionOrchestrator(ConverterConfig config, ExternalValidator validator) {
        this.config = config;
        this.validator = validator;
    }

    public ConversionReport convert(ConversionRequest request) throws IOException {
        return start(request).report();
    }

    public ConversionBatch start(ConversionRequest request) throws IOException {
        var files = sourceFiles(request.input());
        LOGGER.info("Converting {} file(s) from {} into {}", files.size(), request.input(), request.outputDirectory());
        Files.createDirectories(request.outputDirectory());
        var executor = ExecutorUtil.createExecutorService(config.threads(), "wdl2cwl-convert-%d");
        var cancelled = new AtomicBoolean(false);
        var sourceFiles = files.stream().map(file -> sourceFileName(request.input(), file)).collect(Collectors.toList());
        var outputs = new OutputRegistry(sourceFiles);
        var futures = new ArrayList<CompletableFuture<List<UnitResult>>>();
        for (int i = 0; i < files.size(); i++) {
            var sourceFile = sourceFiles.get(i);
            var conversion = new FileConversion(config, request, validator, outputs, files.get(i), sourceFile);
            futures.add(CompletableFuture.supplyAsync(() -> cancelled.get() ? List.of(FileConversion.cancelled(sourceFile)) : conversion.run(),
                    executor).exceptionally(e -> {
                LOGGER.error("Unexpected exception", e);
                return List.of(FileConversion.unexpectedFailure(sourceFile, e));
            }));
        }
        return new ConversionBatch(executor, cancelled, outputs, futures);
    }

    /**
     * Reads a workflow file and describes its call graph without writing anything.
     */
    public WorkflowAnalysis analyze(Path file) throws ConversionException {
        var resolved = new WdlReader().read(file);
        var workflow = resolved.root()
                .workflow()
                .orElseThrow(() -> new ConversionException(DiagnosticKind.UNRECOGNIZED_CONSTRUCT,
                        SourceLocation.of(file.toString(), 1, 1),
                        String.format("File '%s' does not define a workflow", file.getFileName())));
        return new CallGraph(workflow, resolved.namespace()).analyze();
    }

    static List<Path> sourceFiles(Path input) throws IOException {
        if (!Files.isDirectory(input)) {
            if (!Files.exists(input)) {
                throw new IOException(String.format("Input '%s' does not exist", input));
            }
            return List.of(input);
        }
        try (var paths = Files.walk(input)) {
            return paths.filter(Files::isRegularFile).filter(path -> path.getFileName().toString().endsWith(".wdl")).sorted().collect(Collectors.toList());
        }
    }

    private static String sourceFileName(Path input, Path file) {
        if (Files.isDirectory(input)) {
            return input.relativize(file).toString().replace('\\', '/');
        }
        return file.getFileName().toString();
    }
}
