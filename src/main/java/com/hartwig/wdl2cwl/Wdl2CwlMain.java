package com.hartwig.wdl2cwl;

import java.io.FileInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.hartwig.wdl2cwl.config.ConfigReader;
import com.hartwig.wdl2cwl.config.ConverterConfig;
import com.hartwig.wdl2cwl.config.ImmutableConverterConfig;
import com.hartwig.wdl2cwl.conversion.ConversionOrchestrator;
import com.hartwig.wdl2cwl.conversion.ConversionReport;
import com.hartwig.wdl2cwl.conversion.ConversionRequest;
import com.hartwig.wdl2cwl.conversion.UnitResult;
import com.hartwig.wdl2cwl.diagnostic.Diagnostic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;

@CommandLine.Command(name = "wdl2cwl",
                     description = "Converts WDL workflows and tasks to CWL")
public class Wdl2CwlMain implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Wdl2CwlMain.class);

    static final String REPORT_FILE = "conversion-report.json";

    @CommandLine.Parameters(paramLabel = "input",
                            index = "0",
                            description = "WDL file, or directory searched recursively for .wdl files")
    private Path input;

    @CommandLine.Option(names = { "-o", "--output" },
                        required = true,
                        description = "Directory the CWL documents are written to")
    private Path outputDirectory;

    @CommandLine.Option(names = { "-m", "--module" },
                        description = "Name of a workflow or task to convert; repeat to convert several. Converts everything when absent")
    private List<String> modules = List.of();

    @CommandLine.Option(names = { "--validate" },
                        defaultValue = "false",
                        description = "Validate each written document with the external validator")
    private boolean validate;

    @CommandLine.Option(names = { "--analyze" },
                        defaultValue = "false",
                        description = "Write the call graph of the workflow in DOT format and log a summary, without converting")
    private boolean analyze;

    @CommandLine.Option(names = { "--config" },
                        description = "Path to the converter configuration file")
    private Path configFile;

    @CommandLine.Option(names = { "--threads" },
                        description = "Number of files converted in parallel")
    private Integer threads;

    @Override
    public Integer call() {
        try {
            var config = readConfig();
            var orchestrator = new ConversionOrchestrator(config);
            if (analyze) {
                return analyze(orchestrator);
            }
            var request = ConversionRequest.builder()
                    .input(input)
                    .outputDirectory(outputDirectory)
                    .unitFilter(Set.copyOf(modules))
                    .validate(validate)
                    .build();
            var report = orchestrator.convert(request);
            writeReport(report);
            LOGGER.info("Finished converting. {} unit(s) succeeded, {} failed. Final result: {}.",
                    report.successes(),
                    report.failures(),
                    report.isSuccess() ? "Success" : "Failed");
            return report.isSuccess() ? 0 : 1;
        } catch (Exception e) {
            LOGGER.error("Unexpected exception", e);
            return 1;
        }
    }

    private ConverterConfig readConfig() throws Exception {
        var config = ConverterConfig.defaults();
        if (configFile != null) {
            try (var stream = new FileInputStream(configFile.toFile())) {
                config = new ConfigReader().read(stream);
            }
        }
        if (threads != null) {
            config = ImmutableConverterConfig.copyOf(config).withThreads(threads);
        }
        return config;
    }

    private int analyze(ConversionOrchestrator orchestrator) throws Exception {
        var analysis = orchestrator.analyze(input);
        Files.createDirectories(outputDirectory);
        var dotFile = outputDirectory.resolve(analysis.workflowName() + ".dot");
        Files.writeString(dotFile, analysis.dot(), StandardCharsets.UTF_8);
        LOGGER.info("Workflow '{}': {} input(s), {} output(s), {} task(s), {} call(s), max parallelism {}",
                analysis.workflowName(),
                analysis.inputCount(),
                analysis.outputCount(),
                analysis.taskCount(),
                analysis.callCount(),
                analysis.maxParallelism());
        if (analysis.hasCycle()) {
            LOGGER.warn("Workflow '{}' has a dependency cycle", analysis.workflowName());
            return 1;
        }
        LOGGER.info("Execution order: {}", String.join(", ", analysis.executionOrder()));
        LOGGER.info("Call graph written to {}", dotFile);
        return 0;
    }

    private void writeReport(ConversionReport report) throws Exception {
        for (UnitResult unit : report.units()) {
            for (Diagnostic diagnostic : unit.diagnostics()) {
                if (diagnostic.isError()) {
                    LOGGER.error("[{}] {}", unit.unitName(), diagnostic.format());
                } else {
                    LOGGER.warn("[{}] {}", unit.unitName(), diagnostic.format());
                }
            }
        }
        var mapper = new ObjectMapper().registerModule(new Jdk8Module()).enable(SerializationFeature.INDENT_OUTPUT);
        var reportFile = outputDirectory.resolve(REPORT_FILE);
        mapper.writeValue(reportFile.toFile(), report);
        LOGGER.info("Report written to {}", reportFile);
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new Wdl2CwlMain()).execute(args));
    }
}
