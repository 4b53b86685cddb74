package com.hartwig.wdl2cwl.cwl;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hartwig.wdl2cwl.config.ConverterConfig;
import com.hartwig.wdl2cwl.diagnostic.ConversionException;
import com.hartwig.wdl2cwl.diagnostic.CwlWriteException;
import com.hartwig.wdl2cwl.diagnostic.UnsupportedExpressionException;
import com.hartwig.wdl2cwl.expression.ExpressionEvaluator;
import com.hartwig.wdl2cwl.expression.ExpressionTranslator;
import com.hartwig.wdl2cwl.ir.ArrayLiteral;
import com.hartwig.wdl2cwl.ir.Expression;
import com.hartwig.wdl2cwl.ir.FunctionCall;
import com.hartwig.wdl2cwl.ir.Interpolation;
import com.hartwig.wdl2cwl.ir.Literal;
import com.hartwig.wdl2cwl.ir.LiteralText;
import com.hartwig.wdl2cwl.ir.Parameter;
import com.hartwig.wdl2cwl.ir.ParameterType;
import com.hartwig.wdl2cwl.ir.Reference;
import com.hartwig.wdl2cwl.ir.ResourceSpec;
import com.hartwig.wdl2cwl.ir.Task;
import com.hartwig.wdl2cwl.wdl.TaskNamespace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a task as a CWL {@code CommandLineTool}. The command body becomes a script staged through
 * {@code InitialWorkDirRequirement} and run by the configured shell.
 */
public class CwlToolWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(CwlToolWriter.class);

    static final String STDOUT_FILE = "stdout.txt";
    static final String STDERR_FILE = "stderr.txt";

    private static final Map<String, String> READ_FUNCTIONS = Map.of("read_string",
            "self[0].contents.replace(/\\n$/, \"\")",
            "read_int",
            "parseInt(self[0].contents)",
            "read_float",
            "parseFloat(self[0].contents)",
            "read_boolean",
            "self[0].contents.trim().toLowerCase() === \"true\"",
            "read_lines",
            "self[0].contents.split(\"\\n\").filter(function(line) { return line.length > 0; })");

    private final ConverterConfig config;
    private final TaskNamespace namespace;

    public CwlToolWriter(ConverterConfig config, TaskNamespace namespace) {
        this.config = config;
        this.namespace = namespace;
    }

    public static String relativePath(ConverterConfig config, String taskName) {
        return config.toolsDirectory() + "/" + taskName + ".cwl";
    }

    public CwlDocument write(Task task) throws ConversionException {
        return new ToolBuilder(task).build();
    }

    private class ToolBuilder {
        private final Task task;
        private final CwlTypeMapper types;
        private final ToolTranslationContext context;
        private final ExpressionTranslator translator;
        private final ExpressionEvaluator evaluator = new ExpressionEvaluator();
        private boolean usesJavascript;
        private boolean usesStdout;
        private boolean usesStderr;

        private ToolBuilder(Task task) {
            this.task = task;
            this.types = new CwlTypeMapper(namespace);
            this.context = new ToolTranslationContext(task, types);
            this.translator = new ExpressionTranslator(context);
        }

        private CwlDocument build() throws ConversionException {
            var tool = CwlYaml.object();
            tool.put("cwlVersion", config.cwlVersion());
            tool.put("class", "CommandLineTool");
            tool.put("id", task.name());
            var requirements = tool.putObject("requirements");
            var hints = tool.putObject("hints");
            tool.putArray("baseCommand").add(config.shell()).add(config.scriptName());

            var inputs = CwlYaml.object();
            for (Parameter input : task.inputs()) {
                inputs.set(input.name(), input(input));
            }
            var image = ContainerImage.of(task);
            if (image.isPresent()) {
                hints.putObject("DockerRequirement").put("dockerPull", dockerPull(image.get(), inputs));
            }
            var outputs = CwlYaml.object();
            for (Parameter output : task.outputs()) {
                outputs.set(output.name(), output(output));
            }
            var script = translator.template(task.command()).text();

            if (usesStdout) {
                tool.put("stdout", STDOUT_FILE);
            }
            if (usesStderr) {
                tool.put("stderr", STDERR_FILE);
            }
            tool.set("inputs", inputs);
            tool.set("outputs", outputs);

            if (usesJavascript || translator.usesJavascript()) {
                requirements.putObject("InlineJavascriptRequirement");
            }
            if (types.usesStructs()) {
                requirements.putObject("SchemaDefRequirement").putArray("types").addAll(types.schemas());
            }
            var entry = requirements.putObject("InitialWorkDirRequirement").putArray("listing").addObject();
            entry.put("entryname", config.scriptName());
            entry.put("entry", script);
            var resources = resources();
            if (!resources.isEmpty()) {
                requirements.set("ResourceRequirement", resources);
            }
            if (hints.isEmpty()) {
                tool.remove("hints");
            }
            LOGGER.debug("[{}] Wrote tool with {} input(s) and {} output(s)", task.name(), inputs.size(), outputs.size());
            return new CwlDocument(relativePath(config, task.name()), tool);
        }

        private ObjectNode input(Parameter input) throws ConversionException {
            var node = CwlYaml.object();
            var location = input.location().orElse(null);
            if (input.expression().isEmpty() || context.hasComputedDefault(input)) {
                node.set("type", types.map(context.toolType(input), location));
                return node;
            }
            var value = evaluator.evaluate(input.expression().get());
            node.set("type", types.map(value == null ? ParameterType.optionalOf(input.type()) : input.type(), location));
            if (value != null) {
                node.set("default", CwlValues.of(input.type(), value));
            }
            return node;
        }

        private String dockerPull(ContainerImage image, ObjectNode inputs) throws ConversionException {
            if (image.computed().isPresent()) {
                return translator.translate(image.computed().get()).text();
            }
            var name = image.inputName().orElseThrow();
            if (!image.isSynthetic()) {
                return translator.translate(Reference.to(name)).text();
            }
            var node = inputs.putObject(name);
            node.put("type", "string");
            node.put("default", image.defaultImage().orElseThrow());
            return "$(inputs." + name + ")";
        }

        private ObjectNode output(Parameter output) throws ConversionException {
            var node = CwlYaml.object();
            var location = output.location().orElse(null);
            var expression = output.expression()
                    .orElseThrow(() -> new CwlWriteException(location, String.format("Output '%s' has no value", output.name())));
            if (expression instanceof FunctionCall) {
                var call = (FunctionCall) expression;
                if (isStream(call, "stdout") || isStream(call, "stderr")) {
                    if (!output.type().required().isFile()) {
                        throw new CwlWriteException(location, String.format("Output '%s' captures %s() but is not a File", output.name(), call.name()));
                    }
                    usesStdout |= call.name().equals("stdout");
                    usesStderr |= call.name().equals("stderr");
                    node.put("type", call.name());
                    return node;
                }
            }
            node.set("type", types.map(output.type(), location));
            var binding = node.putObject("outputBinding");
            if (expression instanceof FunctionCall) {
                var call = (FunctionCall) expression;
                if (call.name().equals("glob") && call.arguments().size() == 1) {
                    binding.put("glob", globPattern(call.arguments().get(0)));
                    return node;
                }
                var read = READ_FUNCTIONS.get(call.name());
                if (read != null && call.arguments().size() == 1) {
                    binding.put("glob", globPattern(call.arguments().get(0)));
                    binding.put("loadContents", true);
                    binding.put("outputEval", "$(" + read + ")");
                    usesJavascript = true;
                    return node;
                }
            }
            if (output.type().required().isFile() && isPattern(expression)) {
                binding.put("glob", globPattern(expression));
            } else if (output.type().isArray() && output.type().elementType().isFile() && expression instanceof ArrayLiteral) {
                var globs = binding.putArray("glob");
                for (Expression element : ((ArrayLiteral) expression).elements()) {
                    globs.add(globPattern(element));
                }
            } else {
                binding.put("outputEval", translator.translate(expression).text());
            }
            return node;
        }

        private String globPattern(Expression expression) throws ConversionException {
            if (isStream(expression, "stdout")) {
                usesStdout = true;
                return STDOUT_FILE;
            }
            if (isStream(expression, "stderr")) {
                usesStderr = true;
                return STDERR_FILE;
            }
            if (expression instanceof Literal && ((Literal) expression).type() == Literal.Type.STRING) {
                return translator.template(List.of(LiteralText.of(((Literal) expression).text()))).text();
            }
            if (expression instanceof Interpolation) {
                return translator.template(((Interpolation) expression).parts()).text();
            }
            return translator.translate(expression).text();
        }

        private ObjectNode resources() throws ConversionException {
            var resources = CwlYaml.object();
            var runtime = task.runtime();
            if (runtime.cpu().isPresent()) {
                var amount = runtime.cpu().get().amount();
                if (amount instanceof Literal && ((Literal) amount).isNumeric()) {
                    resources.set("coresMin", number((Literal) amount));
                } else {
                    resources.put("coresMin", translator.translate(amount).text());
                }
            }
            if (runtime.memory().isPresent()) {
                resources.set("ramMin", mebibytes(runtime.memory().get()));
            }
            if (runtime.disk().isPresent()) {
                resources.set("outdirMin", mebibytes(runtime.disk().get()));
            }
            return resources;
        }

        private JsonNode mebibytes(ResourceSpec spec) throws ConversionException {
            var unit = spec.unit().orElse("MiB");
            var factor = CwlUnits.mebibytesPer(unit);
            var location = spec.amount().location().orElse(task.location().orElse(null));
            if (factor.isEmpty()) {
                throw new CwlWriteException(location, String.format("Unknown unit '%s' in the runtime of task '%s'", unit, task.name()));
            }
            var amount = spec.amount();
            if (amount instanceof Literal && ((Literal) amount).isNumeric()) {
                return CwlYaml.mapper().getNodeFactory().numberNode(CwlUnits.toMebibytes(new BigDecimal(((Literal) amount).text()), factor.get()));
            }
            if (amount instanceof Literal) {
                throw new UnsupportedExpressionException(location, String.format("Resource amount '%s' is not a number", ((Literal) amount).text()));
            }
            if (factor.get().compareTo(BigDecimal.ONE) == 0) {
                return CwlYaml.mapper().getNodeFactory().textNode(translator.translate(amount).text());
            }
            var javascript = translator.javascript(amount);
            return CwlYaml.mapper()
                    .getNodeFactory()
                    .textNode(String.format("$(Math.ceil((%s) * %s))", javascript, factor.get().toPlainString()));
        }
    }

    private static boolean isStream(Expression expression, String name) {
        return expression instanceof FunctionCall && ((FunctionCall) expression).name().equals(name)
                && ((FunctionCall) expression).arguments().isEmpty();
    }

    private static boolean isPattern(Expression expression) {
        return expression instanceof Interpolation || (expression instanceof Literal && ((Literal) expression).type() == Literal.Type.STRING);
    }

    private static JsonNode number(Literal literal) {
        var factory = CwlYaml.mapper().getNodeFactory();
        return literal.type() == Literal.Type.INT ? factory.numberNode(new BigInteger(literal.text())) : factory.numberNode(new BigDecimal(literal.text()));
    }
}
