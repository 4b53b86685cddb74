package com.hartwig.wdl2cwl.cwl;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.hartwig.wdl2cwl.config.ConverterConfig;
import com.hartwig.wdl2cwl.diagnostic.ConversionException;
import com.hartwig.wdl2cwl.diagnostic.SourceLocation;
import com.hartwig.wdl2cwl.diagnostic.UnresolvedReferenceException;
import com.hartwig.wdl2cwl.diagnostic.UnsupportedExpressionException;
import com.hartwig.wdl2cwl.expression.ExpressionEvaluator;
import com.hartwig.wdl2cwl.expression.ExpressionTranslator;
import com.hartwig.wdl2cwl.expression.ResolvedReference;
import com.hartwig.wdl2cwl.expression.TranslationContext;
import com.hartwig.wdl2cwl.ir.CallStep;
import com.hartwig.wdl2cwl.ir.ConditionalBlock;
import com.hartwig.wdl2cwl.ir.Expression;
import com.hartwig.wdl2cwl.ir.Expressions;
import com.hartwig.wdl2cwl.ir.Interpolation;
import com.hartwig.wdl2cwl.ir.Parameter;
import com.hartwig.wdl2cwl.ir.ParameterType;
import com.hartwig.wdl2cwl.ir.Reference;
import com.hartwig.wdl2cwl.ir.ScatterBlock;
import com.hartwig.wdl2cwl.ir.Workflow;
import com.hartwig.wdl2cwl.ir.WorkflowElement;
import com.hartwig.wdl2cwl.wdl.TaskNamespace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a workflow as a CWL {@code Workflow}. Calls become steps running the tool or sub-workflow document; scatter
 * and conditional blocks become steps running an inline workflow, with the outer values they use passed in as inputs.
 */
public class CwlWorkflowWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(CwlWorkflowWriter.class);

    private final ConverterConfig config;
    private final TaskNamespace namespace;

    public CwlWorkflowWriter(ConverterConfig config, TaskNamespace namespace) {
        this.config = config;
        this.namespace = namespace;
    }

    public static String relativePath(String workflowName) {
        return workflowName + ".cwl";
    }

    public CwlDocument write(Workflow workflow) throws ConversionException {
        var prepared = new UnboundInputs(namespace).expose(workflow);
        return new DocumentBuilder(prepared).build();
    }

    /**
     * Where a WDL value comes from inside one CWL workflow: a workflow input or a step output.
     */
    private static final class ScopeValue {
        private final String source;
        private final ParameterType type;

        private ScopeValue(String source, ParameterType type) {
            this.source = source;
            this.type = type;
        }
    }

    private static final class Resolution {
        private final String key;
        private final ScopeValue value;
        private final List<String> remaining;

        private Resolution(String key, ScopeValue value, List<String> remaining) {
            this.key = key;
            this.value = value;
            this.remaining = remaining;
        }
    }

    /**
     * Values visible in one CWL workflow, keyed by {@code name} for inputs and scatter variables and by
     * {@code call.output} for call outputs.
     */
    private static final class Scope {
        private final Map<String, ScopeValue> values = new LinkedHashMap<>();

        private Optional<Resolution> resolve(Reference reference) {
            var value = values.get(reference.root());
            if (value != null) {
                return Optional.of(new Resolution(reference.root(), value, reference.members()));
            }
            if (!reference.members().isEmpty()) {
                var key = reference.root() + "." + reference.members().get(0);
                var output = values.get(key);
                if (output != null) {
                    return Optional.of(new Resolution(key, output, reference.members().subList(1, reference.members().size())));
                }
            }
            return Optional.empty();
        }
    }

    private class DocumentBuilder {
        private final Workflow workflow;
        private final CwlTypeMapper types = new CwlTypeMapper(namespace);
        private final ExpressionEvaluator evaluator = new ExpressionEvaluator();
        private final Set<String> stepIds = new HashSet<>();
        private int conditionals;
        private boolean usesJavascript;
        private boolean usesSubworkflows;
        private boolean usesScatter;
        private boolean usesStepInputExpressions;
        private boolean usesMultipleInputs;

        private DocumentBuilder(Workflow workflow) {
            this.workflow = workflow;
        }

        private CwlDocument build() throws ConversionException {
            var document = CwlYaml.object();
            document.put("cwlVersion", config.cwlVersion());
            document.put("class", "Workflow");
            document.put("id", workflow.name());
            var requirements = document.putObject("requirements");

            var scope = new Scope();
            stepIds.addAll(workflow.inputs().keySet());
            stepIds.addAll(workflow.outputs().keySet());
            var inputs = document.putObject("inputs");
            for (Parameter input : workflow.inputs().values()) {
                var type = workflowInput(input, inputs.putObject(input.name()));
                scope.values.put(input.name(), new ScopeValue(input.name(), type));
            }
            var outputs = document.putObject("outputs");
            var steps = CwlYaml.object();
            writeBody(workflow.body(), scope, steps);
            for (Parameter output : workflow.outputs().values()) {
                outputs.set(output.name(), workflowOutput(output, scope));
            }
            document.set("steps", steps);

            if (usesJavascript) {
                requirements.putObject("InlineJavascriptRequirement");
            }
            if (types.usesStructs()) {
                requirements.putObject("SchemaDefRequirement").putArray("types").addAll(types.schemas());
            }
            if (usesSubworkflows) {
                requirements.putObject("SubworkflowFeatureRequirement");
            }
            if (usesScatter) {
                requirements.putObject("ScatterFeatureRequirement");
            }
            if (usesMultipleInputs) {
                requirements.putObject("MultipleInputFeatureRequirement");
            }
            if (usesStepInputExpressions) {
                requirements.putObject("StepInputExpressionRequirement");
            }
            if (requirements.isEmpty()) {
                document.remove("requirements");
            }
            LOGGER.debug("[{}] Wrote workflow with {} step(s)", workflow.name(), steps.size());
            return new CwlDocument(relativePath(workflow.name()), document);
        }

        /**
         * @return the type the input has in the document
         */
        private ParameterType workflowInput(Parameter input, ObjectNode node) throws ConversionException {
            var location = input.location().orElse(null);
            var type = input.type();
            Object value = null;
            if (input.expression().isPresent()) {
                if (evaluator.isConstant(input.expression().get())) {
                    value = evaluator.evaluate(input.expression().get());
                }
                if (value == null) {
                    type = ParameterType.optionalOf(type);
                }
            }
            node.set("type", types.map(type, location));
            if (value != null) {
                node.set("default", CwlValues.of(type, value));
            }
            return type;
        }

        private ObjectNode workflowOutput(Parameter output, Scope scope) throws ConversionException {
            var location = output.location().orElse(null);
            var expression = output.expression().orElseThrow();
            if (!(expression instanceof Reference)) {
                throw new UnsupportedExpressionException(location,
                        String.format("Output '%s' of workflow '%s' must reference a call output or input", output.name(), workflow.name()));
            }
            var resolution = resolve((Reference) expression, scope);
            if (!resolution.remaining.isEmpty()) {
                throw new UnsupportedExpressionException(location,
                        String.format("Output '%s' of workflow '%s' selects a member of '%s', which has no CWL equivalent",
                                output.name(),
                                workflow.name(),
                                resolution.key));
            }
            var node = CwlYaml.object();
            node.set("type", types.map(output.type(), location));
            node.put("outputSource", resolution.value.source);
            return node;
        }

        private void writeBody(List<WorkflowElement> body, Scope scope, ObjectNode steps) throws ConversionException {
            for (WorkflowElement element : body) {
                switch (element.kind()) {
                    case CALL:
                        var call = (CallStep) element;
                        var callId = stepId(call.name());
                        steps.set(callId, callStep(call, scope));
                        for (Parameter output : calleeOutputs(call)) {
                            scope.values.put(call.name() + "." + output.name(), new ScopeValue(callId + "/" + output.name(), output.type()));
                        }
                        break;
                    case SCATTER:
                        scatterStep((ScatterBlock) element, scope, steps);
                        break;
                    case CONDITIONAL:
                        conditionalStep((ConditionalBlock) element, scope, steps);
                        break;
                }
            }
        }

        private ObjectNode callStep(CallStep call, Scope scope) throws ConversionException {
            var step = CwlYaml.object();
            var task = namespace.task(call.targetName());
            if (task.isPresent()) {
                step.put("run", CwlToolWriter.relativePath(config, task.get().name()));
            } else if (namespace.workflow(call.targetName()).isPresent()) {
                step.put("run", relativePath(call.targetName()));
                usesSubworkflows = true;
            } else {
                throw new UnresolvedReferenceException(call.location().orElse(null),
                        String.format("Call target '%s' does not match any task or workflow", call.target()));
            }
            var in = step.putObject("in");
            for (Map.Entry<String, Expression> binding : call.bindings().entrySet()) {
                var type = calleeInputType(call, binding.getKey());
                var node = stepInput(binding.getValue(), type, scope, call.location().orElse(null));
                if (node.isPresent()) {
                    in.set(binding.getKey(), node.get());
                }
            }
            var out = step.putArray("out");
            calleeOutputs(call).forEach(output -> out.add(output.name()));
            return step;
        }

        private Optional<ObjectNode> stepInput(Expression expression, ParameterType type, Scope scope, SourceLocation location)
                throws ConversionException {
            var node = CwlYaml.object();
            if (expression instanceof Reference) {
                var resolution = resolve((Reference) expression, scope);
                node.put("source", resolution.value.source);
                if (!resolution.remaining.isEmpty()) {
                    node.put("valueFrom", "$(self." + String.join(".", resolution.remaining) + ")");
                    usesStepInputExpressions = true;
                }
                return Optional.of(node);
            }
            if (evaluator.isConstant(expression)) {
                var value = evaluator.evaluate(expression);
                if (value == null) {
                    return Optional.empty();
                }
                node.set("default", CwlValues.of(type, value));
                return Optional.of(node);
            }
            var sources = new LinkedHashMap<String, Integer>();
            for (Reference reference : Expressions.references(expression)) {
                sources.putIfAbsent(resolve(reference, scope).value.source, sources.size());
            }
            var translator = new ExpressionTranslator(new StepContext(scope, sources));
            var valueFrom = expression instanceof Interpolation
                    ? translator.template(((Interpolation) expression).parts()).text()
                    : translator.translate(expression).text();
            if (sources.size() == 1) {
                node.put("source", sources.keySet().iterator().next());
            } else if (sources.size() > 1) {
                var list = node.putArray("source");
                sources.keySet().forEach(list::add);
                node.put("linkMerge", "merge_nested");
                usesMultipleInputs = true;
            }
            node.put("valueFrom", valueFrom);
            usesStepInputExpressions = true;
            usesJavascript |= translator.usesJavascript();
            LOGGER.debug("[{}] Step input at {} is computed from {} source(s)",
                    workflow.name(),
                    location == null ? "unknown location" : location.describe(),
                    sources.size());
            return Optional.of(node);
        }

        private void scatterStep(ScatterBlock scatter, Scope scope, ObjectNode steps) throws ConversionException {
            var location = scatter.location().orElse(null);
            if (!(scatter.collection() instanceof Reference)) {
                throw new UnsupportedExpressionException(location,
                        String.format("Scatter over '%s' needs a plain reference as collection", scatter.variable()));
            }
            var collection = resolve((Reference) scatter.collection(), scope);
            if (!collection.remaining.isEmpty()) {
                throw new UnsupportedExpressionException(location,
                        String.format("Scatter over '%s' selects a member of '%s', which has no CWL equivalent", scatter.variable(), collection.key));
            }
            var elementType = collection.value.type != null && collection.value.type.isArray() ? collection.value.type.elementType() : null;
            var block = new Block(scatter.body(), scope, Set.of(scatter.variable()));
            block.inner.values.put(scatter.variable(), new ScopeValue(scatter.variable(), elementType));

            var step = CwlYaml.object();
            var run = block.write(Map.of(scatter.variable(), elementType));
            step.set("run", run);
            step.put("scatter", scatter.variable());
            var in = block.stepInputs(step);
            in.putObject(scatter.variable()).put("source", collection.value.source);
            var stepId = stepId("scatter_" + scatter.variable());
            block.publish(stepId, step, scope, ParameterType::arrayOf);
            steps.set(stepId, step);
            usesScatter = true;
            usesSubworkflows = true;
        }

        private void conditionalStep(ConditionalBlock conditional, Scope scope, ObjectNode steps) throws ConversionException {
            var block = new Block(conditional.body(), scope, Set.of());
            block.addInputs(Expressions.references(conditional.condition()));
            var step = CwlYaml.object();
            step.set("run", block.write(Map.of()));
            block.stepInputs(step);
            var when = new ExpressionTranslator(new BlockInputContext(block));
            step.put("when", when.translate(conditional.condition()).text());
            usesJavascript |= when.usesJavascript();
            var stepId = stepId("if_" + ++conditionals);
            block.publish(stepId, step, scope, ParameterType::optionalOf);
            steps.set(stepId, step);
            usesSubworkflows = true;
        }

        /**
         * The inline workflow of a scatter or conditional block.
         */
        private class Block {
            private final List<WorkflowElement> body;
            private final Scope outer;
            private final Set<String> defined;
            private final Scope inner = new Scope();
            private final Map<String, String> inputIds = new LinkedHashMap<>();
            private final Map<String, String> outputIds = new LinkedHashMap<>();
            // ids of the inline workflow
            private final Set<String> ids;

            private Block(List<WorkflowElement> body, Scope outer, Set<String> variables) throws ConversionException {
                this.body = body;
                this.outer = outer;
                this.defined = new HashSet<>(variables);
                collectCallNames(body, defined);
                this.ids = new HashSet<>(defined);
                addInputs(blockReferences(body));
            }

            private void addInputs(List<Reference> references) throws ConversionException {
                for (Reference reference : references) {
                    if (defined.contains(reference.root())) {
                        continue;
                    }
                    var resolution = resolve(reference, outer);
                    if (!inputIds.containsKey(resolution.key)) {
                        var id = uniqueId(resolution.key.replace('.', '_'));
                        // nested steps land in the same inline workflow
                        stepIds.add(id);
                        inputIds.put(resolution.key, id);
                        inner.values.put(resolution.key, new ScopeValue(id, resolution.value.type));
                    }
                }
            }

            /**
             * @param variables scatter variables with their element types
             */
            private ObjectNode write(Map<String, ParameterType> variables) throws ConversionException {
                var run = CwlYaml.object();
                run.put("class", "Workflow");
                var inputs = run.putObject("inputs");
                for (Map.Entry<String, String> input : inputIds.entrySet()) {
                    inputs.putObject(input.getValue()).set("type", typeOrAny(inner.values.get(input.getKey()).type));
                }
                for (Map.Entry<String, ParameterType> variable : variables.entrySet()) {
                    inputs.putObject(variable.getKey()).set("type", typeOrAny(variable.getValue()));
                }
                var outputs = run.putObject("outputs");
                var steps = CwlYaml.object();
                var before = new LinkedHashSet<>(inner.values.keySet());
                writeBody(body, inner, steps);
                steps.fieldNames().forEachRemaining(ids::add);
                for (Map.Entry<String, ScopeValue> value : inner.values.entrySet()) {
                    if (before.contains(value.getKey())) {
                        continue;
                    }
                    var id = uniqueId(value.getKey().replace('.', '_'));
                    outputIds.put(value.getKey(), id);
                    var output = outputs.putObject(id);
                    output.set("type", typeOrAny(value.getValue().type));
                    output.put("outputSource", value.getValue().source);
                }
                run.set("steps", steps);
                return run;
            }

            private String uniqueId(String base) {
                var id = base;
                var suffix = 2;
                while (!ids.add(id)) {
                    id = base + "_" + suffix++;
                }
                return id;
            }

            private ObjectNode stepInputs(ObjectNode step) {
                var in = step.putObject("in");
                for (Map.Entry<String, String> input : inputIds.entrySet()) {
                    in.putObject(input.getValue()).put("source", outer.values.get(input.getKey()).source);
                }
                return in;
            }

            private void publish(String stepId, ObjectNode step, Scope scope, UnaryOperator<ParameterType> wrapper) {
                var out = step.putArray("out");
                for (Map.Entry<String, String> output : outputIds.entrySet()) {
                    out.add(output.getValue());
                    var type = inner.values.get(output.getKey()).type;
                    scope.values.put(output.getKey(), new ScopeValue(stepId + "/" + output.getValue(), type == null ? null : wrapper.apply(type)));
                }
            }
        }

        /**
         * References of a block body that are evaluated inside the block: call bindings and nested collections and
         * conditions.
         */
        private List<Reference> blockReferences(List<WorkflowElement> body) {
            var references = new ArrayList<Reference>();
            for (WorkflowElement element : body) {
                switch (element.kind()) {
                    case CALL:
                        ((CallStep) element).bindings().values().forEach(value -> references.addAll(Expressions.references(value)));
                        break;
                    case SCATTER:
                        references.addAll(Expressions.references(((ScatterBlock) element).collection()));
                        references.addAll(blockReferences(((ScatterBlock) element).body()));
                        break;
                    case CONDITIONAL:
                        references.addAll(Expressions.references(((ConditionalBlock) element).condition()));
                        references.addAll(blockReferences(((ConditionalBlock) element).body()));
                        break;
                }
            }
            return references;
        }

        private void collectCallNames(List<WorkflowElement> body, Set<String> names) {
            for (WorkflowElement element : body) {
                switch (element.kind()) {
                    case CALL:
                        names.add(((CallStep) element).name());
                        break;
                    case SCATTER:
                        names.add(((ScatterBlock) element).variable());
                        collectCallNames(((ScatterBlock) element).body(), names);
                        break;
                    case CONDITIONAL:
                        collectCallNames(((ConditionalBlock) element).body(), names);
                        break;
                }
            }
        }

        private JsonNode typeOrAny(ParameterType type) throws ConversionException {
            return type == null ? TextNode.valueOf("Any") : types.map(type, null);
        }

        private Resolution resolve(Reference reference, Scope scope) throws UnresolvedReferenceException {
            return scope.resolve(reference)
                    .orElseThrow(() -> new UnresolvedReferenceException(reference.location().orElse(null),
                            String.format("'%s' is not declared in workflow '%s'", reference.dotted(), workflow.name())));
        }

        private String stepId(String base) {
            var id = base;
            var suffix = 2;
            while (!stepIds.add(id)) {
                id = base + "_" + suffix++;
            }
            return id;
        }

        private List<Parameter> calleeOutputs(CallStep call) {
            var task = namespace.task(call.targetName());
            if (task.isPresent()) {
                return task.get().outputs();
            }
            return namespace.workflow(call.targetName()).map(callee -> List.copyOf(callee.outputs().values())).orElse(List.of());
        }

        private ParameterType calleeInputType(CallStep call, String input) {
            var task = namespace.task(call.targetName());
            if (task.isPresent()) {
                return task.get().findInput(input).map(Parameter::type).orElse(ParameterType.string());
            }
            return namespace.workflow(call.targetName())
                    .map(callee -> callee.inputs().get(input))
                    .map(Parameter::type)
                    .orElse(ParameterType.string());
        }

        /**
         * Inside a step input's {@code valueFrom}, sources are reached through {@code self}.
         */
        private class StepContext implements TranslationContext {
            private final Scope scope;
            private final Map<String, Integer> sources;

            private StepContext(Scope scope, Map<String, Integer> sources) {
                this.scope = scope;
                this.sources = sources;
            }

            @Override
            public Optional<ResolvedReference> resolve(Reference reference) {
                var resolution = scope.resolve(reference);
                if (resolution.isEmpty()) {
                    return Optional.empty();
                }
                var value = resolution.get().value;
                var base = sources.size() == 1 ? "self" : "self[" + sources.get(value.source) + "]";
                return Optional.of(path(base, resolution.get(), types));
            }
        }

        /**
         * Inside a step's {@code when}, block inputs are reached through {@code inputs}.
         */
        private class BlockInputContext implements TranslationContext {
            private final Block block;

            private BlockInputContext(Block block) {
                this.block = block;
            }

            @Override
            public Optional<ResolvedReference> resolve(Reference reference) {
                return block.inner.resolve(reference)
                        .filter(resolution -> block.inputIds.containsKey(resolution.key))
                        .map(resolution -> path("inputs." + resolution.value.source, resolution, types));
            }
        }
    }

    private static ResolvedReference path(String base, Resolution resolution, CwlTypeMapper types) {
        var path = resolution.remaining.isEmpty() ? base : base + "." + String.join(".", resolution.remaining);
        var type = resolution.value.type == null ? null : types.memberType(resolution.value.type, resolution.remaining).orElse(null);
        return ResolvedReference.of(path, type);
    }
}
