package com.hartwig.wdl2cwl.cwl;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.hartwig.wdl2cwl.expression.ExpressionEvaluator;
import com.hartwig.wdl2cwl.ir.CallStep;
import com.hartwig.wdl2cwl.ir.ConditionalBlock;
import com.hartwig.wdl2cwl.ir.Expression;
import com.hartwig.wdl2cwl.ir.Expressions;
import com.hartwig.wdl2cwl.ir.ImmutableCallStep;
import com.hartwig.wdl2cwl.ir.ImmutableConditionalBlock;
import com.hartwig.wdl2cwl.ir.ImmutableScatterBlock;
import com.hartwig.wdl2cwl.ir.ImmutableWorkflow;
import com.hartwig.wdl2cwl.ir.Literal;
import com.hartwig.wdl2cwl.ir.OverrideFallback;
import com.hartwig.wdl2cwl.ir.Parameter;
import com.hartwig.wdl2cwl.ir.ParameterType;
import com.hartwig.wdl2cwl.ir.Reference;
import com.hartwig.wdl2cwl.ir.ScatterBlock;
import com.hartwig.wdl2cwl.ir.Task;
import com.hartwig.wdl2cwl.ir.Workflow;
import com.hartwig.wdl2cwl.ir.WorkflowElement;
import com.hartwig.wdl2cwl.wdl.TaskNamespace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites a workflow so every call can be run from the workflow inputs alone. Container images and required inputs
 * that a call leaves unbound become workflow inputs bound to the call, and references to workflow inputs with a
 * computed default are replaced by "the input if bound, else the default".
 */
class UnboundInputs {
    private static final Logger LOGGER = LoggerFactory.getLogger(UnboundInputs.class);

    private final TaskNamespace namespace;
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

    UnboundInputs(TaskNamespace namespace) {
        this.namespace = namespace;
    }

    Workflow expose(Workflow workflow) {
        var inputs = new LinkedHashMap<>(workflow.inputs());
        var body = rebind(workflow, workflow.body(), inputs);
        var computed = new LinkedHashMap<String, Expression>();
        for (Parameter input : workflow.inputs().values()) {
            if (input.expression().isPresent() && !evaluator.isConstant(input.expression().get())) {
                computed.put(input.name(), input.expression().get());
            }
        }
        if (!computed.isEmpty()) {
            body = inlineComputedDefaults(body, computed);
        }
        return ImmutableWorkflow.copyOf(workflow).withInputs(inputs).withBody(body);
    }

    private List<WorkflowElement> rebind(Workflow workflow, List<WorkflowElement> body, Map<String, Parameter> inputs) {
        var rebound = new ArrayList<WorkflowElement>();
        for (WorkflowElement element : body) {
            switch (element.kind()) {
                case CALL:
                    rebound.add(rebindCall(workflow, (CallStep) element, inputs));
                    break;
                case SCATTER:
                    var scatter = (ScatterBlock) element;
                    rebound.add(ImmutableScatterBlock.copyOf(scatter).withBody(rebind(workflow, scatter.body(), inputs)));
                    break;
                case CONDITIONAL:
                    var conditional = (ConditionalBlock) element;
                    rebound.add(ImmutableConditionalBlock.copyOf(conditional).withBody(rebind(workflow, conditional.body(), inputs)));
                    break;
            }
        }
        return rebound;
    }

    private CallStep rebindCall(Workflow workflow, CallStep call, Map<String, Parameter> inputs) {
        var bindings = new LinkedHashMap<>(call.bindings());
        List<Parameter> calleeInputs;
        String imageInput = null;
        var task = namespace.task(call.targetName());
        if (task.isPresent()) {
            calleeInputs = task.get().inputs();
            var image = ContainerImage.of(task.get());
            if (image.isPresent() && image.get().inputName().isPresent()) {
                imageInput = image.get().inputName().get();
                if (!bindings.containsKey(imageInput)) {
                    var exposed = exposeImage(task.get(), call, image.get(), inputs);
                    bindings.put(imageInput, Reference.to(exposed));
                    LOGGER.debug("[{}] Image input '{}' of call '{}' is exposed as workflow input '{}'", workflow.name(), imageInput, call.name(), exposed);
                }
            }
        } else {
            // inputs the called workflow exposes itself must be bound here as well
            calleeInputs = namespace.workflow(call.targetName()).map(callee -> List.copyOf(expose(callee).inputs().values())).orElse(List.of());
        }
        for (Parameter input : calleeInputs) {
            if (input.name().equals(imageInput) || bindings.containsKey(input.name()) || input.expression().isPresent()
                    || input.type().isOptional()) {
                continue;
            }
            var name = unique(call.name() + "_" + input.name(), inputs.keySet());
            inputs.put(name, Parameter.builder().from(input).name(name).build());
            bindings.put(input.name(), Reference.to(name));
            LOGGER.debug("[{}] Required input '{}' of call '{}' is exposed as workflow input '{}'", workflow.name(), input.name(), call.name(), name);
        }
        return ImmutableCallStep.copyOf(call).withBindings(bindings);
    }

    private String exposeImage(Task task, CallStep call, ContainerImage image, Map<String, Parameter> inputs) {
        if (image.isSynthetic()) {
            var name = task.name() + "_" + ContainerImage.SYNTHETIC_INPUT;
            var exposed = Parameter.builder()
                    .name(name)
                    .type(ParameterType.string())
                    .expression(Literal.string(image.defaultImage().orElseThrow()))
                    .build();
            var existing = inputs.get(name);
            if (existing != null && existing.type().equals(exposed.type())) {
                return name;
            }
            name = unique(name, inputs.keySet());
            inputs.put(name, Parameter.builder().from(exposed).name(name).build());
            return name;
        }
        var input = task.findInput(image.inputName().orElseThrow()).orElseThrow();
        var existing = inputs.get(input.name());
        if (existing != null && existing.type().equals(input.type())) {
            return input.name();
        }
        var name = existing == null ? input.name() : unique(call.name() + "_" + input.name(), inputs.keySet());
        var exposed = Parameter.builder().name(name).type(input.type());
        if (input.expression().isPresent() && evaluator.isConstant(input.expression().get())) {
            exposed.expression(input.expression().get());
        } else if (input.expression().isPresent()) {
            exposed.type(ParameterType.optionalOf(input.type()));
        }
        inputs.put(name, exposed.build());
        return name;
    }

    private List<WorkflowElement> inlineComputedDefaults(List<WorkflowElement> body, Map<String, Expression> computed) {
        var rewritten = new ArrayList<WorkflowElement>();
        for (WorkflowElement element : body) {
            switch (element.kind()) {
                case CALL:
                    var call = (CallStep) element;
                    var bindings = new LinkedHashMap<String, Expression>();
                    call.bindings().forEach((name, value) -> bindings.put(name, inline(value, computed, new HashSet<>())));
                    rewritten.add(ImmutableCallStep.copyOf(call).withBindings(bindings));
                    break;
                case SCATTER:
                    var scatter = (ScatterBlock) element;
                    rewritten.add(ImmutableScatterBlock.copyOf(scatter)
                            .withCollection(inline(scatter.collection(), computed, new HashSet<>()))
                            .withBody(inlineComputedDefaults(scatter.body(), computed)));
                    break;
                case CONDITIONAL:
                    var conditional = (ConditionalBlock) element;
                    rewritten.add(ImmutableConditionalBlock.copyOf(conditional)
                            .withCondition(inline(conditional.condition(), computed, new HashSet<>()))
                            .withBody(inlineComputedDefaults(conditional.body(), computed)));
                    break;
            }
        }
        return rewritten;
    }

    private static Expression inline(Expression expression, Map<String, Expression> computed, Set<String> inlining) {
        return Expressions.substitute(expression, reference -> {
            var fallback = computed.get(reference.root());
            if (fallback == null || !reference.members().isEmpty() || inlining.contains(reference.root())) {
                return reference;
            }
            inlining.add(reference.root());
            var inlined = OverrideFallback.of(reference, inline(fallback, computed, inlining));
            inlining.remove(reference.root());
            return inlined;
        });
    }

    private static String unique(String base, Set<String> taken) {
        var name = base;
        var suffix = 2;
        while (taken.contains(name)) {
            name = base + "_" + suffix++;
        }
        return name;
    }
}
