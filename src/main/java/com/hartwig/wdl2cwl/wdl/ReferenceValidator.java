package com.hartwig.wdl2cwl.wdl;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import com.google.common.collect.Iterables;
import com.hartwig.wdl2cwl.diagnostic.Diagnostic;
import com.hartwig.wdl2cwl.diagnostic.DiagnosticKind;
import com.hartwig.wdl2cwl.diagnostic.SourceLocation;
import com.hartwig.wdl2cwl.diagnostic.UnresolvedReferenceException;
import com.hartwig.wdl2cwl.ir.CallStep;
import com.hartwig.wdl2cwl.ir.ConditionalBlock;
import com.hartwig.wdl2cwl.ir.Expression;
import com.hartwig.wdl2cwl.ir.Expressions;
import com.hartwig.wdl2cwl.ir.ImportReference;
import com.hartwig.wdl2cwl.ir.Parameter;
import com.hartwig.wdl2cwl.ir.ParameterType;
import com.hartwig.wdl2cwl.ir.Placeholder;
import com.hartwig.wdl2cwl.ir.Reference;
import com.hartwig.wdl2cwl.ir.ScatterBlock;
import com.hartwig.wdl2cwl.ir.Task;
import com.hartwig.wdl2cwl.ir.Workflow;
import com.hartwig.wdl2cwl.ir.WorkflowElement;

import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

/**
 * Checks that the names used by tasks and workflows resolve. All violations of one task or workflow are reported in a
 * single exception.
 */
public class ReferenceValidator {

    private static final class Scope {
        // a null type means the name is bound but its type is not known
        private final Map<String, ParameterType> values = new HashMap<>();
        private final Map<String, Map<String, ParameterType>> calls = new HashMap<>();

        private Scope copy() {
            var copy = new Scope();
            copy.values.putAll(values);
            copy.calls.putAll(calls);
            return copy;
        }
    }

    private final TaskNamespace namespace;

    public ReferenceValidator(TaskNamespace namespace) {
        this.namespace = namespace;
    }

    /**
     * Input defaults, private declarations, runtime amounts, command placeholders and output expressions may only use
     * inputs and private declarations. Declarations may not depend on themselves.
     */
    public void validateTask(Task task) throws UnresolvedReferenceException {
        var declared = new HashSet<String>();
        task.inputs().forEach(input -> declared.add(input.name()));
        task.declarations().forEach(declaration -> declared.add(declaration.name()));
        var diagnostics = new ArrayList<Diagnostic>();
        for (Parameter input : task.inputs()) {
            if (input.expression().isPresent()) {
                checkTaskReferences(input.expression().get(), declared, input.location(),
                        String.format("Default of input '%s' of task '%s'", input.name(), task.name()), diagnostics);
            }
        }
        for (Parameter declaration : task.declarations()) {
            if (declaration.expression().isPresent()) {
                checkTaskReferences(declaration.expression().get(), declared, declaration.location(),
                        String.format("Declaration '%s' of task '%s'", declaration.name(), task.name()), diagnostics);
            }
        }
        var runtime = task.runtime();
        var runtimeExpressions = new LinkedHashMap<String, Expression>();
        runtime.image().ifPresent(image -> runtimeExpressions.put("docker", image));
        runtime.cpu().ifPresent(cpu -> runtimeExpressions.put("cpu", cpu.amount()));
        runtime.memory().ifPresent(memory -> runtimeExpressions.put("memory", memory.amount()));
        runtime.disk().ifPresent(disk -> runtimeExpressions.put("disks", disk.amount()));
        for (Map.Entry<String, Expression> entry : runtimeExpressions.entrySet()) {
            checkTaskReferences(entry.getValue(), declared, task.location(),
                    String.format("Runtime attribute '%s' of task '%s'", entry.getKey(), task.name()), diagnostics);
        }
        for (Placeholder placeholder : task.placeholders()) {
            for (Reference reference : Expressions.references(placeholder.expression())) {
                if (!declared.contains(reference.root())) {
                    diagnostics.add(error(placeholder.location().orElse(null),
                            String.format("Placeholder %s in the command of task '%s' references undeclared name '%s'",
                                    placeholder.marker(),
                                    task.name(),
                                    reference.root())));
                }
            }
        }
        for (Parameter output : task.outputs()) {
            for (Reference reference : Expressions.references(output.expression().orElseThrow())) {
                if (!declared.contains(reference.root())) {
                    diagnostics.add(error(reference.location().or(output::location).orElse(null),
                            String.format("Output '%s' of task '%s' references undeclared name '%s'", output.name(), task.name(), reference.root())));
                }
            }
            declared.add(output.name());
        }
        diagnostics.addAll(selfDependencies(task));
        if (!diagnostics.isEmpty()) {
            throw new UnresolvedReferenceException(diagnostics);
        }
    }

    private static void checkTaskReferences(Expression expression, Set<String> declared, Optional<SourceLocation> fallback, String subject,
            List<Diagnostic> diagnostics) {
        for (Reference reference : Expressions.references(expression)) {
            if (!declared.contains(reference.root())) {
                diagnostics.add(error(reference.location().or(() -> fallback).orElse(null),
                        String.format("%s references undeclared name '%s'", subject, reference.root())));
            }
        }
    }

    /**
     * Inputs with a default and private declarations whose value depends, directly or through other declarations, on
     * the name itself.
     */
    private static List<Diagnostic> selfDependencies(Task task) {
        var computed = new LinkedHashMap<String, Parameter>();
        for (Parameter parameter : Iterables.concat(task.inputs(), task.declarations())) {
            if (parameter.expression().isPresent()) {
                computed.putIfAbsent(parameter.name(), parameter);
            }
        }
        var graph = new DefaultDirectedGraph<String, DefaultEdge>(DefaultEdge.class);
        computed.keySet().forEach(graph::addVertex);
        for (Parameter parameter : computed.values()) {
            for (Reference reference : Expressions.references(parameter.expression().orElseThrow())) {
                if (computed.containsKey(reference.root())) {
                    graph.addEdge(parameter.name(), reference.root());
                }
            }
        }
        var cyclic = new CycleDetector<>(graph).findCycles();
        return computed.values()
                .stream()
                .filter(parameter -> cyclic.contains(parameter.name()))
                .map(parameter -> error(parameter.location().orElse(null),
                        String.format("Declaration '%s' of task '%s' depends on itself", parameter.name(), task.name())))
                .collect(Collectors.toList());
    }

    /**
     * Checks call targets and bindings, scatter collections, conditions and outputs of the workflow and of every
     * workflow it calls.
     */
    public void validateWorkflow(Workflow workflow) throws UnresolvedReferenceException {
        var diagnostics = new ArrayList<Diagnostic>();
        validateWorkflow(workflow, new ArrayList<>(), diagnostics);
        if (!diagnostics.isEmpty()) {
            throw new UnresolvedReferenceException(diagnostics);
        }
    }

    private void validateWorkflow(Workflow workflow, List<String> callers, List<Diagnostic> diagnostics) {
        callers.add(workflow.name());
        var scope = new Scope();
        for (Parameter input : workflow.inputs().values()) {
            input.expression().ifPresent(expression -> checkReferences(expression, scope, input.location(), diagnostics));
            scope.values.put(input.name(), input.type());
        }
        validateBody(workflow, workflow.body(), scope, callers, diagnostics);
        for (Parameter output : workflow.outputs().values()) {
            checkReferences(output.expression().orElseThrow(), scope, output.location(), diagnostics);
        }
        callers.remove(callers.size() - 1);
    }

    /**
     * @return output types of the calls made in the body, as seen from inside the body
     */
    private Map<String, Map<String, ParameterType>> validateBody(Workflow workflow, List<WorkflowElement> body, Scope scope,
            List<String> callers, List<Diagnostic> diagnostics) {
        var declaredCalls = new LinkedHashMap<String, Map<String, ParameterType>>();
        for (WorkflowElement element : body) {
            switch (element.kind()) {
                case CALL:
                    var call = (CallStep) element;
                    var outputs = validateCall(workflow, call, scope, callers, diagnostics);
                    if (scope.calls.containsKey(call.name()) || scope.values.containsKey(call.name())) {
                        diagnostics.add(Diagnostic.error(DiagnosticKind.AMBIGUOUS_DEFINITION,
                                call.location().orElse(null),
                                String.format("Name '%s' of call to '%s' is already used in workflow '%s'", call.name(), call.target(), workflow.name())));
                    }
                    scope.calls.put(call.name(), outputs);
                    declaredCalls.put(call.name(), outputs);
                    break;
                case SCATTER:
                    var scatter = (ScatterBlock) element;
                    var elementType = scatterElementType(scatter, scope, diagnostics);
                    var scatterScope = scope.copy();
                    scatterScope.values.put(scatter.variable(), elementType);
                    var scattered = validateBody(workflow, scatter.body(), scatterScope, callers, diagnostics);
                    addWrapped(scattered, ParameterType::arrayOf, scope, declaredCalls);
                    break;
                case CONDITIONAL:
                    var conditional = (ConditionalBlock) element;
                    checkReferences(conditional.condition(), scope, conditional.location(), diagnostics);
                    var guarded = validateBody(workflow, conditional.body(), scope.copy(), callers, diagnostics);
                    addWrapped(guarded, ParameterType::optionalOf, scope, declaredCalls);
                    break;
            }
        }
        return declaredCalls;
    }

    private static void addWrapped(Map<String, Map<String, ParameterType>> calls, UnaryOperator<ParameterType> wrapper, Scope scope,
            Map<String, Map<String, ParameterType>> declaredCalls) {
        for (Map.Entry<String, Map<String, ParameterType>> call : calls.entrySet()) {
            var wrapped = new LinkedHashMap<String, ParameterType>();
            call.getValue().forEach((name, type) -> wrapped.put(name, type == null ? null : wrapper.apply(type)));
            scope.calls.put(call.getKey(), wrapped);
            declaredCalls.put(call.getKey(), wrapped);
        }
    }

    private ParameterType scatterElementType(ScatterBlock scatter, Scope scope, List<Diagnostic> diagnostics) {
        var collection = scatter.collection();
        checkReferences(collection, scope, scatter.location(), diagnostics);
        if (collection.kind() != Expression.Kind.REFERENCE) {
            return null;
        }
        var type = resolveType((Reference) collection, scope);
        if (type.isEmpty()) {
            return null;
        }
        if (!type.get().isArray()) {
            diagnostics.add(error(scatter.location().orElse(null),
                    String.format("Scatter collection '%s' has type %s, which is not an array",
                            ((Reference) collection).dotted(),
                            type.get().describe())));
            return null;
        }
        return type.get().elementType();
    }

    private Map<String, ParameterType> validateCall(Workflow workflow, CallStep call, Scope scope, List<String> callers,
            List<Diagnostic> diagnostics) {
        var location = call.location().orElse(null);
        var prefix = call.targetNamespace();
        if (prefix.isPresent() && workflow.imports().stream().map(ImportReference::namespace).noneMatch(prefix.get()::equals)) {
            diagnostics.add(error(location,
                    String.format("Call '%s' uses namespace '%s', which is not imported by workflow '%s'", call.target(), prefix.get(), workflow.name())));
        }
        for (Expression binding : call.bindings().values()) {
            checkReferences(binding, scope, call.location(), diagnostics);
        }
        var task = namespace.task(call.targetName());
        if (task.isPresent()) {
            checkBindingNames(call, task.get().inputs().stream().map(Parameter::name).collect(Collectors.toSet()), diagnostics);
            return types(task.get().outputs());
        }
        var callee = namespace.workflow(call.targetName());
        if (callee.isPresent()) {
            checkBindingNames(call, callee.get().inputs().keySet(), diagnostics);
            if (callers.contains(callee.get().name())) {
                diagnostics.add(error(location, String.format("Workflow '%s' calls itself through '%s'", callee.get().name(), workflow.name())));
            } else {
                validateWorkflow(callee.get(), callers, diagnostics);
            }
            return types(callee.get().outputs().values());
        }
        diagnostics.add(error(location, String.format("Call target '%s' does not match any task or workflow", call.target())));
        return Map.of();
    }

    private static void checkBindingNames(CallStep call, Set<String> inputs, List<Diagnostic> diagnostics) {
        for (String name : call.bindings().keySet()) {
            if (!inputs.contains(name)) {
                diagnostics.add(error(call.location().orElse(null),
                        String.format("Call '%s' binds '%s', which is not an input of '%s'", call.name(), name, call.targetName())));
            }
        }
    }

    private static Map<String, ParameterType> types(Iterable<Parameter> parameters) {
        var types = new LinkedHashMap<String, ParameterType>();
        parameters.forEach(parameter -> types.put(parameter.name(), parameter.type()));
        return types;
    }

    private void checkReferences(Expression expression, Scope scope, Optional<SourceLocation> fallback, List<Diagnostic> diagnostics) {
        for (Reference reference : Expressions.references(expression)) {
            var location = reference.location().or(() -> fallback).orElse(null);
            if (scope.calls.containsKey(reference.root())) {
                var outputs = scope.calls.get(reference.root());
                if (reference.members().isEmpty()) {
                    diagnostics.add(error(location, String.format("Reference to call '%s' does not name one of its outputs", reference.root())));
                } else if (!outputs.containsKey(reference.members().get(0))) {
                    diagnostics.add(error(location,
                            String.format("Call '%s' has no output '%s'", reference.root(), reference.members().get(0))));
                } else {
                    checkMembers(reference, outputs.get(reference.members().get(0)), 1, location, diagnostics);
                }
            } else if (scope.values.containsKey(reference.root())) {
                checkMembers(reference, scope.values.get(reference.root()), 0, location, diagnostics);
            } else {
                diagnostics.add(error(location, String.format("'%s' is not declared", reference.dotted())));
            }
        }
    }

    private void checkMembers(Reference reference, ParameterType type, int first, SourceLocation location, List<Diagnostic> diagnostics) {
        var current = type;
        for (String member : reference.members().subList(first, reference.members().size())) {
            if (current == null || current.required().kind() != ParameterType.Kind.STRUCT) {
                return;
            }
            var structName = current.required().name().orElseThrow();
            var struct = namespace.struct(structName);
            if (struct.isEmpty()) {
                diagnostics.add(error(location, String.format("Struct '%s' is not defined", structName)));
                return;
            }
            var definition = struct.get().findMember(member);
            if (definition.isEmpty()) {
                diagnostics.add(error(location, String.format("Struct '%s' has no member '%s' (in '%s')", structName, member, reference.dotted())));
                return;
            }
            current = definition.get().type();
        }
    }

    /**
     * Declared type of a reference, when it can be determined.
     */
    private Optional<ParameterType> resolveType(Reference reference, Scope scope) {
        ParameterType type;
        List<String> members;
        if (scope.calls.containsKey(reference.root())) {
            if (reference.members().isEmpty()) {
                return Optional.empty();
            }
            type = scope.calls.get(reference.root()).get(reference.members().get(0));
            members = reference.members().subList(1, reference.members().size());
        } else {
            type = scope.values.get(reference.root());
            members = reference.members();
        }
        for (String member : members) {
            if (type == null || type.required().kind() != ParameterType.Kind.STRUCT) {
                return Optional.empty();
            }
            type = namespace.struct(type.required().name().orElseThrow())
                    .flatMap(struct -> struct.findMember(member))
                    .map(Parameter::type)
                    .orElse(null);
        }
        return Optional.ofNullable(type);
    }

    private static Diagnostic error(SourceLocation location, String message) {
        return Diagnostic.error(DiagnosticKind.UNRESOLVED_REFERENCE, location, message);
    }
}
