package com.hartwig.wdl2cwl.graph;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.hartwig.wdl2cwl.cwl.CallOrder;
import com.hartwig.wdl2cwl.ir.CallStep;
import com.hartwig.wdl2cwl.ir.ConditionalBlock;
import com.hartwig.wdl2cwl.ir.Expression;
import com.hartwig.wdl2cwl.ir.Expressions;
import com.hartwig.wdl2cwl.ir.Reference;
import com.hartwig.wdl2cwl.ir.ScatterBlock;
import com.hartwig.wdl2cwl.ir.Workflow;
import com.hartwig.wdl2cwl.ir.WorkflowElement;
import com.hartwig.wdl2cwl.wdl.TaskNamespace;

import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.nio.Attribute;
import org.jgrapht.nio.DefaultAttribute;
import org.jgrapht.nio.dot.DOTExporter;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dependency graph of the calls of a workflow. A call depends on another call when one of its bindings, or the
 * collection or condition of a block around it, uses an output of the other call.
 */
public class CallGraph {
    private static final Logger LOGGER = LoggerFactory.getLogger(CallGraph.class);

    private final Workflow workflow;
    private final TaskNamespace namespace;
    private final DefaultDirectedGraph<String, CallDependency> graph;

    public CallGraph(Workflow workflow, TaskNamespace namespace) {
        this.workflow = workflow;
        this.namespace = namespace;
        this.graph = createGraph();
    }

    private DefaultDirectedGraph<String, CallDependency> createGraph() {
        var g = new DefaultDirectedGraph<String, CallDependency>(CallDependency.class);
        for (CallStep call : workflow.calls()) {
            g.addVertex(call.name());
        }
        addDependencies(g, workflow.body(), List.of());
        return g;
    }

    private void addDependencies(DefaultDirectedGraph<String, CallDependency> g, List<WorkflowElement> body, List<Expression> enclosing) {
        for (WorkflowElement element : body) {
            switch (element.kind()) {
                case CALL:
                    var call = (CallStep) element;
                    for (Expression expression : enclosing) {
                        addDependency(g, call, expression, null);
                    }
                    for (Map.Entry<String, Expression> binding : call.bindings().entrySet()) {
                        addDependency(g, call, binding.getValue(), binding.getKey());
                    }
                    break;
                case SCATTER:
                    var scatter = (ScatterBlock) element;
                    addDependencies(g, scatter.body(), append(enclosing, scatter.collection()));
                    break;
                case CONDITIONAL:
                    var conditional = (ConditionalBlock) element;
                    addDependencies(g, conditional.body(), append(enclosing, conditional.condition()));
                    break;
            }
        }
    }

    private static void addDependency(DefaultDirectedGraph<String, CallDependency> g, CallStep call, Expression expression, String input) {
        for (Reference reference : Expressions.references(expression)) {
            if (g.containsVertex(reference.root()) && !reference.members().isEmpty() && !reference.root().equals(call.name())) {
                var edge = g.getEdge(reference.root(), call.name());
                if (edge == null) {
                    edge = new CallDependency();
                    g.addEdge(reference.root(), call.name(), edge);
                }
                edge.add(reference.members().get(0), input);
            }
        }
    }

    private static List<Expression> append(List<Expression> expressions, Expression expression) {
        var appended = new ArrayList<>(expressions);
        appended.add(expression);
        return appended;
    }

    public boolean hasCycle() {
        return new CycleDetector<>(graph).detectCycles();
    }

    /**
     * @return calls in dependency order, empty if the calls form a cycle
     */
    public List<String> executionOrder() {
        if (hasCycle()) {
            return List.of();
        }
        var order = new ArrayList<String>();
        new TopologicalOrderIterator<>(graph).forEachRemaining(order::add);
        return order;
    }

    /**
     * Size of the widest level when every call is placed one level after the deepest call it depends on.
     */
    public int maxParallelism() {
        if (hasCycle()) {
            return 0;
        }
        var levels = new HashMap<String, Integer>();
        var widths = new HashMap<Integer, Integer>();
        for (String call : executionOrder()) {
            var level = graph.incomingEdgesOf(call).stream().mapToInt(edge -> levels.get(graph.getEdgeSource(edge)) + 1).max().orElse(0);
            levels.put(call, level);
            widths.merge(level, 1, Integer::sum);
        }
        return widths.values().stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    public String toDotFormat() {
        var exporter = new DOTExporter<String, CallDependency>();
        exporter.setVertexAttributeProvider((v) -> {
            Map<String, Attribute> map = new LinkedHashMap<>();
            map.put("label", DefaultAttribute.createAttribute(v));
            return map;
        });
        exporter.setEdgeAttributeProvider((e) -> {
            Map<String, Attribute> map = new LinkedHashMap<>();
            map.put("label", DefaultAttribute.createAttribute(String.join(",", e.outputs())));
            if (!e.inputs().isEmpty()) {
                map.put("headlabel", DefaultAttribute.createAttribute(String.join(",", e.inputs())));
            }
            return map;
        });
        var writer = new StringWriter();
        exporter.exportGraph(graph, writer);
        return writer.toString();
    }

    public WorkflowAnalysis analyze() {
        var analysis = WorkflowAnalysis.builder()
                .workflowName(workflow.name())
                .inputCount(workflow.inputs().size())
                .outputCount(workflow.outputs().size())
                .taskCount(CallOrder.of(workflow, namespace).tasks().size())
                .callCount(graph.vertexSet().size())
                .hasCycle(hasCycle())
                .maxParallelism(maxParallelism())
                .executionOrder(executionOrder())
                .dot(toDotFormat())
                .build();
        LOGGER.info("[{}] {} call(s), max parallelism {}{}",
                workflow.name(),
                analysis.callCount(),
                analysis.maxParallelism(),
                analysis.hasCycle() ? ", calls form a cycle" : "");
        return analysis;
    }
}
