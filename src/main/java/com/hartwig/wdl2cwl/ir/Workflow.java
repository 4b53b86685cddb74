package com.hartwig.wdl2cwl.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.hartwig.wdl2cwl.diagnostic.SourceLocation;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Workflow {
    String name();

    /**
     * Calls, scatters and conditionals in source order.
     */
    List<WorkflowElement> body();

    Map<String, Parameter> inputs();

    Map<String, Parameter> outputs();

    List<ImportReference> imports();

    @Value.Auxiliary
    Optional<SourceLocation> location();

    /**
     * Every call of the workflow, including those nested in scatters and conditionals, in source order.
     */
    default List<CallStep> calls() {
        var calls = new ArrayList<CallStep>();
        collectCalls(body(), calls);
        return calls;
    }

    private static void collectCalls(List<WorkflowElement> elements, List<CallStep> calls) {
        for (WorkflowElement element : elements) {
            switch (element.kind()) {
                case CALL:
                    calls.add((CallStep) element);
                    break;
                case SCATTER:
                    collectCalls(((ScatterBlock) element).body(), calls);
                    break;
                case CONDITIONAL:
                    collectCalls(((ConditionalBlock) element).body(), calls);
                    break;
            }
        }
    }

    static ImmutableWorkflow.Builder builder() {
        return ImmutableWorkflow.builder();
    }
}
