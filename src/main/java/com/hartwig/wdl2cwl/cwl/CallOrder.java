package com.hartwig.wdl2cwl.cwl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.hartwig.wdl2cwl.ir.CallStep;
import com.hartwig.wdl2cwl.ir.Task;
import com.hartwig.wdl2cwl.ir.Workflow;
import com.hartwig.wdl2cwl.wdl.TaskNamespace;

/**
 * The tasks and sub-workflows a workflow uses, directly or through the workflows it calls, in the order they are first
 * referenced.
 */
public final class CallOrder {
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final Map<String, Workflow> workflows = new LinkedHashMap<>();

    private CallOrder() {
    }

    public static CallOrder of(Workflow root, TaskNamespace namespace) {
        var order = new CallOrder();
        order.visit(root, namespace);
        order.workflows.remove(root.name());
        return order;
    }

    public List<Task> tasks() {
        return new ArrayList<>(tasks.values());
    }

    /**
     * Called workflows, without the root.
     */
    public List<Workflow> workflows() {
        return new ArrayList<>(workflows.values());
    }

    private void visit(Workflow workflow, TaskNamespace namespace) {
        workflows.put(workflow.name(), workflow);
        for (CallStep call : workflow.calls()) {
            var task = namespace.task(call.targetName());
            if (task.isPresent()) {
                tasks.putIfAbsent(task.get().name(), task.get());
                continue;
            }
            var callee = namespace.workflow(call.targetName());
            if (callee.isPresent() && !workflows.containsKey(callee.get().name())) {
                visit(callee.get(), namespace);
            }
        }
    }
}
