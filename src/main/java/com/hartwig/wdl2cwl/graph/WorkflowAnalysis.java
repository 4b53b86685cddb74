package com.hartwig.wdl2cwl.graph;

import java.util.List;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

/**
 * Shape of a workflow: its size, and how its calls depend on each other.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonSerialize(as = ImmutableWorkflowAnalysis.class)
public interface WorkflowAnalysis {
    String workflowName();

    int inputCount();

    int outputCount();

    /**
     * Distinct tasks called, directly or through sub-workflows
     */
    int taskCount();

    int callCount();

    boolean hasCycle();

    /**
     * Largest number of calls that can run at the same time, not counting scatter fan-out
     */
    int maxParallelism();

    /**
     * Calls in an order that respects their dependencies; empty when the calls form a cycle
     */
    List<String> executionOrder();

    String dot();

    static ImmutableWorkflowAnalysis.Builder builder() {
        return ImmutableWorkflowAnalysis.builder();
    }
}
