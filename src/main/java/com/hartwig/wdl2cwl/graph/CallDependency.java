package com.hartwig.wdl2cwl.graph;

import java.util.LinkedHashSet;
import java.util.Set;

import org.jgrapht.graph.DefaultEdge;

/**
 * Outputs of one call that are used by another call. The inputs are the bindings of the consuming call that use them;
 * a dependency through the collection or condition of an enclosing block has no binding.
 */
class CallDependency extends DefaultEdge {
    private final Set<String> outputs = new LinkedHashSet<>();
    private final Set<String> inputs = new LinkedHashSet<>();

    void add(String output, String input) {
        outputs.add(output);
        if (input != null) {
            inputs.add(input);
        }
    }

    Set<String> outputs() {
        return outputs;
    }

    Set<String> inputs() {
        return inputs;
    }

    @Override
    public String toString() {
        return String.format("%s.%s -> %s.%s", getSource(), outputs, getTarget(), inputs);
    }
}
