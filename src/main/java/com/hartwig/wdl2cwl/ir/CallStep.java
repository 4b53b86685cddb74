package com.hartwig.wdl2cwl.ir;

import java.util.Map;
import java.util.Optional;

import com.hartwig.wdl2cwl.diagnostic.SourceLocation;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface CallStep extends WorkflowElement {
    /**
     * Called task or workflow, possibly qualified by an import namespace: {@code tasks.BuildMatrix}.
     */
    String target();

    Optional<String> alias();

    /**
     * Input name of the callee to the expression bound to it.
     */
    Map<String, Expression> bindings();

    @Override
    @Value.Auxiliary
    Optional<SourceLocation> location();

    @Override
    default Kind kind() {
        return Kind.CALL;
    }

    /**
     * Name under which the outputs of this call are referenced.
     */
    default String name() {
        return alias().orElseGet(this::targetName);
    }

    default String targetName() {
        var dot = target().lastIndexOf('.');
        return dot < 0 ? target() : target().substring(dot + 1);
    }

    default Optional<String> targetNamespace() {
        var dot = target().lastIndexOf('.');
        return dot < 0 ? Optional.empty() : Optional.of(target().substring(0, dot));
    }

    static ImmutableCallStep.Builder builder() {
        return ImmutableCallStep.builder();
    }
}
