package com.hartwig.wdl2cwl.ir;

import java.util.List;
import java.util.Optional;

import com.hartwig.wdl2cwl.diagnostic.SourceLocation;

import org.immutables.value.Value;

/**
 * Runs its body once per element of the collection, with the element bound to the variable.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ScatterBlock extends WorkflowElement {
    String variable();

    Expression collection();

    List<WorkflowElement> body();

    @Override
    @Value.Auxiliary
    Optional<SourceLocation> location();

    @Override
    default Kind kind() {
        return Kind.SCATTER;
    }

    static ImmutableScatterBlock.Builder builder() {
        return ImmutableScatterBlock.builder();
    }
}
