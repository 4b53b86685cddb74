package com.hartwig.wdl2cwl.ir;

import java.util.List;
import java.util.Optional;

import com.hartwig.wdl2cwl.diagnostic.SourceLocation;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ConditionalBlock extends WorkflowElement {
    Expression condition();

    List<WorkflowElement> body();

    @Override
    @Value.Auxiliary
    Optional<SourceLocation> location();

    @Override
    default Kind kind() {
        return Kind.CONDITIONAL;
    }

    static ImmutableConditionalBlock.Builder builder() {
        return ImmutableConditionalBlock.builder();
    }
}
