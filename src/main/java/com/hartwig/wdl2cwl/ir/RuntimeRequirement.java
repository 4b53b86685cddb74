package com.hartwig.wdl2cwl.ir;

import java.util.Map;
import java.util.Optional;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface RuntimeRequirement {
    /**
     * Container image, a literal or an expression over task inputs.
     */
    Optional<Expression> image();

    Optional<ResourceSpec> cpu();

    Optional<ResourceSpec> memory();

    Optional<ResourceSpec> disk();

    /**
     * Name of the task input that, when bound, overrides the literal resource defaults.
     */
    Optional<String> overrideParameter();

    /**
     * Runtime keys without a CWL counterpart (preemptible, maxRetries, ...), kept as written.
     */
    Map<String, Expression> platformHints();

    static ImmutableRuntimeRequirement.Builder builder() {
        return ImmutableRuntimeRequirement.builder();
    }

    static RuntimeRequirement empty() {
        return builder().build();
    }
}
