package com.hartwig.wdl2cwl.ir;

import java.util.List;
import java.util.Optional;

import com.hartwig.wdl2cwl.diagnostic.SourceLocation;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface StructDefinition {
    String name();

    List<Parameter> members();

    @Value.Auxiliary
    Optional<SourceLocation> location();

    default Optional<Parameter> findMember(String name) {
        return members().stream().filter(member -> member.name().equals(name)).findFirst();
    }

    static ImmutableStructDefinition.Builder builder() {
        return ImmutableStructDefinition.builder();
    }
}
