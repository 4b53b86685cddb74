package com.hartwig.wdl2cwl.ir;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.hartwig.wdl2cwl.diagnostic.SourceLocation;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Task {
    String name();

    List<Parameter> inputs();

    List<Parameter> outputs();

    /**
     * Non-input declarations of the task body, in source order.
     */
    List<Parameter> declarations();

    @Value.Default
    default RuntimeRequirement runtime() {
        return RuntimeRequirement.empty();
    }

    /**
     * The command body, verbatim text split around its placeholders.
     */
    List<TemplatePart> command();

    @Value.Auxiliary
    Optional<SourceLocation> location();

    default Optional<Parameter> findInput(String name) {
        return inputs().stream().filter(input -> input.name().equals(name)).findFirst();
    }

    default Optional<Parameter> findOutput(String name) {
        return outputs().stream().filter(output -> output.name().equals(name)).findFirst();
    }

    default Optional<Parameter> findDeclaration(String name) {
        return declarations().stream().filter(declaration -> declaration.name().equals(name)).findFirst();
    }

    default List<Placeholder> placeholders() {
        return command().stream().filter(part -> !part.isLiteral()).map(Placeholder.class::cast).collect(Collectors.toList());
    }

    static ImmutableTask.Builder builder() {
        return ImmutableTask.builder();
    }
}
