package com.hartwig.wdl2cwl.ir;

import java.util.List;

import org.immutables.value.Value;

/**
 * A named value, optionally followed by member accesses: {@code sample}, {@code BuildMatrix.matrix},
 * {@code runtime_attr.cpu_cores}.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Reference extends Expression {
    List<String> path();

    @Override
    default Kind kind() {
        return Kind.REFERENCE;
    }

    @Value.Check
    default void check() {
        if (path().isEmpty()) {
            throw new IllegalStateException("Reference needs at least one path element");
        }
    }

    default String root() {
        return path().get(0);
    }

    default List<String> members() {
        return path().subList(1, path().size());
    }

    default String dotted() {
        return String.join(".", path());
    }

    static Reference to(String... path) {
        return ImmutableReference.builder().addPath(path).build();
    }
}
