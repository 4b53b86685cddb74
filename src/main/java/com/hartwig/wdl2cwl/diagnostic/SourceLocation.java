package com.hartwig.wdl2cwl.diagnostic;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

/**
 * Position of a construct in a source document. Lines and columns start at 1.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonSerialize(as = ImmutableSourceLocation.class)
public interface SourceLocation {
    @Value.Parameter
    String file();

    @Value.Parameter
    int line();

    @Value.Parameter
    int column();

    default String describe() {
        return String.format("%s:%d:%d", file(), line(), column());
    }

    static SourceLocation of(String file, int line, int column) {
        return ImmutableSourceLocation.of(file, line, column);
    }
}
