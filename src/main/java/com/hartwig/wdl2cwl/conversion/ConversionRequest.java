package com.hartwig.wdl2cwl.conversion;

import java.nio.file.Path;
import java.util.Set;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ConversionRequest {
    /**
     * A WDL file, or a directory searched recursively for {@code .wdl} files
     */
    Path input();

    Path outputDirectory();

    /**
     * Names of the workflows and tasks to convert; empty converts everything
     */
    Set<String> unitFilter();

    @Value.Default
    default boolean validate() {
        return false;
    }

    static ImmutableConversionRequest.Builder builder() {
        return ImmutableConversionRequest.builder();
    }
}
