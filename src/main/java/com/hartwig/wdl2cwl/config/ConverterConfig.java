package com.hartwig.wdl2cwl.config;

import java.util.List;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableConverterConfig.class)
@JsonSerialize(as = ImmutableConverterConfig.class)
public interface ConverterConfig {
    /**
     * CWL version written into every document
     */
    @Value.Default
    default String cwlVersion() {
        return "v1.2";
    }

    /**
     * Subdirectory of the output directory for tool documents
     */
    @Value.Default
    default String toolsDirectory() {
        return "tools";
    }

    /**
     * Number of files converted in parallel
     */
    @Value.Default
    default int threads() {
        return 4;
    }

    /**
     * Interpreter of the generated command scripts
     */
    @Value.Default
    default String shell() {
        return "bash";
    }

    @Value.Default
    default String scriptName() {
        return "script.sh";
    }

    /**
     * Validator command, the document path is appended
     */
    @Value.Default
    default List<String> validatorCommand() {
        return List.of("cwltool", "--validate");
    }

    @Value.Default
    default int validatorTimeoutSeconds() {
        return 120;
    }

    /**
     * Whether an input template is written next to each workflow document
     */
    @Value.Default
    default boolean writeInputTemplates() {
        return true;
    }

    @Value.Check
    default void check() {
        if (threads() < 1) {
            throw new IllegalStateException("threads must be at least 1");
        }
        if (validatorTimeoutSeconds() < 1) {
            throw new IllegalStateException("validatorTimeoutSeconds must be at least 1");
        }
        if (validatorCommand().isEmpty()) {
            throw new IllegalStateException("validatorCommand cannot be empty");
        }
    }

    static ImmutableConverterConfig.Builder builder() {
        return ImmutableConverterConfig.builder();
    }

    static ConverterConfig defaults() {
        return builder().build();
    }
}
