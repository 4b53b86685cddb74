package com.hartwig.wdl2cwl.ir;

import java.util.Map;
import java.util.Optional;

import com.hartwig.wdl2cwl.diagnostic.SourceLocation;

import org.immutables.value.Value;

/**
 * An interpolation marker such as {@code ~{sample}} or {@code ${sep=" " files}}.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface Placeholder extends TemplatePart {
    Expression expression();

    /**
     * Placeholder options ({@code sep}, {@code default}, {@code true}, {@code false}) with their literal values.
     */
    Map<String, String> options();

    /**
     * The marker exactly as written in the source.
     */
    @Value.Auxiliary
    String marker();

    @Value.Auxiliary
    Optional<SourceLocation> location();

    /**
     * Set on the operands of a {@code +} concatenation. An undefined operand makes the whole string undefined, where an
     * ordinary placeholder renders as empty text.
     */
    @Value.Default
    default boolean propagatesUndefined() {
        return false;
    }

    @Override
    default boolean isLiteral() {
        return false;
    }

    default Optional<String> option(String name) {
        return Optional.ofNullable(options().get(name));
    }

    static ImmutablePlaceholder.Builder builder() {
        return ImmutablePlaceholder.builder();
    }
}
