package com.hartwig.wdl2cwl.expression;

import java.util.Optional;

import com.hartwig.wdl2cwl.ir.Expression;
import com.hartwig.wdl2cwl.ir.Reference;

/**
 * The names an expression can see: tool inputs inside a tool, step inputs inside a step's {@code valueFrom}.
 */
public interface TranslationContext {
    /**
     * @return the CWL location of the full reference, including its member path, or empty if the name is unknown
     */
    Optional<ResolvedReference> resolve(Reference reference);

    /**
     * Value of a private declaration, which is translated in place of the reference.
     */
    default Optional<Expression> inline(String name) {
        return Optional.empty();
    }
}
