package com.hartwig.wdl2cwl.ir;

import java.util.Optional;

import com.hartwig.wdl2cwl.diagnostic.SourceLocation;

import org.immutables.value.Value;

/**
 * A WDL value expression, kept unevaluated. The set of kinds is closed: whatever the parser cannot place in one of the
 * other kinds ends up as {@link UnsupportedExpression}.
 */
public interface Expression {
    enum Kind {
        LITERAL,
        REFERENCE,
        INTERPOLATION,
        FIRST_DEFINED,
        OVERRIDE_FALLBACK,
        FUNCTION_CALL,
        NEGATION,
        OBJECT_LITERAL,
        ARRAY_LITERAL,
        UNSUPPORTED
    }

    Kind kind();

    @Value.Auxiliary
    Optional<SourceLocation> location();
}
