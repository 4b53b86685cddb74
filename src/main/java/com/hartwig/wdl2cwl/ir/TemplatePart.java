package com.hartwig.wdl2cwl.ir;

/**
 * Piece of a command body or of an interpolated string: either literal text or a placeholder.
 */
public interface TemplatePart {
    boolean isLiteral();
}
