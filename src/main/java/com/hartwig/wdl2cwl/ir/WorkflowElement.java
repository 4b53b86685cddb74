package com.hartwig.wdl2cwl.ir;

import java.util.Optional;

import com.hartwig.wdl2cwl.diagnostic.SourceLocation;

/**
 * Statement of a workflow body.
 */
public interface WorkflowElement {
    enum Kind {
        CALL,
        SCATTER,
        CONDITIONAL
    }

    Kind kind();

    Optional<SourceLocation> location();
}
