package com.hartwig.wdl2cwl.conversion;

public enum UnitKind {
    WORKFLOW,
    TASK,
    /**
     * A source file whose units are unknown because it could not be read, or was never started.
     */
    FILE
}
