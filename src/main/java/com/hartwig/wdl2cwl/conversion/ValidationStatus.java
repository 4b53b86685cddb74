package com.hartwig.wdl2cwl.conversion;

public enum ValidationStatus {
    NOT_REQUESTED,
    PASSED,
    FAILED,
    /**
     * The validator could not be run. Not a conversion failure.
     */
    SKIPPED
}
