package com.hartwig.wdl2cwl.conversion;

public enum ConversionStatus {
    SUCCESS,
    FAILED,
    CANCELLED
}
