package com.hartwig.wdl2cwl.diagnostic;

public enum Severity {
    ERROR,
    WARNING
}
