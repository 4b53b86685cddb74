package com.hartwig.wdl2cwl.conversion;

import java.nio.file.Path;

/**
 * Checks a generated document with a tool outside this process.
 */
public interface ExternalValidator {
    ValidationOutcome validate(Path document);
}
