package com.hartwig.wdl2cwl.ir;

import java.util.List;
import java.util.Optional;

import com.hartwig.wdl2cwl.diagnostic.Diagnostic;

import org.immutables.value.Value;

/**
 * Everything one WDL file declares, before its imports are resolved.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface SourceDocument {
    String path();

    Optional<String> version();

    List<ImportReference> imports();

    List<StructDefinition> structs();

    List<Task> tasks();

    Optional<Workflow> workflow();

    /**
     * Non-fatal findings of the parser, such as skipped constructs.
     */
    List<Diagnostic> warnings();

    static ImmutableSourceDocument.Builder builder() {
        return ImmutableSourceDocument.builder();
    }
}
