package com.hartwig.wdl2cwl.ir;

import java.util.Optional;

import com.hartwig.wdl2cwl.diagnostic.SourceLocation;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ImportReference {
    /**
     * Import path as written, relative to the importing document.
     */
    String path();

    Optional<String> alias();

    @Value.Auxiliary
    Optional<SourceLocation> location();

    /**
     * The alias, or the file name of the import without its extension.
     */
    default String namespace() {
        if (alias().isPresent()) {
            return alias().get();
        }
        var fileName = path().substring(path().lastIndexOf('/') + 1);
        return fileName.endsWith(".wdl") ? fileName.substring(0, fileName.length() - 4) : fileName;
    }

    static ImmutableImportReference.Builder builder() {
        return ImmutableImportReference.builder();
    }
}
