package com.hartwig.wdl2cwl.wdl;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.hartwig.wdl2cwl.diagnostic.ConversionException;
import com.hartwig.wdl2cwl.diagnostic.Diagnostic;
import com.hartwig.wdl2cwl.diagnostic.DiagnosticKind;
import com.hartwig.wdl2cwl.diagnostic.ImportCycleException;
import com.hartwig.wdl2cwl.diagnostic.SourceLocation;
import com.hartwig.wdl2cwl.diagnostic.UnresolvedReferenceException;
import com.hartwig.wdl2cwl.ir.ImportReference;
import com.hartwig.wdl2cwl.ir.SourceDocument;
import com.hartwig.wdl2cwl.ir.StructDefinition;
import com.hartwig.wdl2cwl.ir.Task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses a document and, recursively, the documents it imports, registering every definition in a
 * {@link TaskNamespace}. Imports are resolved relative to the importing file. Each file is parsed once; a file that is
 * imported while it is still being resolved closes a cycle.
 */
class ImportResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImportResolver.class);

    private final TaskNamespace namespace;
    private final Map<Path, SourceDocument> parsed = new HashMap<>();
    private final List<Path> resolving = new ArrayList<>();
    private final List<Diagnostic> warnings = new ArrayList<>();

    ImportResolver(TaskNamespace namespace) {
        this.namespace = namespace;
    }

    SourceDocument resolve(Path file) throws ConversionException {
        return resolve(file, null);
    }

    List<Diagnostic> warnings() {
        return warnings;
    }

    private SourceDocument resolve(Path file, ImportReference importedBy) throws ConversionException {
        var normalized = file.toAbsolutePath().normalize();
        if (resolving.contains(normalized)) {
            throw cycle(normalized, importedBy);
        }
        var cached = parsed.get(normalized);
        if (cached != null) {
            return cached;
        }
        resolving.add(normalized);
        try {
            var document = WdlParser.parse(file.toString(), read(file, importedBy));
            warnings.addAll(document.warnings());
            var directory = normalized.getParent();
            for (ImportReference reference : document.imports()) {
                if (reference.path().contains("://")) {
                    throw new UnresolvedReferenceException(reference.location().orElse(null),
                            String.format("Remote import '%s' is not supported", reference.path()));
                }
                LOGGER.debug("[{}] Resolving import '{}'", file, reference.path());
                resolve(directory.resolve(reference.path()), reference);
            }
            register(document, normalized.toString());
            parsed.put(normalized, document);
            return document;
        } finally {
            resolving.remove(resolving.size() - 1);
        }
    }

    private void register(SourceDocument document, String origin) throws ConversionException {
        for (StructDefinition struct : document.structs()) {
            namespace.register(struct, origin);
        }
        for (Task task : document.tasks()) {
            namespace.register(task, origin);
        }
        if (document.workflow().isPresent()) {
            namespace.register(document.workflow().get(), origin);
        }
    }

    private ImportCycleException cycle(Path repeated, ImportReference importedBy) {
        var chain = resolving.subList(resolving.indexOf(repeated), resolving.size())
                .stream()
                .map(path -> path.getFileName().toString())
                .collect(Collectors.toList());
        chain.add(repeated.getFileName().toString());
        var location = importedBy == null ? null : importedBy.location().orElse(null);
        return new ImportCycleException(location, "Import cycle: " + String.join(" -> ", chain));
    }

    private static String read(Path file, ImportReference importedBy) throws ConversionException {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            if (importedBy != null) {
                throw new UnresolvedReferenceException(importedBy.location().orElse(null),
                        String.format("Imported file '%s' does not exist", importedBy.path()));
            }
            throw ioError(file, e);
        } catch (IOException e) {
            throw ioError(file, e);
        }
    }

    private static ConversionException ioError(Path file, IOException e) {
        return new ConversionException(DiagnosticKind.IO_ERROR,
                SourceLocation.of(file.toString(), 1, 1),
                String.format("Could not read '%s': %s", file, e.getMessage()),
                e);
    }
}
