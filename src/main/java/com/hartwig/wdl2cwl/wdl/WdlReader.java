package com.hartwig.wdl2cwl.wdl;

import java.nio.file.Path;

import com.hartwig.wdl2cwl.diagnostic.ConversionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class WdlReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(WdlReader.class);

    /**
     * Parses a WDL file and everything it imports into a fresh namespace.
     */
    public ResolvedDocument read(Path file) throws ConversionException {
        var namespace = new TaskNamespace();
        var resolver = new ImportResolver(namespace);
        var root = resolver.resolve(file);
        LOGGER.info("[{}] Read {} task(s){}",
                file.getFileName(),
                namespace.tasks().size(),
                root.workflow().map(workflow -> " and workflow " + workflow.name()).orElse(""));
        return new ResolvedDocument(root, namespace, resolver.warnings());
    }
}
