package com.hartwig.wdl2cwl.conversion;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.hartwig.wdl2cwl.diagnostic.Diagnostic;
import com.hartwig.wdl2cwl.diagnostic.DiagnosticKind;
import com.hartwig.wdl2cwl.diagnostic.SourceLocation;

/**
 * Output documents of a batch by path. Files that import the same task produce the same document under the same path.
 * When files produce different documents under one path, the file submitted first keeps the path, whatever order the
 * workers finish in, and the units of the other files are reported as ambiguous.
 */
class OutputRegistry {

    interface ContentWriter {
        void write(String content) throws IOException;
    }

    private static final class Claim {
        private final int rank;
        private final String sourceFile;
        private final String unitName;
        private final String content;

        private Claim(int rank, String sourceFile, String unitName, String content) {
            this.rank = rank;
            this.sourceFile = sourceFile;
            this.unitName = unitName;
            this.content = content;
        }
    }

    private final Map<String, Integer> ranks = new HashMap<>();
    private final Map<String, List<Claim>> claims = new LinkedHashMap<>();
    private final Map<String, Claim> owners = new HashMap<>();

    /**
     * @param sourceFiles names of the batch's files in submission order
     */
    OutputRegistry(List<String> sourceFiles) {
        for (int i = 0; i < sourceFiles.size(); i++) {
            ranks.putIfAbsent(sourceFiles.get(i), i);
        }
    }

    /**
     * Records that the unit produced the document and writes it when no file submitted earlier owns the path.
     */
    synchronized void write(String relativePath, String content, String sourceFile, String unitName, ContentWriter writer) throws IOException {
        var claim = new Claim(ranks.getOrDefault(sourceFile, Integer.MAX_VALUE), sourceFile, unitName, content);
        claims.computeIfAbsent(relativePath, path -> new ArrayList<>()).add(claim);
        var owner = owners.get(relativePath);
        if (owner == null || claim.rank < owner.rank || (claim.rank == owner.rank && !owner.content.equals(content))) {
            owners.put(relativePath, claim);
            if (owner == null || !owner.content.equals(content)) {
                writer.write(content);
            }
        }
    }

    /**
     * One error for every path where the unit produced a different document than the file that owns the path.
     */
    synchronized List<Diagnostic> conflicts(String sourceFile, String unitName) {
        var diagnostics = new ArrayList<Diagnostic>();
        for (Map.Entry<String, List<Claim>> path : claims.entrySet()) {
            var owner = owners.get(path.getKey());
            for (Claim claim : path.getValue()) {
                if (claim.sourceFile.equals(sourceFile) && claim.unitName.equals(unitName) && !claim.content.equals(owner.content)) {
                    diagnostics.add(Diagnostic.error(DiagnosticKind.AMBIGUOUS_DEFINITION,
                            SourceLocation.of(sourceFile, 1, 1),
                            String.format("Output '%s' of '%s' is also produced by '%s' with different content",
                                    path.getKey(),
                                    unitName,
                                    owner.sourceFile)));
                    break;
                }
            }
        }
        return diagnostics;
    }
}
