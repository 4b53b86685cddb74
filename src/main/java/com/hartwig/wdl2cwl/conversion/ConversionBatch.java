package com.hartwig.wdl2cwl.conversion;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

import com.hartwig.wdl2cwl.diagnostic.Diagnostic;
import com.hartwig.wdl2cwl.diagnostic.DiagnosticKind;
import com.hartwig.wdl2cwl.diagnostic.SourceLocation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversion of a set of files in progress. Files are converted in parallel; the report lists them in the order they
 * were submitted.
 */
public class ConversionBatch {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConversionBatch.class);

    private final ExecutorService executor;
    private final AtomicBoolean cancelled;
    private final OutputRegistry outputs;
    private final List<CompletableFuture<List<UnitResult>>> files;

    ConversionBatch(ExecutorService executor, AtomicBoolean cancelled, OutputRegistry outputs,
            List<CompletableFuture<List<UnitResult>>> files) {
        this.executor = executor;
        this.cancelled = cancelled;
        this.outputs = outputs;
        this.files = files;
    }

    /**
     * Files that have not started converting yet are reported as cancelled. Files already in progress complete.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Waits for every file to finish and releases the worker threads. Units whose output collides with a different
     * document from a file submitted earlier fail, as does the workflow of their file.
     */
    public ConversionReport report() {
        try {
            var units = new ArrayList<UnitResult>();
            for (CompletableFuture<List<UnitResult>> file : files) {
                units.addAll(withoutConflicts(file.join()));
            }
            return ConversionReport.builder().units(units).build();
        } finally {
            executor.shutdown();
        }
    }

    private List<UnitResult> withoutConflicts(List<UnitResult> units) {
        var resolved = new ArrayList<UnitResult>();
        var failedTasks = new LinkedHashSet<String>();
        for (UnitResult unit : units) {
            var conflicts = unit.success() ? outputs.conflicts(unit.sourceFile(), unit.unitName()) : List.<Diagnostic>of();
            if (conflicts.isEmpty()) {
                resolved.add(unit);
            } else {
                LOGGER.warn("[{}] '{}' collides with the output of another file", unit.sourceFile(), unit.unitName());
                resolved.add(failed(unit, conflicts));
                if (unit.kind() == UnitKind.TASK) {
                    failedTasks.add(unit.unitName());
                }
            }
        }
        if (failedTasks.isEmpty()) {
            return resolved;
        }
        for (int i = 0; i < resolved.size(); i++) {
            var unit = resolved.get(i);
            if (unit.kind() == UnitKind.WORKFLOW && unit.success()) {
                var diagnostics = new ArrayList<Diagnostic>();
                for (String task : failedTasks) {
                    diagnostics.add(Diagnostic.error(DiagnosticKind.AMBIGUOUS_DEFINITION,
                            SourceLocation.of(unit.sourceFile(), 1, 1),
                            String.format("Workflow '%s' uses task '%s', whose output collides with another file", unit.unitName(), task)));
                }
                resolved.set(i, failed(unit, diagnostics));
            }
        }
        return resolved;
    }

    private static UnitResult failed(UnitResult unit, List<Diagnostic> conflicts) {
        var diagnostics = new ArrayList<>(unit.diagnostics());
        diagnostics.addAll(conflicts);
        return UnitResult.builder()
                .from(unit)
                .outputPath(Optional.empty())
                .status(ConversionStatus.FAILED)
                .diagnostics(diagnostics)
                .build();
    }
}
