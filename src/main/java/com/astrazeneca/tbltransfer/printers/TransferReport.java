package com.astrazeneca.tbltransfer.printers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Notes of one chromosome transfer. Each chromosome has its own report, reports are merged in
 * {@link RunSummary} once the chromosome is finished.
 */
public class TransferReport {
    private final String chromosome;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public TransferReport(String chromosome) {
        this.chromosome = chromosome;
    }

    public String getChromosome() {
        return chromosome;
    }

    public void add(int featureIndex, String feature, DiagnosticKind kind, String message) {
        diagnostics.add(new Diagnostic(chromosome, featureIndex, feature, kind, message));
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> getDiagnostics(DiagnosticKind kind) {
        List<Diagnostic> result = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.kind == kind) {
                result.add(diagnostic);
            }
        }
        return result;
    }

    public long count(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.kind == kind).count();
    }
}
