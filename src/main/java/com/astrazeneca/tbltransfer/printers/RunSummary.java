package com.astrazeneca.tbltransfer.printers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a whole run: chromosomes written, chromosomes skipped and all notes. A run with some
 * skipped chromosomes is still successful as long as one chromosome was written.
 */
public class RunSummary {
    private final List<String> completed = new ArrayList<>();
    private final List<String> outputs = new ArrayList<>();
    private final List<String> failed = new ArrayList<>();
    private final List<String> unmatched = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public synchronized void addCompleted(TransferReport report, String output) {
        completed.add(report.getChromosome());
        outputs.add(output);
        diagnostics.addAll(report.getDiagnostics());
    }

    public synchronized void addFailed(TransferReport report, String reason) {
        failed.add(report.getChromosome());
        diagnostics.addAll(report.getDiagnostics());
        diagnostics.add(Diagnostic.forChromosome(report.getChromosome(), DiagnosticKind.CHROMOSOME_FAILED, reason));
    }

    public synchronized void addUnmatched(String chromosome, String reason) {
        unmatched.add(chromosome);
        diagnostics.add(Diagnostic.forChromosome(chromosome, DiagnosticKind.UNMATCHED_CHROMOSOME, reason));
    }

    public synchronized List<String> getCompleted() {
        return Collections.unmodifiableList(new ArrayList<>(completed));
    }

    public synchronized List<String> getOutputs() {
        return Collections.unmodifiableList(new ArrayList<>(outputs));
    }

    public synchronized List<String> getFailed() {
        return Collections.unmodifiableList(new ArrayList<>(failed));
    }

    public synchronized List<String> getUnmatched() {
        return Collections.unmodifiableList(new ArrayList<>(unmatched));
    }

    public synchronized List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public synchronized long count(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.kind == kind).count();
    }

    public synchronized boolean isSuccessful() {
        return !completed.isEmpty();
    }
}
