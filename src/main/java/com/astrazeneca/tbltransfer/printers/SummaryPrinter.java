package com.astrazeneca.tbltransfer.printers;

import java.io.PrintStream;

import static com.astrazeneca.tbltransfer.Utils.join;

/**
 * Prints the human readable run summary. The "out" stream can be set by implementing new type in enum
 * PrinterType, adding it to method createPrinter() and creating new child SummaryPrinter class extending this class.
 */
public abstract class SummaryPrinter {
    protected PrintStream out;

    /**
     * Prints counts of written, failed and unmatched chromosomes followed by the per kind counts of notes.
     * @param summary finished run
     */
    public void print(RunSummary summary) {
        out.println("Transferred chromosomes: " + summary.getCompleted().size()
                + (summary.getCompleted().isEmpty() ? "" : " (" + join(", ", summary.getCompleted().toArray()) + ")"));
        for (String output : summary.getOutputs()) {
            out.println("  written: " + output);
        }
        if (!summary.getFailed().isEmpty()) {
            out.println("Failed chromosomes: " + join(", ", summary.getFailed().toArray()));
        }
        if (!summary.getUnmatched().isEmpty()) {
            out.println("Unmatched chromosomes: " + join(", ", summary.getUnmatched().toArray()));
        }
        out.println("Dropped features: " + summary.count(DiagnosticKind.FEATURE_DROPPED)
                + ", dropped intervals: " + summary.count(DiagnosticKind.INTERVAL_DROPPED)
                + ", truncated boundaries: " + summary.count(DiagnosticKind.BOUNDARY_TRUNCATED)
                + ", changed lengths: " + summary.count(DiagnosticKind.LENGTH_CHANGED)
                + ", gap adjacent boundaries: " + summary.count(DiagnosticKind.GAP_ADJACENT_BOUNDARY));
        for (Diagnostic diagnostic : summary.getDiagnostics()) {
            if (diagnostic.kind == DiagnosticKind.FEATURE_DROPPED || diagnostic.kind == DiagnosticKind.CHROMOSOME_FAILED) {
                out.println("  " + diagnostic.kind + " " + diagnostic.chromosome + " " + diagnostic.feature
                        + ": " + diagnostic.message);
            }
        }
    }

    public void setOut(PrintStream printStream) {
        out = printStream;
    }

    public PrintStream getOut() {
        return out;
    }

    /**
     * Factory method for creating needed printer classes for each printer type set in configuration.
     * @param type needed type
     * @return created specific SummaryPrinter
     */
    public static SummaryPrinter createPrinter(PrinterType type) {
        switch(type) {
            case OUT: return new SystemOutSummaryPrinter();
            case ERR: return new SystemErrSummaryPrinter();
            default:  return new SystemOutSummaryPrinter();
        }
    }
}
