package com.astrazeneca.tbltransfer.printers;

import java.util.Objects;

import static com.astrazeneca.tbltransfer.Utils.join;

/**
 * One line of the diagnostics report.
 */
public final class Diagnostic {
    public static final String HEADER = join("\t", "Chromosome", "FeatureIndex", "Feature", "Kind", "Message");

    /**
     * Reference chromosome the note belongs to
     */
    public final String chromosome;
    /**
     * 1-based index of the feature in the reference table, 0 for chromosome level notes
     */
    public final int featureIndex;
    public final String feature;
    public final DiagnosticKind kind;
    public final String message;

    public Diagnostic(String chromosome, int featureIndex, String feature, DiagnosticKind kind, String message) {
        this.chromosome = chromosome;
        this.featureIndex = featureIndex;
        this.feature = feature;
        this.kind = kind;
        this.message = message;
    }

    public static Diagnostic forChromosome(String chromosome, DiagnosticKind kind, String message) {
        return new Diagnostic(chromosome, 0, ".", kind, message);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Diagnostic that = (Diagnostic) o;
        return featureIndex == that.featureIndex &&
                Objects.equals(chromosome, that.chromosome) &&
                Objects.equals(feature, that.feature) &&
                kind == that.kind &&
                Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chromosome, featureIndex, feature, kind, message);
    }

    @Override
    public String toString() {
        return join("\t", chromosome, featureIndex, feature.replace('\t', ' '), kind, message.replace('\t', ' '));
    }
}
