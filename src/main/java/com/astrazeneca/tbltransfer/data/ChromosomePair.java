package com.astrazeneca.tbltransfer.data;

import com.astrazeneca.tbltransfer.alignment.PairwiseAlignment;
import htsjdk.samtools.reference.ReferenceSequence;

import java.io.File;

/**
 * One unit of work: a reference chromosome with its feature table and the target sequence it is transferred to.
 * Either both sequences (to be aligned) or a ready alignment are present.
 */
public final class ChromosomePair {
    private static final String TARGET_SUFFIX = "#target";

    /**
     * Reference sequence name
     */
    public final String refName;

    /**
     * Target sequence name, used as the identifier of the output table
     */
    public final String altName;

    public final FeatureTable refTable;
    public final ReferenceSequence refSequence;
    public final ReferenceSequence altSequence;
    public final PairwiseAlignment alignment;
    public final File output;

    private ChromosomePair(String refName, String altName, FeatureTable refTable, ReferenceSequence refSequence,
                           ReferenceSequence altSequence, PairwiseAlignment alignment, File output) {
        this.refName = refName;
        this.altName = altName;
        this.refTable = refTable;
        this.refSequence = refSequence;
        this.altSequence = altSequence;
        this.alignment = alignment;
        this.output = output;
    }

    /**
     * Pair whose sequences still have to be aligned.
     */
    public static ChromosomePair toAlign(FeatureTable refTable, ReferenceSequence refSequence,
                                         ReferenceSequence altSequence, File output) {
        return new ChromosomePair(refSequence.getName(), altSequence.getName(), refTable, refSequence, altSequence,
                null, output);
    }

    /**
     * Pair taken from a pre-made alignment. Row names of the alignment are the sequence names.
     */
    public static ChromosomePair prealigned(FeatureTable refTable, PairwiseAlignment alignment, File output) {
        return new ChromosomePair(alignment.nameA, alignment.nameB, refTable, null, null, alignment, output);
    }

    public boolean isPrealigned() {
        return alignment != null;
    }

    /**
     * Name of the reference row in the alignment.
     */
    public String refKey() {
        return isPrealigned() ? alignment.nameA : refName;
    }

    /**
     * Name of the target row in the alignment. Differs from {@link #altName} only when the reference and the
     * target sequences carry the same name.
     */
    public String altKey() {
        if (isPrealigned()) {
            return alignment.nameB;
        }
        return altName.equals(refName) ? altName + TARGET_SUFFIX : altName;
    }

    /**
     * Name used in reports: the reference chromosome, or the target when several targets share one
     * reference in a pre-made alignment.
     */
    public String label() {
        return isPrealigned() ? altName : refName;
    }

    @Override
    public String toString() {
        return refName + " -> " + altName;
    }
}
