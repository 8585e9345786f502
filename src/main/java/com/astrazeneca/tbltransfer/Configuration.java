package com.astrazeneca.tbltransfer;

import com.astrazeneca.tbltransfer.printers.PrinterType;

import java.util.*;

public class Configuration {
    public static final String DEFAULT_MAFFT = "mafft";
    public static final String DIAGNOSTICS_FILE = "transfer_diagnostics.tsv";
    public static final String TBL_EXTENSION = ".tbl";
    public static final String INCOMPLETE_CDS_NOTE = "sequencing did not capture complete CDS";

    /**
     * Behaviour for features which are partly outside of the target sequence.
     */
    public enum OutOfBoundsPolicy {
        /**
         * truncate at the sequence edge and mark the boundary partial
         */
        CLIP,
        /**
         * drop every interval that is partly out of bounds
         */
        DROP
    }

    /**
     * Behaviour for an interval whose bases are all deleted in the target, so both boundaries fall into the
     * same gap.
     */
    public enum DeletedIntervalPolicy {
        DROP,
        /**
         * keep a single base interval at the closest upstream base, both boundaries partial
         */
        COLLAPSE
    }

    /**
     * How reference chromosomes are paired with target sequences when no explicit pair is given.
     */
    public enum ChromosomeMatching {
        NAME,
        ORDER
    }

    /**
     * Name of the command being run (tbl_transfer, tbl_transfer_multichr, tbl_transfer_prealigned)
     */
    public String command;

    /**
     * Reference sequences, one chromosome/segment per file for tbl_transfer_multichr
     */
    public List<String> refFastas = new ArrayList<>();

    /**
     * Reference annotations in NCBI feature table format
     */
    public List<String> refTables = new ArrayList<>();

    /**
     * Sequence(s) of the new genome
     */
    public String altFasta;

    /**
     * Pre-made alignment containing the reference and the targets (tbl_transfer_prealigned)
     */
    public String alignmentFasta;

    /**
     * Output table (tbl_transfer) or output directory (other commands)
     */
    public String output;

    /**
     * Machine readable list of notes. Defaults to transfer_diagnostics.tsv near the output.
     */
    public String diagnostics; // --diagnostics

    public OutOfBoundsPolicy outOfBoundsPolicy = OutOfBoundsPolicy.CLIP; // --oob_clip / --oob_drop

    /**
     * Features specified as ambiguous ("&lt;####" or "&gt;####") are interpreted as exact values
     */
    public boolean ignoreAmbiguousEdges = false; // --ignoreAmbigFeatureEdge

    public DeletedIntervalPolicy deletedIntervalPolicy = DeletedIntervalPolicy.DROP; // --deleted_interval

    /**
     * Qualifiers which are not copied to transferred tables
     */
    public Set<String> excludedQualifiers = new LinkedHashSet<>(Collections.singletonList("protein_id"));

    public ChromosomeMatching chromosomeMatching = ChromosomeMatching.NAME; // --match_by_order

    /**
     * Explicit reference -&gt; target chromosome pairs, take precedence over the matching
     */
    public Map<String, String> chromosomePairs = new LinkedHashMap<>(); // --chr_map

    /**
     * Reference chromosomes which are skipped on purpose
     */
    public Set<String> excludedChromosomes = new LinkedHashSet<>(); // --exclude_chr

    /**
     * Fail the run if a reference chromosome has no target. If false, report it and continue.
     */
    public boolean strictChromosomes = true; // --warn_unmatched

    /**
     * Threads count to use in multithreading mode
     */
    public int threads = 1; // -th

    /**
     * Seconds to wait for the alignment of one chromosome, 0 - no limit. A chromosome over the limit fails.
     */
    public long alignerTimeout = 0; // --aligner_timeout

    public String mafftPath = DEFAULT_MAFFT; // --mafft

    /**
     * Verbose mode. Will output transfer process.
     */
    public boolean y; // -y

    /**
     * Default printer for run summary - system.out
     */
    public PrinterType printerType = PrinterType.OUT; // -DP

    public boolean isParallel() {
        return threads > 1;
    }
}
