package com.astrazeneca.tbltransfer.modes;

import com.astrazeneca.tbltransfer.Configuration;
import com.astrazeneca.tbltransfer.aligners.Aligner;
import com.astrazeneca.tbltransfer.alignment.MultipleAlignment;
import com.astrazeneca.tbltransfer.data.ChromosomePair;
import com.astrazeneca.tbltransfer.data.FeatureTable;
import com.astrazeneca.tbltransfer.exception.AlignmentParseException;
import com.astrazeneca.tbltransfer.exception.UnmatchedChromosomeException;
import com.astrazeneca.tbltransfer.parsers.FastaLoader;
import com.astrazeneca.tbltransfer.parsers.FeatureTableParser;
import htsjdk.samtools.reference.ReferenceSequence;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.astrazeneca.tbltransfer.Utils.printTime;
import static com.astrazeneca.tbltransfer.Utils.sameSequence;
import static com.astrazeneca.tbltransfer.Utils.toFileName;

/**
 * Mode of tbl_transfer_prealigned: the input is an alignment holding the reference sequence and one or more
 * targets. The table of the reference is transferred to every other sequence of the alignment.
 */
public class PrealignedTransferMode extends AbstractMode {

    public PrealignedTransferMode(Configuration conf, Aligner aligner) {
        super(conf, aligner);
    }

    @Override
    protected List<ChromosomePair> loadPairs() {
        FastaLoader fastaLoader = new FastaLoader();
        MultipleAlignment alignment = fastaLoader.readAlignment(new File(conf.alignmentFasta));

        List<String> refIds = new ArrayList<>();
        for (String fasta : conf.refFastas) {
            for (ReferenceSequence sequence : fastaLoader.readSequences(new File(fasta))) {
                refIds.add(sequence.getName());
            }
        }
        String refRow = null;
        for (String name : alignment.names()) {
            if (refIds.contains(name)) {
                refRow = name;
                break;
            }
        }
        if (refRow == null) {
            throw new AlignmentParseException(alignment.getSource(),
                    "none of the aligned sequences is a reference sequence " + refIds);
        }

        FeatureTable refTable = null;
        FeatureTableParser parser = new FeatureTableParser();
        for (String tbl : conf.refTables) {
            for (FeatureTable table : parser.parseAllFromFile(new File(tbl))) {
                if (refTable == null && sameSequence(table.seqId, refRow)) {
                    refTable = table;
                }
            }
        }
        if (refTable == null) {
            if (conf.strictChromosomes) {
                throw new UnmatchedChromosomeException(Collections.singletonList(refRow));
            }
            summary.addUnmatched(refRow, "no feature table describes " + refRow);
            return Collections.emptyList();
        }

        File directory = AlignAndTransferMode.prepareDirectory(conf.output);
        List<ChromosomePair> pairs = new ArrayList<>();
        for (String name : alignment.names()) {
            if (name.equals(refRow) || conf.excludedChromosomes.contains(name)) {
                continue;
            }
            File output = new File(directory, toFileName(name) + Configuration.TBL_EXTENSION);
            pairs.add(ChromosomePair.prealigned(refTable, alignment.pair(refRow, name), output));
        }
        printTime(conf.y, "Reference " + refRow + " aligned with " + pairs.size() + " target(s)");
        return pairs;
    }
}
