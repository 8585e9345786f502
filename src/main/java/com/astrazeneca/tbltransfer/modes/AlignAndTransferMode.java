package com.astrazeneca.tbltransfer.modes;

import com.astrazeneca.tbltransfer.ChromosomeMatcher;
import com.astrazeneca.tbltransfer.Configuration;
import com.astrazeneca.tbltransfer.aligners.Aligner;
import com.astrazeneca.tbltransfer.data.ChromosomePair;
import com.astrazeneca.tbltransfer.data.FeatureTable;
import com.astrazeneca.tbltransfer.exception.InputFileException;
import com.astrazeneca.tbltransfer.parsers.FastaLoader;
import com.astrazeneca.tbltransfer.parsers.FeatureTableParser;
import htsjdk.samtools.reference.ReferenceSequence;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static com.astrazeneca.tbltransfer.Utils.printTime;
import static com.astrazeneca.tbltransfer.Utils.toFileName;

/**
 * Mode of tbl_transfer and tbl_transfer_multichr: reference and target sequences are aligned with the external
 * aligner for every chromosome pair. With a single output the run writes exactly one table to the output file,
 * otherwise one table per target sequence is written to the output directory.
 */
public class AlignAndTransferMode extends AbstractMode {
    private final boolean singleOutput;

    public AlignAndTransferMode(Configuration conf, Aligner aligner, boolean singleOutput) {
        super(conf, aligner);
        this.singleOutput = singleOutput;
    }

    @Override
    protected List<ChromosomePair> loadPairs() {
        FastaLoader fastaLoader = new FastaLoader();
        FeatureTableParser parser = new FeatureTableParser();

        List<FeatureTable> tables = new ArrayList<>();
        for (String tbl : conf.refTables) {
            tables.addAll(parser.parseAllFromFile(new File(tbl)));
        }
        List<ReferenceSequence> refSequences = new ArrayList<>();
        for (String fasta : conf.refFastas) {
            refSequences.addAll(fastaLoader.readSequences(new File(fasta)));
        }
        List<ReferenceSequence> altSequences = fastaLoader.readSequences(new File(conf.altFasta));
        printTime(conf.y, "Read " + tables.size() + " table(s), " + refSequences.size() + " reference and "
                + altSequences.size() + " target sequence(s)");

        Function<String, File> outputs;
        if (singleOutput) {
            File output = new File(conf.output);
            outputs = name -> output;
        } else {
            File directory = prepareDirectory(conf.output);
            outputs = name -> new File(directory, toFileName(name) + Configuration.TBL_EXTENSION);
        }
        List<ChromosomePair> pairs = new ChromosomeMatcher(conf).match(tables, refSequences, altSequences,
                outputs, summary);
        if (singleOutput && pairs.size() > 1) {
            throw new InputFileException(conf.output, pairs.size() + " chromosomes were paired but only one "
                    + "table can be written, use tbl_transfer_multichr instead.");
        }
        return pairs;
    }

    static File prepareDirectory(String path) {
        File directory = new File(path);
        if (!directory.isDirectory() && !directory.mkdirs()) {
            throw new InputFileException(path, "Output directory can't be created.");
        }
        return directory;
    }
}
