package com.astrazeneca.tbltransfer.parsers;

import com.astrazeneca.tbltransfer.alignment.MultipleAlignment;
import com.astrazeneca.tbltransfer.exception.AlignmentParseException;
import com.astrazeneca.tbltransfer.exception.InputFileException;
import htsjdk.samtools.SAMException;
import htsjdk.samtools.reference.FastaSequenceFile;
import htsjdk.samtools.reference.ReferenceSequence;
import htsjdk.samtools.util.CloserUtil;

import java.io.File;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Utility class for reading plain and aligned FASTA files. Names are truncated at the first whitespace.
 */
public class FastaLoader {

    /**
     * Reads all records of a FASTA file in file order.
     * @param file FASTA file, may be gzipped
     * @return list of sequences
     */
    public List<ReferenceSequence> readSequences(File file) {
        if (!file.canRead()) {
            throw new InputFileException(file.getPath(), "File is missing or unreadable.");
        }
        List<ReferenceSequence> sequences = new ArrayList<>();
        FastaSequenceFile fasta = null;
        try {
            fasta = new FastaSequenceFile(file, true);
            ReferenceSequence sequence;
            while ((sequence = fasta.nextSequence()) != null) {
                sequences.add(sequence);
            }
        } catch (SAMException e) {
            throw new InputFileException(file.getPath(), e);
        } finally {
            CloserUtil.close(fasta);
        }
        return sequences;
    }

    /**
     * Reads a gapped FASTA file (e.g. MAFFT output) as an alignment.
     * @param file aligned FASTA file
     * @return alignment rows in file order
     */
    public MultipleAlignment readAlignment(File file) {
        LinkedHashMap<String, String> rows = new LinkedHashMap<>();
        for (ReferenceSequence sequence : readSequences(file)) {
            if (rows.put(sequence.getName(), sequence.getBaseString()) != null) {
                throw new AlignmentParseException(file.getPath(), "duplicated sequence name " + sequence.getName());
            }
        }
        return new MultipleAlignment(file.getPath(), rows);
    }
}
