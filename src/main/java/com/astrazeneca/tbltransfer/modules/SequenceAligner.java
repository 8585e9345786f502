package com.astrazeneca.tbltransfer.modules;

import com.astrazeneca.tbltransfer.Configuration;
import com.astrazeneca.tbltransfer.aligners.Aligner;
import com.astrazeneca.tbltransfer.alignment.PairwiseAlignment;
import com.astrazeneca.tbltransfer.data.ChromosomePair;
import com.astrazeneca.tbltransfer.data.scopedata.AlignmentData;
import com.astrazeneca.tbltransfer.data.scopedata.Scope;

import static com.astrazeneca.tbltransfer.Utils.printTime;

/**
 * First step of the pipeline: produces the alignment of the pair. Pre-made alignments are passed through.
 */
public class SequenceAligner implements Module<ChromosomePair, AlignmentData> {
    private final Aligner aligner;
    private final Configuration conf;

    public SequenceAligner(Aligner aligner, Configuration conf) {
        this.aligner = aligner;
        this.conf = conf;
    }

    @Override
    public Scope<AlignmentData> process(Scope<ChromosomePair> scope) {
        ChromosomePair pair = scope.data;
        if (pair.isPrealigned()) {
            return new Scope<>(scope, new AlignmentData(pair, pair.alignment));
        }
        printTime(conf.y, "Start aligning " + pair);
        PairwiseAlignment alignment = aligner.align(pair.refKey(), pair.refSequence.getBaseString(),
                pair.altKey(), pair.altSequence.getBaseString());
        printTime(conf.y, "Aligned " + pair + ", " + alignment.columns() + " columns");
        return new Scope<>(scope, new AlignmentData(pair, alignment));
    }
}
