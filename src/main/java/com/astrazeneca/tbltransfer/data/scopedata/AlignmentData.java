package com.astrazeneca.tbltransfer.data.scopedata;

import com.astrazeneca.tbltransfer.alignment.PairwiseAlignment;
import com.astrazeneca.tbltransfer.data.ChromosomePair;

public class AlignmentData {
    public final ChromosomePair pair;
    public final PairwiseAlignment alignment;

    public AlignmentData(ChromosomePair pair, PairwiseAlignment alignment) {
        this.pair = pair;
        this.alignment = alignment;
    }
}
