package com.astrazeneca.tbltransfer.data.scopedata;

import com.astrazeneca.tbltransfer.data.ChromosomePair;
import com.astrazeneca.tbltransfer.data.FeatureTable;

/**
 * Final data of the pipeline: the table transferred onto the target sequence.
 */
public class TransferredData {
    public final ChromosomePair pair;
    public final FeatureTable table;

    public TransferredData(ChromosomePair pair, FeatureTable table) {
        this.pair = pair;
        this.table = table;
    }
}
