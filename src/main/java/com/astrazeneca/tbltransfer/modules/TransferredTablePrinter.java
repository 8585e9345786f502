package com.astrazeneca.tbltransfer.modules;

import com.astrazeneca.tbltransfer.Configuration;
import com.astrazeneca.tbltransfer.data.scopedata.Scope;
import com.astrazeneca.tbltransfer.data.scopedata.TransferredData;
import com.astrazeneca.tbltransfer.parsers.FeatureTableWriter;

import java.util.function.Consumer;

import static com.astrazeneca.tbltransfer.Utils.printTime;

/**
 * Last step of the pipeline: writes the transferred table to the output file of the pair.
 */
public class TransferredTablePrinter implements Consumer<Scope<TransferredData>> {
    private final Configuration conf;

    public TransferredTablePrinter(Configuration conf) {
        this.conf = conf;
    }

    @Override
    public void accept(Scope<TransferredData> scope) {
        new FeatureTableWriter(conf.excludedQualifiers).write(scope.data.table, scope.data.pair.output);
        printTime(conf.y, "Wrote " + scope.data.table.features.size() + " features of " + scope.chromosome
                + " to " + scope.data.pair.output);
    }
}
