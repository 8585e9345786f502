package com.astrazeneca.tbltransfer.modes;

import com.astrazeneca.tbltransfer.Configuration;
import com.astrazeneca.tbltransfer.aligners.Aligner;
import com.astrazeneca.tbltransfer.collection.DirectThreadExecutor;
import com.astrazeneca.tbltransfer.data.ChromosomePair;
import com.astrazeneca.tbltransfer.data.scopedata.Scope;
import com.astrazeneca.tbltransfer.data.scopedata.TransferredData;
import com.astrazeneca.tbltransfer.exception.TblTransferException;
import com.astrazeneca.tbltransfer.modules.CoordMapperBuilder;
import com.astrazeneca.tbltransfer.modules.FeatureRemapper;
import com.astrazeneca.tbltransfer.modules.SequenceAligner;
import com.astrazeneca.tbltransfer.modules.TransferredTablePrinter;
import com.astrazeneca.tbltransfer.printers.RunSummary;
import com.astrazeneca.tbltransfer.printers.TransferReport;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static com.astrazeneca.tbltransfer.Utils.printExceptionAndContinue;
import static com.astrazeneca.tbltransfer.Utils.printTime;

/**
 * Abstract Mode of TblTransfer. Provides the typical pipeline run on every chromosome pair and the
 * not-parallel and parallel ways of running it. Modes differ in how they read their inputs and build the pairs.
 * <p>
 * A failure of one chromosome is recorded in the run summary and never stops the other chromosomes.
 */
public abstract class AbstractMode {
    protected final Configuration conf;
    protected final Aligner aligner;
    protected final RunSummary summary = new RunSummary();
    protected List<ChromosomePair> pairs = new ArrayList<>();

    public AbstractMode(Configuration conf, Aligner aligner) {
        this.conf = conf;
        this.aligner = aligner;
    }

    /**
     * Reads the inputs of the command and pairs reference chromosomes with targets. Unmatched chromosomes
     * allowed by the configuration are recorded in the summary.
     * @return pairs to transfer, in output order
     */
    protected abstract List<ChromosomePair> loadPairs();

    /**
     * Runs the transfer of every pair.
     * @return summary of the run
     */
    public RunSummary start() {
        pairs = loadPairs();
        printTime(conf.y, "Transferring " + pairs.size() + " chromosome(s)");
        if (conf.isParallel() && pairs.size() > 1) {
            parallel();
        } else {
            notParallel();
        }
        return summary;
    }

    /**
     * Starts the typical pipeline of TblTransfer on a chromosome pair: aligns the sequences (or takes the
     * pre-made alignment), builds the coordinate mapper and transfers the features.
     * @param initialScope pair and its report
     * @param executor current Executor for parallel/single mode
     * @return object contains the transferred table
     */
    public CompletableFuture<Scope<TransferredData>> pipeline(Scope<ChromosomePair> initialScope, Executor executor) {
        return CompletableFuture.supplyAsync(
                () -> new SequenceAligner(aligner, conf).process(initialScope), executor)
                .thenApply(new CoordMapperBuilder()::process)
                .thenApply(new FeatureRemapper(conf)::process);
    }

    /**
     * In not parallel mode each chromosome will be processed in sequence.
     */
    public void notParallel() {
        for (ChromosomePair pair : pairs) {
            record(processChromosome(pair));
        }
    }

    /**
     * In parallel mode workers are created for each chromosome. Results are recorded in the order of the pairs.
     */
    public void parallel() {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(conf.threads, pairs.size()));
        List<Future<ChromosomeOutcome>> futures = new ArrayList<>();
        try {
            for (ChromosomePair pair : pairs) {
                futures.add(executor.submit(() -> processChromosome(pair)));
            }
            boolean interrupted = false;
            for (int i = 0; i < futures.size(); i++) {
                Future<ChromosomeOutcome> future = futures.get(i);
                // after an interruption only finished chromosomes are kept
                if (interrupted && future.cancel(true)) {
                    record(ChromosomeOutcome.failed(new TransferReport(pairs.get(i).label()), "cancelled"));
                    continue;
                }
                try {
                    record(future.get());
                } catch (InterruptedException e) {
                    interrupted = true;
                    i--;
                } catch (ExecutionException e) {
                    printExceptionAndContinue(e.getCause(), pairs.get(i).label());
                    record(ChromosomeOutcome.failed(new TransferReport(pairs.get(i).label()), describe(e.getCause())));
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        } finally {
            executor.shutdownNow();
        }
    }

    ChromosomeOutcome processChromosome(ChromosomePair pair) {
        TransferReport report = new TransferReport(pair.label());
        Scope<ChromosomePair> initialScope = new Scope<>(pair.label(), report, pair);
        try {
            pipeline(initialScope, new DirectThreadExecutor())
                    .thenAccept(new TransferredTablePrinter(conf))
                    .join();
            printTime(conf.y, "Transferred " + pair);
            return ChromosomeOutcome.completed(report, pair.output.getPath());
        } catch (CompletionException | CancellationException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof TblTransferException) {
                System.err.println("Chromosome " + pair + " was not transferred: " + cause.getMessage());
            } else {
                printExceptionAndContinue(cause, pair.label());
            }
            return ChromosomeOutcome.failed(report, describe(cause));
        }
    }

    private void record(ChromosomeOutcome outcome) {
        if (outcome.failure == null) {
            summary.addCompleted(outcome.report, outcome.output);
        } else {
            summary.addFailed(outcome.report, outcome.failure);
        }
    }

    static String describe(Throwable cause) {
        if (cause instanceof TblTransferException) {
            return ((TblTransferException) cause).getKind() + ": " + cause.getMessage();
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    /**
     * Result of one chromosome: the output written or the reason of the failure.
     */
    static final class ChromosomeOutcome {
        final TransferReport report;
        final String output;
        final String failure;

        private ChromosomeOutcome(TransferReport report, String output, String failure) {
            this.report = report;
            this.output = output;
            this.failure = failure;
        }

        static ChromosomeOutcome completed(TransferReport report, String output) {
            return new ChromosomeOutcome(report, output, null);
        }

        static ChromosomeOutcome failed(TransferReport report, String failure) {
            return new ChromosomeOutcome(report, null, failure);
        }
    }
}
