package com.astrazeneca.tbltransfer.collection;

import java.util.concurrent.Executor;

/**
 * Runs the pipeline steps in the calling thread (not parallel mode and workers of the parallel mode).
 */
public class DirectThreadExecutor implements Executor {
    @Override
    public void execute(Runnable command) {
        command.run();
    }
}
