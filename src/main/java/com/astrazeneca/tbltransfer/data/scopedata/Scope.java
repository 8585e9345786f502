package com.astrazeneca.tbltransfer.data.scopedata;

import com.astrazeneca.tbltransfer.printers.TransferReport;

/**
 * Common scope of data must be storing between steps of the transfer pipeline of one chromosome.
 * @param <T> data of current step of pipeline
 */
public class Scope<T> {

    /**
     * Reference chromosome processed by the pipeline
     */
    public final String chromosome;
    /**
     * Notes of this chromosome, only written by the thread running its pipeline
     */
    public final TransferReport report;

    public final T data;

    public Scope(String chromosome, TransferReport report, T data) {
        this.chromosome = chromosome;
        this.report = report;
        this.data = data;
    }

    public Scope(Scope<?> inheritableScope, T data) {
        this(inheritableScope.chromosome, inheritableScope.report, data);
    }
}
