package com.astrazeneca.tbltransfer.printers;

/**
 * Error output for summary printer (will print to STDERR).
 */
public class SystemErrSummaryPrinter extends SummaryPrinter {
    public SystemErrSummaryPrinter() {
        out = System.err;
    }
}
