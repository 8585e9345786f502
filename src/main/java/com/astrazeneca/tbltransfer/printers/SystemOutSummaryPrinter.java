package com.astrazeneca.tbltransfer.printers;

/**
 * Standard output for summary printer (will print to STDOUT).
 */
public class SystemOutSummaryPrinter extends SummaryPrinter {
    public SystemOutSummaryPrinter() {
        out = System.out;
    }
}
