package com.astrazeneca.tbltransfer.printers;

/**
 * Destinations of the run summary, chosen with -DP OUT|ERR.
 */
public enum PrinterType {
    OUT,
    ERR
}
