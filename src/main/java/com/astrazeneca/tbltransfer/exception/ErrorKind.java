package com.astrazeneca.tbltransfer.exception;

/**
 * Kinds of failures reported at the boundary of a transfer run.
 */
public enum ErrorKind {
    PARSE_ERROR,
    OUT_OF_RANGE,
    NO_ALIGNMENT,
    UNMATCHED_CHROMOSOME,
    ALIGNMENT_FAILED,
    IO_ERROR
}
