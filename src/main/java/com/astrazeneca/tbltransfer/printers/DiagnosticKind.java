package com.astrazeneca.tbltransfer.printers;

/**
 * Kinds of notes collected while transferring features. None of them is an error by itself.
 */
public enum DiagnosticKind {
    FEATURE_DROPPED,
    INTERVAL_DROPPED,
    BOUNDARY_TRUNCATED,
    LENGTH_CHANGED,
    GAP_ADJACENT_BOUNDARY,
    QUALIFIER_DROPPED,
    UNMATCHED_CHROMOSOME,
    CHROMOSOME_FAILED
}
