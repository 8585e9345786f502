package com.astrazeneca.tbltransfer.data;

/**
 * Side of an interval on the forward coordinate axis. Decides which end of a mapped range is taken when
 * a single base maps onto several target bases.
 */
public enum Side {
    LOWER, UPPER
}
