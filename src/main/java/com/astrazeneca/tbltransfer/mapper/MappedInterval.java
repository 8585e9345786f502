package com.astrazeneca.tbltransfer.mapper;

import com.astrazeneca.tbltransfer.data.Side;

/**
 * Result of mapping an interval: both boundaries mapped on the forward axis of the target sequence.
 * Reverse intervals keep their orientation through {@link #start()} and {@link #end()}.
 */
public final class MappedInterval {
    public final MappedPosition lowerBoundary;
    public final MappedPosition upperBoundary;
    public final boolean reverse;
    public final int targetLength;

    public MappedInterval(MappedPosition lowerBoundary, MappedPosition upperBoundary, boolean reverse, int targetLength) {
        this.lowerBoundary = lowerBoundary;
        this.upperBoundary = upperBoundary;
        this.reverse = reverse;
        this.targetLength = targetLength;
    }

    /**
     * Mapping of the 5' boundary of the source interval.
     */
    public MappedPosition start() {
        return reverse ? upperBoundary : lowerBoundary;
    }

    /**
     * Mapping of the 3' boundary of the source interval.
     */
    public MappedPosition end() {
        return reverse ? lowerBoundary : upperBoundary;
    }

    public int lower() {
        return lowerBoundary.position(Side.LOWER);
    }

    public int upper() {
        return upperBoundary.position(Side.UPPER);
    }

    /**
     * Both boundaries are inside the target sequence.
     */
    public boolean isInBounds() {
        return lowerBoundary.isInBounds() && upperBoundary.isInBounds();
    }

    /**
     * The whole interval is aligned before the first or after the last base of the target.
     */
    public boolean isOutside() {
        return lowerBoundary.status == MappedPosition.Status.AFTER_END
                || upperBoundary.status == MappedPosition.Status.BEFORE_START;
    }

    /**
     * Number of target bases aligned inside the interval. Zero means that the interval falls entirely into
     * a deletion of the target (or entirely outside of it).
     */
    public int targetBases() {
        if (isOutside()) {
            return 0;
        }
        int exclusiveLower;
        switch (lowerBoundary.status) {
            case BEFORE_START: exclusiveLower = 0; break;
            // an approximate lower boundary points at the base before the deletion
            case GAP_ADJACENT: exclusiveLower = lowerBoundary.lower; break;
            default: exclusiveLower = lowerBoundary.lower - 1;
        }
        int inclusiveUpper = upperBoundary.status == MappedPosition.Status.AFTER_END
                ? targetLength
                : upperBoundary.upper;
        return Math.max(0, inclusiveUpper - exclusiveLower);
    }

    @Override
    public String toString() {
        return reverse ? upperBoundary + ".." + lowerBoundary : lowerBoundary + ".." + upperBoundary;
    }
}
