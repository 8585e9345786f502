package com.astrazeneca.tbltransfer.mapper;

import com.astrazeneca.tbltransfer.data.Side;

import java.util.Objects;

/**
 * Result of mapping one base position onto the paired sequence.
 * <p>
 * An exact mapping covers a range {@code lower..upper}: one base, plus the target bases inserted right after it.
 * When the source base is aligned to a gap the position of the closest upstream target base is returned and
 * the mapping is flagged {@link Status#GAP_ADJACENT}. Positions aligned before the first or after the last
 * base of the target carry no coordinate.
 */
public final class MappedPosition {

    public enum Status {
        EXACT,
        GAP_ADJACENT,
        BEFORE_START,
        AFTER_END
    }

    private static final MappedPosition BEFORE_START = new MappedPosition(Status.BEFORE_START, 0, 0);
    private static final MappedPosition AFTER_END = new MappedPosition(Status.AFTER_END, 0, 0);

    public final Status status;
    public final int lower;
    public final int upper;

    private MappedPosition(Status status, int lower, int upper) {
        this.status = status;
        this.lower = lower;
        this.upper = upper;
    }

    public static MappedPosition exact(int lower, int upper) {
        return new MappedPosition(Status.EXACT, lower, upper);
    }

    public static MappedPosition exact(int position) {
        return exact(position, position);
    }

    public static MappedPosition gapAdjacent(int upstream) {
        return new MappedPosition(Status.GAP_ADJACENT, upstream, upstream);
    }

    public static MappedPosition beforeStart() {
        return BEFORE_START;
    }

    public static MappedPosition afterEnd() {
        return AFTER_END;
    }

    public boolean isInBounds() {
        return status == Status.EXACT || status == Status.GAP_ADJACENT;
    }

    public boolean isApproximate() {
        return status == Status.GAP_ADJACENT;
    }

    /**
     * @param side which end of the mapped range is wanted
     * @return target position, 0 if the mapping is out of bounds
     */
    public int position(Side side) {
        return side == Side.LOWER ? lower : upper;
    }

    /**
     * Same range flagged as approximate. Out of bounds results are returned unchanged.
     */
    MappedPosition approximate() {
        return status == Status.EXACT ? new MappedPosition(Status.GAP_ADJACENT, lower, upper) : this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MappedPosition that = (MappedPosition) o;
        return lower == that.lower && upper == that.upper && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, lower, upper);
    }

    @Override
    public String toString() {
        switch (status) {
            case EXACT: return lower == upper ? String.valueOf(lower) : lower + "-" + upper;
            case GAP_ADJACENT: return "~" + lower;
            default: return status.name();
        }
    }
}
