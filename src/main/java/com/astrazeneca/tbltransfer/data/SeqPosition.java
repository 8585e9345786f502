package com.astrazeneca.tbltransfer.data;

import java.util.Objects;

/**
 * One boundary of an interval: 1-based position on the sequence and its fuzziness.
 */
public final class SeqPosition {
    public final int position;
    public final Fuzziness fuzziness;

    public SeqPosition(int position, Fuzziness fuzziness) {
        this.position = position;
        this.fuzziness = fuzziness;
    }

    public static SeqPosition exact(int position) {
        return new SeqPosition(position, Fuzziness.EXACT);
    }

    public SeqPosition withFuzziness(Fuzziness newFuzziness) {
        return new SeqPosition(position, newFuzziness);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SeqPosition that = (SeqPosition) o;
        return position == that.position && fuzziness == that.fuzziness;
    }

    @Override
    public int hashCode() {
        return Objects.hash(position, fuzziness);
    }

    /**
     * @return feature table text of the boundary, e.g. "&lt;1", "250"
     */
    @Override
    public String toString() {
        return fuzziness.marker + position;
    }
}
