package com.astrazeneca.tbltransfer.data;

import java.util.Objects;

/**
 * Contiguous span of a feature. The start boundary is the 5' end of the span: for reverse strand intervals
 * start is greater than end, as written in the feature table.
 */
public final class Interval {
    public final SeqPosition start;
    public final SeqPosition end;

    public Interval(SeqPosition start, SeqPosition end) {
        this.start = start;
        this.end = end;
    }

    public static Interval of(int start, int end) {
        return new Interval(SeqPosition.exact(start), SeqPosition.exact(end));
    }

    public Strand strand() {
        return start.position > end.position ? Strand.REVERSE : Strand.FORWARD;
    }

    public boolean isReverse() {
        return strand() == Strand.REVERSE;
    }

    public int lower() {
        return Math.min(start.position, end.position);
    }

    public int upper() {
        return Math.max(start.position, end.position);
    }

    public int length() {
        return upper() - lower() + 1;
    }

    public Interval withoutFuzziness() {
        return new Interval(start.withFuzziness(Fuzziness.EXACT), end.withFuzziness(Fuzziness.EXACT));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Interval interval = (Interval) o;
        return Objects.equals(start, interval.start) &&
                Objects.equals(end, interval.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
