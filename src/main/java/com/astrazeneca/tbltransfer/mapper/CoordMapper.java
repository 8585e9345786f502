package com.astrazeneca.tbltransfer.mapper;

import com.astrazeneca.tbltransfer.alignment.MultipleAlignment;
import com.astrazeneca.tbltransfer.alignment.PairwiseAlignment;
import com.astrazeneca.tbltransfer.exception.AlignmentParseException;
import com.astrazeneca.tbltransfer.exception.NoAlignmentException;
import com.astrazeneca.tbltransfer.exception.PositionOutOfRangeException;

import java.util.*;

/**
 * Maps coordinates between sequences connected by pairwise alignments. Sequences aligned to a common hub
 * (e.g. several targets aligned to one reference) are mapped through the hub.
 * <p>
 * Instances are created by {@link Builder} and are immutable, lookups may run concurrently.
 */
public final class CoordMapper {
    private final Map<String, Map<String, PairwiseCoordMapper>> pairs;
    private final Map<String, Integer> lengths;

    private CoordMapper(Map<String, Map<String, PairwiseCoordMapper>> pairs, Map<String, Integer> lengths) {
        this.pairs = pairs;
        this.lengths = lengths;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mapper of a single pairwise alignment.
     */
    public static CoordMapper of(PairwiseAlignment alignment) {
        return builder().add(alignment).build();
    }

    /**
     * @return ungapped length of the sequence
     */
    public int length(String name) {
        Integer length = lengths.get(name);
        if (length == null) {
            throw new NoAlignmentException(name, "any sequence");
        }
        return length;
    }

    /**
     * Translates a 1-based position of sequence {@code from} to sequence {@code to}.
     * @throws PositionOutOfRangeException if the position is outside of {@code from}
     * @throws NoAlignmentException if the two sequences aren't connected by an alignment
     */
    public MappedPosition mapPoint(String from, String to, int position) {
        if (from.equals(to)) {
            if (position < 1 || position > length(from)) {
                throw new PositionOutOfRangeException(from, position, length(from));
            }
            return MappedPosition.exact(position);
        }
        PairwiseCoordMapper direct = direct(from, to);
        if (direct != null) {
            return direct.mapPoint(from, position);
        }
        String hub = findHub(from, to);
        if (hub == null) {
            throw new NoAlignmentException(from, to);
        }
        MappedPosition onHub = direct(from, hub).mapPoint(from, position);
        if (!onHub.isInBounds()) {
            return onHub;
        }
        PairwiseCoordMapper second = direct(hub, to);
        MappedPosition lower = second.mapPoint(hub, onHub.lower);
        MappedPosition upper = onHub.upper == onHub.lower ? lower : second.mapPoint(hub, onHub.upper);
        if (!lower.isInBounds()) {
            return lower;
        }
        MappedPosition result = MappedPosition.exact(lower.lower, upper.isInBounds() ? upper.upper : lower.upper);
        return onHub.isApproximate() || lower.isApproximate() ? result.approximate() : result;
    }

    /**
     * Maps both boundaries of an interval. {@code start} may be greater than {@code end} for reverse strand
     * intervals, the orientation is kept in the result. The lower boundary takes the first base of the
     * mapped range, the upper boundary the last one.
     */
    public MappedInterval mapInterval(String from, String to, int start, int end) {
        int low = Math.min(start, end);
        int high = Math.max(start, end);
        MappedPosition lower = mapPoint(from, to, low);
        MappedPosition upper = low == high ? lower : mapPoint(from, to, high);
        return new MappedInterval(lower, upper, start > end, length(to));
    }

    public boolean isConnected(String from, String to) {
        if (!lengths.containsKey(from) || !lengths.containsKey(to)) {
            return false;
        }
        return from.equals(to) || direct(from, to) != null || findHub(from, to) != null;
    }

    private PairwiseCoordMapper direct(String from, String to) {
        Map<String, PairwiseCoordMapper> partners = pairs.get(from);
        if (partners == null) {
            throw new NoAlignmentException(from, to);
        }
        return partners.get(to);
    }

    private String findHub(String from, String to) {
        for (String hub : pairs.get(from).keySet()) {
            Map<String, PairwiseCoordMapper> hubPartners = pairs.get(hub);
            if (hubPartners != null && hubPartners.containsKey(to)) {
                return hub;
            }
        }
        return null;
    }

    /**
     * Collects alignments before the position tables are frozen.
     */
    public static final class Builder {
        private final Map<String, Map<String, PairwiseCoordMapper>> pairs = new LinkedHashMap<>();
        private final Map<String, Integer> lengths = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(PairwiseAlignment alignment) {
            PairwiseCoordMapper mapper = new PairwiseCoordMapper(alignment);
            registerLength(alignment.nameA, mapper.length(alignment.nameA));
            registerLength(alignment.nameB, mapper.length(alignment.nameB));
            pairs.computeIfAbsent(alignment.nameA, k -> new LinkedHashMap<>()).put(alignment.nameB, mapper);
            pairs.computeIfAbsent(alignment.nameB, k -> new LinkedHashMap<>()).put(alignment.nameA, mapper);
            return this;
        }

        /**
         * Adds every row of a multiple alignment paired with the hub row.
         */
        public Builder add(MultipleAlignment alignment, String hub) {
            for (String name : alignment.names()) {
                if (!name.equals(hub)) {
                    add(alignment.pair(hub, name));
                }
            }
            return this;
        }

        private void registerLength(String name, int length) {
            Integer known = lengths.putIfAbsent(name, length);
            if (known != null && known != length) {
                throw new AlignmentParseException(name, "sequence has length " + length
                        + " in one alignment and " + known + " in another");
            }
        }

        public CoordMapper build() {
            Map<String, Map<String, PairwiseCoordMapper>> frozen = new LinkedHashMap<>();
            for (Map.Entry<String, Map<String, PairwiseCoordMapper>> entry : pairs.entrySet()) {
                frozen.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(entry.getValue())));
            }
            return new CoordMapper(Collections.unmodifiableMap(frozen),
                    Collections.unmodifiableMap(new LinkedHashMap<>(lengths)));
        }
    }
}
