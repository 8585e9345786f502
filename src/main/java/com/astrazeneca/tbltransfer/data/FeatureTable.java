package com.astrazeneca.tbltransfer.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered features of one named sequence, as read from a "&gt;Feature" block.
 */
public final class FeatureTable {
    /**
     * Sequence identifier from the header line
     */
    public final String seqId;

    /**
     * Optional table name following the sequence identifier on the header line
     */
    public final String tableName;

    public final List<Feature> features;

    public FeatureTable(String seqId, String tableName, List<Feature> features) {
        this.seqId = seqId;
        this.tableName = tableName;
        this.features = Collections.unmodifiableList(new ArrayList<>(features));
    }

    public FeatureTable(String seqId, List<Feature> features) {
        this(seqId, null, features);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FeatureTable that = (FeatureTable) o;
        return Objects.equals(seqId, that.seqId) &&
                Objects.equals(tableName, that.tableName) &&
                Objects.equals(features, that.features);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seqId, tableName, features);
    }

    @Override
    public String toString() {
        return "FeatureTable [seqId=" + seqId + ", features=" + features.size() + "]";
    }
}
