package com.astrazeneca.tbltransfer.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Annotation of a sequence (gene, CDS, mRNA...). Intervals are kept in join (transcription) order,
 * qualifiers in the order they were read, repeated names included.
 */
public final class Feature {
    public final String type;
    public final List<Interval> intervals;
    public final List<Qualifier> qualifiers;

    public Feature(String type, List<Interval> intervals, List<Qualifier> qualifiers) {
        if (intervals.isEmpty()) {
            throw new IllegalArgumentException("Feature " + type + " must have at least one interval");
        }
        this.type = type;
        this.intervals = Collections.unmodifiableList(new ArrayList<>(intervals));
        this.qualifiers = Collections.unmodifiableList(new ArrayList<>(qualifiers));
    }

    public boolean isCds() {
        return "CDS".equals(type);
    }

    /**
     * @param name qualifier name
     * @return values of all qualifiers with this name, in table order
     */
    public List<String> getQualifierValues(String name) {
        List<String> values = new ArrayList<>();
        for (Qualifier qualifier : qualifiers) {
            if (qualifier.name.equals(name)) {
                values.add(qualifier.value);
            }
        }
        return values;
    }

    /**
     * Label used in reports: gene, locus_tag or product when present, the type otherwise.
     */
    public String label() {
        for (String name : new String[]{"gene", "locus_tag", "product"}) {
            List<String> values = getQualifierValues(name);
            if (!values.isEmpty() && values.get(0) != null) {
                return type + ":" + values.get(0);
            }
        }
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Feature feature = (Feature) o;
        return Objects.equals(type, feature.type) &&
                Objects.equals(intervals, feature.intervals) &&
                Objects.equals(qualifiers, feature.qualifiers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, intervals, qualifiers);
    }

    @Override
    public String toString() {
        return "Feature [type=" + type + ", intervals=" + intervals + ", qualifiers=" + qualifiers + "]";
    }
}
