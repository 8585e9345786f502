package com.astrazeneca.tbltransfer.modules;

import com.astrazeneca.tbltransfer.Configuration;
import com.astrazeneca.tbltransfer.data.*;
import com.astrazeneca.tbltransfer.data.scopedata.MappingData;
import com.astrazeneca.tbltransfer.data.scopedata.Scope;
import com.astrazeneca.tbltransfer.data.scopedata.TransferredData;
import com.astrazeneca.tbltransfer.exception.NoAlignmentException;
import com.astrazeneca.tbltransfer.mapper.CoordMapper;
import com.astrazeneca.tbltransfer.mapper.MappedInterval;
import com.astrazeneca.tbltransfer.mapper.MappedPosition;
import com.astrazeneca.tbltransfer.printers.DiagnosticKind;
import com.astrazeneca.tbltransfer.printers.TransferReport;

import java.util.ArrayList;
import java.util.List;

import static com.astrazeneca.tbltransfer.Configuration.INCOMPLETE_CDS_NOTE;

/**
 * Class for transferring the features of a reference table onto the target sequence.
 * Features keep their order, type and qualifiers; every interval is mapped through the coordinate mapper
 * and everything that had to be changed on the way is noted in the chromosome report.
 */
public class FeatureRemapper implements Module<MappingData, TransferredData> {
    private static final int CODON = 3;

    private final Configuration conf;

    public FeatureRemapper(Configuration conf) {
        this.conf = conf;
    }

    @Override
    public Scope<TransferredData> process(Scope<MappingData> scope) {
        ChromosomePair pair = scope.data.pair;
        FeatureTable transferred = transfer(pair.refTable, scope.data.mapper, pair.refKey(), pair.altKey(),
                pair.altName, scope.report);
        return new Scope<>(scope, new TransferredData(pair, transferred));
    }

    /**
     * @param reference table of the reference sequence
     * @param mapper mapper connecting {@code from} and {@code to}
     * @param from name of the reference sequence in the mapper
     * @param to name of the target sequence in the mapper
     * @param outputId sequence identifier of the new table
     * @param report collects the notes of this table
     * @return new table, features that lost all their intervals are left out
     */
    public FeatureTable transfer(FeatureTable reference, CoordMapper mapper, String from, String to,
                                 String outputId, TransferReport report) {
        if (!mapper.isConnected(from, to)) {
            throw new NoAlignmentException(from, to);
        }
        List<Feature> features = new ArrayList<>();
        QualifierRemapper qualifierRemapper = new QualifierRemapper(mapper, from, to);
        for (int i = 0; i < reference.features.size(); i++) {
            FeatureContext context = new FeatureContext(reference.features.get(i), i + 1, report);
            Feature feature = transferFeature(context, mapper, from, to, qualifierRemapper);
            if (feature != null) {
                features.add(feature);
            }
        }
        return new FeatureTable(outputId, reference.tableName, features);
    }

    private Feature transferFeature(FeatureContext context, CoordMapper mapper, String from, String to,
                                    QualifierRemapper qualifierRemapper) {
        Feature feature = context.feature;
        List<Interval> intervals = new ArrayList<>();
        for (Interval interval : feature.intervals) {
            Interval source = conf.ignoreAmbiguousEdges ? interval.withoutFuzziness() : interval;
            Interval mapped = transferInterval(context, source, mapper.mapInterval(from, to,
                    source.start.position, source.end.position));
            if (mapped != null) {
                intervals.add(mapped);
            }
        }
        if (intervals.isEmpty()) {
            context.note(DiagnosticKind.FEATURE_DROPPED, "none of " + feature.intervals.size()
                    + " interval(s) could be placed on the target sequence");
            return null;
        }

        List<Qualifier> qualifiers = new ArrayList<>();
        for (Qualifier qualifier : feature.qualifiers) {
            if (!QualifierRemapper.hasCoordinates(qualifier)) {
                qualifiers.add(qualifier);
                continue;
            }
            Qualifier remapped = qualifierRemapper.remap(qualifier);
            if (remapped == null) {
                context.note(DiagnosticKind.QUALIFIER_DROPPED, qualifier.name + " " + qualifier.value
                        + " refers to bases missing from the target sequence");
            } else {
                qualifiers.add(remapped);
            }
        }
        if (context.truncated && feature.isCds() && !feature.getQualifierValues("note").contains(INCOMPLETE_CDS_NOTE)) {
            qualifiers.add(new Qualifier("note", INCOMPLETE_CDS_NOTE));
        }
        return new Feature(feature.type, intervals, qualifiers);
    }

    /**
     * @return mapped interval or null if it was dropped
     */
    Interval transferInterval(FeatureContext context, Interval source, MappedInterval mapped) {
        if (mapped.isOutside()) {
            context.note(DiagnosticKind.INTERVAL_DROPPED, "interval " + source + " lies outside of the target sequence");
            return null;
        }
        if (mapped.isInBounds() && mapped.targetBases() == 0) {
            return collapseDeleted(context, source, mapped);
        }

        boolean reverse = source.isReverse();
        boolean clipLower = mapped.lowerBoundary.status == MappedPosition.Status.BEFORE_START;
        boolean clipUpper = mapped.upperBoundary.status == MappedPosition.Status.AFTER_END;
        int lower = clipLower ? 1 : mapped.lower();
        int upper = clipUpper ? mapped.targetLength : mapped.upper();
        boolean clipStart = reverse ? clipUpper : clipLower;
        boolean clipEnd = reverse ? clipLower : clipUpper;

        if (clipLower || clipUpper) {
            if (conf.outOfBoundsPolicy == Configuration.OutOfBoundsPolicy.DROP) {
                context.note(DiagnosticKind.INTERVAL_DROPPED, "interval " + source
                        + " extends beyond the target sequence of length " + mapped.targetLength);
                return null;
            }
            context.truncated = true;
            if (clipStart && context.feature.isCds()) {
                // the clipped 5' end is moved to the first complete codon
                if (reverse) {
                    upper = mapped.targetLength - ((mapped.targetLength - lower + 1) % CODON);
                } else {
                    lower = (upper % CODON) + 1;
                }
                if (upper - lower + 1 < CODON) {
                    context.note(DiagnosticKind.INTERVAL_DROPPED, "less than a codon of CDS interval " + source
                            + " lies within the target sequence");
                    return null;
                }
            }
        }

        Fuzziness startFuzziness = clipStart ? Fuzziness.LESS_THAN : source.start.fuzziness;
        Fuzziness endFuzziness = clipEnd ? Fuzziness.GREATER_THAN : source.end.fuzziness;
        Interval result = reverse
                ? new Interval(new SeqPosition(upper, startFuzziness), new SeqPosition(lower, endFuzziness))
                : new Interval(new SeqPosition(lower, startFuzziness), new SeqPosition(upper, endFuzziness));

        if (clipLower || clipUpper) {
            context.note(DiagnosticKind.BOUNDARY_TRUNCATED, "interval " + source + " truncated to " + result
                    + " at the edge of the target sequence");
        } else if (result.length() != source.length()) {
            context.note(DiagnosticKind.LENGTH_CHANGED, "interval " + source + " became " + result
                    + ", length changed from " + source.length() + " to " + result.length()
                    + (result.length() < source.length() ? " due to a deletion" : " due to an insertion"));
        }
        if (mapped.start().isApproximate()) {
            context.note(DiagnosticKind.GAP_ADJACENT_BOUNDARY, "start " + source.start.position + " of interval "
                    + source + " is deleted in the target, mapped to the closest upstream base");
        }
        if (mapped.end().isApproximate()) {
            context.note(DiagnosticKind.GAP_ADJACENT_BOUNDARY, "end " + source.end.position + " of interval "
                    + source + " is deleted in the target, mapped to the closest upstream base");
        }
        return result;
    }

    private Interval collapseDeleted(FeatureContext context, Interval source, MappedInterval mapped) {
        if (conf.deletedIntervalPolicy == Configuration.DeletedIntervalPolicy.DROP) {
            context.note(DiagnosticKind.INTERVAL_DROPPED, "interval " + source + " is deleted in the target sequence");
            return null;
        }
        int upstream = mapped.lowerBoundary.lower;
        Interval collapsed = new Interval(new SeqPosition(upstream, Fuzziness.LESS_THAN),
                new SeqPosition(upstream, Fuzziness.GREATER_THAN));
        context.note(DiagnosticKind.LENGTH_CHANGED, "interval " + source + " is deleted in the target sequence, "
                + "collapsed to " + collapsed + " at the closest upstream base");
        return collapsed;
    }

    /**
     * Feature being transferred with its position in the table.
     */
    static final class FeatureContext {
        final Feature feature;
        final int index;
        final TransferReport report;
        boolean truncated;

        FeatureContext(Feature feature, int index, TransferReport report) {
            this.feature = feature;
            this.index = index;
            this.report = report;
        }

        void note(DiagnosticKind kind, String message) {
            report.add(index, feature.label(), kind, message);
        }
    }
}
