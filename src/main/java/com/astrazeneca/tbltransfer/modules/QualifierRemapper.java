package com.astrazeneca.tbltransfer.modules;

import com.astrazeneca.tbltransfer.data.Qualifier;
import com.astrazeneca.tbltransfer.mapper.CoordMapper;
import com.astrazeneca.tbltransfer.mapper.MappedInterval;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Matcher;

import static com.astrazeneca.tbltransfer.Utils.toInt;
import static com.astrazeneca.tbltransfer.data.Patterns.POS_PREFIX;
import static com.astrazeneca.tbltransfer.data.Patterns.POS_RANGE;

/**
 * Remaps coordinates written inside qualifier values, e.g. {@code (pos:213..215,aa:Sec)} of transl_except or
 * {@code (pos:complement(4156..4158),aa:Met,seq:cat)} of anticodon.
 */
public class QualifierRemapper {
    public static final Set<String> COORDINATE_QUALIFIERS =
            Collections.unmodifiableSet(new HashSet<>(Arrays.asList("transl_except", "anticodon")));

    private final CoordMapper mapper;
    private final String from;
    private final String to;

    public QualifierRemapper(CoordMapper mapper, String from, String to) {
        this.mapper = mapper;
        this.to = to;
        this.from = from;
    }

    public static boolean hasCoordinates(Qualifier qualifier) {
        return qualifier.value != null && COORDINATE_QUALIFIERS.contains(qualifier.name);
    }

    /**
     * @param qualifier qualifier with coordinates in its value
     * @return qualifier with target coordinates, null if one of the positions has no counterpart in the target
     * or a location can't be read
     */
    public Qualifier remap(Qualifier qualifier) {
        Matcher matcher = POS_RANGE.matcher(qualifier.value);
        StringBuffer remapped = new StringBuffer();
        int locations = 0;
        while (matcher.find()) {
            locations++;
            int start = toInt(matcher.group(3));
            boolean range = matcher.group(5) != null;
            int end = range ? toInt(matcher.group(5)) : start;

            MappedInterval mapped = mapper.mapInterval(from, to, start, end);
            if (!mapped.isInBounds() || mapped.targetBases() == 0) {
                return null;
            }
            StringBuilder replacement = new StringBuilder(POS_PREFIX);
            if (matcher.group(1) != null) {
                replacement.append(matcher.group(1));
            }
            replacement.append(matcher.group(2));
            if (range) {
                replacement.append(mapped.lower()).append("..").append(matcher.group(4)).append(mapped.upper());
            } else {
                replacement.append(mapped.lower());
            }
            matcher.appendReplacement(remapped, Matcher.quoteReplacement(replacement.toString()));
        }
        // join(...) and other locations the pattern doesn't read would keep reference coordinates
        if (locations != countLocations(qualifier.value)) {
            return null;
        }
        matcher.appendTail(remapped);
        return qualifier.withValue(remapped.toString());
    }

    private static int countLocations(String value) {
        int count = 0;
        for (int i = value.indexOf(POS_PREFIX); i >= 0; i = value.indexOf(POS_PREFIX, i + POS_PREFIX.length())) {
            count++;
        }
        return count;
    }
}
