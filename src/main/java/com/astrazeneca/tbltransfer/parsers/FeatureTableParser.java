package com.astrazeneca.tbltransfer.parsers;

import com.astrazeneca.tbltransfer.data.*;
import com.astrazeneca.tbltransfer.exception.FeatureTableParseException;
import com.astrazeneca.tbltransfer.exception.InputFileException;
import htsjdk.samtools.util.IOUtil;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;

import static com.astrazeneca.tbltransfer.data.Patterns.FEATURE_HEADER;
import static com.astrazeneca.tbltransfer.data.Patterns.POSITION;
import static com.astrazeneca.tbltransfer.data.Patterns.WHITESPACES;

/**
 * Reads NCBI 5-column feature tables (the format accepted by tbl2asn).
 * <pre>
 * &gt;Feature KJ660346.2
 * &lt;1	&gt;1500	gene
 * 			gene	NP
 * 56	1537	CDS
 * 			product	nucleoprotein
 * </pre>
 * Any malformed line stops the parsing with {@link FeatureTableParseException}, there is no partial recovery.
 */
public class FeatureTableParser {
    private static final String QUALIFIER_PREFIX = "\t\t\t";

    /**
     * Parses a file containing exactly one table.
     * @param file feature table file, may be gzipped
     * @return parsed table
     */
    public FeatureTable parseFile(File file) {
        List<FeatureTable> tables = parseAllFromFile(file);
        if (tables.size() != 1) {
            throw new FeatureTableParseException(file.getPath(), 0, "",
                    "expected one feature table, found " + tables.size());
        }
        return tables.get(0);
    }

    /**
     * Parses every "&gt;Feature" block of a file.
     * @param file feature table file, may be gzipped
     * @return tables in file order
     */
    public List<FeatureTable> parseAllFromFile(File file) {
        if (!file.canRead()) {
            throw new InputFileException(file.getPath(), "File is missing or unreadable.");
        }
        try (BufferedReader reader = IOUtil.openFileForBufferedReading(file)) {
            return parseAll(reader, file.getPath());
        } catch (IOException e) {
            throw new InputFileException(file.getPath(), e);
        }
    }

    public FeatureTable parse(String text) {
        List<FeatureTable> tables = parseAll(new BufferedReader(new StringReader(text)), "<text>");
        if (tables.size() != 1) {
            throw new FeatureTableParseException("<text>", 0, "", "expected one feature table, found " + tables.size());
        }
        return tables.get(0);
    }

    public List<FeatureTable> parseAll(BufferedReader reader, String source) {
        TableBuilder builder = new TableBuilder(source);
        String line;
        int lineNumber = 0;
        try {
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.endsWith("\r")) {
                    line = line.substring(0, line.length() - 1);
                }
                builder.accept(line, lineNumber);
            }
        } catch (IOException e) {
            throw new InputFileException(source, e);
        }
        return builder.finish();
    }

    /**
     * Parses one boundary of an interval such as "123", "&lt;1" or "&gt;1500".
     * @return position or null if the text isn't a boundary
     */
    static SeqPosition parsePosition(String text) {
        Matcher matcher = POSITION.matcher(text.trim());
        if (!matcher.find()) {
            return null;
        }
        int position;
        try {
            position = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            return null;
        }
        if (position < 1) {
            return null;
        }
        Fuzziness fuzziness = matcher.group(1).isEmpty() ? Fuzziness.EXACT : Fuzziness.fromMarker(matcher.group(1).charAt(0));
        return new SeqPosition(position, fuzziness);
    }

    /**
     * Accumulates lines into tables. Intervals must precede the qualifiers of their feature.
     */
    private static class TableBuilder {
        private final String source;
        private final List<FeatureTable> tables = new ArrayList<>();

        private String seqId;
        private String tableName;
        private List<Feature> features;

        private String featureType;
        private List<Interval> intervals;
        private List<Qualifier> qualifiers;

        TableBuilder(String source) {
            this.source = source;
        }

        void accept(String line, int lineNumber) {
            if (line.trim().isEmpty()) {
                return;
            }
            // interval lines may start with a ">" boundary
            if (line.startsWith(FEATURE_HEADER)) {
                startTable(line, lineNumber);
                return;
            }
            if (features == null) {
                throw error(lineNumber, line, "line precedes the >Feature header");
            }
            String[] columns = line.split("\t", -1);
            if (line.startsWith(QUALIFIER_PREFIX)) {
                addQualifier(columns, line, lineNumber);
            } else {
                addInterval(columns, line, lineNumber);
            }
        }

        private void startTable(String line, int lineNumber) {
            String rest = line.substring(FEATURE_HEADER.length());
            if (!rest.isEmpty() && !Character.isWhitespace(rest.charAt(0))) {
                throw error(lineNumber, line, "header must start with " + FEATURE_HEADER);
            }
            String[] parts = WHITESPACES.split(rest.trim(), 2);
            if (parts[0].isEmpty()) {
                throw error(lineNumber, line, "missing sequence identifier");
            }
            closeTable();
            seqId = parts[0];
            tableName = parts.length > 1 ? parts[1] : null;
            features = new ArrayList<>();
        }

        private void addQualifier(String[] columns, String line, int lineNumber) {
            if (featureType == null) {
                throw error(lineNumber, line, "qualifier without feature");
            }
            if (columns.length < 4 || columns[3].trim().isEmpty()) {
                throw error(lineNumber, line, "missing qualifier name");
            }
            String value = columns.length > 4
                    ? String.join("\t", Arrays.copyOfRange(columns, 4, columns.length))
                    : null;
            qualifiers.add(new Qualifier(columns[3], value));
        }

        private void addInterval(String[] columns, String line, int lineNumber) {
            if (columns.length < 2) {
                throw error(lineNumber, line, "missing columns, start and stop are required");
            }
            SeqPosition start = parsePosition(columns[0]);
            SeqPosition end = parsePosition(columns[1]);
            if (start == null || end == null) {
                throw error(lineNumber, line, "non-numeric coordinate");
            }
            String type = columns.length > 2 ? columns[2].trim() : "";
            for (int i = 3; i < columns.length; i++) {
                if (!columns[i].trim().isEmpty()) {
                    throw error(lineNumber, line, "unexpected column " + (i + 1) + " on a location line");
                }
            }
            Interval interval = new Interval(start, end);
            if (!type.isEmpty()) {
                closeFeature();
                featureType = type;
                intervals = new ArrayList<>();
                qualifiers = new ArrayList<>();
                intervals.add(interval);
                return;
            }
            if (featureType == null) {
                throw error(lineNumber, line, "missing feature key");
            }
            if (!qualifiers.isEmpty()) {
                throw error(lineNumber, line, "location line after qualifiers of feature " + featureType);
            }
            intervals.add(interval);
        }

        private void closeFeature() {
            if (featureType != null) {
                features.add(new Feature(featureType, intervals, qualifiers));
            }
            featureType = null;
            intervals = null;
            qualifiers = null;
        }

        private void closeTable() {
            closeFeature();
            if (features != null) {
                tables.add(new FeatureTable(seqId, tableName, features));
            }
            features = null;
        }

        List<FeatureTable> finish() {
            closeTable();
            return tables;
        }

        private FeatureTableParseException error(int lineNumber, String line, String reason) {
            return new FeatureTableParseException(source, lineNumber, line, reason);
        }
    }
}
