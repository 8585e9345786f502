package com.astrazeneca.tbltransfer.parsers;

import com.astrazeneca.tbltransfer.data.Feature;
import com.astrazeneca.tbltransfer.data.FeatureTable;
import com.astrazeneca.tbltransfer.data.Interval;
import com.astrazeneca.tbltransfer.data.Qualifier;
import com.astrazeneca.tbltransfer.exception.InputFileException;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Set;

import static com.astrazeneca.tbltransfer.data.Patterns.FEATURE_HEADER;

/**
 * Writes feature tables in the layout read by {@link FeatureTableParser}. Every line ends with "\n",
 * columns are separated by a single tab.
 */
public class FeatureTableWriter {
    private final Set<String> excludedQualifiers;

    public FeatureTableWriter() {
        this(Collections.emptySet());
    }

    /**
     * @param excludedQualifiers names of qualifiers which are not written (e.g. protein_id)
     */
    public FeatureTableWriter(Set<String> excludedQualifiers) {
        this.excludedQualifiers = excludedQualifiers;
    }

    public String toString(FeatureTable table) {
        StringWriter writer = new StringWriter();
        try {
            write(table, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    public void write(FeatureTable table, File file) {
        try (Writer writer = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8))) {
            write(table, writer);
        } catch (IOException e) {
            throw new InputFileException(file.getPath(), e);
        }
    }

    public void write(FeatureTable table, Writer writer) throws IOException {
        writer.write(FEATURE_HEADER + " " + table.seqId);
        if (table.tableName != null) {
            writer.write(" " + table.tableName);
        }
        writer.write("\n");
        for (Feature feature : table.features) {
            writeFeature(feature, writer);
        }
        writer.flush();
    }

    private void writeFeature(Feature feature, Writer writer) throws IOException {
        for (int i = 0; i < feature.intervals.size(); i++) {
            Interval interval = feature.intervals.get(i);
            writer.write(interval.start + "\t" + interval.end);
            if (i == 0) {
                writer.write("\t" + feature.type);
            }
            writer.write("\n");
        }
        for (Qualifier qualifier : feature.qualifiers) {
            if (excludedQualifiers.contains(qualifier.name)) {
                continue;
            }
            writer.write("\t\t\t" + qualifier.name);
            if (qualifier.value != null) {
                writer.write("\t" + qualifier.value);
            }
            writer.write("\n");
        }
    }
}
