package com.astrazeneca.tbltransfer.alignment;

import com.astrazeneca.tbltransfer.exception.AlignmentParseException;

import java.util.*;

/**
 * Gapped sequences of equal length, in file order. Used for pre-made alignments where one row is
 * the reference and all other rows are targets.
 */
public final class MultipleAlignment {
    private final String source;
    private final LinkedHashMap<String, String> rows;

    public MultipleAlignment(String source, LinkedHashMap<String, String> rows) {
        if (rows.size() < 2) {
            throw new AlignmentParseException(source, "at least two aligned sequences are required, found " + rows.size());
        }
        int width = -1;
        for (Map.Entry<String, String> row : rows.entrySet()) {
            if (width == -1) {
                width = row.getValue().length();
            } else if (row.getValue().length() != width) {
                throw new AlignmentParseException(source, "sequence " + row.getKey() + " has " + row.getValue().length()
                        + " columns, expected " + width);
            }
        }
        this.source = source;
        this.rows = new LinkedHashMap<>(rows);
    }

    public String getSource() {
        return source;
    }

    public List<String> names() {
        return new ArrayList<>(rows.keySet());
    }

    public String row(String name) {
        String row = rows.get(name);
        if (row == null) {
            throw new AlignmentParseException(source, "sequence " + name + " is not part of the alignment");
        }
        return row;
    }

    /**
     * @return pairwise alignment of two rows with shared gap columns removed
     */
    public PairwiseAlignment pair(String nameA, String nameB) {
        return PairwiseAlignment.project(nameA, row(nameA), nameB, row(nameB));
    }
}
