package com.astrazeneca.tbltransfer.alignment;

import com.astrazeneca.tbltransfer.exception.AlignmentParseException;

import java.util.Locale;

/**
 * Two gapped sequences of equal length: column i of the first is aligned to column i of the second.
 * Bases are stored upper case, '-' and '.' are gaps. A column with gaps in both rows is rejected.
 */
public final class PairwiseAlignment {
    public static final char GAP = '-';

    public final String nameA;
    public final String nameB;
    public final String rowA;
    public final String rowB;

    public PairwiseAlignment(String nameA, String rowA, String nameB, String rowB) {
        if (nameA.equals(nameB)) {
            throw new AlignmentParseException(nameA, "both aligned sequences have the same name");
        }
        if (rowA.length() != rowB.length()) {
            throw new AlignmentParseException(nameA + "/" + nameB, String.format(Locale.US,
                    "aligned sequences differ in length (%d and %d)", rowA.length(), rowB.length()));
        }
        this.nameA = nameA;
        this.nameB = nameB;
        this.rowA = normalize(nameA, rowA);
        this.rowB = normalize(nameB, rowB);
        for (int column = 0; column < this.rowA.length(); column++) {
            if (this.rowA.charAt(column) == GAP && this.rowB.charAt(column) == GAP) {
                throw new AlignmentParseException(nameA + "/" + nameB,
                        "column " + (column + 1) + " is a gap in both sequences");
            }
        }
    }

    /**
     * Builds the pairwise alignment of two rows of a multiple alignment, removing columns that are gaps
     * in both of them.
     */
    public static PairwiseAlignment project(String nameA, String rowA, String nameB, String rowB) {
        if (rowA.length() != rowB.length()) {
            throw new AlignmentParseException(nameA + "/" + nameB, String.format(Locale.US,
                    "aligned sequences differ in length (%d and %d)", rowA.length(), rowB.length()));
        }
        StringBuilder a = new StringBuilder(rowA.length());
        StringBuilder b = new StringBuilder(rowB.length());
        for (int column = 0; column < rowA.length(); column++) {
            boolean gapA = isGap(rowA.charAt(column));
            boolean gapB = isGap(rowB.charAt(column));
            if (gapA && gapB) {
                continue;
            }
            a.append(rowA.charAt(column));
            b.append(rowB.charAt(column));
        }
        return new PairwiseAlignment(nameA, a.toString(), nameB, b.toString());
    }

    public static boolean isGap(char c) {
        return c == '-' || c == '.';
    }

    public int columns() {
        return rowA.length();
    }

    private static String normalize(String name, String row) {
        StringBuilder sb = new StringBuilder(row.length());
        for (int i = 0; i < row.length(); i++) {
            char c = row.charAt(i);
            if (isGap(c)) {
                sb.append(GAP);
            } else if (Character.isLetter(c)) {
                sb.append(Character.toUpperCase(c));
            } else {
                throw new AlignmentParseException(name, "unexpected character '" + c + "' at column " + (i + 1));
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "PairwiseAlignment [" + nameA + " vs " + nameB + ", columns=" + columns() + "]";
    }
}
