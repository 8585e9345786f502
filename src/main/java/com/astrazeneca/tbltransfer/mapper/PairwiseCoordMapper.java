package com.astrazeneca.tbltransfer.mapper;

import com.astrazeneca.tbltransfer.alignment.PairwiseAlignment;
import com.astrazeneca.tbltransfer.exception.NoAlignmentException;
import com.astrazeneca.tbltransfer.exception.PositionOutOfRangeException;

import static com.astrazeneca.tbltransfer.alignment.PairwiseAlignment.GAP;

/**
 * Position tables of one pairwise alignment. Built once, read-only afterwards, so it can be shared
 * between threads.
 */
public final class PairwiseCoordMapper {
    private final String[] names = new String[2];
    private final int[] lengths = new int[2];
    private final int columns;

    /**
     * 1-based position -&gt; 0-based alignment column
     */
    private final int[][] positionToColumn = new int[2][];
    /**
     * 0-based alignment column -&gt; 1-based position, 0 for a gap
     */
    private final int[][] columnToPosition = new int[2][];
    /**
     * number of bases in columns 0..column, i.e. the last position at or before the column
     */
    private final int[][] basesUpToColumn = new int[2][];
    /**
     * number of bases of the other sequence inserted right after the position (internal insertions only)
     */
    private final int[][] insertedAfter = new int[2][];
    private final int[] firstColumn = new int[2];
    private final int[] lastColumn = new int[2];

    public PairwiseCoordMapper(PairwiseAlignment alignment) {
        names[0] = alignment.nameA;
        names[1] = alignment.nameB;
        columns = alignment.columns();
        fill(0, alignment.rowA);
        fill(1, alignment.rowB);
        fillInsertions(0);
        fillInsertions(1);
    }

    private void fill(int side, String row) {
        int length = 0;
        for (int i = 0; i < row.length(); i++) {
            if (row.charAt(i) != GAP) {
                length++;
            }
        }
        lengths[side] = length;
        positionToColumn[side] = new int[length + 1];
        columnToPosition[side] = new int[columns];
        basesUpToColumn[side] = new int[columns];
        firstColumn[side] = -1;
        lastColumn[side] = -1;
        int position = 0;
        for (int column = 0; column < columns; column++) {
            if (row.charAt(column) != GAP) {
                position++;
                positionToColumn[side][position] = column;
                columnToPosition[side][column] = position;
                if (firstColumn[side] == -1) {
                    firstColumn[side] = column;
                }
                lastColumn[side] = column;
            }
            basesUpToColumn[side][column] = position;
        }
    }

    private void fillInsertions(int side) {
        insertedAfter[side] = new int[lengths[side] + 1];
        for (int position = 1; position <= lengths[side]; position++) {
            int column = positionToColumn[side][position] + 1;
            int inserted = 0;
            while (column < columns && columnToPosition[side][column] == 0) {
                inserted++;
                column++;
            }
            // bases after the last aligned base are an overhang, not an insertion
            insertedAfter[side][position] = column < columns ? inserted : 0;
        }
    }

    public int length(String name) {
        return lengths[side(name)];
    }

    /**
     * Translates a base position of one sequence of the pair into the other one.
     * @param from name of the sequence the position belongs to
     * @param position 1-based position
     * @return mapped position, see {@link MappedPosition}
     */
    public MappedPosition mapPoint(String from, int position) {
        int fromSide = side(from);
        int toSide = 1 - fromSide;
        checkRange(fromSide, position);
        int column = positionToColumn[fromSide][position];
        int target = columnToPosition[toSide][column];
        if (target != 0) {
            return MappedPosition.exact(target, target + insertedAfter[fromSide][position]);
        }
        if (firstColumn[toSide] == -1 || column < firstColumn[toSide]) {
            return MappedPosition.beforeStart();
        }
        if (column > lastColumn[toSide]) {
            return MappedPosition.afterEnd();
        }
        // gaps map to the closest upstream base
        return MappedPosition.gapAdjacent(basesUpToColumn[toSide][column]);
    }

    private void checkRange(int side, int position) {
        if (position < 1 || position > lengths[side]) {
            throw new PositionOutOfRangeException(names[side], position, lengths[side]);
        }
    }

    private int side(String name) {
        if (names[0].equals(name)) {
            return 0;
        }
        if (names[1].equals(name)) {
            return 1;
        }
        throw new NoAlignmentException(name, names[0] + "/" + names[1]);
    }
}
