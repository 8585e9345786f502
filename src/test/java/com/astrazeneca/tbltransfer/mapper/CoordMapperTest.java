package com.astrazeneca.tbltransfer.mapper;

import com.astrazeneca.tbltransfer.alignment.MultipleAlignment;
import com.astrazeneca.tbltransfer.alignment.PairwiseAlignment;
import com.astrazeneca.tbltransfer.exception.NoAlignmentException;
import com.astrazeneca.tbltransfer.exception.PositionOutOfRangeException;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.LinkedHashMap;

import static org.testng.Assert.*;

public class CoordMapperTest {

    private static CoordMapper mapper(String ref, String alt) {
        return CoordMapper.of(new PairwiseAlignment("ref", ref, "alt", alt));
    }

    @Test
    public void identicalSequencesMapOntoThemselves() {
        CoordMapper mapper = mapper("ACGTACGT", "ACGTACGT");
        for (int position = 1; position <= 8; position++) {
            assertEquals(mapper.mapPoint("ref", "alt", position), MappedPosition.exact(position));
            assertEquals(mapper.mapPoint("alt", "ref", position), MappedPosition.exact(position));
        }
        assertEquals(mapper.mapPoint("ref", "ref", 3), MappedPosition.exact(3));
    }

    @Test
    public void deletedBaseMapsToClosestUpstreamBase() {
        CoordMapper mapper = mapper("ACGTACGT", "ACGT-CGT");

        assertEquals(mapper.mapPoint("ref", "alt", 4), MappedPosition.exact(4));
        assertEquals(mapper.mapPoint("ref", "alt", 5), MappedPosition.gapAdjacent(4));
        assertTrue(mapper.mapPoint("ref", "alt", 5).isApproximate());
        assertEquals(mapper.mapPoint("ref", "alt", 6), MappedPosition.exact(5));
        assertEquals(mapper.mapPoint("ref", "alt", 8), MappedPosition.exact(7));
    }

    @Test
    public void insertionExtendsTheMappedRange() {
        CoordMapper mapper = mapper("ACG--TAC", "ACGGGTAC");

        assertEquals(mapper.mapPoint("ref", "alt", 3), MappedPosition.exact(3, 5));
        assertEquals(mapper.mapPoint("ref", "alt", 4), MappedPosition.exact(6));
        // the inverse direction sees a deletion
        assertEquals(mapper.mapPoint("alt", "ref", 4), MappedPosition.gapAdjacent(3));

        MappedInterval interval = mapper.mapInterval("ref", "alt", 2, 4);
        assertEquals(interval.lower(), 2);
        assertEquals(interval.upper(), 6);
        assertEquals(interval.targetBases(), 5);
    }

    @Test
    public void overhangOfTheTargetIsNotAnInsertion() {
        CoordMapper mapper = mapper("ACGT---", "ACGTAAA");

        assertEquals(mapper.mapPoint("ref", "alt", 4), MappedPosition.exact(4));
        assertEquals(mapper.mapPoint("alt", "ref", 6), MappedPosition.afterEnd());
    }

    @Test
    public void positionsBeyondTargetEdgesAreOutOfBounds() {
        CoordMapper mapper = mapper("ACGTACGTAC", "--GTACG---");

        assertEquals(mapper.mapPoint("ref", "alt", 1), MappedPosition.beforeStart());
        assertEquals(mapper.mapPoint("ref", "alt", 3), MappedPosition.exact(1));
        assertEquals(mapper.mapPoint("ref", "alt", 7), MappedPosition.exact(5));
        assertEquals(mapper.mapPoint("ref", "alt", 8), MappedPosition.afterEnd());

        MappedInterval interval = mapper.mapInterval("ref", "alt", 9, 2);
        assertTrue(interval.reverse);
        assertEquals(interval.start().status, MappedPosition.Status.AFTER_END);
        assertEquals(interval.end().status, MappedPosition.Status.BEFORE_START);
        assertFalse(interval.isInBounds());
        assertFalse(interval.isOutside());
        assertEquals(interval.targetBases(), 5);

        assertTrue(mapper.mapInterval("ref", "alt", 8, 10).isOutside());
    }

    @Test
    public void fullyDeletedIntervalHasNoTargetBases() {
        CoordMapper mapper = mapper("ACGTACGT", "AC---CGT");

        MappedInterval interval = mapper.mapInterval("ref", "alt", 3, 5);
        assertTrue(interval.isInBounds());
        assertEquals(interval.targetBases(), 0);
        assertEquals(interval.lowerBoundary, MappedPosition.gapAdjacent(2));

        assertEquals(mapper.mapInterval("ref", "alt", 3, 6).targetBases(), 1);
    }

    @DataProvider(name = "alignments")
    public Object[][] alignments() {
        return new Object[][] {
                {"ACGTACGTAC", "ACGTACGTAC"},
                {"ACGTACGTAC", "AC--ACG-AC"},
                {"AC--GTACGT", "ACTTGTACGT"},
                {"ACG-TA-CGT", "A-GGTAC-GT"},
        };
    }

    @Test(dataProvider = "alignments")
    public void mappingIsMonotonic(String ref, String alt) {
        CoordMapper mapper = mapper(ref, alt);
        int previous = 0;
        for (int position = 1; position <= mapper.length("ref"); position++) {
            MappedPosition mapped = mapper.mapPoint("ref", "alt", position);
            assertTrue(mapped.isInBounds());
            assertTrue(mapped.lower >= previous, "position " + position + " maps before " + previous);
            previous = mapped.lower;
        }
    }

    @Test(dataProvider = "alignments")
    public void exactMappingsAreInvertible(String ref, String alt) {
        CoordMapper mapper = mapper(ref, alt);
        for (int position = 1; position <= mapper.length("ref"); position++) {
            MappedPosition forward = mapper.mapPoint("ref", "alt", position);
            if (forward.status == MappedPosition.Status.EXACT) {
                assertEquals(mapper.mapPoint("alt", "ref", forward.lower).lower, position);
            }
        }
    }

    @Test(expectedExceptions = PositionOutOfRangeException.class)
    public void positionAfterSequenceEndIsRejected() {
        mapper("ACGT", "ACGT").mapPoint("ref", "alt", 5);
    }

    @Test(expectedExceptions = PositionOutOfRangeException.class)
    public void zeroPositionIsRejected() {
        mapper("ACGT", "ACGT").mapPoint("alt", "ref", 0);
    }

    @Test(expectedExceptions = NoAlignmentException.class)
    public void unknownSequenceIsRejected() {
        mapper("ACGT", "ACGT").mapPoint("ref", "other", 1);
    }

    @Test
    public void targetsOfOneHubAreConnected() {
        LinkedHashMap<String, String> rows = new LinkedHashMap<>();
        rows.put("ref", "ACGTACGT");
        rows.put("alt1", "ACGT-CGT");
        rows.put("alt2", "A-GTACGT");
        CoordMapper mapper = CoordMapper.builder().add(new MultipleAlignment("test", rows), "ref").build();

        assertTrue(mapper.isConnected("alt1", "alt2"));
        assertFalse(mapper.isConnected("alt1", "unknown"));
        assertEquals(mapper.length("alt2"), 7);
        // alt1:5 -> ref:6 -> alt2:5
        assertEquals(mapper.mapPoint("alt1", "alt2", 5), MappedPosition.exact(5));
        // alt1:2 -> ref:2 which is deleted in alt2
        assertEquals(mapper.mapPoint("alt1", "alt2", 2), MappedPosition.gapAdjacent(1));
        // alt2:4 -> ref:5 which is deleted in alt1
        assertTrue(mapper.mapPoint("alt2", "alt1", 4).isApproximate());
    }
}
