package com.astrazeneca.tbltransfer;

import com.astrazeneca.tbltransfer.data.ChromosomePair;
import com.astrazeneca.tbltransfer.data.FeatureTable;
import com.astrazeneca.tbltransfer.exception.UnmatchedChromosomeException;
import com.astrazeneca.tbltransfer.printers.RunSummary;
import htsjdk.samtools.reference.ReferenceSequence;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import static org.testng.Assert.*;

public class ChromosomeMatcherTest {
    private Configuration config;
    private RunSummary summary;
    private final Function<String, File> outputs = name -> new File("out", name + ".tbl");

    @BeforeMethod
    public void setUp() {
        config = new Configuration();
        summary = new RunSummary();
    }

    private static ReferenceSequence sequence(String name, int index) {
        return new ReferenceSequence(name, index, "ACGT".getBytes(StandardCharsets.US_ASCII));
    }

    private static FeatureTable table(String id) {
        return new FeatureTable(id, Collections.emptyList());
    }

    private List<ChromosomePair> match(List<FeatureTable> tables, List<ReferenceSequence> alts) {
        List<ReferenceSequence> refs = Arrays.asList(sequence("gb|seg1|", 0), sequence("seg2", 1), sequence("seg3", 2));
        return new ChromosomeMatcher(config).match(tables, refs, alts, outputs, summary);
    }

    @Test
    public void shouldPairByName() {
        List<ChromosomePair> pairs = match(Arrays.asList(table("seg2"), table("seg1")),
                Arrays.asList(sequence("seg1", 0), sequence("seg2", 1)));

        assertEquals(pairs.size(), 2);
        assertEquals(pairs.get(0).refName, "seg2");
        assertEquals(pairs.get(0).altName, "seg2");
        assertEquals(pairs.get(1).refName, "gb|seg1|");
        assertEquals(pairs.get(1).altName, "seg1");
        assertEquals(pairs.get(1).output, new File("out", "seg1.tbl"));
    }

    @Test
    public void sameNamesGetDistinctAlignmentRows() {
        ChromosomePair pair = match(Collections.singletonList(table("seg2")),
                Collections.singletonList(sequence("seg2", 0))).get(0);

        assertEquals(pair.refKey(), "seg2");
        assertNotEquals(pair.altKey(), pair.refKey());
        assertFalse(pair.isPrealigned());
    }

    @Test
    public void shouldPairByOrder() {
        config.chromosomeMatching = Configuration.ChromosomeMatching.ORDER;

        List<ChromosomePair> pairs = match(Arrays.asList(table("seg1"), table("seg2")),
                Arrays.asList(sequence("sampleA", 0), sequence("sampleB", 1)));

        assertEquals(pairs.get(0).altName, "sampleA");
        assertEquals(pairs.get(1).altName, "sampleB");
    }

    @Test
    public void explicitPairsTakePrecedence() {
        config.chromosomePairs.put("seg2", "seg1");

        List<ChromosomePair> pairs = match(Collections.singletonList(table("seg2")),
                Arrays.asList(sequence("seg1", 0), sequence("seg2", 1)));

        assertEquals(pairs.size(), 1);
        assertEquals(pairs.get(0).refName, "seg2");
        assertEquals(pairs.get(0).altName, "seg1");
    }

    @Test
    public void unmatchedChromosomeFailsInStrictMode() {
        try {
            match(Arrays.asList(table("seg1"), table("seg3")), Collections.singletonList(sequence("seg1", 0)));
            fail("Unmatched chromosome was accepted");
        } catch (UnmatchedChromosomeException e) {
            assertTrue(e.getMessage().contains("seg3"), e.getMessage());
        }
    }

    @Test
    public void unmatchedChromosomeIsReportedWhenAllowed() {
        config.strictChromosomes = false;

        List<ChromosomePair> pairs = match(Arrays.asList(table("seg1"), table("seg3"), table("unknown")),
                Collections.singletonList(sequence("seg1", 0)));

        assertEquals(pairs.size(), 1);
        assertEquals(summary.getUnmatched(), Arrays.asList("seg3", "unknown"));
    }

    @Test
    public void excludedChromosomesAreSkippedSilently() {
        config.excludedChromosomes.add("seg3");

        List<ChromosomePair> pairs = match(Arrays.asList(table("seg1"), table("seg3")),
                Collections.singletonList(sequence("seg1", 0)));

        assertEquals(pairs.size(), 1);
        assertTrue(summary.getUnmatched().isEmpty());
    }

    @Test
    public void targetIsPairedOnlyOnce() {
        config.strictChromosomes = false;
        config.chromosomePairs.put("seg2", "seg1");

        List<ChromosomePair> pairs = match(new ArrayList<>(Arrays.asList(table("seg1"), table("seg2"))),
                Collections.singletonList(sequence("seg1", 0)));

        assertEquals(pairs.size(), 1);
        assertEquals(summary.getUnmatched(), Collections.singletonList("seg2"));
    }
}
