package com.astrazeneca.tbltransfer;

import com.astrazeneca.tbltransfer.printers.PrinterType;
import org.apache.commons.cli.ParseException;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.testng.Assert.*;

public class CmdParserTest {
    private final ByteArrayOutputStream outContent = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeMethod
    public void setUpStreams() {
        originalOut = System.out;
        System.setOut(new PrintStream(outContent));
    }

    @AfterMethod
    public void restoreStreams() {
        System.setOut(originalOut);
        outContent.reset();
    }

    @Test
    public void shouldReadSingleTransfer() throws ParseException {
        Configuration config = new CmdParser().parseParams(new String[]{
                "tbl_transfer", "ref.fasta", "ref.tbl", "alt.fasta", "out.tbl"});

        assertEquals(config.command, CommandTable.TBL_TRANSFER);
        assertEquals(config.refFastas, Collections.singletonList("ref.fasta"));
        assertEquals(config.refTables, Collections.singletonList("ref.tbl"));
        assertEquals(config.altFasta, "alt.fasta");
        assertEquals(config.output, "out.tbl");
        assertEquals(config.chromosomeMatching, Configuration.ChromosomeMatching.ORDER);
        assertEquals(config.outOfBoundsPolicy, Configuration.OutOfBoundsPolicy.CLIP);
        assertEquals(config.deletedIntervalPolicy, Configuration.DeletedIntervalPolicy.DROP);
        assertEquals(config.excludedQualifiers, Collections.singleton("protein_id"));
        assertTrue(config.strictChromosomes);
        assertEquals(config.threads, 1);
        assertFalse(config.isParallel());
    }

    @Test
    public void shouldReadCommonOptions() throws ParseException {
        Configuration config = new CmdParser().parseParams(new String[]{
                "tbl_transfer", "--oob_drop", "--ignoreAmbigFeatureEdge", "--deleted_interval", "collapse",
                "--warn_unmatched", "--exclude_qualifier", "note", "--aligner_timeout", "60", "--mafft", "/opt/mafft",
                "-DP", "ERR", "-y", "-th", "3", "ref.fasta", "ref.tbl", "alt.fasta", "out.tbl"});

        assertEquals(config.outOfBoundsPolicy, Configuration.OutOfBoundsPolicy.DROP);
        assertTrue(config.ignoreAmbiguousEdges);
        assertEquals(config.deletedIntervalPolicy, Configuration.DeletedIntervalPolicy.COLLAPSE);
        assertFalse(config.strictChromosomes);
        assertTrue(config.excludedQualifiers.containsAll(Arrays.asList("protein_id", "note")));
        assertEquals(config.alignerTimeout, 60L);
        assertEquals(config.mafftPath, "/opt/mafft");
        assertEquals(config.printerType, PrinterType.ERR);
        assertTrue(config.y);
        assertEquals(config.threads, 3);
        assertTrue(config.isParallel());
    }

    @Test
    public void shouldReadMultichrTransfer() throws ParseException, IOException {
        File map = File.createTempFile("chr", ".map");
        map.deleteOnExit();
        Files.write(map.toPath(), "# ref alt\nseg3\tsample_3\n".getBytes(StandardCharsets.UTF_8));

        Configuration config = new CmdParser().parseParams(new String[]{
                "tbl_transfer_multichr", "--ref_fastas", "a.fasta,b.fasta", "--ref_fastas", "c.fasta",
                "--ref_tbls", "a.tbl", "--chr_map", "seg1=sample_1", "--chr_map", map.getPath(),
                "--match_by_order", "alt.fasta", "out"});

        assertEquals(config.refFastas, Arrays.asList("a.fasta", "b.fasta", "c.fasta"));
        assertEquals(config.refTables, Collections.singletonList("a.tbl"));
        assertEquals(config.altFasta, "alt.fasta");
        assertEquals(config.output, "out");
        assertEquals(config.chromosomeMatching, Configuration.ChromosomeMatching.ORDER);
        Map<String, String> expected = new HashMap<>();
        expected.put("seg1", "sample_1");
        expected.put("seg3", "sample_3");
        assertEquals(config.chromosomePairs, expected);
    }

    @Test
    public void shouldReadPrealignedTransfer() throws ParseException {
        Configuration config = new CmdParser().parseParams(new String[]{
                "tbl_transfer_prealigned", "aligned.fasta", "ref.fasta", "out", "a.tbl", "b.tbl"});

        assertEquals(config.alignmentFasta, "aligned.fasta");
        assertEquals(config.refFastas, Collections.singletonList("ref.fasta"));
        assertEquals(config.output, "out");
        assertEquals(config.refTables, Arrays.asList("a.tbl", "b.tbl"));
        assertEquals(config.chromosomeMatching, Configuration.ChromosomeMatching.NAME);
    }

    @Test(expectedExceptions = ParseException.class)
    public void shouldRequireReferenceFilesForMultichr() throws ParseException {
        new CmdParser().parseParams(new String[]{"tbl_transfer_multichr", "alt.fasta", "out"});
    }

    @Test(expectedExceptions = ParseException.class)
    public void shouldRejectWrongNumberOfArguments() throws ParseException {
        new CmdParser().parseParams(new String[]{"tbl_transfer", "ref.fasta", "ref.tbl", "alt.fasta"});
    }

    @Test(expectedExceptions = ParseException.class)
    public void shouldRejectUnknownCommand() throws ParseException {
        new CmdParser().parseParams(new String[]{"tbl_merge", "a"});
    }

    @Test(expectedExceptions = ParseException.class)
    public void shouldRejectUnknownDeletedIntervalPolicy() throws ParseException {
        new CmdParser().parseParams(new String[]{"tbl_transfer", "--deleted_interval", "keep",
                "ref.fasta", "ref.tbl", "alt.fasta", "out.tbl"});
    }

    @Test(expectedExceptions = ParseException.class)
    public void shouldRejectBothOutOfBoundsPolicies() throws ParseException {
        new CmdParser().parseParams(new String[]{"tbl_transfer", "--oob_clip", "--oob_drop",
                "ref.fasta", "ref.tbl", "alt.fasta", "out.tbl"});
    }

    @Test
    public void helpListsCommands() throws ParseException {
        assertNull(new CmdParser().parseParams(new String[0]));

        String help = outContent.toString();
        assertTrue(help.contains("tbl_transfer_multichr"), help);
        assertTrue(help.contains("tbl_transfer_prealigned"), help);
    }

    @Test
    public void commandHelpListsOptions() throws ParseException {
        assertNull(new CmdParser().parseParams(new String[]{"tbl_transfer_multichr", "-H"}));

        assertTrue(outContent.toString().contains("--ref_fastas"), outContent.toString());
    }
}
