package com.astrazeneca.tbltransfer.aligners;

import com.astrazeneca.tbltransfer.alignment.PairwiseAlignment;
import com.astrazeneca.tbltransfer.exception.AlignmentFailedException;
import org.testng.SkipException;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;

import static org.testng.Assert.*;

public class MafftAlignerTest {

    /**
     * Shell script standing in for mafft.
     */
    private static String fakeMafft(String body) throws IOException {
        if (File.separatorChar != '/') {
            throw new SkipException("Needs a POSIX shell");
        }
        File buildDir = new File("target");
        File script = File.createTempFile("mafft", ".sh", buildDir.isDirectory() ? buildDir : null);
        script.deleteOnExit();
        Files.write(script.toPath(), ("#!/bin/sh\n" + body).getBytes(StandardCharsets.UTF_8));
        assertTrue(script.setExecutable(true));
        return script.getPath();
    }

    @Test
    public void shouldRunMafftOnTheInputFile() {
        File input = new File("pair.fasta");

        assertEquals(new MafftAligner("/opt/mafft", 0).command(input),
                Arrays.asList("/opt/mafft", "--auto", "--preservecase", "--quiet", "--thread", "1", input.getPath()));
    }

    @Test
    public void shouldReadAlignmentPrintedByMafft() throws IOException {
        String mafft = fakeMafft("printf '>ref\\nAC-GT\\n>alt\\nactgt\\n'\n");

        PairwiseAlignment alignment = new MafftAligner(mafft, 0).align("seg1", "ACGT", "sample1", "ACTGT");

        assertEquals(alignment.nameA, "seg1");
        assertEquals(alignment.nameB, "sample1");
        assertEquals(alignment.rowA, "AC-GT");
        assertEquals(alignment.rowB, "ACTGT");
    }

    @Test
    public void shouldPassBothSequencesToMafft() throws IOException {
        // echo the input file back, an unaligned pair of equal length is a valid alignment
        String mafft = fakeMafft("for last; do :; done\ncat \"$last\"\n");

        PairwiseAlignment alignment = new MafftAligner(mafft, 0).align("seg1", "ACGT", "sample1", "ACCT");

        assertEquals(alignment.rowA, "ACGT");
        assertEquals(alignment.rowB, "ACCT");
    }

    @Test(expectedExceptions = AlignmentFailedException.class, expectedExceptionsMessageRegExp = ".*exited with code 3")
    public void shouldFailOnNonZeroExitCode() throws IOException {
        new MafftAligner(fakeMafft("exit 3\n"), 0).align("seg1", "ACGT", "sample1", "ACGT");
    }

    @Test(expectedExceptions = AlignmentFailedException.class, expectedExceptionsMessageRegExp = ".*did not finish in 1 seconds")
    public void shouldFailWhenMafftIsTooSlow() throws IOException {
        new MafftAligner(fakeMafft("sleep 10\n"), 1).align("seg1", "ACGT", "sample1", "ACGT");
    }

    @Test(expectedExceptions = AlignmentFailedException.class, expectedExceptionsMessageRegExp = ".*couldn't run .*")
    public void shouldFailWhenMafftIsMissing() {
        new MafftAligner("/nonexistent/mafft", 0).align("seg1", "ACGT", "sample1", "ACGT");
    }

    @Test(expectedExceptions = AlignmentFailedException.class)
    public void shouldFailOnEmptyOutput() throws IOException {
        new MafftAligner(fakeMafft("exit 0\n"), 0).align("seg1", "ACGT", "sample1", "ACGT");
    }
}
