package com.astrazeneca.tbltransfer;

import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

public class MainTest {
    private final ByteArrayOutputStream errContent = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeMethod
    public void setUpStreams() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(new ByteArrayOutputStream()));
        System.setErr(new PrintStream(errContent));
    }

    @AfterMethod
    public void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    public void helpExitsWithSuccess() {
        assertEquals(Main.run(new String[]{"--help"}), Main.EXIT_OK);
    }

    @Test
    public void badUsageExitsWithUsageCode() {
        assertEquals(Main.run(new String[]{"tbl_transfer", "ref.fasta"}), Main.EXIT_USAGE);
        assertTrue(errContent.toString().contains("Wrong number of arguments"), errContent.toString());
    }

    @Test
    public void missingInputExitsWithFailure() {
        int code = Main.run(new String[]{"tbl_transfer", "missing.fasta", "missing.tbl", "missing_alt.fasta", "out.tbl"});

        assertEquals(code, Main.EXIT_FAILED);
        assertTrue(errContent.toString().contains("IO_ERROR"), errContent.toString());
    }
}
