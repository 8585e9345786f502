package com.astrazeneca.tbltransfer.parsers;

import com.astrazeneca.tbltransfer.alignment.MultipleAlignment;
import com.astrazeneca.tbltransfer.exception.AlignmentParseException;
import com.astrazeneca.tbltransfer.exception.InputFileException;
import htsjdk.samtools.reference.ReferenceSequence;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import static org.testng.Assert.assertEquals;

public class FastaLoaderTest {
    private final FastaLoader loader = new FastaLoader();

    private File fasta(String content) throws IOException {
        File file = File.createTempFile("loader", ".fasta");
        file.deleteOnExit();
        Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    public void shouldReadRecordsInFileOrder() throws IOException {
        List<ReferenceSequence> sequences = loader.readSequences(fasta(">chr2 second\nACGT\nAC\n>chr1\nGGG\n"));

        assertEquals(sequences.size(), 2);
        assertEquals(sequences.get(0).getName(), "chr2");
        assertEquals(sequences.get(0).getBaseString(), "ACGTAC");
        assertEquals(sequences.get(1).getName(), "chr1");
    }

    @Test
    public void shouldReadGappedRowsAsAlignment() throws IOException {
        MultipleAlignment alignment = loader.readAlignment(fasta(">ref\nACGT-A\n>alt1\nAC--TA\n>alt2\nACGTTA\n"));

        assertEquals(alignment.names(), Arrays.asList("ref", "alt1", "alt2"));
        assertEquals(alignment.row("alt1"), "AC--TA");
        assertEquals(alignment.pair("ref", "alt1").columns(), 6);
        assertEquals(alignment.pair("ref", "alt1").rowA, "ACGT-A");
    }

    @Test(expectedExceptions = AlignmentParseException.class)
    public void shouldRejectRowsOfDifferentWidth() throws IOException {
        loader.readAlignment(fasta(">ref\nACGT\n>alt\nACG\n"));
    }

    @Test(expectedExceptions = AlignmentParseException.class)
    public void shouldRejectDuplicatedNames() throws IOException {
        loader.readAlignment(fasta(">ref\nACGT\n>ref\nACGT\n"));
    }

    @Test(expectedExceptions = InputFileException.class)
    public void shouldFailOnMissingFile() {
        loader.readSequences(new File("missing.fasta"));
    }
}
