package com.astrazeneca.tbltransfer.parsers;

import com.astrazeneca.tbltransfer.data.*;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static org.testng.Assert.assertEquals;

public class FeatureTableWriterTest {

    private FeatureTable table() {
        Feature gene = new Feature("gene",
                Collections.singletonList(new Interval(new SeqPosition(1, Fuzziness.LESS_THAN), SeqPosition.exact(90))),
                Collections.singletonList(new Qualifier("gene", "L")));
        Feature cds = new Feature("CDS",
                Arrays.asList(Interval.of(90, 61), Interval.of(40, 11)),
                Arrays.asList(new Qualifier("product", "polymerase"), new Qualifier("protein_id", "gb|X1|"),
                        new Qualifier("pseudo", null)));
        return new FeatureTable("seq1", Arrays.asList(gene, cds));
    }

    @Test
    public void shouldWriteFiveColumnLayout() {
        String text = new FeatureTableWriter().toString(table());

        assertEquals(text, ">Feature seq1\n" +
                "<1\t90\tgene\n" +
                "\t\t\tgene\tL\n" +
                "90\t61\tCDS\n" +
                "40\t11\n" +
                "\t\t\tproduct\tpolymerase\n" +
                "\t\t\tprotein_id\tgb|X1|\n" +
                "\t\t\tpseudo\n");
    }

    @Test
    public void shouldSkipExcludedQualifiers() {
        String text = new FeatureTableWriter(new HashSet<>(Collections.singletonList("protein_id"))).toString(table());

        assertEquals(text.contains("protein_id"), false);
        assertEquals(text.contains("\t\t\tproduct\tpolymerase\n"), true);
    }

    @Test
    public void writtenTableIsReadBackUnchanged() throws IOException {
        File file = File.createTempFile("writer", ".tbl");
        file.deleteOnExit();
        FeatureTable table = new FeatureTable("seq1", "Table1", table().features);

        new FeatureTableWriter().write(table, file);

        assertEquals(new FeatureTableParser().parseFile(file), table);
        assertEquals(new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8).startsWith(">Feature seq1 Table1\n"), true);
    }

    @DataProvider(name = "tables")
    public Object[][] tables() throws IOException {
        String fixture = new String(Files.readAllBytes(new File(FeatureTableWriterTest.class
                .getResource("/com/astrazeneca/tbltransfer/ref.tbl").getPath()).toPath()), StandardCharsets.UTF_8);
        return new Object[][]{
                {fixture},
                {">Feature KJ660346.2 Table1\n" +
                        "<1\t>1500\tgene\n" +
                        "\t\t\tgene\tNP\n" +
                        "3000\t2501\tCDS\n" +
                        "2400\t2001\n" +
                        "\t\t\tproduct\tL\n" +
                        "\t\t\tribosomal_slippage\n"},
                {">Feature seq1\n" +
                        ">1050\t<900\tgene\n" +
                        "\t\t\tnote\tfirst\n" +
                        "\t\t\tnote\tsecond\n" +
                        "\t\t\tpseudo\n" +
                        "20\t12\tmRNA\n" +
                        ">8\t<1\n"},
                {">Feature chr1\n1\t10\tgene\n>Feature chr2\n<5\t>8\tmisc_feature\n\t\t\tnote\ttwo\tcolumns\n"},
        };
    }

    @Test(dataProvider = "tables")
    public void parsedTextIsWrittenBackUnchanged(String text) {
        List<FeatureTable> tables = new FeatureTableParser().parseAll(new BufferedReader(new StringReader(text)), "test");
        StringBuilder written = new StringBuilder();
        for (FeatureTable table : tables) {
            written.append(new FeatureTableWriter().toString(table));
        }

        assertEquals(written.toString(), text);
    }
}
