package com.astrazeneca.tbltransfer;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;

public class UtilsTest {

    @DataProvider(name = "identifiers")
    public Object[][] identifiers() {
        return new Object[][]{
                {"KJ660346.2", "KJ660346.2", true},
                {"KJ660346.2", "gb|KJ660346.2|", true},
                {"gb|KJ660346.2|", "KJ660346.2", true},
                {"KJ660346.2", "KJ660346.1", false},
                {"KJ660346", "KJ660346.2", false},
                {"seg1", "gb|seg10|", false},
        };
    }

    @Test(dataProvider = "identifiers")
    public void sameSequenceMatchesIdentifierTokens(String tableId, String sequenceId, boolean expected) {
        assertEquals(Utils.sameSequence(tableId, sequenceId), expected);
    }

    @Test
    public void fileNameReplacesUnsafeCharacters() {
        assertEquals(Utils.toFileName("gb|KJ660346.2|"), "gb_KJ660346.2_");
        assertEquals(Utils.toFileName("sample_1"), "sample_1");
    }

    @Test
    public void joinUsesDelimiter() {
        assertEquals(Utils.join("\t", "seg1", 3, "gene"), "seg1\t3\tgene");
        assertEquals(Utils.join(", "), "");
    }
}
