package com.astrazeneca.tbltransfer.data;

import java.util.regex.Pattern;

/**
 * Regex Patterns from all classes of TblTransfer stored in one place.
 */
public class Patterns {
    // Feature table patterns
    public static final String FEATURE_HEADER = ">Feature";
    public static final Pattern POSITION = Pattern.compile("^([<>]?)(\\d+)$");
    public static final Pattern WHITESPACES = Pattern.compile("\\s+");

    // Coordinates inside qualifier values: (pos:213..215,aa:Sec), (pos:complement(4156..4158),aa:TERM),
    // (pos:1017,aa:TERM), (pos:10..>11,aa:TERM)
    public static final String POS_PREFIX = "pos:";
    public static final Pattern POS_RANGE = Pattern.compile("pos:(complement\\()?([<>]?)(\\d+)(?:\\.\\.([<>]?)(\\d+))?(?![\\d.])");

    // Sequence names
    public static final Pattern NOT_FILE_NAME_CHARS = Pattern.compile("[^A-Za-z0-9._\\-]+");
    public static final Pattern ID_SEPARATOR = Pattern.compile("\\|");

    // Chromosome map entries: ref=alt or ref<TAB>alt
    public static final Pattern CHR_PAIR = Pattern.compile("^\\s*([^=\\s]+)\\s*(?:=|\\s)\\s*(\\S+)\\s*$");
}
