package com.astrazeneca.tbltransfer.exception;


import java.util.Locale;

public class FeatureTableParseException extends TblTransferException {
    public final static String FeatureTableParseExceptionMessage = "Malformed feature table %s at line %d (%s): \"%s\"";

    private final int lineNumber;
    private final String line;

    public FeatureTableParseException(String source, int lineNumber, String line, String reason) {
        super(ErrorKind.PARSE_ERROR,
                String.format(Locale.US, FeatureTableParseExceptionMessage, source, lineNumber, reason, line));
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }
}
