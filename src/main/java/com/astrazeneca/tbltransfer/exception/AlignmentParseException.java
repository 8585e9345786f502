package com.astrazeneca.tbltransfer.exception;


import java.util.Locale;

public class AlignmentParseException extends TblTransferException {
    public final static String AlignmentParseExceptionMessage = "Malformed alignment %s: %s";

    public AlignmentParseException(String source, String reason) {
        super(ErrorKind.PARSE_ERROR, String.format(Locale.US, AlignmentParseExceptionMessage, source, reason));
    }
}
