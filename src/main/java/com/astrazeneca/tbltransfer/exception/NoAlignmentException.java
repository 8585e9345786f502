package com.astrazeneca.tbltransfer.exception;


import java.util.Locale;

public class NoAlignmentException extends TblTransferException {
    public final static String NoAlignmentExceptionMessage = "There is no alignment between sequences \"%s\" and \"%s\".";

    public NoAlignmentException(String from, String to) {
        super(ErrorKind.NO_ALIGNMENT, String.format(Locale.US, NoAlignmentExceptionMessage, from, to));
    }
}
