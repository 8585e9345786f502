package com.astrazeneca.tbltransfer.exception;


import java.util.Locale;

public class AlignmentFailedException extends TblTransferException {
    public final static String AlignmentFailedExceptionMessage = "Alignment of \"%s\" against \"%s\" failed: %s";

    public AlignmentFailedException(String ref, String alt, String reason) {
        super(ErrorKind.ALIGNMENT_FAILED, String.format(Locale.US, AlignmentFailedExceptionMessage, alt, ref, reason));
    }

    public AlignmentFailedException(String ref, String alt, String reason, Throwable e) {
        super(ErrorKind.ALIGNMENT_FAILED, String.format(Locale.US, AlignmentFailedExceptionMessage, alt, ref, reason), e);
    }
}
