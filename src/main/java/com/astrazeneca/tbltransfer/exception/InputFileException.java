package com.astrazeneca.tbltransfer.exception;


import java.util.Locale;

public class InputFileException extends TblTransferException {
    public final static String InputFileExceptionMessage = "Couldn't read or write file %s.";

    public InputFileException(String file, Throwable e) {
        super(ErrorKind.IO_ERROR, String.format(Locale.US, InputFileExceptionMessage, file), e);
    }

    public InputFileException(String file, String reason) {
        super(ErrorKind.IO_ERROR, String.format(Locale.US, InputFileExceptionMessage, file) + " " + reason);
    }
}
