package com.astrazeneca.tbltransfer.exception;


import java.util.Locale;

public class PositionOutOfRangeException extends TblTransferException {
    public final static String PositionOutOfRangeExceptionMessage = "Position %d is outside of sequence \"%s\" " +
            "(valid positions are 1-%d). Please check that the feature table belongs to this sequence.";

    public PositionOutOfRangeException(String sequence, int position, int length) {
        super(ErrorKind.OUT_OF_RANGE,
                String.format(Locale.US, PositionOutOfRangeExceptionMessage, position, sequence, length));
    }
}
