package com.astrazeneca.tbltransfer.exception;


import java.util.Collection;
import java.util.Locale;

public class UnmatchedChromosomeException extends TblTransferException {
    public final static String UnmatchedChromosomeExceptionMessage = "No target sequence was found for reference " +
            "chromosome(s) %s. Use --chr_map to pair them explicitly, --exclude_chr to skip them or " +
            "--warn_unmatched to continue without them.";

    public UnmatchedChromosomeException(Collection<String> chromosomes) {
        super(ErrorKind.UNMATCHED_CHROMOSOME,
                String.format(Locale.US, UnmatchedChromosomeExceptionMessage, String.join(", ", chromosomes)));
    }
}
