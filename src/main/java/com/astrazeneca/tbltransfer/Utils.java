package com.astrazeneca.tbltransfer;

import java.time.LocalDateTime;

import static com.astrazeneca.tbltransfer.data.Patterns.ID_SEPARATOR;
import static com.astrazeneca.tbltransfer.data.Patterns.NOT_FILE_NAME_CHARS;

public final class Utils {

    private Utils() {
    }

    /**
     * Method creates string from arguments by appending them with specified delimiter
     * @param delim specified delimiter
     * @param args array of arguments
     * @return generated string
     */
    public static String join(String delim, Object... args) {
        if (args.length == 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            sb.append(args[i]);
            if (i + 1 != args.length) {
                sb.append(delim);
            }
        }
        return sb.toString();
    }

    public static int toInt(String intStr) {
        return Integer.parseInt(intStr);
    }

    /**
     * Turns a sequence identifier into a safe file name: "gb|KJ660346.2|" becomes "gb_KJ660346.2_".
     * @param name sequence identifier
     * @return file name without extension
     */
    public static String toFileName(String name) {
        return NOT_FILE_NAME_CHARS.matcher(name).replaceAll("_");
    }

    /**
     * Checks whether a feature table identifier names a FASTA record. Besides equality, one of the
     * '|'-separated tokens of either identifier may match the other one ("KJ660346.2" matches "gb|KJ660346.2|").
     * @param tableId identifier from the "&gt;Feature" line
     * @param sequenceId FASTA record name
     * @return true if the identifiers refer to the same sequence
     */
    public static boolean sameSequence(String tableId, String sequenceId) {
        if (tableId.equals(sequenceId)) {
            return true;
        }
        for (String token : ID_SEPARATOR.split(sequenceId)) {
            if (!token.isEmpty() && token.equals(tableId)) {
                return true;
            }
        }
        for (String token : ID_SEPARATOR.split(tableId)) {
            if (!token.isEmpty() && token.equals(sequenceId)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Prints progress line in verbose mode.
     */
    public static void printTime(boolean verbose, String message) {
        if (verbose) {
            System.err.println("TIME: " + message + ": " + LocalDateTime.now());
        }
    }

    /**
     * Prints the exception of one chromosome. Other chromosomes are processed further.
     * @param exception exception thrown while processing the chromosome
     * @param chromosome reference chromosome name
     */
    public static void printExceptionAndContinue(Throwable exception, String chromosome) {
        System.err.println("There was Exception while processing chromosome " + chromosome
                + ". The processing will be continued from the next chromosome.");
        exception.printStackTrace();
    }
}
