package com.astrazeneca.tbltransfer;

import com.astrazeneca.tbltransfer.aligners.MafftAligner;
import com.astrazeneca.tbltransfer.exception.ErrorKind;
import com.astrazeneca.tbltransfer.exception.TblTransferException;
import com.astrazeneca.tbltransfer.printers.RunSummary;
import htsjdk.samtools.SAMException;
import org.apache.commons.cli.ParseException;

import java.io.UncheckedIOException;

public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    /**
     * Method to build options from command line and start the transfer
     * @param args array of arguments from command line
     */
    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Configuration config;
        try {
            config = new CmdParser().parseParams(args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            return EXIT_USAGE;
        }
        if (config == null) {
            return EXIT_OK;
        }
        try {
            MafftAligner aligner = new MafftAligner(config.mafftPath, config.alignerTimeout);
            RunSummary summary = new TblTransferLauncher(CommandTable.standard(), aligner).start(config);
            return summary.isSuccessful() ? EXIT_OK : EXIT_FAILED;
        } catch (TblTransferException e) {
            System.err.println(e.getKind() + ": " + e.getMessage());
            return EXIT_FAILED;
        } catch (SAMException | UncheckedIOException e) {
            System.err.println(ErrorKind.IO_ERROR + ": " + e.getMessage());
            return EXIT_FAILED;
        } catch (RuntimeException e) {
            System.err.println("Unexpected error: " + e);
            e.printStackTrace();
            return EXIT_FAILED;
        }
    }
}
