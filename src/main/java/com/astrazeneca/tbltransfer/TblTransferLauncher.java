package com.astrazeneca.tbltransfer;

import com.astrazeneca.tbltransfer.aligners.Aligner;
import com.astrazeneca.tbltransfer.modes.AbstractMode;
import com.astrazeneca.tbltransfer.printers.DiagnosticsWriter;
import com.astrazeneca.tbltransfer.printers.RunSummary;
import com.astrazeneca.tbltransfer.printers.SummaryPrinter;

import java.io.File;

import static com.astrazeneca.tbltransfer.Utils.printTime;

/**
 * Class starts the TblTransfer for current run
 */
public class TblTransferLauncher {
    private final CommandTable commands;
    private final Aligner aligner;

    public TblTransferLauncher(CommandTable commands, Aligner aligner) {
        this.commands = commands;
        this.aligner = aligner;
    }

    /**
     * Starts the mode of the configured command, then writes the diagnostics and prints the summary.
     * Failures of single chromosomes are part of the summary, failures of the inputs are thrown.
     * @param config starting configuration
     * @return summary of the run
     */
    public RunSummary start(Configuration config) {
        Command command = commands.get(config.command);
        if (command == null) {
            throw new IllegalArgumentException("Unknown command: " + config.command);
        }
        printTime(config.y, "Start " + command.name);
        AbstractMode mode = command.createMode(config, aligner);
        RunSummary summary = mode.start();

        File diagnostics = diagnosticsFile(config);
        new DiagnosticsWriter().write(summary.getDiagnostics(), diagnostics);
        printTime(config.y, "Wrote " + summary.getDiagnostics().size() + " note(s) to " + diagnostics);

        SummaryPrinter.createPrinter(config.printerType).print(summary);
        printTime(config.y, "Done " + command.name);
        return summary;
    }

    static File diagnosticsFile(Configuration config) {
        if (config.diagnostics != null) {
            return new File(config.diagnostics);
        }
        File output = new File(config.output);
        if (CommandTable.TBL_TRANSFER.equals(config.command)) {
            File parent = output.getAbsoluteFile().getParentFile();
            return new File(parent, Configuration.DIAGNOSTICS_FILE);
        }
        return new File(output, Configuration.DIAGNOSTICS_FILE);
    }
}
