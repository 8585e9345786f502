package com.astrazeneca.tbltransfer;

import com.astrazeneca.tbltransfer.printers.PrinterType;
import org.apache.commons.cli.*;

import java.io.PrintWriter;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * Class to parse the parameters from the command line. The first argument names the command, the remaining
 * ones are parsed against the common options and the options of that command.
 */
public class CmdParser {
    private final CommandTable commands;

    public CmdParser() {
        this(CommandTable.standard());
    }

    public CmdParser(CommandTable commands) {
        this.commands = commands;
    }

    /**
     * Parses the array of command line parameters and fills configuration parameters.
     * @param args arguments from command line to be parsed
     * @return configuration with parameters from command line, null if only the help was requested
     * @throws ParseException if parse can't be finished
     */
    public Configuration parseParams(String[] args) throws ParseException {
        if (args.length == 0 || "-H".equals(args[0]) || "--help".equals(args[0])) {
            help();
            return null;
        }
        Command command = commands.get(args[0]);
        if (command == null) {
            help();
            throw new ParseException("Unknown command: " + args[0]);
        }
        Options options = buildOptions(command);
        CommandLineParser parser = new BasicParser();

        try {
            CommandLine cmd = parser.parse(options, Arrays.copyOfRange(args, 1, args.length));
            if (cmd.hasOption("H")) {
                help(command, options);
                return null;
            }
            return parseCmd(command, cmd);
        } catch (MissingOptionException e) {
            List<?> missingOptions = e.getMissingOptions();
            StringBuilder message = new StringBuilder("Missing required option(s): ");
            for (Iterator<?> iterator = missingOptions.iterator(); iterator.hasNext(); ) {
                message.append(iterator.next());
                if (iterator.hasNext()) {
                    message.append(", ");
                }
            }
            help(command, options);
            throw new ParseException(message.toString());
        }
    }

    /**
     * For each parameter in CMD set the Configuration variable
     * @param command command being run
     * @param cmd parsed CommandLine from apache CLI
     * @return configuration with parameters from command line
     * @throws ParseException if a value can't be read
     */
    private Configuration parseCmd(Command command, CommandLine cmd) throws ParseException {
        Configuration config = new Configuration();
        config.command = command.name;

        if (cmd.hasOption("oob_clip") && cmd.hasOption("oob_drop")) {
            throw new ParseException("Options --oob_clip and --oob_drop can't be used together");
        }
        if (cmd.hasOption("oob_drop")) {
            config.outOfBoundsPolicy = Configuration.OutOfBoundsPolicy.DROP;
        }
        config.ignoreAmbiguousEdges = cmd.hasOption("ignoreAmbigFeatureEdge");

        if (cmd.hasOption("deleted_interval")) {
            String policy = cmd.getOptionValue("deleted_interval").toUpperCase();
            try {
                config.deletedIntervalPolicy = Configuration.DeletedIntervalPolicy.valueOf(policy);
            } catch (IllegalArgumentException e) {
                throw new ParseException("Unknown value of --deleted_interval: " + cmd.getOptionValue("deleted_interval"));
            }
        }
        if (cmd.hasOption("exclude_qualifier")) {
            config.excludedQualifiers.addAll(Arrays.asList(cmd.getOptionValues("exclude_qualifier")));
        }
        if (cmd.hasOption("exclude_chr")) {
            config.excludedChromosomes.addAll(Arrays.asList(cmd.getOptionValues("exclude_chr")));
        }
        config.strictChromosomes = !cmd.hasOption("warn_unmatched");
        config.diagnostics = cmd.getOptionValue("diagnostics");

        config.threads = Math.max(readThreadsCount(cmd), 1);
        config.alignerTimeout = getLongValue(cmd, "aligner_timeout", 0);
        config.mafftPath = cmd.getOptionValue("mafft", Configuration.DEFAULT_MAFFT);
        config.y = cmd.hasOption("y");

        if (cmd.hasOption("DP")) {
            String defaultPrinter = cmd.getOptionValue("DP", PrinterType.OUT.name());
            switch (defaultPrinter) {
                case "OUT": config.printerType = PrinterType.OUT; break;
                case "ERR": config.printerType = PrinterType.ERR; break;
                default: config.printerType = PrinterType.OUT;
            }
        }

        command.readArguments(cmd, config);
        return config;
    }

    /**
     * Help information about options contains long and short option names and their descriptions
     * @return common options and the options of the command
     */
    @SuppressWarnings("static-access")
    Options buildOptions(Command command) {
        Options options = new Options();
        options.addOption("H", "help", false, "Print this help page");
        options.addOption("y", "verbose", false, "Verbose mode. Will output transfer progress.");
        options.addOption(null, "oob_clip", false, "Truncate features which extend beyond the target sequence "
                + "and mark them partial (default)");
        options.addOption(null, "oob_drop", false, "Drop intervals which extend beyond the target sequence");
        options.addOption(null, "ignoreAmbigFeatureEdge", false, "Treat ambiguous edges (<123, >456) of "
                + "the reference features as exact positions");
        options.addOption(null, "warn_unmatched", false, "Report reference chromosomes without a target "
                + "and continue instead of failing");

        options.addOption(OptionBuilder.withArgName("drop|collapse")
                .hasArg(true)
                .withDescription("What to do with an interval deleted in the target: drop it (default) or collapse "
                        + "it to the closest upstream base")
                .withType(String.class)
                .withLongOpt("deleted_interval")
                .create());

        options.addOption(OptionBuilder.withArgName("name")
                .hasArg(true)
                .withDescription("Qualifier which is not copied to the new tables, may be repeated. "
                        + "protein_id is always excluded.")
                .withType(String.class)
                .withLongOpt("exclude_qualifier")
                .create());

        options.addOption(OptionBuilder.withArgName("chr")
                .hasArg(true)
                .withDescription("Reference chromosome to skip, may be repeated")
                .withType(String.class)
                .withLongOpt("exclude_chr")
                .create());

        options.addOption(OptionBuilder.withArgName("file")
                .hasArg(true)
                .withDescription("Write the transfer notes to this TSV file. Default: "
                        + Configuration.DIAGNOSTICS_FILE + " next to the output")
                .withType(String.class)
                .withLongOpt("diagnostics")
                .create());

        options.addOption(OptionBuilder.withArgName("INT")
                .hasOptionalArg()
                .withDescription("Threads count, chromosomes are transferred in parallel. "
                        + "Without value the number of processors is used.")
                .withType(Number.class)
                .isRequired(false)
                .create("th"));

        options.addOption(OptionBuilder.withArgName("seconds")
                .hasArg(true)
                .withDescription("Time limit of the alignment of one chromosome. Default: no limit")
                .withType(Number.class)
                .withLongOpt("aligner_timeout")
                .create());

        options.addOption(OptionBuilder.withArgName("path")
                .hasArg(true)
                .withDescription("MAFFT executable. Default: " + Configuration.DEFAULT_MAFFT)
                .withType(String.class)
                .withLongOpt("mafft")
                .create());

        options.addOption(OptionBuilder.withArgName("OUT|ERR")
                .hasArg(true)
                .withDescription("Stream of the run summary. Default: OUT")
                .withType(String.class)
                .create("DP"));

        for (Option option : command.options().getOptions()) {
            options.addOption(option);
        }
        return options;
    }

    private long getLongValue(CommandLine cmd, String option, long defaultValue) throws ParseException {
        Object value = cmd.getParsedOptionValue(option);
        return value == null ? defaultValue : ((Number) value).longValue();
    }

    /**
     * Calculates possible count of threads to use. If -th set without value, it will be set to number of
     * available processors.
     * @param cmd parsed CommandLine from apache CLI
     * @return number of threads
     * @throws ParseException if option -th can't be read
     */
    private int readThreadsCount(CommandLine cmd) throws ParseException {
        int threads = 0;
        if (cmd.hasOption("th")) {
            Object value = cmd.getParsedOptionValue("th");
            if (value == null) {
                threads = Runtime.getRuntime().availableProcessors();
            } else {
                threads = ((Number) value).intValue();
            }
        }
        return threads;
    }

    private void help() {
        PrintWriter writer = new PrintWriter(System.out);
        writer.println("usage: tbltransfer <command> [options] arguments");
        writer.println();
        writer.println("Transfers NCBI feature table annotations from a reference genome to related genomes.");
        writer.println("Commands:");
        for (Command command : commands.commands()) {
            writer.println("  " + command.name + " " + command.usage);
            writer.println("      " + command.description);
        }
        writer.println();
        writer.println("Run \"tbltransfer <command> -H\" for the options of a command.");
        writer.flush();
    }

    private void help(Command command, Options options) {
        HelpFormatter formater = new HelpFormatter();
        formater.setOptionComparator(null);
        formater.printHelp(120, "tbltransfer " + command.name + " [options] " + command.usage,
                command.description, options, "");
    }
}
