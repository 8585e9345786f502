package com.astrazeneca.tbltransfer;

import com.astrazeneca.tbltransfer.modes.AlignAndTransferMode;
import com.astrazeneca.tbltransfer.modes.PrealignedTransferMode;
import org.apache.commons.cli.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.*;
import java.util.regex.Matcher;

import static com.astrazeneca.tbltransfer.data.Patterns.CHR_PAIR;

/**
 * Immutable table of the sub-commands, built once at startup.
 */
public final class CommandTable {
    public static final String TBL_TRANSFER = "tbl_transfer";
    public static final String TBL_TRANSFER_MULTICHR = "tbl_transfer_multichr";
    public static final String TBL_TRANSFER_PREALIGNED = "tbl_transfer_prealigned";

    private final Map<String, Command> commands;

    public CommandTable(Collection<Command> commands) {
        Map<String, Command> byName = new LinkedHashMap<>();
        for (Command command : commands) {
            if (byName.put(command.name, command) != null) {
                throw new IllegalArgumentException("Command " + command.name + " is defined twice");
            }
        }
        this.commands = Collections.unmodifiableMap(byName);
    }

    /**
     * @return null if there is no such command
     */
    public Command get(String name) {
        return commands.get(name);
    }

    public Collection<Command> commands() {
        return commands.values();
    }

    public static CommandTable standard() {
        return new CommandTable(Arrays.asList(
                new Command(TBL_TRANSFER,
                        "ref_fasta ref_tbl alt_fasta out_tbl",
                        "Transfers the feature table of a reference sequence to a new genome aligned with MAFFT.",
                        Options::new,
                        CommandTable::readSingleTransfer,
                        (config, aligner) -> new AlignAndTransferMode(config, aligner, true)),
                new Command(TBL_TRANSFER_MULTICHR,
                        "--ref_fastas F [--ref_fastas F ...] --ref_tbls T [--ref_tbls T ...] alt_fasta out_dir",
                        "Transfers the feature tables of a multi-chromosome reference to every paired sequence "
                                + "of alt_fasta, one table per chromosome.",
                        CommandTable::multichrOptions,
                        CommandTable::readMultichrTransfer,
                        (config, aligner) -> new AlignAndTransferMode(config, aligner, false)),
                new Command(TBL_TRANSFER_PREALIGNED,
                        "inputFasta refFasta outputDir refAnnotTblFiles...",
                        "Transfers the feature table of the reference to every other sequence of an existing "
                                + "alignment.",
                        Options::new,
                        CommandTable::readPrealignedTransfer,
                        PrealignedTransferMode::new)
        ));
    }

    private static void readSingleTransfer(CommandLine cmd, Configuration config) throws ParseException {
        String[] args = positional(cmd, 4, 4);
        config.refFastas.add(args[0]);
        config.refTables.add(args[1]);
        config.altFasta = args[2];
        config.output = args[3];
        // one reference against one target
        config.chromosomeMatching = Configuration.ChromosomeMatching.ORDER;
    }

    @SuppressWarnings("static-access")
    private static Options multichrOptions() {
        Options options = new Options();
        options.addOption(OptionBuilder.withArgName("fasta")
                .hasArg(true)
                .withDescription("Reference sequence file, one per chromosome. Repeat the option or separate files by commas.")
                .isRequired(true)
                .withLongOpt("ref_fastas")
                .create());
        options.addOption(OptionBuilder.withArgName("tbl")
                .hasArg(true)
                .withDescription("Reference feature table file. Repeat the option or separate files by commas.")
                .isRequired(true)
                .withLongOpt("ref_tbls")
                .create());
        options.addOption(OptionBuilder.withArgName("ref=alt|file")
                .hasArg(true)
                .withDescription("Explicit chromosome pair, or a file with one \"ref alt\" pair per line. May be repeated.")
                .withLongOpt("chr_map")
                .create());
        options.addOption(null, "match_by_order", false,
                "Pair the i-th reference table with the i-th sequence of alt_fasta instead of matching names");
        return options;
    }

    private static void readMultichrTransfer(CommandLine cmd, Configuration config) throws ParseException {
        String[] args = positional(cmd, 2, 2);
        config.refFastas.addAll(splitValues(cmd.getOptionValues("ref_fastas")));
        config.refTables.addAll(splitValues(cmd.getOptionValues("ref_tbls")));
        config.altFasta = args[0];
        config.output = args[1];
        if (cmd.hasOption("match_by_order")) {
            config.chromosomeMatching = Configuration.ChromosomeMatching.ORDER;
        }
        if (cmd.hasOption("chr_map")) {
            for (String value : cmd.getOptionValues("chr_map")) {
                readChromosomePairs(value, config.chromosomePairs);
            }
        }
    }

    private static void readPrealignedTransfer(CommandLine cmd, Configuration config) throws ParseException {
        String[] args = positional(cmd, 4, Integer.MAX_VALUE);
        config.alignmentFasta = args[0];
        config.refFastas.add(args[1]);
        config.output = args[2];
        config.refTables.addAll(Arrays.asList(args).subList(3, args.length));
    }

    /**
     * Reads "ref=alt" or a file of "ref alt" lines.
     */
    static void readChromosomePairs(String value, Map<String, String> pairs) throws ParseException {
        File file = new File(value);
        List<String> lines;
        if (file.isFile()) {
            try {
                lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new ParseException("Chromosome map " + value + " can't be read: " + e.getMessage());
            }
        } else {
            lines = Collections.singletonList(value);
        }
        for (String line : lines) {
            if (line.trim().isEmpty() || line.startsWith("#")) {
                continue;
            }
            Matcher matcher = CHR_PAIR.matcher(line);
            if (!matcher.find()) {
                throw new ParseException("Chromosome pair must look like ref=alt: " + line);
            }
            pairs.put(matcher.group(1), matcher.group(2));
        }
    }

    private static String[] positional(CommandLine cmd, int min, int max) throws ParseException {
        String[] args = cmd.getArgs();
        if (args.length < min || args.length > max) {
            throw new ParseException("Wrong number of arguments: " + args.length + " given, expected "
                    + (min == max ? String.valueOf(min) : "at least " + min));
        }
        return args;
    }

    private static List<String> splitValues(String[] values) {
        List<String> result = new ArrayList<>();
        for (String value : values) {
            for (String part : value.split(",")) {
                if (!part.isEmpty()) {
                    result.add(part);
                }
            }
        }
        return result;
    }
}
