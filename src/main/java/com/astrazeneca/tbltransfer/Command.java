package com.astrazeneca.tbltransfer;

import com.astrazeneca.tbltransfer.aligners.Aligner;
import com.astrazeneca.tbltransfer.modes.AbstractMode;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.util.function.Supplier;

/**
 * Sub-command of the command line: its own options and positional arguments, and the mode running it.
 */
public final class Command {

    /**
     * Fills the command specific part of the configuration.
     */
    @FunctionalInterface
    public interface ArgumentsReader {
        void read(CommandLine cmd, Configuration config) throws ParseException;
    }

    @FunctionalInterface
    public interface ModeFactory {
        AbstractMode create(Configuration config, Aligner aligner);
    }

    public final String name;
    public final String usage;
    public final String description;
    private final Supplier<Options> options;
    private final ArgumentsReader argumentsReader;
    private final ModeFactory modeFactory;

    public Command(String name, String usage, String description, Supplier<Options> options,
                   ArgumentsReader argumentsReader, ModeFactory modeFactory) {
        this.name = name;
        this.usage = usage;
        this.description = description;
        this.options = options;
        this.argumentsReader = argumentsReader;
        this.modeFactory = modeFactory;
    }

    /**
     * @return new set of the command specific options
     */
    public Options options() {
        return options.get();
    }

    public void readArguments(CommandLine cmd, Configuration config) throws ParseException {
        argumentsReader.read(cmd, config);
    }

    public AbstractMode createMode(Configuration config, Aligner aligner) {
        return modeFactory.create(config, aligner);
    }
}
