package eu.fbk.aaer.util;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A parsed command line, with a fluent {@link Parser} built on Apache Commons CLI.
 */
public final class CommandLine {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLine.class);

    private final org.apache.commons.cli.CommandLine cmd;

    private final List<String> args;

    private CommandLine(final org.apache.commons.cli.CommandLine cmd) {
        this.cmd = cmd;
        this.args = ImmutableList.copyOf(cmd.getArgList());
    }

    public boolean hasOption(final String name) {
        return this.cmd.hasOption(name);
    }

    @Nullable
    public <T> T getOptionValue(final String name, final Class<T> type) {
        return getOptionValue(name, type, null);
    }

    /**
     * Returns the value of an option, converted to the type supplied.
     *
     * @param name
     *            the short or long name of the option
     * @param type
     *            the type of the value, among {@code String}, {@code Integer}, {@code Path}
     * @param defaultValue
     *            the value to return if the option was not specified
     * @return the option value, or the default value
     * @throws Exception
     *             if the value cannot be converted
     */
    @Nullable
    public <T> T getOptionValue(final String name, final Class<T> type,
            @Nullable final T defaultValue) {
        final String value = this.cmd.getOptionValue(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            if (type == String.class) {
                return type.cast(value);
            } else if (type == Integer.class) {
                return type.cast(Integer.valueOf(value));
            } else if (type == Path.class) {
                return type.cast(Paths.get(value));
            }
        } catch (final RuntimeException ex) {
            throw new Exception("Invalid value '" + value + "' for option " + name, ex);
        }
        throw new IllegalArgumentException("Unsupported option type " + type.getName());
    }

    public List<String> getArgs() {
        return this.args;
    }

    /**
     * Reports a failure to the user and terminates the JVM. Command line errors are printed
     * without stack trace.
     *
     * @param throwable
     *            the failure
     */
    public static void fail(final Throwable throwable) {
        if (throwable instanceof Exception) {
            System.err.println("SYNTAX ERROR: " + throwable.getMessage());
        } else {
            LOGGER.error("EXECUTION FAILED: " + throwable.getMessage(), throwable);
        }
        System.exit(1);
    }

    public static Parser parser() {
        return new Parser();
    }

    public enum Type {

        STRING,

        INTEGER,

        FILE,

        FILE_EXISTING,

        DIRECTORY,

        DIRECTORY_EXISTING

    }

    public static final class Parser {

        private final Options options = new Options();

        private String name = "java";

        @Nullable
        private String header;

        private final List<Option> typed = new ArrayList<>();

        private final List<Type> types = new ArrayList<>();

        Parser() {
            this.options.addOption("h", "help", false, "displays this help message and exits");
        }

        public Parser withName(final String name) {
            this.name = Objects.requireNonNull(name);
            return this;
        }

        public Parser withHeader(final String header) {
            this.header = header;
            return this;
        }

        public Parser withOption(@Nullable final String shortName, final String longName,
                final String description) {
            this.options.addOption(Option.builder(shortName).longOpt(longName).desc(description)
                    .build());
            return this;
        }

        public Parser withOption(@Nullable final String shortName, final String longName,
                final String description, final String argName, final Type type,
                final boolean argRequired, final boolean multiple, final boolean mandatory) {
            final Option.Builder builder = Option.builder(shortName).longOpt(longName)
                    .desc(description).argName(argName).required(mandatory);
            // optionalArg() may change the argument count, so it goes before hasArg()
            if (!argRequired) {
                builder.optionalArg(true);
            }
            if (multiple) {
                builder.hasArgs();
            } else {
                builder.hasArg();
            }
            final Option option = builder.build();
            this.options.addOption(option);
            this.typed.add(option);
            this.types.add(type);
            return this;
        }

        /**
         * Parses the arguments supplied. If the help option is given, the help message is
         * printed and the JVM terminated.
         *
         * @param args
         *            the command line arguments
         * @return the parsed command line
         * @throws Exception
         *             on syntax errors or invalid option values
         */
        public CommandLine parse(final String... args) {
            final org.apache.commons.cli.CommandLine cmd;
            try {
                cmd = new DefaultParser().parse(this.options, args);
            } catch (final ParseException ex) {
                throw new Exception(ex.getMessage(), ex);
            }
            if (cmd.hasOption("h")) {
                final PrintWriter out = new PrintWriter(System.out);
                new HelpFormatter().printHelp(out, HelpFormatter.DEFAULT_WIDTH, this.name,
                        this.header, this.options, HelpFormatter.DEFAULT_LEFT_PAD,
                        HelpFormatter.DEFAULT_DESC_PAD, null, true);
                out.flush();
                System.exit(0);
            }
            for (int i = 0; i < this.typed.size(); ++i) {
                check(cmd, this.typed.get(i), this.types.get(i));
            }
            return new CommandLine(cmd);
        }

        private static void check(final org.apache.commons.cli.CommandLine cmd,
                final Option option, final Type type) {
            final String name = option.getOpt() != null ? option.getOpt() : option.getLongOpt();
            final String[] values = cmd.getOptionValues(name);
            if (values == null) {
                return;
            }
            for (final String value : values) {
                switch (type) {
                case INTEGER:
                    try {
                        Integer.parseInt(value);
                    } catch (final NumberFormatException ex) {
                        throw new Exception("Option " + name + " requires an integer", ex);
                    }
                    break;
                case FILE_EXISTING:
                    if (!Files.isRegularFile(Paths.get(value))) {
                        throw new Exception("File '" + value + "' does not exist");
                    }
                    break;
                case DIRECTORY_EXISTING:
                    if (!Files.isDirectory(Paths.get(value))) {
                        throw new Exception("Directory '" + value + "' does not exist");
                    }
                    break;
                default:
                    break;
                }
            }
        }

    }

    /**
     * Signals a syntax error in the command line or an invalid option value.
     */
    public static final class Exception extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public Exception(final String message) {
            super(message);
        }

        public Exception(final String message, @Nullable final Throwable cause) {
            super(message, cause);
        }

    }

}
