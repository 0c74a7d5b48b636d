package com.kookykangaroo.cli;

import com.kookykangaroo.cli.Command.Option;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Parsed command line: global verbosity, the command, and its options.
 *
 * <p>Accepted form: {@code [-v|--verbose ...] <command> [--option value | --option=value ...]}.
 * Verbosity flags may be repeated or combined ({@code -vvv}) and may appear anywhere.
 */
public final class CommandLineArguments {

    private static final String VERBOSE_LONG = "--verbose";
    private static final String HELP_LONG = "--help";
    private static final String HELP_SHORT = "-h";

    private final Command command;
    private final int verbosity;
    private final Map<Option, String> options;

    private CommandLineArguments(Command command, int verbosity, Map<Option, String> options) {
        this.command = command;
        this.verbosity = verbosity;
        this.options = options;
    }

    // ==================== Parsing ====================

    public static CommandLineArguments parse(String... arguments) {
        if (Arrays.stream(arguments).anyMatch(CommandLineArguments::isHelpFlag)) {
            return help(arguments);
        }

        Command command = null;
        int verbosity = 0;
        Map<Option, String> options = new EnumMap<>(Option.class);

        for (int p = 0; p < arguments.length; p++) {
            var argument = arguments[p];

            if (isVerboseFlag(argument)) {
                verbosity += verbosityOf(argument);
            } else if (argument.startsWith("-")) {
                if (command == null) {
                    throw new CommandLineException("Option " + argument + " given before a command");
                }
                p = parseOption(command, arguments, p, options);
            } else if (command == null) {
                command = Command.fromName(argument)
                        .orElseThrow(() -> new CommandLineException("No such command '" + argument + "'"));
            } else if (command != Command.HELP) {
                throw new CommandLineException("Unexpected argument '" + argument + "'");
            }
        }

        var resolved = command == null ? Command.HELP : command;
        validateRequired(resolved, options);
        return new CommandLineArguments(resolved, verbosity, options);
    }

    /**
     * A help flag anywhere wins over the rest of the line, which is not validated.
     */
    private static CommandLineArguments help(String[] arguments) {
        int verbosity = Arrays.stream(arguments)
                .filter(CommandLineArguments::isVerboseFlag)
                .mapToInt(CommandLineArguments::verbosityOf)
                .sum();
        return new CommandLineArguments(Command.HELP, verbosity, new EnumMap<>(Option.class));
    }

    /**
     * Parses the option at {@code index} and returns the index of the last argument it consumed.
     */
    private static int parseOption(Command command, String[] arguments, int index, Map<Option, String> options) {
        var argument = arguments[index];
        var flag = argument;
        String value = null;
        int consumed = index;

        int equalsAt = argument.indexOf('=');
        if (argument.startsWith("--") && equalsAt > 0) {
            flag = argument.substring(0, equalsAt);
            value = argument.substring(equalsAt + 1);
        }

        var name = flag;
        var option = Option.fromFlag(flag)
                .filter(command.options()::contains)
                .orElseThrow(() -> new CommandLineException(
                        "No such option: " + name + " for command " + command.commandName()));

        if (value == null) {
            if (index + 1 >= arguments.length) {
                throw new CommandLineException("Option " + flag + " requires a value");
            }
            value = arguments[index + 1];
            consumed = index + 1;
        }

        options.put(option, value);
        return consumed;
    }

    private static void validateRequired(Command command, Map<Option, String> options) {
        var missing = command.requiredOptions().stream()
                .filter(option -> !options.containsKey(option))
                .map(Option::longName)
                .sorted()
                .collect(Collectors.joining(", "));
        if (!missing.isEmpty()) {
            throw new CommandLineException("Missing option(s) " + missing + " for command " + command.commandName());
        }
    }

    private static boolean isHelpFlag(String argument) {
        return HELP_LONG.equals(argument) || HELP_SHORT.equals(argument);
    }

    private static int verbosityOf(String argument) {
        return VERBOSE_LONG.equals(argument) ? 1 : argument.length() - 1;
    }

    private static boolean isVerboseFlag(String argument) {
        if (VERBOSE_LONG.equals(argument)) {
            return true;
        }
        return argument.length() > 1
                && argument.charAt(0) == '-'
                && argument.substring(1).chars().allMatch(c -> c == 'v');
    }

    // ==================== Accessors ====================

    public Command getCommand() {
        return command;
    }

    public int getVerbosity() {
        return verbosity;
    }

    public Optional<String> getOption(Option option) {
        return Optional.ofNullable(options.get(option));
    }

    public String getRequiredOption(Option option) {
        return getOption(option)
                .orElseThrow(() -> new CommandLineException("Missing option " + option.longName()));
    }

    // ==================== Usage ====================

    public static String usage() {
        var sb = new StringBuilder();
        sb.append("Usage: kookykangaroo [-v|--verbose ...] <command> [options]\n\n");
        sb.append("Parse Markdown files into Neo4j graphs and traverse them.\n\n");
        sb.append("Commands:\n");
        Arrays.stream(Command.values()).forEach(command -> {
            sb.append("  %-16s %s%n".formatted(command.commandName(), command.description()));
            command.options().stream()
                    .sorted()
                    .forEach(option -> sb.append("      %-20s %s%s%n".formatted(
                            option.usage(),
                            option.help(),
                            command.requiredOptions().contains(option) ? " (required)" : "")));
        });
        sb.append("\nGlobal options:\n");
        sb.append("  -v, --verbose          Increase verbosity level (repeatable).\n");
        sb.append("  -h, --help             Show usage.\n");
        return sb.toString();
    }
}
