package com.kookykangaroo.cli;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

/**
 * Commands understood by the command line, with the options each accepts.
 */
public enum Command {

    CREATE_GRAPH("create-graph", "Create a Neo4j graph from a markdown file.",
            Set.of(Option.FILE, Option.URI, Option.USERNAME, Option.PASSWORD), Set.of(Option.FILE)),

    TRAVERSE_GRAPH("traverse-graph", "Traverse a graph and print it as markdown.",
            Set.of(Option.URI, Option.USERNAME, Option.PASSWORD), Set.of()),

    CYPHER_SCRIPT("cypher-script", "Print the Cypher script for a markdown file without running it.",
            Set.of(Option.FILE, Option.OUTPUT), Set.of(Option.FILE)),

    HELP("help", "Show usage.", Set.of(), Set.of());

    private final String commandName;
    private final String description;
    private final Set<Option> options;
    private final Set<Option> requiredOptions;

    Command(String commandName, String description, Set<Option> options, Set<Option> requiredOptions) {
        this.commandName = commandName;
        this.description = description;
        this.options = options;
        this.requiredOptions = requiredOptions;
    }

    public String commandName() {
        return commandName;
    }

    public String description() {
        return description;
    }

    public Set<Option> options() {
        return options;
    }

    public Set<Option> requiredOptions() {
        return requiredOptions;
    }

    public static Optional<Command> fromName(String name) {
        return Arrays.stream(values())
                .filter(command -> command.commandName.equals(name))
                .findFirst();
    }

    /**
     * Command options. Each has a long name and, for some, a short alias.
     */
    public enum Option {

        FILE("--file", "-f", "Markdown file to parse."),
        URI("--uri", "-u", "Neo4j URI."),
        USERNAME("--username", null, "Neo4j username."),
        PASSWORD("--password", null, "Neo4j password."),
        OUTPUT("--output", "-o", "Write the script to this file instead of stdout.");

        private final String longName;
        private final String shortName;
        private final String help;

        Option(String longName, String shortName, String help) {
            this.longName = longName;
            this.shortName = shortName;
            this.help = help;
        }

        public String longName() {
            return longName;
        }

        public String help() {
            return help;
        }

        public String usage() {
            return shortName == null ? longName : longName + ", " + shortName;
        }

        public static Optional<Option> fromFlag(String flag) {
            return Arrays.stream(values())
                    .filter(option -> option.longName.equals(flag) || flag.equals(option.shortName))
                    .findFirst();
        }
    }
}
