package com.kookykangaroo.cli;

import com.kookykangaroo.config.VerbosityConfigurer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Entry point from Spring Boot into the command line: parses the arguments,
 * applies verbosity and dispatches to {@link GraphCommands}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    private final GraphCommands graphCommands;
    private final VerbosityConfigurer verbosityConfigurer;

    private int exitCode = GraphCommands.EXIT_SUCCESS;

    @Override
    public void run(String... args) {
        var out = utf8(new FileOutputStream(FileDescriptor.out));
        exitCode = execute(out, System.err, args);
        out.flush();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Command output is UTF-8 whatever the platform charset, matching how input files are read.
     */
    static PrintStream utf8(OutputStream sink) {
        return new PrintStream(sink, true, StandardCharsets.UTF_8);
    }

    int execute(PrintStream out, PrintStream err, String... args) {
        CommandLineArguments arguments;
        try {
            arguments = CommandLineArguments.parse(args);
        } catch (CommandLineException e) {
            err.println("Error: " + e.getMessage());
            err.println();
            err.print(CommandLineArguments.usage());
            return GraphCommands.EXIT_USAGE;
        }

        verbosityConfigurer.apply(arguments.getVerbosity());
        log.debug("Running command {}", arguments.getCommand().commandName());

        return switch (arguments.getCommand()) {
            case CREATE_GRAPH -> graphCommands.createGraph(arguments);
            case TRAVERSE_GRAPH -> graphCommands.traverseGraph(arguments, out);
            case CYPHER_SCRIPT -> graphCommands.cypherScript(arguments, out);
            case HELP -> {
                err.print(CommandLineArguments.usage());
                yield GraphCommands.EXIT_SUCCESS;
            }
        };
    }
}
