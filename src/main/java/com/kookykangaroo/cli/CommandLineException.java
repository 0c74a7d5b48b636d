package com.kookykangaroo.cli;

/**
 * Exception thrown when the command line cannot be parsed.
 */
public class CommandLineException extends RuntimeException {

    public CommandLineException(String message) {
        super(message);
    }
}
