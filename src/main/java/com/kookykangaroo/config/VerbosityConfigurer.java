package com.kookykangaroo.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

/**
 * Maps the {@code -v} count to the log level of the application's loggers.
 *
 * 0 keeps the configured ERROR level, 1 is INFO, 2 is DEBUG, 3 or more is TRACE.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VerbosityConfigurer {

    static final String APPLICATION_LOGGER = "com.kookykangaroo";

    private final LoggingSystem loggingSystem;

    public void apply(int verbosity) {
        var level = levelFor(verbosity);
        if (level == LogLevel.ERROR) {
            return;
        }
        loggingSystem.setLogLevel(APPLICATION_LOGGER, level);
        log.debug("Log level set to {}", level);
    }

    static LogLevel levelFor(int verbosity) {
        if (verbosity >= 3) return LogLevel.TRACE;
        if (verbosity == 2) return LogLevel.DEBUG;
        if (verbosity == 1) return LogLevel.INFO;
        return LogLevel.ERROR;
    }
}
