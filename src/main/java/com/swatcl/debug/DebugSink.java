package com.swatcl.debug;

/** Receives trace records from {@link Debug}; the CLI writes them to stderr, tests collect them. */
@FunctionalInterface
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
