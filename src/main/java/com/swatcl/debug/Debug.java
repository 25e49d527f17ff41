package com.swatcl.debug;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide trace hub for the expression engine.
 *
 * - Reached through Debug.get()
 * - Records go to one pluggable {@link DebugSink}; none is installed by default
 * - Records below the threshold level are dropped before reaching the sink
 */
public final class Debug {

    // NOOP must be initialised before INSTANCE, whose constructor reads it.
    private static final DebugSink NOOP = (level, tag, message, error) -> { };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);
    private volatile DebugLevel threshold = DebugLevel.TRACE;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Installs the sink; null restores the silent default. */
    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public void setThreshold(DebugLevel level) {
        threshold = (level == null) ? DebugLevel.TRACE : level;
    }

    public DebugLevel getThreshold() {
        return threshold;
    }

    /** Whether a TRACE record would reach a sink. */
    public boolean enabled() {
        return enabled(DebugLevel.TRACE);
    }

    public boolean enabled(DebugLevel level) {
        return sinkRef.get() != NOOP && level.ordinal() >= threshold.ordinal();
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void d(String tag, String msg, Throwable err) { log(DebugLevel.DEBUG, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (level.ordinal() < threshold.ordinal()) return;
        sinkRef.get().log(level, tag, message, error);
    }

    /**
     * Reads a level name such as "debug" or "TRACE". Anything else, including
     * "1" or "true", means TRACE.
     */
    public static DebugLevel parseLevel(String text) {
        if (text != null) {
            for (DebugLevel l : DebugLevel.values()) {
                if (l.name().equals(text.trim().toUpperCase(Locale.ROOT))) return l;
            }
        }
        return DebugLevel.TRACE;
    }

    /** One line per record on stderr: "[LEVEL] tag: message". */
    public static DebugSink stderrSink() {
        return (level, tag, message, error) -> {
            System.err.println("[" + level + "] " + tag + ": " + message);
            if (error != null) error.printStackTrace(System.err);
        };
    }
}
