package com.swatcl.debug;

/** Severity of a trace record, least severe first. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR
}
