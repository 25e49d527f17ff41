package com.swatcl.script.parser;

/** Entry state of the {@link Lexer}. */
public enum LexMode {
    /** Command text: words, substitutions, separators, comments. */
    STATEMENT,
    /** Argument of expr: numbers, operators, functions; no newlines or comments. */
    EXPRESSION
}
