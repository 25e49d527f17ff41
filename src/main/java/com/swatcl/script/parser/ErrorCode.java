package com.swatcl.script.parser;

/** Classifies why an expression failed to lex, parse or evaluate. */
public enum ErrorCode {
    /** Unclosed quote/brace/variable/command, malformed number, illegal character. */
    LEXER,
    /** Unmatched parenthesis, comma outside a function call, bare word without '('. */
    SYNTAX,
    /** Missing or non-numeric operand, wrong argument count or type. */
    OPERAND,
    /** Unknown or unsupported operator. */
    OPERATOR,
    /** Parser stacks in an impossible state. */
    BAD_STATE,
    NUMBER_RANGE,
    NUMBER_SYNTAX,
    BOOLEAN_SYNTAX,
    /** Host failed to resolve a variable. */
    VARIABLE,
    /** Host failed to evaluate a nested command. */
    COMMAND,
    /** Function name not present in the function table. */
    FUNCTION
}
