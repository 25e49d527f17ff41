package com.swatcl.script.parser;

public enum TokenType {
    ERROR,
    STRING,      // bare word
    QUOTE,       // fragment of a double-quoted word
    BRACE,       // {uninterpreted text}
    COMMAND,     // [nested command]
    VARIABLE,    // $name or ${name}
    FUNCTION,    // expression function name (the '(' follows as PAREN)
    OPERATOR,
    INTEGER,
    FLOAT,
    COMMA,
    PAREN,
    EOL,
    EOF
}
