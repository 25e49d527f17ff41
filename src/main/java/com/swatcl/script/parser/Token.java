package com.swatcl.script.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    /** Index of the first source character; for ERROR tokens, where the failing construct began. */
    public final int offset;
    // Quote fragments only: does this fragment carry the opening/closing '"' of its word.
    final boolean opensQuote;
    final boolean closesQuote;

    Token(TokenType type, String lexeme, int offset) {
        this(type, lexeme, offset, false, false);
    }

    Token(TokenType type, String lexeme, int offset, boolean opensQuote, boolean closesQuote) {
        this.type = type;
        this.lexeme = lexeme;
        this.offset = offset;
        this.opensQuote = opensQuote;
        this.closesQuote = closesQuote;
    }

    public TokenType type() { return type; }

    /** Index just past the last source character. */
    public int end() { return offset + lexeme.length(); }

    public boolean opensQuote() { return opensQuote; }

    public boolean closesQuote() { return closesQuote; }

    /**
     * The payload of the token without its delimiters: braces, brackets, the
     * delimiting quotes of a quoted word, and the '$' or '${ }' of a variable.
     */
    public String contents() {
        String s = lexeme;
        switch (type) {
            case BRACE:
            case COMMAND:
                return s.length() >= 2 ? s.substring(1, s.length() - 1) : s;
            case QUOTE: {
                int begin = (opensQuote && s.startsWith("\"")) ? 1 : 0;
                int end = s.length();
                if (closesQuote && end > begin && s.endsWith("\"")) end--;
                return s.substring(begin, end);
            }
            case VARIABLE:
                if (s.startsWith("${") && s.endsWith("}")) return s.substring(2, s.length() - 1);
                return s.startsWith("$") ? s.substring(1) : s;
            default:
                return s;
        }
    }

    @Override
    public String toString() {
        switch (type) {
            case EOF:
                return "EOF";
            case ERROR:
                return lexeme;
            default:
                if (lexeme.length() > 10) return type + " \"" + lexeme.substring(0, 10) + "\"...";
                return type + " \"" + lexeme + "\"";
        }
    }
}
