package com.swatcl.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Finite-state scanner for SwaTcl command text and expressions.
 *
 * Tokens are produced lazily: each call to {@link #next()} runs the state
 * machine just far enough to yield one token. The sequence always ends with
 * either an EOF or an ERROR token, after which {@link #hasNext()} is false.
 */
public class Lexer implements Iterator<Token> {
    private static final int EOF = -1;

    private static final String DIGITS = "0123456789";
    private static final String OCTAL_DIGITS = "01234567";
    private static final String HEX_DIGITS = "0123456789abcdefABCDEF";

    private static final Set<String> TWO_CHAR_OPERATORS =
            Set.of("**", "<<", ">>", "<=", ">=", "&&", "||", "==", "!=");

    static final String MISSING_PAREN = "apparent function call missing (";

    private static final Set<String> WORD_OPERATORS = Set.of("eq", "ne", "in", "ni");

    private final String source;
    private final LexMode mode;
    private final ArrayDeque<Token> pending = new ArrayDeque<>();
    private int start = 0;
    private int pos = 0;
    private int width = 0;
    private boolean finished = false;
    // statement mode: '#' opens a comment only where a command may begin
    private boolean commandStart = true;

    public Lexer(String source, LexMode mode) {
        this.source = (source == null) ? "" : source;
        this.mode = (mode == null) ? LexMode.STATEMENT : mode;
    }

    public static Lexer statement(String source) { return new Lexer(source, LexMode.STATEMENT); }
    public static Lexer expression(String source) { return new Lexer(source, LexMode.EXPRESSION); }

    @Override
    public boolean hasNext() {
        fill();
        return !pending.isEmpty();
    }

    @Override
    public Token next() {
        fill();
        Token t = pending.poll();
        if (t == null) throw new NoSuchElementException("lexer exhausted");
        return t;
    }

    /** Drains the remaining tokens, including the final EOF or ERROR. */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (hasNext()) tokens.add(next());
        return tokens;
    }

    private void fill() {
        while (pending.isEmpty() && !finished) {
            if (mode == LexMode.EXPRESSION) lexExprStart();
            else lexStart();
        }
    }

    // ===================== START STATES =====================

    private void lexStart() {
        int r = nextRune();
        switch (r) {
            case EOF:
                emit(TokenType.EOF);
                finished = true;
                break;
            case ' ': case '\t': case '\r':
                lexSeparator();
                break;
            case '\n': case ';':
                lexEol();
                break;
            case '[':
                lexCommand();
                break;
            case '$':
                if (lexVariable() && start < pos) lexString();
                break;
            case '#':
                if (commandStart) lexComment();
                else lexString();
                break;
            case '{':
                lexBrace();
                break;
            case '"':
                lexQuotes();
                break;
            default:
                backup();
                lexString();
        }
    }

    private void lexExprStart() {
        int r = nextRune();
        switch (r) {
            case EOF:
                emit(TokenType.EOF);
                finished = true;
                break;
            case ' ': case '\t': case '\r':
                lexSeparator();
                break;
            case '\n': case ';': case '#':
                error("newline, semicolon, and hash not allowed in expression");
                break;
            case '[':
                lexCommand();
                break;
            case '$':
                if (lexVariable() && start < pos) lexString();
                break;
            case '{':
                lexBrace();
                break;
            case '"':
                lexQuotes();
                break;
            case '(': case ')':
                emit(TokenType.PAREN);
                break;
            case ',':
                emit(TokenType.COMMA);
                break;
            case '-': case '+': case '~': case '!': case '*': case '/': case '%':
            case '<': case '>': case '=': case '&': case '^': case '|': case '?': case ':':
                lexOperator(r);
                break;
            case '.': case '0': case '1': case '2': case '3': case '4':
            case '5': case '6': case '7': case '8': case '9':
                backup();
                lexNumber();
                break;
            default:
                backup();
                lexFunction();
        }
    }

    // ===================== SHARED STATES =====================

    private void lexSeparator() {
        acceptRun(" \t\r");
        ignore();
    }

    private void lexEol() {
        acceptRun(" \t\r\n;");
        emit(TokenType.EOL);
    }

    private void lexComment() {
        int r = nextRune();
        while (r != EOF && r != '\n') r = nextRune();
        backup();
        ignore();
    }

    private boolean lexBrace() {
        int level = 1;
        for (;;) {
            int r = nextRune();
            switch (r) {
                case EOF:
                    return error("unclosed left brace: " + quoted(source.substring(start, pos)));
                case '\\':
                    nextRune();
                    break;
                case '}':
                    if (--level == 0) {
                        emit(TokenType.BRACE);
                        return true;
                    }
                    break;
                case '{':
                    level++;
                    break;
                default:
                    break;
            }
        }
    }

    private void lexString() {
        for (;;) {
            int r = nextRune();
            switch (r) {
                case EOF:
                    emit(TokenType.STRING);
                    return;
                case '\\':
                    nextRune();
                    break;
                case '{': case '$': case '[': case ' ': case '\t': case '\n': case '\r': case ';':
                    backup();
                    emit(TokenType.STRING);
                    return;
                default:
                    break;
            }
        }
    }

    /** Expects the opening '[' to be consumed already. */
    private boolean lexCommand() {
        int level = 1;
        int braceLevel = 0;
        for (;;) {
            int r = nextRune();
            if (r == EOF) {
                return error("unclosed command: " + quoted(source.substring(start, pos)));
            } else if (r == '[' && braceLevel == 0) {
                level++;
            } else if (r == ']' && braceLevel == 0) {
                if (--level == 0) break;
            } else if (r == '\\') {
                nextRune();
            } else if (r == '{') {
                braceLevel++;
            } else if (r == '}' && braceLevel > 0) {
                braceLevel--;
            }
        }
        emit(TokenType.COMMAND);
        return true;
    }

    /**
     * Expects the '$' to be consumed already. If no variable name follows,
     * nothing is emitted and the '$' stays pending: the caller decides whether
     * it becomes a bare string or part of a quoted word.
     */
    private boolean lexVariable() {
        boolean braced = false;
        int r = nextRune();
        if (r == '{') {
            braced = true;
            r = nextRune();
        }
        while (isNameChar(r)) r = nextRune();
        if (braced) {
            if (r != '}') {
                return error("unclosed variable reference: " + quoted(source.substring(start, pos)));
            }
        } else {
            backup();
        }
        if (pos == start + 1) {
            return true;
        }
        emit(TokenType.VARIABLE);
        return true;
    }

    /** Expects the opening '"' to be consumed already. */
    private boolean lexQuotes() {
        boolean opening = true;
        for (;;) {
            int r = nextRune();
            switch (r) {
                case EOF:
                    return error("unclosed quoted string: " + quoted(source.substring(start, pos)));
                case '\\':
                    nextRune();
                    break;
                case '$': {
                    int la = lookahead();
                    if (la != '{' && !isNameChar(la)) break;
                    backup();
                    if (emitQuote(opening, false)) opening = false;
                    nextRune();
                    if (!lexVariable()) return false;
                    break;
                }
                case '[':
                    backup();
                    if (emitQuote(opening, false)) opening = false;
                    nextRune();
                    if (!lexCommand()) return false;
                    break;
                case '"':
                    emitQuote(opening, true);
                    return true;
                default:
                    break;
            }
        }
    }

    // ===================== EXPRESSION STATES =====================

    private void lexOperator(int first) {
        int second = lookahead();
        if (second != EOF) {
            String pair = new StringBuilder().appendCodePoint(first).appendCodePoint(second).toString();
            if (TWO_CHAR_OPERATORS.contains(pair)) nextRune();
        }
        emit(TokenType.OPERATOR);
    }

    /**
     * Integer in octal (leading 0), decimal or hexadecimal (0x), or a float
     * with optional fraction and exponent. A leading sign is a unary operator
     * and never part of the literal.
     */
    private boolean lexNumber() {
        int first = nextRune();
        boolean isFloat = false;
        if (first == '0' && accept("xX")) {
            if (acceptRun(HEX_DIGITS) == 0) return malformedNumber();
        } else {
            boolean sawDigit = first != '.';
            if (first == '.') {
                isFloat = true;
                sawDigit = acceptRun(DIGITS) > 0;
            } else {
                acceptRun(DIGITS);
                if (accept(".")) {
                    isFloat = true;
                    acceptRun(DIGITS);
                }
            }
            if (!sawDigit) return malformedNumber();
            if (accept("eE")) {
                isFloat = true;
                accept("+-");
                if (acceptRun(DIGITS) == 0) return malformedNumber();
            }
            if (!isFloat && first == '0' && !allIn(source.substring(start, pos), OCTAL_DIGITS)) {
                return malformedNumber();
            }
        }
        if (isAlphaNumeric(lookahead())) {
            nextRune();
            return malformedNumber();
        }
        emit(isFloat ? TokenType.FLOAT : TokenType.INTEGER);
        return true;
    }

    private boolean malformedNumber() {
        return error("malformed number: " + quoted(source.substring(start, pos)));
    }

    private boolean lexFunction() {
        int r = nextRune();
        while (isAsciiAlphaNumeric(r)) r = nextRune();
        if (r == '(') {
            backup();
            emit(TokenType.FUNCTION);
            nextRune();
            emit(TokenType.PAREN);
            return true;
        }
        backup();
        if (WORD_OPERATORS.contains(source.substring(start, pos))) {
            emit(TokenType.OPERATOR);
            return true;
        }
        nextRune();
        return error(MISSING_PAREN + ": " + quoted(source.substring(start, pos)));
    }

    // ===================== CURSOR =====================

    private int nextRune() {
        if (pos >= source.length()) {
            width = 0;
            return EOF;
        }
        int r = source.codePointAt(pos);
        width = Character.charCount(r);
        pos += width;
        return r;
    }

    /** Steps back one code point; valid once per call to nextRune(). */
    private void backup() {
        pos -= width;
        width = 0;
    }

    private int lookahead() {
        return pos < source.length() ? source.codePointAt(pos) : EOF;
    }

    private void ignore() {
        start = pos;
    }

    private boolean accept(String valid) {
        int r = nextRune();
        if (r != EOF && valid.indexOf(r) >= 0) return true;
        backup();
        return false;
    }

    private int acceptRun(String valid) {
        int count = 0;
        while (accept(valid)) count++;
        return count;
    }

    private void emit(TokenType type) {
        pending.add(new Token(type, source.substring(start, pos), start));
        start = pos;
        if (type == TokenType.EOL) commandStart = true;
        else if (type != TokenType.EOF) commandStart = false;
    }

    /** Emits the pending quoted text; returns false when there was nothing to emit. */
    private boolean emitQuote(boolean opening, boolean closing) {
        if (start == pos && !opening && !closing) return false;
        pending.add(new Token(TokenType.QUOTE, source.substring(start, pos), start, opening, closing));
        start = pos;
        commandStart = false;
        return true;
    }

    private boolean error(String message) {
        pending.add(new Token(TokenType.ERROR, message, start));
        finished = true;
        return false;
    }

    // ===================== CHARACTER CLASSES =====================

    private static boolean isNameChar(int r) {
        return (r >= 'a' && r <= 'z') || (r >= 'A' && r <= 'Z') || (r >= '0' && r <= '9') || r == '_';
    }

    private static boolean isAsciiAlphaNumeric(int r) {
        return (r >= 'a' && r <= 'z') || (r >= 'A' && r <= 'Z') || (r >= '0' && r <= '9');
    }

    static boolean isAlphaNumeric(int r) {
        return r != EOF && Character.isLetterOrDigit(r);
    }

    private static boolean allIn(String text, String valid) {
        for (int i = 0; i < text.length(); i++) {
            if (valid.indexOf(text.charAt(i)) < 0) return false;
        }
        return true;
    }

    private static String quoted(String text) {
        return '"' + text.replace("\n", "\\n") + '"';
    }
}
