package com.swatcl.script.parser;

import java.math.BigInteger;
import java.util.Locale;

/**
 * String to number conversion rules shared by the parser, the operators and
 * the function table.
 */
public final class Coercion {

    private Coercion() {}

    /**
     * Best-effort conversion of text to an INT or FLOAT value. One leading sign
     * is honoured; the rest must be exactly one numeric literal. Anything else
     * comes back as the original string. Never throws.
     */
    public static Value coerceNumber(String text) {
        if (text == null || text.isEmpty()) return Value.string(text);
        String body = text;
        boolean negative = false;
        char c = text.charAt(0);
        if (text.length() > 1 && (c == '-' || c == '+')) {
            negative = c == '-';
            body = text.substring(1);
        }
        Token t = Lexer.expression(body).next();
        if ((t.type != TokenType.INTEGER && t.type != TokenType.FLOAT) || !t.lexeme.equals(body)) {
            return Value.string(text);
        }
        try {
            return (t.type == TokenType.INTEGER) ? integerValue(body, negative) : floatValue(body, negative);
        } catch (EvalException e) {
            return Value.string(text);
        }
    }

    /** Coerces STRING values; numbers pass through untouched. */
    public static Value coerce(Value v) {
        return (v.type == Value.Type.STRING) ? coerceNumber((String) v.value) : v;
    }

    /**
     * Converts the text of an INTEGER token: 0x prefix is hexadecimal, a
     * leading 0 is octal, otherwise decimal.
     */
    public static Value integerValue(String digits, boolean negative) {
        int radix = 10;
        String d = digits;
        if (d.length() > 2 && d.charAt(0) == '0' && (d.charAt(1) == 'x' || d.charAt(1) == 'X')) {
            radix = 16;
            d = d.substring(2);
        } else if (d.length() > 1 && d.charAt(0) == '0') {
            radix = 8;
            d = d.substring(1);
        }
        BigInteger big;
        try {
            big = new BigInteger(d, radix);
        } catch (NumberFormatException e) {
            throw new EvalException(ErrorCode.NUMBER_SYNTAX, "invalid integer \"" + digits + "\"", e);
        }
        if (negative) big = big.negate();
        if (big.bitLength() > 63) {
            throw new EvalException(ErrorCode.NUMBER_RANGE, "integer value too large to represent: " + digits);
        }
        return Value.integer(big.longValue());
    }

    /** Converts the text of a FLOAT token. */
    public static Value floatValue(String text, boolean negative) {
        double d;
        try {
            d = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new EvalException(ErrorCode.NUMBER_SYNTAX, "invalid floating-point value \"" + text + "\"", e);
        }
        if (Double.isInfinite(d)) {
            throw new EvalException(ErrorCode.NUMBER_RANGE, "floating-point value too large to represent: " + text);
        }
        return Value.floating(negative ? -d : d);
    }

    /**
     * Integers are true when non-zero; true/yes/on and false/no/off are
     * accepted in any case.
     */
    public static boolean evalBoolean(String text) {
        if (text != null) {
            try {
                return Long.parseLong(text.trim()) != 0;
            } catch (NumberFormatException ignored) {
                // not an integer, try the words
            }
            switch (text.toLowerCase(Locale.ROOT)) {
                case "true": case "yes": case "on":
                    return true;
                case "false": case "no": case "off":
                    return false;
                default:
                    break;
            }
        }
        throw new EvalException(ErrorCode.BOOLEAN_SYNTAX, "expected boolean value but got \"" + text + "\"");
    }

    /** Boolean reading of any value: numbers compare against zero, strings go through {@link #evalBoolean}. */
    public static boolean truthy(Value v) {
        Value n = coerce(v);
        switch (n.type) {
            case INT: return (long) n.value != 0L;
            case FLOAT: return (double) n.value != 0.0;
            default: return evalBoolean((String) n.value);
        }
    }

    /**
     * Backslash substitution: \a \b \f \n \r \t \v \\, \0oo octal, \xHH hex
     * and \\uHHHH unicode. Other escaped characters stand for themselves.
     */
    public static String evalString(String text) {
        if (text == null || text.indexOf('\\') < 0) return text;

        StringBuilder sb = new StringBuilder(text.length());
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i++);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (i >= n) {
                sb.append('\\');
                break;
            }
            char e = text.charAt(i++);
            switch (e) {
                case 'a': sb.append('\u0007'); break;
                case 'b': sb.append('\b'); break;
                case 'f': sb.append('\f'); break;
                case 'n': sb.append('\n'); break;
                case 'r': sb.append('\r'); break;
                case 't': sb.append('\t'); break;
                case 'v': sb.append('\u000b'); break;
                case '\\': sb.append('\\'); break;
                case '0':
                    sb.append((char) digits(text, i, 2, 8));
                    i += 2;
                    break;
                case 'x':
                    sb.append((char) digits(text, i, 2, 16));
                    i += 2;
                    break;
                case 'u':
                    sb.append((char) digits(text, i, 4, 16));
                    i += 4;
                    break;
                default:
                    sb.append(e);
            }
        }
        return sb.toString();
    }

    private static int digits(String text, int from, int count, int radix) {
        if (from + count > text.length()) {
            throw new EvalException(ErrorCode.NUMBER_SYNTAX, "truncated escape sequence in \"" + text + "\"");
        }
        int value = 0;
        for (int k = from; k < from + count; k++) {
            int d = Character.digit(text.charAt(k), radix);
            if (d < 0) {
                throw new EvalException(ErrorCode.NUMBER_SYNTAX,
                        "invalid digit '" + text.charAt(k) + "' in escape sequence in \"" + text + "\"");
            }
            value = value * radix + d;
        }
        return value;
    }
}
