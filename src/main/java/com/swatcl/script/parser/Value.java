package com.swatcl.script.parser;

import java.util.Locale;
import java.util.Objects;

/**
 * Result of evaluating an expression: a 64-bit integer, a double or a string.
 * Booleans are integers 1 and 0.
 */
public class Value {
    public enum Type { INT, FLOAT, STRING }

    public static final Value TRUE = new Value(Type.INT, 1L);
    public static final Value FALSE = new Value(Type.INT, 0L);

    public final Type type;
    public final Object value;

    public Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value integer(long l) { return new Value(Type.INT, l); }
    public static Value floating(double d) { return new Value(Type.FLOAT, d); }
    public static Value string(String s) { return new Value(Type.STRING, s == null ? "" : s); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }

    public Type getType() { return type; }

    public boolean isNumeric() { return type != Type.STRING; }

    public long asInt() {
        if (type != Type.INT) throw new EvalException(ErrorCode.OPERAND, "expected integer, got " + describe());
        return (long) value;
    }

    /** Numeric value widened to double. */
    public double asFloat() {
        switch (type) {
            case INT: return (double) (long) value;
            case FLOAT: return (double) value;
            default: throw new EvalException(ErrorCode.OPERAND, "expected number, got " + describe());
        }
    }

    public String asString() {
        return toString();
    }

    /** Type and text, for error messages. */
    public String describe() {
        return type.name().toLowerCase(Locale.ROOT) + " \"" + this + "\"";
    }

    @Override
    public String toString() {
        switch (type) {
            case INT:
                return Long.toString((long) value);
            case FLOAT:
                return formatDouble((double) value);
            default:
                return (String) value;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    /** Shortest round-trip text, exponents as e+NN / e-NN, NaN and Inf spelled out. */
    public static String formatDouble(double d) {
        if (Double.isNaN(d)) return "NaN";
        if (Double.isInfinite(d)) return d > 0 ? "Inf" : "-Inf";
        String s = Double.toString(d);
        int e = s.indexOf('E');
        if (e < 0) return s;
        String mantissa = s.substring(0, e);
        String exponent = s.substring(e + 1);
        if (mantissa.endsWith(".0")) mantissa = mantissa.substring(0, mantissa.length() - 2);
        if (!exponent.startsWith("-")) exponent = "+" + exponent;
        return mantissa + "e" + exponent;
    }
}
