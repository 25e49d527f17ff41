package com.swatcl.script.parser;

/**
 * Typed semantics of the expression operators. Operands arrive evaluated but
 * not yet coerced; each operator decides whether it wants numbers or text.
 */
final class Operators {

    private Operators() {}

    static boolean isSupported(String op, int arity) {
        if (arity == 1) {
            switch (op) {
                case "+": case "-": case "~": case "!":
                    return true;
                default:
                    return false;
            }
        }
        switch (op) {
            case "+": case "-": case "*": case "/": case "%": case "**":
            case "<<": case ">>": case "&": case "^": case "|":
            case "<": case ">": case "<=": case ">=": case "==": case "!=":
            case "eq": case "ne": case "&&": case "||":
                return true;
            default:
                // '?:' has no semantics yet; 'in'/'ni' need lists
                return false;
        }
    }

    static EvalException unsupported(String op, int arity) {
        return new EvalException(ErrorCode.OPERATOR,
                "unsupported " + (arity == 1 ? "unary" : "binary") + " operator \"" + op + "\"");
    }

    static Value unary(String op, Value operand) {
        switch (op) {
            case "+":
                return numeric(op, operand);
            case "-": {
                Value v = numeric(op, operand);
                if (v.type == Value.Type.INT) return Value.integer(-(long) v.value);
                return Value.floating(-(double) v.value);
            }
            case "~":
                return Value.integer(~integer(op, operand));
            case "!":
                return Value.bool(!truth(op, operand));
            default:
                throw unsupported(op, 1);
        }
    }

    static Value binary(String op, Value left, Value right) {
        switch (op) {
            case "+": case "-": case "*": case "/":
                return arithmetic(op, left, right);
            case "%": {
                long a = integer(op, left);
                long b = integer(op, right);
                if (b == 0) throw new EvalException(ErrorCode.OPERAND, "divide by zero");
                return Value.integer(a % b);
            }
            case "**":
                return power(left, right);
            case "<<": case ">>":
                return shift(op, integer(op, left), integer(op, right));
            case "&":
                return Value.integer(integer(op, left) & integer(op, right));
            case "^":
                return Value.integer(integer(op, left) ^ integer(op, right));
            case "|":
                return Value.integer(integer(op, left) | integer(op, right));
            case "<":
                return Value.bool(compare(left, right) < 0);
            case ">":
                return Value.bool(compare(left, right) > 0);
            case "<=":
                return Value.bool(compare(left, right) <= 0);
            case ">=":
                return Value.bool(compare(left, right) >= 0);
            case "==":
                return Value.bool(compare(left, right) == 0);
            case "!=":
                return Value.bool(compare(left, right) != 0);
            case "eq":
                return Value.bool(left.toString().equals(right.toString()));
            case "ne":
                return Value.bool(!left.toString().equals(right.toString()));
            case "&&":
                return Value.bool(truth(op, left) && truth(op, right));
            case "||":
                return Value.bool(truth(op, left) || truth(op, right));
            default:
                throw unsupported(op, 2);
        }
    }

    // ===================== HELPERS =====================

    private static Value arithmetic(String op, Value left, Value right) {
        Value a = numeric(op, left);
        Value b = numeric(op, right);
        if (a.type == Value.Type.INT && b.type == Value.Type.INT) {
            long x = (long) a.value;
            long y = (long) b.value;
            switch (op) {
                case "+": return Value.integer(x + y);
                case "-": return Value.integer(x - y);
                case "*": return Value.integer(x * y);
                default:
                    if (y == 0) throw new EvalException(ErrorCode.OPERAND, "divide by zero");
                    return Value.integer(x / y);
            }
        }
        double x = a.asFloat();
        double y = b.asFloat();
        switch (op) {
            case "+": return Value.floating(x + y);
            case "-": return Value.floating(x - y);
            case "*": return Value.floating(x * y);
            default: return Value.floating(x / y);
        }
    }

    private static Value power(Value left, Value right) {
        Value a = numeric("**", left);
        Value b = numeric("**", right);
        if (a.type != Value.Type.INT || b.type != Value.Type.INT) {
            return Value.floating(Math.pow(a.asFloat(), b.asFloat()));
        }
        long base = (long) a.value;
        long exp = (long) b.value;
        if (exp < 0) {
            if (base == 0) throw new EvalException(ErrorCode.OPERAND, "exponentiation of zero by negative power");
            if (base == 1) return Value.integer(1);
            if (base == -1) return Value.integer((exp & 1) == 0 ? 1 : -1);
            return Value.integer(0);
        }
        long result = 1;
        while (exp > 0) {
            if ((exp & 1) == 1) result *= base;
            base *= base;
            exp >>= 1;
        }
        return Value.integer(result);
    }

    private static Value shift(String op, long value, long count) {
        if (count < 0) throw new EvalException(ErrorCode.OPERAND, "negative shift argument");
        if ("<<".equals(op)) {
            return Value.integer(count >= 64 ? 0 : value << count);
        }
        return Value.integer(count >= 64 ? (value < 0 ? -1 : 0) : value >> count);
    }

    /**
     * Numeric comparison when both sides are numbers (INT against FLOAT is
     * widened), otherwise a lexical comparison of their text.
     */
    static int compare(Value left, Value right) {
        Value a = Coercion.coerce(left);
        Value b = Coercion.coerce(right);
        if (a.isNumeric() && b.isNumeric()) {
            if (a.type == Value.Type.INT && b.type == Value.Type.INT) {
                return Long.compare((long) a.value, (long) b.value);
            }
            double x = a.asFloat();
            double y = b.asFloat();
            if (x < y) return -1;
            if (x > y) return 1;
            return (x == y) ? 0 : Double.compare(x, y);
        }
        return left.toString().compareTo(right.toString());
    }

    private static Value numeric(String op, Value v) {
        Value n = Coercion.coerce(v);
        if (!n.isNumeric()) {
            throw new EvalException(ErrorCode.OPERAND,
                    "can't use non-numeric string \"" + v + "\" as operand of \"" + op + "\"");
        }
        return n;
    }

    private static long integer(String op, Value v) {
        Value n = numeric(op, v);
        if (n.type != Value.Type.INT) {
            throw new EvalException(ErrorCode.OPERAND,
                    "can't use floating-point value \"" + v + "\" as operand of \"" + op + "\"");
        }
        return (long) n.value;
    }

    static boolean truth(String op, Value v) {
        try {
            return Coercion.truthy(v);
        } catch (EvalException e) {
            throw new EvalException(ErrorCode.OPERAND,
                    "can't use non-boolean string \"" + v + "\" as operand of \"" + op + "\"", e);
        }
    }
}
