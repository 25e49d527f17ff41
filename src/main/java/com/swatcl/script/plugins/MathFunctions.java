package com.swatcl.script.plugins;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import com.swatcl.script.SwatclExpr.BuiltinFunction;
import com.swatcl.script.parser.Coercion;
import com.swatcl.script.parser.ErrorCode;
import com.swatcl.script.parser.EvalException;
import com.swatcl.script.parser.Value;

/**
 * MathFunctions
 *
 * The fixed function table of the expression language:
 *   abs, bool, ceil, double, exp, floor, fmod, log, log10,
 *   max, min, pow, rand, round, sqrt, srand
 *
 * Arguments arrive already coerced. A wrong argument count or a non-numeric
 * argument fails with an OPERAND error naming the function.
 *
 * rand() and srand() share one generator for the whole process.
 */
public final class MathFunctions {

    private static final double TWO_POW_63 = 9.223372036854775808E18;

    private static final Random RANDOM = new Random();

    private static final Map<String, BuiltinFunction> TABLE;

    static {
        Map<String, BuiltinFunction> m = new LinkedHashMap<>();

        m.put("abs", args -> {
            requireArgs("abs", args, 1);
            Value v = num("abs", args, 0);
            if (v.getType() == Value.Type.INT) return Value.integer(Math.abs(v.asInt()));
            return Value.floating(Math.abs(v.asFloat()));
        });

        m.put("bool", args -> {
            requireArgs("bool", args, 1);
            Value v = args.get(0);
            if (v.isNumeric()) return Value.bool(Coercion.truthy(v));
            try {
                return Value.bool(Coercion.evalBoolean(v.asString()));
            } catch (EvalException e) {
                throw new EvalException(ErrorCode.OPERAND,
                        "argument to bool() must be a number or boolean, got " + v.describe(), e);
            }
        });

        m.put("ceil", args -> {
            requireArgs("ceil", args, 1);
            return Value.floating(Math.ceil(dbl("ceil", args, 0)));
        });

        m.put("double", args -> {
            requireArgs("double", args, 1);
            return Value.floating(dbl("double", args, 0));
        });

        m.put("exp", args -> {
            requireArgs("exp", args, 1);
            return Value.floating(Math.exp(dbl("exp", args, 0)));
        });

        m.put("floor", args -> {
            requireArgs("floor", args, 1);
            return Value.floating(Math.floor(dbl("floor", args, 0)));
        });

        m.put("fmod", args -> {
            requireArgs("fmod", args, 2);
            // Java's % on doubles truncates like C fmod
            return Value.floating(dbl("fmod", args, 0) % dbl("fmod", args, 1));
        });

        m.put("log", args -> {
            requireArgs("log", args, 1);
            return Value.floating(Math.log(dbl("log", args, 0)));
        });

        m.put("log10", args -> {
            requireArgs("log10", args, 1);
            return Value.floating(Math.log10(dbl("log10", args, 0)));
        });

        m.put("max", args -> extreme("max", args, true));

        m.put("min", args -> extreme("min", args, false));

        m.put("pow", args -> {
            requireArgs("pow", args, 2);
            return Value.floating(Math.pow(dbl("pow", args, 0), dbl("pow", args, 1)));
        });

        m.put("rand", args -> {
            requireArgs("rand", args, 0);
            return Value.floating(RANDOM.nextDouble());
        });

        m.put("round", args -> {
            requireArgs("round", args, 1);
            Value v = num("round", args, 0);
            if (v.getType() == Value.Type.INT) return v;
            return Value.integer(roundHalfEven(v.asFloat()));
        });

        m.put("sqrt", args -> {
            requireArgs("sqrt", args, 1);
            return Value.floating(Math.sqrt(dbl("sqrt", args, 0)));
        });

        m.put("srand", args -> {
            requireArgs("srand", args, 1);
            Value v = num("srand", args, 0);
            if (v.getType() != Value.Type.INT) {
                throw new EvalException(ErrorCode.OPERAND, "argument to srand() must be an integer, got " + v.describe());
            }
            synchronized (RANDOM) {
                RANDOM.setSeed(v.asInt());
                return Value.floating(RANDOM.nextDouble());
            }
        });

        TABLE = Collections.unmodifiableMap(m);
    }

    private MathFunctions() {}

    /** The read-only function table, keyed by function name. */
    public static Map<String, BuiltinFunction> table() {
        return TABLE;
    }

    /**
     * Rounds to the nearest integer, ties to the even neighbour.
     *
     * @throws EvalException NUMBER_RANGE for NaN, infinities and results
     *         outside the 64-bit range
     */
    public static long roundHalfEven(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new EvalException(ErrorCode.NUMBER_RANGE, "cannot round " + Value.formatDouble(d));
        }
        double r = Math.rint(d);
        if (r >= TWO_POW_63 || r < -TWO_POW_63) {
            throw new EvalException(ErrorCode.NUMBER_RANGE,
                    "integer value too large to represent: " + Value.formatDouble(d));
        }
        return (long) r;
    }

    // ===================== HELPERS =====================

    private static Value extreme(String fn, List<Value> args, boolean max) {
        if (args.isEmpty()) {
            throw new EvalException(ErrorCode.OPERAND, fn + "() expects at least 1 argument, got 0");
        }
        List<Value> nums = new ArrayList<>(args.size());
        boolean allInt = true;
        for (int i = 0; i < args.size(); i++) {
            Value v = num(fn, args, i);
            if (v.getType() != Value.Type.INT) allInt = false;
            nums.add(v);
        }
        if (allInt) {
            long best = nums.get(0).asInt();
            for (Value v : nums) best = max ? Math.max(best, v.asInt()) : Math.min(best, v.asInt());
            return Value.integer(best);
        }
        double best = nums.get(0).asFloat();
        for (Value v : nums) best = max ? Math.max(best, v.asFloat()) : Math.min(best, v.asFloat());
        return Value.floating(best);
    }

    private static void requireArgs(String fn, List<Value> args, int n) {
        if (args.size() != n) {
            throw new EvalException(ErrorCode.OPERAND,
                    fn + "() expects " + n + " argument" + (n == 1 ? "" : "s") + ", got " + args.size());
        }
    }

    private static Value num(String fn, List<Value> args, int idx) {
        Value v = Coercion.coerce(args.get(idx));
        if (!v.isNumeric()) {
            throw new EvalException(ErrorCode.OPERAND,
                    "argument " + (idx + 1) + " of " + fn + "() must be numeric, got " + v.describe());
        }
        return v;
    }

    private static double dbl(String fn, List<Value> args, int idx) {
        return num(fn, args, idx).asFloat();
    }
}
