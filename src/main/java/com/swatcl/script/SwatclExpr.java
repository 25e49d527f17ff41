package com.swatcl.script;

import java.util.List;
import java.util.Map;

import com.swatcl.debug.Debug;
import com.swatcl.script.parser.EvalException;
import com.swatcl.script.parser.Evaluator;
import com.swatcl.script.parser.ExprNode.Node;
import com.swatcl.script.parser.ExprParser;
import com.swatcl.script.parser.Value;
import com.swatcl.script.plugins.MathFunctions;

/**
 * Core SwaTcl expression engine.
 *
 * - Tcl expression syntax: operators, grouping, math functions
 * - Operands: numbers (int, octal, hex, float), $var, ${var}, [command], {literal}, "quoted $subst"
 * - Values: 64-bit integer, double, string; booleans are 1 and 0
 * - Variables and nested commands are resolved through the injected {@link ExprHost}
 *
 * Each call to {@link #evaluate(String)} builds its own lexer, parser and
 * evaluator, so hosts may re-enter the engine from their callbacks.
 */
public class SwatclExpr {

    /** Functional interface for expression functions such as abs() or max(). */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    private static final String TAG = "swatcl.expr";

    private final ExprHost host;
    private final Map<String, BuiltinFunction> functions;
    private int maxOperatorStack = ExprParser.DEFAULT_MAX_OPERATORS;

    public SwatclExpr(ExprHost host) {
        if (host == null) throw new IllegalArgumentException("host is null");
        this.host = host;
        this.functions = MathFunctions.table();
    }

    /** Upper bound on pending operators and parentheses within one expression. */
    public void setMaxOperatorStack(int max) {
        this.maxOperatorStack = (max <= 0) ? ExprParser.DEFAULT_MAX_OPERATORS : max;
    }

    public int getMaxOperatorStack() { return maxOperatorStack; }

    public ExprHost getHost() { return host; }

    /**
     * Parses the expression into a tree without evaluating it.
     *
     * @throws EvalException on lexical or syntax errors
     */
    public Node parse(String expression) {
        return new ExprParser(expression, maxOperatorStack).parse();
    }

    /**
     * Parses and evaluates the expression.
     *
     * @throws EvalException on the first failure; no partial result is produced
     */
    public Value evaluate(String expression) {
        Debug.get().t(TAG, "evaluate: " + expression);
        Node root = parse(expression);
        Value result = new Evaluator(host, functions).evaluate(root);
        Debug.get().t(TAG, "result: " + result);
        return result;
    }
}
