package com.swatcl.script.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.swatcl.script.ExprHost;
import com.swatcl.script.SwatclExpr.BuiltinFunction;
import com.swatcl.script.parser.ExprNode.CommandRef;
import com.swatcl.script.parser.ExprNode.Function;
import com.swatcl.script.parser.ExprNode.FunctionMarker;
import com.swatcl.script.parser.ExprNode.GroupMarker;
import com.swatcl.script.parser.ExprNode.Interpolation;
import com.swatcl.script.parser.ExprNode.Literal;
import com.swatcl.script.parser.ExprNode.Node;
import com.swatcl.script.parser.ExprNode.NodeVisitor;
import com.swatcl.script.parser.ExprNode.Operator;
import com.swatcl.script.parser.ExprNode.VariableRef;

/**
 * Walks an expression tree and computes its value. Variables and nested
 * commands are resolved through the host; functions through the function
 * table. The first failure aborts the walk.
 */
public class Evaluator implements NodeVisitor<Value> {
    private final ExprHost host;
    private final Map<String, BuiltinFunction> functions;

    public Evaluator(ExprHost host, Map<String, BuiltinFunction> functions) {
        this.host = host;
        this.functions = functions;
    }

    public Value evaluate(Node root) {
        return root.accept(this);
    }

    @Override
    public Value visitLiteral(Literal node) {
        return node.value;
    }

    @Override
    public Value visitVariableRef(VariableRef node) {
        return Coercion.coerceNumber(variableText(node.name));
    }

    @Override
    public Value visitCommandRef(CommandRef node) {
        return Coercion.coerceNumber(commandText(node.script));
    }

    @Override
    public Value visitInterpolation(Interpolation node) {
        StringBuilder sb = new StringBuilder();
        for (Node part : node.parts) {
            // substituted text is spliced verbatim, never reformatted as a number
            if (part instanceof VariableRef) sb.append(variableText(((VariableRef) part).name));
            else if (part instanceof CommandRef) sb.append(commandText(((CommandRef) part).script));
            else sb.append(part.accept(this));
        }
        return Value.string(sb.toString());
    }

    @Override
    public Value visitOperator(Operator node) {
        if (!Operators.isSupported(node.op, node.arity)) {
            throw Operators.unsupported(node.op, node.arity);
        }
        if (node.arity == 1) {
            return Operators.unary(node.op, evaluate(node.right()));
        }
        if ("&&".equals(node.op)) {
            if (!Operators.truth(node.op, evaluate(node.left()))) return Value.FALSE;
            return Value.bool(Operators.truth(node.op, evaluate(node.right())));
        }
        if ("||".equals(node.op)) {
            if (Operators.truth(node.op, evaluate(node.left()))) return Value.TRUE;
            return Value.bool(Operators.truth(node.op, evaluate(node.right())));
        }
        Value left = evaluate(node.left());
        Value right = evaluate(node.right());
        return Operators.binary(node.op, left, right);
    }

    @Override
    public Value visitFunction(Function node) {
        BuiltinFunction fn = functions.get(node.name);
        if (fn == null) {
            throw new EvalException(ErrorCode.FUNCTION, "unsupported function \"" + node.name + "\"");
        }
        List<Value> args = new ArrayList<>(node.arguments().size());
        for (Node arg : node.arguments()) {
            args.add(Coercion.coerce(evaluate(arg)));
        }
        return fn.call(args);
    }

    @Override
    public Value visitGroupMarker(GroupMarker node) {
        throw new EvalException(ErrorCode.BAD_STATE, "parenthesis marker left in expression tree");
    }

    @Override
    public Value visitFunctionMarker(FunctionMarker node) {
        throw new EvalException(ErrorCode.BAD_STATE, "function marker " + node.name + "( left in expression tree");
    }

    // ===================== HOST CALLS =====================

    private String variableText(String name) {
        String text;
        try {
            text = host.getVariable(name);
        } catch (EvalException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvalException(ErrorCode.VARIABLE, "can't read \"" + name + "\": " + reason(e), e);
        }
        if (text == null) {
            throw new EvalException(ErrorCode.VARIABLE, "can't read \"" + name + "\": no such variable");
        }
        return text;
    }

    private String commandText(String script) {
        String text;
        try {
            text = host.evaluateCommand(script);
        } catch (EvalException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvalException(ErrorCode.COMMAND, "command [" + script + "] failed: " + reason(e), e);
        }
        return (text == null) ? "" : text;
    }

    private static String reason(RuntimeException e) {
        return (e.getMessage() == null) ? e.toString() : e.getMessage();
    }
}
