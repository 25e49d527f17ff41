package com.swatcl.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

import com.swatcl.debug.Debug;
import com.swatcl.script.parser.ExprNode.CommandRef;
import com.swatcl.script.parser.ExprNode.Function;
import com.swatcl.script.parser.ExprNode.FunctionMarker;
import com.swatcl.script.parser.ExprNode.GroupMarker;
import com.swatcl.script.parser.ExprNode.Interpolation;
import com.swatcl.script.parser.ExprNode.Literal;
import com.swatcl.script.parser.ExprNode.Node;
import com.swatcl.script.parser.ExprNode.Operator;
import com.swatcl.script.parser.ExprNode.VariableRef;

/**
 * Builds an expression tree from the expression-mode token stream using two
 * stacks: one holding trees under construction (arguments), the other
 * holding operators and the markers for open parentheses and function
 * argument lists.
 *
 * Every token either pushes onto one of the stacks or reduces them by
 * combining the top operator with its operands. The search state records
 * whether an argument or an operator is expected next, which is what tells a
 * unary minus from a binary one.
 *
 * A parser is good for one expression; create a new one per call.
 */
public class ExprParser {

    public static final int DEFAULT_MAX_OPERATORS = 500;

    private static final String TAG = "swatcl.parser";

    private enum SearchState { EXPECT_ARGUMENT, EXPECT_OPERATOR }

    private final Lexer lexer;
    private final int maxOperators;
    private final Deque<Node> arguments = new ArrayDeque<>();
    private final Deque<Node> operators = new ArrayDeque<>();
    private SearchState state = SearchState.EXPECT_ARGUMENT;
    private int functionDepth = 0;

    public ExprParser(String expression) {
        this(expression, DEFAULT_MAX_OPERATORS);
    }

    public ExprParser(String expression, int maxOperators) {
        this.lexer = Lexer.expression(expression);
        this.maxOperators = Math.max(1, maxOperators);
    }

    /** Parses the whole expression and returns the root of its tree. */
    public Node parse() {
        for (;;) {
            Token tok = lexer.next();
            switch (tok.type) {
                case ERROR:
                    // a bare word is a malformed call, not a lexical fault
                    throw new EvalException(tok.lexeme.startsWith(Lexer.MISSING_PAREN)
                            ? ErrorCode.SYNTAX : ErrorCode.LEXER, tok.lexeme);
                case EOF:
                    return handleEof();
                case VARIABLE:
                    pushArgument(new VariableRef(tok.contents()), tok);
                    break;
                case COMMAND:
                    pushArgument(new CommandRef(tok.contents()), tok);
                    break;
                case INTEGER:
                    pushArgument(new Literal(Coercion.integerValue(tok.lexeme, false)), tok);
                    break;
                case FLOAT:
                    pushArgument(new Literal(Coercion.floatValue(tok.lexeme, false)), tok);
                    break;
                case STRING:
                    pushArgument(new Literal(Value.string(Coercion.evalString(tok.lexeme))), tok);
                    break;
                case BRACE:
                    pushArgument(new Literal(Value.string(tok.contents())), tok);
                    break;
                case QUOTE:
                    pushArgument(quotedWord(tok), tok);
                    break;
                case OPERATOR:
                    handleOperator(tok.lexeme);
                    break;
                case FUNCTION:
                    handleFunction(tok);
                    break;
                case PAREN:
                    if ("(".equals(tok.lexeme)) handleOpenParen();
                    else handleCloseParen();
                    break;
                case COMMA:
                    handleComma();
                    break;
                default:
                    throw new EvalException(ErrorCode.BAD_STATE, "unexpected token in expression: " + tok);
            }
        }
    }

    // ===================== TOKEN HANDLERS =====================

    private void pushArgument(Node node, Token tok) {
        if (state == SearchState.EXPECT_OPERATOR) {
            throw new EvalException(ErrorCode.SYNTAX, "missing operator before " + tok);
        }
        arguments.push(node);
        state = SearchState.EXPECT_OPERATOR;
    }

    private void handleOperator(String op) {
        // Where an argument is expected the operator can only be a prefix one.
        int arity = (state == SearchState.EXPECT_OPERATOR) ? 2 : 1;
        Operator node = new Operator(op, arity);
        if (arity == 2) forcePrecedence(node);
        pushOperator(node);
        state = SearchState.EXPECT_ARGUMENT;
    }

    private void handleFunction(Token tok) {
        if (state == SearchState.EXPECT_OPERATOR) {
            throw new EvalException(ErrorCode.SYNTAX, "missing operator before function " + tok.lexeme);
        }
        // The marker goes on both stacks: on the argument stack it delimits the
        // arguments, on the operator stack it tells ')' that a call is closing.
        FunctionMarker marker = new FunctionMarker(tok.lexeme);
        arguments.push(marker);
        pushOperator(marker);
        functionDepth++;
        state = SearchState.EXPECT_ARGUMENT;
    }

    private void handleOpenParen() {
        if (state == SearchState.EXPECT_OPERATOR) {
            throw new EvalException(ErrorCode.SYNTAX, "missing operator before (");
        }
        pushOperator(new GroupMarker());
        state = SearchState.EXPECT_ARGUMENT;
    }

    private void handleCloseParen() {
        if (operators.isEmpty()) {
            throw new EvalException(ErrorCode.SYNTAX, "unmatched right parenthesis");
        }
        if (state == SearchState.EXPECT_ARGUMENT && !emptyCallPending()) {
            throw new EvalException(ErrorCode.SYNTAX, "missing operand before )");
        }
        while (!ExprNode.isMarker(operators.peek())) {
            reduce();
            if (operators.isEmpty()) {
                throw new EvalException(ErrorCode.SYNTAX, "unmatched right parenthesis");
            }
        }
        if (!(operators.peek() instanceof GroupMarker)) {
            throw badState("function marker without its open parenthesis");
        }
        operators.pop();

        if (operators.peek() instanceof FunctionMarker) {
            FunctionMarker marker = (FunctionMarker) operators.pop();
            Function call = new Function(marker.name);
            for (;;) {
                if (arguments.isEmpty()) throw badState("function marker missing from argument stack");
                Node arg = arguments.pop();
                if (arg == marker) break;
                if (ExprNode.isMarker(arg)) throw badState("stray marker among function arguments");
                call.prependArgument(arg);
            }
            // A finished call is a value, not an operator.
            arguments.push(call);
            functionDepth--;
        }
        state = SearchState.EXPECT_OPERATOR;
    }

    private void handleComma() {
        if (functionDepth == 0) {
            throw new EvalException(ErrorCode.SYNTAX, "found comma outside function call");
        }
        if (state == SearchState.EXPECT_ARGUMENT) {
            throw new EvalException(ErrorCode.SYNTAX, "missing function argument before ,");
        }
        while (!operators.isEmpty() && !ExprNode.isMarker(operators.peek())) {
            reduce();
        }
        if (!(operators.peek() instanceof GroupMarker) || !(secondOperator() instanceof FunctionMarker)) {
            throw new EvalException(ErrorCode.SYNTAX, "found comma outside function call");
        }
        state = SearchState.EXPECT_ARGUMENT;
    }

    private Node handleEof() {
        while (!operators.isEmpty()) {
            if (ExprNode.isMarker(operators.peek())) {
                throw new EvalException(ErrorCode.SYNTAX, "unmatched left parenthesis");
            }
            reduce();
        }
        if (arguments.isEmpty()) {
            throw new EvalException(ErrorCode.SYNTAX, "empty expression");
        }
        if (arguments.size() != 1 || ExprNode.isMarker(arguments.peek())) {
            throw badState("argument stack is not empty");
        }
        return arguments.pop();
    }

    /**
     * A quoted word: either one complete fragment (a plain string) or an
     * opening fragment followed by variables, commands and more fragments up
     * to the closing one.
     */
    private Node quotedWord(Token first) {
        if (first.closesQuote()) {
            return new Literal(Value.string(Coercion.evalString(first.contents())));
        }
        List<Node> parts = new ArrayList<>();
        addFragment(parts, first);
        for (;;) {
            Token tok = lexer.next();
            switch (tok.type) {
                case QUOTE:
                    addFragment(parts, tok);
                    if (tok.closesQuote()) return new Interpolation(parts);
                    break;
                case VARIABLE:
                    parts.add(new VariableRef(tok.contents()));
                    break;
                case COMMAND:
                    parts.add(new CommandRef(tok.contents()));
                    break;
                case ERROR:
                    throw new EvalException(ErrorCode.LEXER, tok.lexeme);
                default:
                    throw badState("unexpected token inside quoted word: " + tok);
            }
        }
    }

    private static void addFragment(List<Node> parts, Token fragment) {
        String text = Coercion.evalString(fragment.contents());
        if (!text.isEmpty()) parts.add(new Literal(Value.string(text)));
    }

    // ===================== STACK OPERATIONS =====================

    /**
     * Reduces while the operator on top binds at least as tightly as the new
     * one. Reducing on equal precedence makes operators left-associative.
     */
    private void forcePrecedence(Operator node) {
        while (!operators.isEmpty() && !ExprNode.isMarker(operators.peek())
                && node.precedence >= ((Operator) operators.peek()).precedence) {
            reduce();
        }
    }

    /**
     * Combines the top operator with its operands into one tree that goes back
     * on the argument stack. A marker on top is left for the caller.
     */
    private void reduce() {
        Node top = operators.peek();
        if (top == null || ExprNode.isMarker(top)) return;
        Operator op = (Operator) operators.pop();
        if (op.arity == 2) {
            Node right = popOperand(op);
            Node left = popOperand(op);
            op.setLeft(left);
            op.setRight(right);
        } else {
            op.setRight(popOperand(op));
        }
        arguments.push(op);
    }

    private Node popOperand(Operator op) {
        if (arguments.isEmpty() || ExprNode.isMarker(arguments.peek())) {
            throw new EvalException(ErrorCode.OPERAND, "operator " + op.op + " requires "
                    + (op.arity == 2 ? "two operands" : "an operand"));
        }
        return arguments.pop();
    }

    private void pushOperator(Node node) {
        if (operators.size() >= maxOperators) {
            throw badState("operator stack too large");
        }
        operators.push(node);
    }

    private Node secondOperator() {
        Iterator<Node> it = operators.iterator();
        if (!it.hasNext()) return null;
        it.next();
        return it.hasNext() ? it.next() : null;
    }

    /** True right after "name(" with no argument read yet. */
    private boolean emptyCallPending() {
        return operators.peek() instanceof GroupMarker
                && secondOperator() instanceof FunctionMarker
                && arguments.peek() == secondOperator();
    }

    private EvalException badState(String message) {
        dumpStacks();
        return new EvalException(ErrorCode.BAD_STATE, message);
    }

    private void dumpStacks() {
        Debug debug = Debug.get();
        if (!debug.enabled()) return;
        debug.t(TAG, "argument stack (top first): " + (arguments.isEmpty() ? "(empty)" : arguments));
        debug.t(TAG, "operator stack (top first): " + (operators.isEmpty() ? "(empty)" : operators));
    }
}
