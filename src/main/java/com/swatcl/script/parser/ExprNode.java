package com.swatcl.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ExprNode {

    public interface Node {
        <R> R accept(NodeVisitor<R> visitor);
    }

    public interface NodeVisitor<R> {
        R visitLiteral(Literal node);
        R visitVariableRef(VariableRef node);
        R visitCommandRef(CommandRef node);
        R visitInterpolation(Interpolation node);
        R visitOperator(Operator node);
        R visitFunction(Function node);

        // Markers only live on the parser stacks; a finished tree never holds one.
        R visitGroupMarker(GroupMarker node);
        R visitFunctionMarker(FunctionMarker node);
    }

    /** Markers delimit a parenthesised group or a function's argument list. */
    public static boolean isMarker(Node node) {
        return node instanceof GroupMarker || node instanceof FunctionMarker;
    }

    // -------------------------
    // Leaves
    // -------------------------

    public static final class Literal implements Node {
        public final Value value;

        public Literal(Value value) {
            this.value = value;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitLiteral(this);
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    public static final class VariableRef implements Node {
        public final String name;

        public VariableRef(String name) {
            this.name = name;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitVariableRef(this);
        }

        @Override
        public String toString() {
            return "$" + name;
        }
    }

    public static final class CommandRef implements Node {
        public final String script;

        public CommandRef(String script) {
            this.script = script;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitCommandRef(this);
        }

        @Override
        public String toString() {
            return "[" + script + "]";
        }
    }

    /** A double-quoted word with substitutions: "total $n items". */
    public static final class Interpolation implements Node {
        public final List<Node> parts;

        public Interpolation(List<Node> parts) {
            this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitInterpolation(this);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("\"");
            for (Node part : parts) sb.append(part);
            return sb.append('"').toString();
        }
    }

    // -------------------------
    // Operators and functions
    // -------------------------

    public static final class Operator implements Node {
        public final String op;
        public final int arity;
        public final int precedence;
        private Node left;
        private Node right;

        public Operator(String op, int arity) {
            this.op = op;
            this.arity = arity;
            this.precedence = precedenceOf(op, arity);
        }

        public Node left() { return left; }
        public Node right() { return right; }

        void setLeft(Node left) { this.left = left; }
        void setRight(Node right) { this.right = right; }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitOperator(this);
        }

        @Override
        public String toString() {
            if (arity == 1) return "(" + op + right + ")";
            return "(" + left + " " + op + " " + right + ")";
        }

        /**
         * Binding strength of an operator; lower numbers bind tighter. Only
         * the relative order matters.
         */
        public static int precedenceOf(String op, int arity) {
            switch (op) {
                case "~": case "!":
                    return 1;
                case "+": case "-":
                    return arity == 1 ? 1 : 4;
                case "**":
                    return 2;
                case "*": case "/": case "%":
                    return 3;
                case "<<": case ">>":
                    return 5;
                case "<": case ">": case "<=": case ">=":
                    return 6;
                case "==": case "!=":
                    return 7;
                case "eq": case "ne": case "in": case "ni":
                    return 8;
                case "&":
                    return 9;
                case "^":
                    return 10;
                case "|":
                    return 11;
                case "&&":
                    return 12;
                case "||":
                    return 13;
                default:
                    // '?', ':', '=' and anything unknown: loosest, rejected at evaluation
                    return 14;
            }
        }
    }

    public static final class Function implements Node {
        public final String name;
        private final List<Node> arguments = new ArrayList<>();

        public Function(String name) {
            this.name = name;
        }

        public List<Node> arguments() {
            return Collections.unmodifiableList(arguments);
        }

        /** Arguments come off the parser stack last-first, so each one goes to the front. */
        void prependArgument(Node arg) {
            arguments.add(0, arg);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitFunction(this);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(name).append('(');
            for (int i = 0; i < arguments.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(arguments.get(i));
            }
            return sb.append(')').toString();
        }
    }

    // -------------------------
    // Stack markers
    // -------------------------

    public static final class GroupMarker implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitGroupMarker(this);
        }

        @Override
        public String toString() {
            return "(";
        }
    }

    public static final class FunctionMarker implements Node {
        public final String name;

        public FunctionMarker(String name) {
            this.name = name;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitFunctionMarker(this);
        }

        @Override
        public String toString() {
            return name + "(";
        }
    }
}
