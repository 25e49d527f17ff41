package com.swatcl.script.json;

import java.io.UncheckedIOException;
import java.util.Locale;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.swatcl.script.parser.ErrorCode;
import com.swatcl.script.parser.EvalException;
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
import com.swatcl.script.parser.Value;

/**
 * Renders a parsed expression tree as JSON, one object per node:
 *
 *   {"type":"operator","op":"+","arity":2,"left":{...},"right":{...}}
 *   {"type":"function","name":"max","args":[...]}
 *   {"type":"literal","valueType":"int","value":42}
 *   {"type":"variable","name":"x"}
 *   {"type":"command","script":"llength $l"}
 *   {"type":"interpolation","parts":[...]}
 *
 * Unary operators carry their operand under "operand".
 */
public final class ExprTreeJson implements NodeVisitor<ObjectNode> {

    private static final ObjectMapper om = new ObjectMapper();

    private ExprTreeJson() {}

    public static ObjectNode toJson(Node root) {
        return root.accept(new ExprTreeJson());
    }

    public static String toJsonString(Node root, boolean pretty) {
        try {
            ObjectNode n = toJson(root);
            return pretty ? om.writerWithDefaultPrettyPrinter().writeValueAsString(n) : om.writeValueAsString(n);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public ObjectNode visitLiteral(Literal node) {
        ObjectNode o = node("literal");
        Value v = node.value;
        o.put("valueType", v.getType().name().toLowerCase(Locale.ROOT));
        switch (v.getType()) {
            case INT:
                o.put("value", v.asInt());
                break;
            case FLOAT:
                o.put("value", v.asFloat());
                break;
            default:
                o.put("value", v.asString());
        }
        return o;
    }

    @Override
    public ObjectNode visitVariableRef(VariableRef node) {
        ObjectNode o = node("variable");
        o.put("name", node.name);
        return o;
    }

    @Override
    public ObjectNode visitCommandRef(CommandRef node) {
        ObjectNode o = node("command");
        o.put("script", node.script);
        return o;
    }

    @Override
    public ObjectNode visitInterpolation(Interpolation node) {
        ObjectNode o = node("interpolation");
        ArrayNode parts = o.putArray("parts");
        for (Node part : node.parts) parts.add(part.accept(this));
        return o;
    }

    @Override
    public ObjectNode visitOperator(Operator node) {
        ObjectNode o = node("operator");
        o.put("op", node.op);
        o.put("arity", node.arity);
        if (node.arity == 1) {
            o.set("operand", node.right().accept(this));
        } else {
            o.set("left", node.left().accept(this));
            o.set("right", node.right().accept(this));
        }
        return o;
    }

    @Override
    public ObjectNode visitFunction(Function node) {
        ObjectNode o = node("function");
        o.put("name", node.name);
        ArrayNode args = o.putArray("args");
        for (Node arg : node.arguments()) args.add(arg.accept(this));
        return o;
    }

    @Override
    public ObjectNode visitGroupMarker(GroupMarker node) {
        throw new EvalException(ErrorCode.BAD_STATE, "parenthesis marker left in expression tree");
    }

    @Override
    public ObjectNode visitFunctionMarker(FunctionMarker node) {
        throw new EvalException(ErrorCode.BAD_STATE, "function marker " + node.name + "( left in expression tree");
    }

    private static ObjectNode node(String type) {
        ObjectNode o = om.createObjectNode();
        o.put("type", type);
        return o;
    }
}
