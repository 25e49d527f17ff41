import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.swatcl.script.MapExprHost;
import com.swatcl.script.json.ExprTreeJson;
import com.swatcl.script.parser.ExprNode.Node;
import com.swatcl.script.parser.Value;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class ExprTreeJsonTest {

    private static final ObjectMapper om = new ObjectMapper();

    private static JsonNode tree(String expr) {
        Node root = new MapExprHost().engine().parse(expr);
        return ExprTreeJson.toJson(root);
    }

    @Test
    void binaryOperator_leftAssociative() {
        JsonNode n = tree("1 - 2 - 3");
        assertEquals("operator", n.get("type").asText());
        assertEquals("-", n.get("op").asText());
        assertEquals(2, n.get("arity").asInt());
        assertEquals(3, n.get("right").get("value").asLong());
        JsonNode left = n.get("left");
        assertEquals("operator", left.get("type").asText());
        assertEquals(1, left.get("left").get("value").asLong());
        assertEquals(2, left.get("right").get("value").asLong());
    }

    @Test
    void unaryOperator_hasOperand() {
        JsonNode n = tree("-$x");
        assertEquals(1, n.get("arity").asInt());
        assertNull(n.get("left"));
        assertEquals("variable", n.get("operand").get("type").asText());
        assertEquals("x", n.get("operand").get("name").asText());
    }

    @Test
    void literals_carryTheirType() {
        JsonNode n = tree("max(7, 2.5, {abc}, [cmd a])");
        assertEquals("function", n.get("type").asText());
        assertEquals("max", n.get("name").asText());
        JsonNode args = n.get("args");
        assertEquals(4, args.size());
        assertEquals("int", args.get(0).get("valueType").asText());
        assertTrue(args.get(0).get("value").isIntegralNumber());
        assertEquals("float", args.get(1).get("valueType").asText());
        assertEquals(2.5, args.get(1).get("value").asDouble(), 0.0);
        assertEquals("string", args.get(2).get("valueType").asText());
        assertEquals("abc", args.get(2).get("value").asText());
        assertEquals("command", args.get(3).get("type").asText());
        assertEquals("cmd a", args.get(3).get("script").asText());
    }

    @Test
    void interpolation_listsItsParts() {
        JsonNode n = tree("\"n=$n!\"");
        assertEquals("interpolation", n.get("type").asText());
        JsonNode parts = n.get("parts");
        assertEquals(3, parts.size());
        assertEquals("n=", parts.get(0).get("value").asText());
        assertEquals("variable", parts.get(1).get("type").asText());
        assertEquals("!", parts.get(2).get("value").asText());
    }

    @Test
    void jsonString_parsesBack() throws Exception {
        Node root = new MapExprHost().engine().parse("abs(-1) + 2");
        JsonNode compact = om.readTree(ExprTreeJson.toJsonString(root, false));
        JsonNode pretty = om.readTree(ExprTreeJson.toJsonString(root, true));
        assertEquals(compact, pretty);
        assertEquals("+", compact.get("op").asText());
        assertEquals("abs", compact.get("left").get("name").asText());
    }

    @Test
    void typeNames_ignoreDefaultLocale() {
        Locale saved = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));
            assertEquals("int", tree("7").get("valueType").asText());
            assertEquals("int \"7\"", Value.integer(7).describe());
            assertEquals("string \"i\"", Value.string("i").describe());
        } finally {
            Locale.setDefault(saved);
        }
    }
}
