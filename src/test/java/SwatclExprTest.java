import org.junit.jupiter.api.Test;

import com.swatcl.script.ExprHost;
import com.swatcl.script.MapExprHost;
import com.swatcl.script.SwatclExpr;
import com.swatcl.script.parser.ErrorCode;
import com.swatcl.script.parser.EvalException;
import com.swatcl.script.parser.Value;

import static org.junit.jupiter.api.Assertions.*;

public class SwatclExprTest {

    private static Value eval(String expr) {
        return new MapExprHost().evaluate(expr);
    }

    private static void assertInt(long expected, String expr) {
        Value v = eval(expr);
        assertEquals(Value.Type.INT, v.getType(), expr + " -> " + v.describe());
        assertEquals(expected, v.asInt(), expr);
    }

    private static void assertFloat(double expected, String expr) {
        Value v = eval(expr);
        assertEquals(Value.Type.FLOAT, v.getType(), expr + " -> " + v.describe());
        assertEquals(expected, v.asFloat(), 1e-12, expr);
    }

    private static ErrorCode failure(String expr) {
        EvalException e = assertThrows(EvalException.class, () -> eval(expr), expr);
        return e.code();
    }

    @Test
    void leftAssociativity() {
        assertInt(-4, "1 - 2 - 3");
        assertInt(2, "12 / 3 / 2");
    }

    @Test
    void precedence() {
        assertInt(7, "1 + 2 * 3");
        assertInt(9, "(1 + 2) * 3");
        assertInt(0, "((1 + 1) - 2) * 3");
        assertInt(1, "1 + 2 > 2 && 4 == 2 * 2");
    }

    @Test
    void unaryBinaryDisambiguation() {
        assertInt(-1, "-1");
        assertInt(0, "1 - 1");
        assertInt(2, "1 - -1");
        assertInt(-6, "-2 * 3");

        MapExprHost host = new MapExprHost();
        host.setVariable("foo", "-123");
        Value v = host.evaluate("+${foo}");
        assertEquals(Value.integer(-123), v);
    }

    @Test
    void numericBases() {
        assertInt(1973, "0x7b5");
        assertInt(246, "0366");
        assertFloat(60000.0, "6E4");
        assertEquals("60000.0", eval("6E4").toString());
    }

    @Test
    void overflowWrapsSilently() {
        assertInt(Long.MIN_VALUE, "9223372036854775807 + 1");
        assertInt(Long.MAX_VALUE, "-9223372036854775807 - 1 - 1");
    }

    @Test
    void literalTooLarge_isRangeError() {
        assertEquals(ErrorCode.NUMBER_RANGE, failure("9223372036854775808"));
    }

    @Test
    void relationalDispatch() {
        assertEquals(Value.TRUE, eval("{abc} < {def}"));
        assertEquals(Value.FALSE, eval("5.0 < 3"));
        assertEquals(Value.TRUE, eval("10 > 9"));
        assertEquals(Value.TRUE, eval("{10} > {9}"));
        assertEquals(Value.FALSE, eval("{a10} > {a9}"));
        assertEquals(Value.TRUE, eval("1 == 1.0"));
    }

    @Test
    void mixedArithmeticWidens() {
        assertFloat(3.5, "1 + 2.5");
        assertInt(3, "7 / 2");
        assertInt(-3, "-7 / 2");
        assertFloat(3.5, "7.0 / 2");
        assertInt(1, "7 % 3");
    }

    @Test
    void divideByZero() {
        assertEquals(ErrorCode.OPERAND, failure("1 / 0"));
        assertEquals(ErrorCode.OPERAND, failure("1 % 0"));
        assertEquals("Inf", eval("1.0 / 0").toString());
    }

    @Test
    void modulo_requiresIntegers() {
        assertEquals(ErrorCode.OPERAND, failure("7.5 % 2"));
    }

    @Test
    void nonNumericOperand_isOperandError() {
        assertEquals(ErrorCode.OPERAND, failure("{abc} + 1"));
        assertEquals(ErrorCode.OPERAND, failure("-{abc}"));
    }

    @Test
    void stringComparison() {
        assertEquals(Value.TRUE, eval("{abc} eq {abc}"));
        assertEquals(Value.TRUE, eval("1 ne 1.0"));
        assertEquals(Value.FALSE, eval("{x} ne {x}"));
    }

    @Test
    void quotedWords() {
        MapExprHost host = new MapExprHost();
        host.setVariable("n", "3");
        assertEquals(Value.TRUE, host.evaluate("\"total $n items\" eq {total 3 items}"));
        assertEquals(Value.integer(13), host.evaluate("\"12\" + 1"));
        assertEquals("a\tb", host.evaluate("\"a\\tb\"").toString());
        assertEquals("${n}", host.evaluate("{${n}}").toString());
    }

    @Test
    void braceLiteral_isNotSubstituted() {
        assertEquals("$x [y]", eval("{$x [y]}").toString());
    }

    @Test
    void logicalOperators_shortCircuit() {
        MapExprHost host = new MapExprHost();
        assertEquals(Value.FALSE, host.evaluate("0 && $missing"));
        assertEquals(Value.TRUE, host.evaluate("1 || $missing"));
        assertEquals(Value.TRUE, host.evaluate("{yes} && {on}"));
        assertEquals(Value.TRUE, host.evaluate("!0"));
    }

    @Test
    void unmatchedParentheses_areSyntaxErrors() {
        assertEquals(ErrorCode.SYNTAX, failure("(1 + 2"));
        assertEquals(ErrorCode.SYNTAX, failure("1 + 2)"));
        assertEquals(ErrorCode.SYNTAX, failure(")"));
    }

    @Test
    void commaOutsideCall_isSyntaxError() {
        assertEquals(ErrorCode.SYNTAX, failure("1, 2"));
        assertEquals(ErrorCode.SYNTAX, failure("max((1, 2))"));
        assertEquals(ErrorCode.SYNTAX, failure("max(1,)"));
    }

    @Test
    void bareWord_isSyntaxError() {
        assertEquals(ErrorCode.SYNTAX, failure("abc"));
    }

    @Test
    void missingOperand_andMissingOperator() {
        assertEquals(ErrorCode.OPERAND, failure("1 +"));
        assertEquals(ErrorCode.SYNTAX, failure("1 2"));
        assertEquals(ErrorCode.SYNTAX, failure(""));
        assertEquals(ErrorCode.SYNTAX, failure("()"));
    }

    @Test
    void unterminatedConstructs_areLexerErrors() {
        assertEquals(ErrorCode.LEXER, failure("\"foo"));
        assertEquals(ErrorCode.LEXER, failure("{foo"));
        assertEquals(ErrorCode.LEXER, failure("${foo"));
        assertEquals(ErrorCode.LEXER, failure("[foo"));
        assertEquals(ErrorCode.LEXER, failure("1 ; 2"));
    }

    @Test
    void unsupportedOperators() {
        assertEquals(ErrorCode.OPERATOR, failure("1 ? 2 : 3"));
        assertEquals(ErrorCode.OPERATOR, failure("{a} in {a b}"));
        assertEquals(ErrorCode.OPERATOR, failure("1 = 2"));
    }

    @Test
    void unknownFunction() {
        assertEquals(ErrorCode.FUNCTION, failure("nope(1)"));
    }

    @Test
    void unknownVariable() {
        EvalException e = assertThrows(EvalException.class, () -> eval("$nope + 1"));
        assertEquals(ErrorCode.VARIABLE, e.code());
        assertTrue(e.getMessage().contains("no such variable"), e.getMessage());
    }

    @Test
    void hostFailures_areWrapped() {
        ExprHost failing = new ExprHost() {
            @Override
            public String getVariable(String name) {
                throw new IllegalStateException("store offline");
            }

            @Override
            public String evaluateCommand(String script) {
                throw new IllegalArgumentException("bad command");
            }
        };
        SwatclExpr engine = new SwatclExpr(failing);

        EvalException v = assertThrows(EvalException.class, () -> engine.evaluate("$x"));
        assertEquals(ErrorCode.VARIABLE, v.code());
        assertTrue(v.getMessage().contains("store offline"));
        assertTrue(v.getCause() instanceof IllegalStateException);

        EvalException c = assertThrows(EvalException.class, () -> engine.evaluate("[boom]"));
        assertEquals(ErrorCode.COMMAND, c.code());
        assertTrue(c.getMessage().contains("bad command"));
    }

    @Test
    void variableAndCommandResults_areCoerced() {
        ExprHost host = new ExprHost() {
            @Override
            public String getVariable(String name) {
                return "0x10";
            }

            @Override
            public String evaluateCommand(String script) {
                return "2.5";
            }
        };
        SwatclExpr engine = new SwatclExpr(host);
        assertEquals(Value.integer(16), engine.evaluate("$a"));
        assertEquals(Value.floating(5.0), engine.evaluate("[anything] * 2"));
    }

    @Test
    void operatorStackLimit() {
        SwatclExpr engine = new MapExprHost().engine();
        engine.setMaxOperatorStack(4);
        assertEquals(4, engine.getMaxOperatorStack());
        assertEquals(Value.integer(3), engine.evaluate("1 + 2"));
        EvalException e = assertThrows(EvalException.class, () -> engine.evaluate("((((((1))))))"));
        assertEquals(ErrorCode.BAD_STATE, e.code());
    }

    @Test
    void nullHost_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SwatclExpr(null));
    }
}
