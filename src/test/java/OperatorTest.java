import org.junit.jupiter.api.Test;

import com.swatcl.script.MapExprHost;
import com.swatcl.script.parser.ErrorCode;
import com.swatcl.script.parser.EvalException;
import com.swatcl.script.parser.Value;

import static org.junit.jupiter.api.Assertions.*;

public class OperatorTest {

    private final MapExprHost host = new MapExprHost();

    private Value eval(String expr) {
        return host.evaluate(expr);
    }

    private ErrorCode failure(String expr) {
        return assertThrows(EvalException.class, () -> eval(expr), expr).code();
    }

    @Test
    void power() {
        assertEquals(Value.integer(1024), eval("2 ** 10"));
        assertEquals(Value.integer(-8), eval("-2 ** 3"));
        assertEquals(Value.floating(0.25), eval("2.0 ** -2"));
        assertEquals(Value.integer(0), eval("2 ** -1"));
        assertEquals(Value.integer(-1), eval("-1 ** -3"));
        assertEquals(ErrorCode.OPERAND, failure("0 ** -1"));
    }

    @Test
    void power_bindsTighterThanMultiplication() {
        assertEquals(Value.integer(18), eval("2 * 3 ** 2"));
    }

    @Test
    void shifts() {
        assertEquals(Value.integer(40), eval("5 << 3"));
        assertEquals(Value.integer(-4), eval("-16 >> 2"));
        assertEquals(Value.integer(0), eval("1 << 64"));
        assertEquals(ErrorCode.OPERAND, failure("1 << -1"));
        assertEquals(ErrorCode.OPERAND, failure("1.5 << 1"));
    }

    @Test
    void shift_bindsLooserThanAddition() {
        assertEquals(Value.integer(16), eval("1 << 2 + 2"));
    }

    @Test
    void bitwise() {
        assertEquals(Value.integer(8), eval("12 & 10"));
        assertEquals(Value.integer(6), eval("12 ^ 10"));
        assertEquals(Value.integer(14), eval("12 | 10"));
        assertEquals(Value.integer(-1), eval("~0"));
        assertEquals(Value.integer(13), eval("1 | 4 & 6 ^ 8"));
    }

    @Test
    void bitwise_rejectsFloats() {
        assertEquals(ErrorCode.OPERAND, failure("1.0 & 1"));
        assertEquals(ErrorCode.OPERAND, failure("~1.5"));
    }

    @Test
    void comparisonResultsAreIntegers() {
        assertEquals(Value.TRUE, eval("2 >= 2"));
        assertEquals(Value.TRUE, eval("2 <= 3"));
        assertEquals(Value.FALSE, eval("2 != 2.0"));
        assertEquals(Value.integer(2), eval("(1 < 2) + (3 > 2)"));
    }

    @Test
    void logicalNot_onBooleanWords() {
        assertEquals(Value.FALSE, eval("!{yes}"));
        assertEquals(Value.TRUE, eval("!!5"));
        assertEquals(ErrorCode.OPERAND, failure("!{maybe}"));
    }

    @Test
    void logical_rejectsNonBooleans() {
        assertEquals(ErrorCode.OPERAND, failure("{maybe} && 1"));
        assertEquals(ErrorCode.OPERAND, failure("0 || {maybe}"));
    }

    @Test
    void unaryPlus_requiresNumber() {
        assertEquals(Value.floating(2.5), eval("+2.5"));
        assertEquals(ErrorCode.OPERAND, failure("+{x}"));
    }
}
