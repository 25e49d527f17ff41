import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.swatcl.debug.Debug;
import com.swatcl.debug.DebugLevel;
import com.swatcl.script.MapExprHost;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DebugTraceTest {

    @AfterEach
    void resetSink() {
        Debug.get().setSink(null);
        Debug.get().setThreshold(DebugLevel.TRACE);
    }

    @Test
    void defaultSink_isSilentAndEvaluationWorks() {
        assertFalse(Debug.get().enabled());
        assertEquals(3L, new MapExprHost().evaluate("1 + 2").asInt());
        assertEquals(42L, new MapExprHost().evaluate("max(6 * 7, 1)").asInt());
    }

    @Test
    void noSink_isDisabled() {
        Debug.get().setSink(null);
        assertFalse(Debug.get().enabled());
        Debug.get().t("swatcl.expr", "dropped");
    }

    @Test
    void evaluation_isTracedUnderExprTag() {
        List<String> records = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> records.add(level + " " + tag + " " + message));
        assertTrue(Debug.get().enabled());

        new MapExprHost().evaluate("2 * 21");

        assertTrue(records.contains(DebugLevel.TRACE + " swatcl.expr evaluate: 2 * 21"), records.toString());
        assertTrue(records.contains(DebugLevel.TRACE + " swatcl.expr result: 42"), records.toString());
    }

    @Test
    void failedEvaluation_isNotLoggedAsError() {
        List<DebugLevel> levels = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> levels.add(level));

        assertThrows(RuntimeException.class, () -> new MapExprHost().evaluate("1 +"));
        assertFalse(levels.contains(DebugLevel.ERROR));
    }

    @Test
    void threshold_dropsLowerLevels() {
        List<DebugLevel> levels = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> levels.add(level));
        Debug.get().setThreshold(DebugLevel.DEBUG);

        new MapExprHost().evaluate("1 + 1");
        Debug.get().d("test", "kept");

        assertEquals(List.of(DebugLevel.DEBUG), levels);
        assertFalse(Debug.get().enabled());
        assertTrue(Debug.get().enabled(DebugLevel.WARN));
    }

    @Test
    void parseLevel() {
        assertEquals(DebugLevel.DEBUG, Debug.parseLevel("debug"));
        assertEquals(DebugLevel.WARN, Debug.parseLevel(" Warn "));
        assertEquals(DebugLevel.TRACE, Debug.parseLevel("1"));
        assertEquals(DebugLevel.TRACE, Debug.parseLevel(null));
    }
}
