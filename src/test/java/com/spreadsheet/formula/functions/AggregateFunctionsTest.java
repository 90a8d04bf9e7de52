package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.EvaluationException;
import com.spreadsheet.formula.models.Value;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AggregateFunctionsTest extends FunctionTestSupport {

    @Test
    void testSumAndAverage() {
        assertEquals(n(60), call("SUM", n(10), n(20), n(30)));
        assertEquals(n(0), call("SUM"));
        assertEquals(n(5), call("SUM", n(2), s("3"), s("text")));
        assertEquals(n(20), call("AVERAGE", n(10), n(20), n(30)));
        assertThrows(EvaluationException.class, () -> call("AVERAGE"));
    }

    @Test
    void testMinAndMax() {
        assertEquals(n(-2), call("MIN", n(4), n(-2), n(9)));
        assertEquals(n(9), call("MAX", n(4), n(-2), n(9)));
        assertEquals(n(3), call("MAX", n(Double.NaN), n(3)));
        assertThrows(EvaluationException.class, () -> call("MIN"));
        assertThrows(EvaluationException.class, () -> call("MAX"));
    }

    @Test
    void testCounts() {
        assertEquals(n(2), call("COUNT", n(1), s("a"), n(2), Value.EMPTY));
        assertEquals(n(3), call("COUNTA", n(1), s("a"), n(2), Value.EMPTY));
    }

    @Test
    void testSparkline() {
        assertEquals(s(" ▄█"), call("SPARKLINE", n(1), n(2), n(3)));
        assertEquals(s("▄▄"), call("SPARKLINE", n(5), n(5)));
        assertEquals(s("█ "), call("SPARKLINE", n(10), n(-10)));
        assertThrows(EvaluationException.class, () -> call("SPARKLINE"));
    }
}
