package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.EvaluationException;
import com.spreadsheet.formula.models.Value;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogicalFunctionsTest extends FunctionTestSupport {

    @Test
    void testIf() {
        assertEquals(s("yes"), call("IF", n(1), s("yes"), s("no")));
        assertEquals(s("no"), call("IF", n(0), s("yes"), s("no")));
        assertEquals(s("yes"), call("IF", s("anything"), s("yes"), s("no")));
        assertEquals(s("no"), call("IF", Value.EMPTY, s("yes"), s("no")));
        assertThrows(EvaluationException.class, () -> call("IF", n(1), n(2)));
    }

    @Test
    void testAndOrNot() {
        assertEquals(Value.ONE, call("AND", n(1), s("x"), n(-3)));
        assertEquals(Value.ZERO, call("AND", n(1), n(0)));
        assertEquals(Value.ONE, call("AND"));
        assertEquals(Value.ONE, call("OR", n(0), s("x")));
        assertEquals(Value.ZERO, call("OR"));
        assertEquals(Value.ONE, call("NOT", n(0)));
        assertEquals(Value.ZERO, call("NOT", s("x")));
    }

    @Test
    void testNotArity() {
        EvaluationException ex = assertThrows(EvaluationException.class, () -> call("NOT", n(1), n(2)));
        assertEquals("NOT requires exactly 1 argument, got 2", ex.getMessage());
    }
}
