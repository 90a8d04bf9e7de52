package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.EvaluationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextFunctionsTest extends FunctionTestSupport {

    @Test
    void testConcatAndLen() {
        assertEquals(s("ab3"), call("CONCAT", s("a"), s("b"), n(3)));
        assertEquals(s(""), call("CONCAT"));
        assertEquals(n(5), call("LEN", s("Hello")));
        assertEquals(n(2), call("LEN", s("😀x")));
        assertEquals(n(3), call("LEN", n(1.5)));
    }

    @Test
    void testCaseAndCleanup() {
        assertEquals(s("HELLO"), call("UPPER", s("Hello")));
        assertEquals(s("hello"), call("LOWER", s("HeLLo")));
        assertEquals(s("a b"), call("TRIM", s("  a b \t")));
        assertEquals(s("Hello World-Wide"), call("PROPER", s("hELLO world-wide")));
        assertEquals(s("ab"), call("CLEAN", s("a\u0007b\n")));
    }

    @Test
    void testCodeAndChar() {
        assertEquals(n(65), call("CODE", s("ABC")));
        assertEquals(s("A"), call("CHAR", n(65)));
        assertThrows(EvaluationException.class, () -> call("CODE", s("")));
        assertThrows(EvaluationException.class, () -> call("CHAR", n(-1)));
        assertThrows(EvaluationException.class, () -> call("CHAR", n(0xD800)));
    }

    @Test
    void testSlicing() {
        assertEquals(s("Hel"), call("LEFT", s("Hello"), n(3)));
        assertEquals(s("Hello"), call("LEFT", s("Hello"), n(99)));
        assertEquals(s(""), call("LEFT", s("Hello"), n(-2)));
        assertEquals(s("llo"), call("RIGHT", s("Hello"), n(3)));
        assertEquals(s("World"), call("MID", s("Hello World"), n(6), n(5)));
        assertEquals(s("d"), call("MID", s("Hello World"), n(10), n(5)));
        assertEquals(s(""), call("MID", s("Hello"), n(50), n(2)));
    }

    @Test
    void testFind() {
        assertEquals(n(3), call("FIND", s("lo"), s("Hello")));
        assertEquals(n(0), call("FIND", s(""), s("Hello")));
        assertEquals(n(7), call("FIND", s("o"), s("Hello World"), n(5)));
        EvaluationException missing = assertThrows(EvaluationException.class, () -> call("FIND", s("z"), s("Hello")));
        assertEquals("FIND could not find \"z\"", missing.getMessage());
        assertThrows(EvaluationException.class, () -> call("FIND", s("o"), s("Hello"), n(6)));
    }

    @Test
    void testSubstituteReplaceRept() {
        assertEquals(s("a-b-c"), call("SUBSTITUTE", s("a b c"), s(" "), s("-")));
        assertEquals(s("HeXXo"), call("REPLACE", s("Hello"), n(3), n(2), s("XX")));
        assertEquals(s("Hello!"), call("REPLACE", s("Hello"), n(10), n(1), s("!")));
        assertEquals(s("ababab"), call("REPT", s("ab"), n(3)));
        assertEquals(s(""), call("REPT", s("ab"), n(0)));
        assertThrows(EvaluationException.class, () -> call("REPT", s("ab"), n(1e9)));
    }

    @Test
    void testExact() {
        assertEquals(n(1), call("EXACT", s("a"), s("a")));
        assertEquals(n(0), call("EXACT", s("a"), s("A")));
        assertEquals(n(1), call("EXACT", n(2), s("2")));
    }
}
