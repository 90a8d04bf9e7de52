package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.EvaluationException;
import com.spreadsheet.formula.exceptions.UrlFetchException;
import com.spreadsheet.formula.models.Value;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class WebFunctionsTest extends FunctionTestSupport {

    @Test
    void testGetReturnsBody() {
        assertEquals(s("body of https://example.com/data"), call("GET", s(" https://example.com/data ")));
    }

    @Test
    void testGetRequiresUrl() {
        assertThrows(EvaluationException.class, () -> call("GET", s("")));
        assertThrows(EvaluationException.class, () -> call("GET"));
    }

    @Test
    void testFetchFailureBecomesEvaluationError() {
        FunctionRegistry failing = FunctionRegistry.withBuiltins(url -> {
            throw new UrlFetchException("connection refused", null);
        }, Clock.systemUTC());

        EvaluationException ex = assertThrows(EvaluationException.class, () ->
                failing.lookup("GET").get().apply(Collections.singletonList(Value.string("http://localhost:1"))));
        assertEquals("GET failed: connection refused", ex.getMessage());
        assertTrue(ex.getCause() instanceof UrlFetchException);
    }
}
