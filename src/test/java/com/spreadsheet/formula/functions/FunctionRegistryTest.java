package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.models.Value;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class FunctionRegistryTest extends FunctionTestSupport {

    @Test
    void testBuiltinsAreRegistered() {
        for (String name : Arrays.asList("SUM", "AVERAGE", "MIN", "MAX", "COUNT", "COUNTA", "SPARKLINE",
                "IF", "AND", "OR", "NOT", "ABS", "ROUND", "SQRT", "MOD", "POWER", "CEILING", "FLOOR",
                "INT", "SIGN", "LN", "LOG", "EXP", "RAND", "RANDBETWEEN", "CONCAT", "LEN", "UPPER",
                "LOWER", "TRIM", "PROPER", "CLEAN", "CODE", "CHAR", "LEFT", "RIGHT", "MID", "FIND",
                "SUBSTITUTE", "REPLACE", "REPT", "EXACT", "ISBLANK", "ISNUMBER", "ISTEXT", "TYPE",
                "TEXT", "VALUE", "NUMBERVALUE", "GET")) {
            assertTrue(registry.contains(name), name);
        }
    }

    @Test
    void testLookupIsCaseInsensitive() {
        assertTrue(registry.lookup("sum").isPresent());
        assertTrue(registry.lookup("Sum").isPresent());
        assertFalse(registry.lookup("NOSUCH").isPresent());
        assertFalse(registry.lookup(null).isPresent());
    }

    @Test
    void testRegisterReplacesExisting() {
        FunctionRegistry custom = new FunctionRegistry();
        custom.register("double", args -> Value.number(args.get(0).toNumber() * 2));
        custom.register("DOUBLE", args -> Value.number(args.get(0).toNumber() * 3));

        assertEquals(Collections.singleton("DOUBLE"), custom.getFunctionNames());
        assertEquals(Value.number(6), custom.lookup("Double").get().apply(Collections.singletonList(Value.number(2))));
    }

    @Test
    void testBlankNameIsRejected() {
        FunctionRegistry custom = new FunctionRegistry();
        assertThrows(IllegalArgumentException.class, () -> custom.register(" ", args -> Value.ZERO));
        assertThrows(NullPointerException.class, () -> custom.register("X", null));
    }

    @Test
    void testNamesAreSorted() {
        String previous = "";
        for (String name : registry.getFunctionNames()) {
            assertTrue(previous.compareTo(name) < 0);
            previous = name;
        }
    }
}
