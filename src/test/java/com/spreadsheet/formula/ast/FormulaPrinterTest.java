package com.spreadsheet.formula.ast;

import com.spreadsheet.formula.parser.Parser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FormulaPrinterTest {

    private static String reprint(String formula) {
        return FormulaPrinter.print(new Parser(formula).parse());
    }

    @Test
    void testDropsRedundantParentheses() {
        assertEquals("1+2*3", reprint("1 + (2 * 3)"));
        assertEquals("SUM(A1:B2,3)", reprint("sum( a1 : b2 , 3 )"));
    }

    @Test
    void testKeepsRequiredParentheses() {
        assertEquals("(1+2)*3", reprint("(1 + 2) * 3"));
        assertEquals("10-(4-3)", reprint("10 - (4 - 3)"));
        assertEquals("(2**3)**2", reprint("(2 ^ 3) ^ 2"));
        assertEquals("2**3**2", reprint("2 ^ (3 ^ 2)"));
        assertEquals("-(1+2)", reprint("-(1 + 2)"));
    }

    @Test
    void testLiterals() {
        assertEquals("\"say \"\"hi\"\"\"&A1", reprint("\"say \"\"hi\"\"\" & A1"));
        assertEquals("2.5", reprint("2.50"));
    }

    @Test
    void testPrintedFormulaParsesToSameTree() {
        String[] formulas = {
                "IF(A1>=2,\"big\",\"small\")&\"!\"",
                "1-2-3",
                "(1=2)=0",
                "--A1%3",
                "MID(\"Hello World\",6,5)"
        };
        for (String formula : formulas) {
            Expr parsed = new Parser(formula).parse();
            assertEquals(parsed, new Parser(FormulaPrinter.print(parsed)).parse(), formula);
        }
    }
}
