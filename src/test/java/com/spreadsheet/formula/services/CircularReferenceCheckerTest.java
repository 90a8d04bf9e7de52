package com.spreadsheet.formula.services;

import com.spreadsheet.formula.config.FormulaProperties;
import com.spreadsheet.formula.exceptions.CircularReferenceException;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.CellData;
import com.spreadsheet.formula.models.Spreadsheet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class CircularReferenceCheckerTest {

    private static final CellAddress A1 = CellAddress.of(0, 0);
    private static final CellAddress B1 = CellAddress.of(0, 1);
    private static final CellAddress C1 = CellAddress.of(0, 2);

    private CircularReferenceChecker checker;
    private Spreadsheet grid;

    @BeforeEach
    void setUp() {
        checker = new CircularReferenceChecker(new FormulaProperties());
        grid = new Spreadsheet();
    }

    private void formula(CellAddress address, String text) {
        grid.setCell(address, CellData.ofFormula("", text));
    }

    @Test
    void testExtractReferences() {
        assertEquals(Arrays.asList(A1, B1, CellAddress.of(9, 2)),
                CircularReferenceChecker.extractReferences("=SUM(A1:B1)+c10"));
        // Text inside string literals is scanned too
        assertEquals(Arrays.asList(A1), CircularReferenceChecker.extractReferences("=\"A1\""));
        assertTrue(CircularReferenceChecker.extractReferences("=SUM(1,2)").isEmpty());
        assertTrue(CircularReferenceChecker.extractReferences(null).isEmpty());
    }

    @Test
    void testPlainTextIsNeverCircular() {
        assertFalse(checker.wouldCreateCircularReference("A1", A1, grid));
        assertFalse(checker.wouldCreateCircularReference("", A1, grid));
    }

    @Test
    void testSelfReference() {
        assertTrue(checker.wouldCreateCircularReference("=A1+1", A1, grid));
        assertTrue(checker.wouldCreateCircularReference("=SUM(A1:C3)", B1, grid));
    }

    @Test
    void testIndirectCycle() {
        formula(B1, "=C1*2");
        formula(C1, "=A1+1");
        assertTrue(checker.wouldCreateCircularReference("=B1", A1, grid));
    }

    @Test
    void testReferencesToPlainCellsAreNotCircular() {
        grid.setCell(B1, CellData.ofValue("=A1 looks like a formula but is stored as text"));
        assertFalse(checker.wouldCreateCircularReference("=B1", A1, grid));
    }

    @Test
    void testDiamondIsNotCircular() {
        // A1 -> B1, A1 -> C1, B1 -> D1, C1 -> D1
        formula(B1, "=D1");
        formula(C1, "=D1+1");
        assertFalse(checker.wouldCreateCircularReference("=B1+C1", A1, grid));
    }

    @Test
    void testExistingCycleElsewhereTerminates() {
        formula(B1, "=C1");
        formula(C1, "=B1");
        assertFalse(checker.wouldCreateCircularReference("=B1", A1, grid));
    }

    @Test
    void testLongChainBeyondLimitIsTreatedAsCircular() {
        FormulaProperties properties = new FormulaProperties();
        properties.setMaxDepth(10);
        CircularReferenceChecker limited = new CircularReferenceChecker(properties);

        // A2 -> A3 -> ... -> A30, none of which reaches B1
        for (int row = 1; row < 30; row++) {
            formula(CellAddress.of(row, 0), "=A" + (row + 2));
        }
        assertTrue(limited.wouldCreateCircularReference("=A2", B1, grid));
        assertFalse(checker.wouldCreateCircularReference("=A2", B1, grid));
    }

    @Test
    void testHugeRangeIsNotExpanded() {
        formula(CellAddress.of(49, 2), "=A1");
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            assertTrue(checker.wouldCreateCircularReference("=SUM(A1:ZZZ1000000)", A1, grid));
            assertFalse(checker.wouldCreateCircularReference("=SUM(B1:ZZZ1000000)", A1, new Spreadsheet()));
            // C50 lies inside the range and reads A1
            assertTrue(checker.wouldCreateCircularReference("=SUM(B2:ZZZ1000000)", A1, grid));
            assertFalse(checker.wouldCreateCircularReference("=SUM(D2:ZZZ1000000)", A1, grid));
        });
    }

    @Test
    void testLongChainDoesNotOverflow() {
        formula(B1, "=A1");
        assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
            assertFalse(checker.wouldCreateCircularReference("=" + "1+".repeat(100_000) + "1", A1, grid));
            assertTrue(checker.wouldCreateCircularReference("=" + "B1+".repeat(100_000) + "1", A1, grid));
            assertFalse(checker.wouldCreateCircularReference("=" + "C1+".repeat(100_000) + "1", A1, grid));
        });
    }

    @Test
    void testCheckThrows() {
        CircularReferenceException ex = assertThrows(CircularReferenceException.class, () ->
                checker.check("=A1", A1, grid));
        assertTrue(ex.getMessage().contains("A1"));
        checker.check("=B1", A1, grid);
    }
}
