package com.spreadsheet.formula.models;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CellAddressTest {

    @Test
    void testColumnLabels() {
        assertEquals("A", CellAddress.columnLabel(0));
        assertEquals("Z", CellAddress.columnLabel(25));
        assertEquals("AA", CellAddress.columnLabel(26));
        assertEquals("AZ", CellAddress.columnLabel(51));
        assertEquals("BA", CellAddress.columnLabel(52));
        assertEquals("ZZ", CellAddress.columnLabel(701));
        assertEquals("AAA", CellAddress.columnLabel(702));
        assertThrows(IllegalArgumentException.class, () -> CellAddress.columnLabel(-1));
    }

    @Test
    void testColumnLabelsAreDistinct() {
        Set<String> labels = new HashSet<>();
        for (int col = 0; col < 20_000; col++) {
            assertTrue(labels.add(CellAddress.columnLabel(col)), "duplicate label for column " + col);
        }
    }

    @Test
    void testLabelRoundTrip() {
        for (int row = 0; row < 50; row++) {
            for (int col = 0; col < 800; col += 7) {
                String label = CellAddress.columnLabel(col) + (row + 1);
                assertEquals(Optional.of(CellAddress.of(row, col)), CellAddress.parse(label));
            }
        }
    }

    @Test
    void testParse() {
        assertEquals(CellAddress.of(0, 0), CellAddress.parse("A1").get());
        assertEquals(CellAddress.of(11, 27), CellAddress.parse("AB12").get());
        assertEquals(CellAddress.of(6, 1), CellAddress.parse("b7").get());
        assertEquals("B7", CellAddress.parse("b7").get().getLabel());
    }

    @Test
    void testParseRejectsMalformedReferences() {
        assertFalse(CellAddress.parse(null).isPresent());
        assertFalse(CellAddress.parse("").isPresent());
        assertFalse(CellAddress.parse("A").isPresent());
        assertFalse(CellAddress.parse("12").isPresent());
        assertFalse(CellAddress.parse("1A").isPresent());
        assertFalse(CellAddress.parse("A1B").isPresent());
        assertFalse(CellAddress.parse("A0").isPresent());
        assertFalse(CellAddress.parse("A-1").isPresent());
        assertFalse(CellAddress.parse("A99999999999").isPresent());
        assertFalse(CellAddress.parse("ZZZZZZZZZZ1").isPresent());
    }

    @Test
    void testLargestRowRoundTrips() {
        assertFalse(CellAddress.parse("A2147483648").isPresent());

        CellAddress last = CellAddress.parse("A2147483647").orElseThrow();
        assertEquals(Integer.MAX_VALUE - 1, last.getRow());
        assertEquals("A2147483647", last.getLabel());
        assertEquals(last, last.offset(10, 0));
        assertEquals("A2147483647", CellAddress.of(1, 0).offset(Integer.MAX_VALUE, 0).getLabel());
    }

    @Test
    void testOffsetClampsAtZero() {
        CellAddress b2 = CellAddress.of(1, 1);
        assertEquals(CellAddress.of(3, 2), b2.offset(2, 1));
        assertEquals(CellAddress.of(0, 0), b2.offset(-5, -5));
    }

    @Test
    void testRowMajorOrdering() {
        assertTrue(CellAddress.of(0, 5).compareTo(CellAddress.of(1, 0)) < 0);
        assertTrue(CellAddress.of(2, 1).compareTo(CellAddress.of(2, 0)) > 0);
        assertEquals(0, CellAddress.of(3, 3).compareTo(CellAddress.of(3, 3)));
    }
}
