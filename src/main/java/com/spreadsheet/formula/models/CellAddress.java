package com.spreadsheet.formula.models;

import java.util.Objects;
import java.util.Optional;

/**
 * Zero-based (row, column) coordinate of a grid cell.
 * Converts to and from the textual "letters + digits" form, e.g. "AA12",
 * where the letters name the column and the digits the 1-based row.
 */
public final class CellAddress implements Comparable<CellAddress> {

    private final int row;
    private final int col;

    private CellAddress(int row, int col) {
        if (row < 0 || col < 0) {
            throw new IllegalArgumentException("Cell coordinates must be non-negative: (" + row + ", " + col + ")");
        }
        this.row = row;
        this.col = col;
    }

    public static CellAddress of(int row, int col) {
        return new CellAddress(row, col);
    }

    /**
     * Bijective base-26 column label: 0 -> "A", 25 -> "Z", 26 -> "AA".
     */
    public static String columnLabel(int col) {
        if (col < 0) {
            throw new IllegalArgumentException("Column index must be non-negative: " + col);
        }
        StringBuilder label = new StringBuilder();
        int c = col;
        while (true) {
            label.insert(0, (char) ('A' + c % 26));
            if (c < 26) {
                break;
            }
            c = c / 26 - 1;
        }
        return label.toString();
    }

    /**
     * Parses a reference such as "B7" or "aa12".
     * Returns empty for anything that is not letters followed by digits,
     * for row 0, and for a row or column number above Integer.MAX_VALUE.
     */
    public static Optional<CellAddress> parse(String reference) {
        if (reference == null || reference.isEmpty()) {
            return Optional.empty();
        }
        int length = reference.length();
        int i = 0;
        long col = 0;
        while (i < length && isAsciiLetter(reference.charAt(i))) {
            col = col * 26 + (Character.toUpperCase(reference.charAt(i)) - 'A' + 1);
            if (col > Integer.MAX_VALUE) {
                return Optional.empty();
            }
            i++;
        }
        if (i == 0 || i == length) {
            return Optional.empty();
        }
        long row = 0;
        for (int j = i; j < length; j++) {
            char ch = reference.charAt(j);
            if (ch < '0' || ch > '9') {
                return Optional.empty();
            }
            row = row * 10 + (ch - '0');
            if (row > Integer.MAX_VALUE) {
                return Optional.empty();
            }
        }
        if (row == 0) {
            return Optional.empty();
        }
        return Optional.of(new CellAddress((int) (row - 1), (int) (col - 1)));
    }

    private static boolean isAsciiLetter(char ch) {
        return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z');
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    /**
     * Text form of this address, e.g. "C4".
     */
    public String getLabel() {
        return columnLabel(col) + ((long) row + 1);
    }

    /**
     * Shifts this address, clamping both coordinates at zero and at the
     * largest value parse accepts.
     */
    public CellAddress offset(int rowOffset, int colOffset) {
        return new CellAddress(shift(row, rowOffset), shift(col, colOffset));
    }

    private static int shift(int coordinate, int delta) {
        long shifted = (long) coordinate + delta;
        return (int) Math.max(0, Math.min(Integer.MAX_VALUE - 1, shifted));
    }

    // Row-major ordering
    @Override
    public int compareTo(CellAddress other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(col, other.col);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress that = (CellAddress) o;
        return row == that.row && col == that.col;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, col);
    }

    @Override
    public String toString() {
        return getLabel();
    }
}
