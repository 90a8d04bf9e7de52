package com.spreadsheet.formula.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rectangle of cells between two corners, both inclusive.
 * A range whose end lies above or left of its start is empty.
 */
public final class CellRange {

    private final CellAddress start;
    private final CellAddress end;

    private CellRange(CellAddress start, CellAddress end) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
    }

    public static CellRange of(CellAddress start, CellAddress end) {
        return new CellRange(start, end);
    }

    public static CellRange of(CellAddress cell) {
        return new CellRange(cell, cell);
    }

    public CellAddress getStart() {
        return start;
    }

    public CellAddress getEnd() {
        return end;
    }

    public boolean isSingleCell() {
        return start.equals(end);
    }

    public boolean contains(CellAddress address) {
        return address.getRow() >= start.getRow() && address.getRow() <= end.getRow()
                && address.getCol() >= start.getCol() && address.getCol() <= end.getCol();
    }

    public long getCellCount() {
        long rows = (long) end.getRow() - start.getRow() + 1;
        long cols = (long) end.getCol() - start.getCol() + 1;
        if (rows <= 0 || cols <= 0) {
            return 0;
        }
        return rows * cols;
    }

    /**
     * The part of this range that lies inside a rows x cols grid.
     */
    public CellRange clampTo(int rows, int cols) {
        if (start.getRow() >= rows || start.getCol() >= cols) {
            // end above start
            return new CellRange(CellAddress.of(1, 1), CellAddress.of(0, 0));
        }
        return new CellRange(start, CellAddress.of(Math.min(end.getRow(), rows - 1), Math.min(end.getCol(), cols - 1)));
    }

    /**
     * Every cell of the range, row by row.
     */
    public List<CellAddress> cells() {
        List<CellAddress> cells = new ArrayList<>();
        for (int row = start.getRow(); row <= end.getRow(); row++) {
            for (int col = start.getCol(); col <= end.getCol(); col++) {
                cells.add(CellAddress.of(row, col));
            }
        }
        return cells;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRange)) {
            return false;
        }
        CellRange that = (CellRange) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return isSingleCell() ? start.getLabel() : start.getLabel() + ":" + end.getLabel();
    }
}
