package com.spreadsheet.formula.models;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A sparse grid of cells:
 * - rows/cols give the logical size
 * - only non-empty cells are stored; any other coordinate reads as an empty cell
 * Formula evaluation and cycle checks only read from it.
 */
public class Spreadsheet {

    public static final int DEFAULT_ROWS = 100;
    public static final int DEFAULT_COLS = 26;

    private final int rows;
    private final int cols;
    private final Map<CellAddress, CellData> cells = new ConcurrentHashMap<>();

    public Spreadsheet() {
        this(DEFAULT_ROWS, DEFAULT_COLS);
    }

    public Spreadsheet(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Spreadsheet size must be positive: " + rows + "x" + cols);
        }
        this.rows = rows;
        this.cols = cols;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public CellData getCell(int row, int col) {
        return getCell(CellAddress.of(row, col));
    }

    public CellData getCell(CellAddress address) {
        return cells.getOrDefault(address, CellData.EMPTY);
    }

    public void setCell(int row, int col, CellData data) {
        setCell(CellAddress.of(row, col), data);
    }

    /**
     * Stores the cell; an empty value without a formula removes it instead.
     */
    public void setCell(CellAddress address, CellData data) {
        if (data == null || (data.getValue().isEmpty() && !data.hasFormula())) {
            cells.remove(address);
        } else {
            cells.put(address, data);
        }
    }

    public boolean contains(CellAddress address) {
        return address.getRow() < rows && address.getCol() < cols;
    }

    public Map<CellAddress, CellData> getCells() {
        return Collections.unmodifiableMap(cells);
    }
}
