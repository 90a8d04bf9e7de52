package com.spreadsheet.formula.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Represents the content of a single spreadsheet cell.
 * Stores:
 * - value: the display text (user input, or the evaluated result of the formula)
 * - formula: optional formula text, always starting with '='
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CellData {

    public static final CellData EMPTY = new CellData("", null);

    private final String value;
    private final String formula;

    public CellData(String value, String formula) {
        this.value = value == null ? "" : value;
        this.formula = formula;
    }

    public static CellData ofValue(String value) {
        return new CellData(value, null);
    }

    public static CellData ofFormula(String value, String formula) {
        return new CellData(value, formula);
    }

    public String getValue() {
        return value;
    }

    public String getFormula() {
        return formula;
    }

    public boolean hasFormula() {
        return formula != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellData)) {
            return false;
        }
        CellData that = (CellData) o;
        return value.equals(that.value) && Objects.equals(formula, that.formula);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, formula);
    }

    @Override
    public String toString() {
        return formula == null ? value : value + " (" + formula + ")";
    }
}
