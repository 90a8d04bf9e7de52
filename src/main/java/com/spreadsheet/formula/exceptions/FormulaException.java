package com.spreadsheet.formula.exceptions;

/**
 * Base class for everything that can go wrong while lexing, parsing
 * or evaluating a formula. Callers at the cell-store boundary catch
 * this type and show "#ERROR" instead of a value.
 */
public abstract class FormulaException extends RuntimeException {
    protected FormulaException(String message) {
        super(message);
    }

    protected FormulaException(String message, Throwable cause) {
        super(message, cause);
    }
}
