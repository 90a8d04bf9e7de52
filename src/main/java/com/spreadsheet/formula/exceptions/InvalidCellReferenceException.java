package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a caller addresses a cell that is not a valid reference,
 * or lies outside the sheet's rows/columns.
 * For example, "Invalid cell reference: 1A".
 */
public class InvalidCellReferenceException extends RuntimeException {
    public InvalidCellReferenceException(String message) {
        super(message);
    }
}
