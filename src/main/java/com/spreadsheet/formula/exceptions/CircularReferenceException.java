package com.spreadsheet.formula.exceptions;

/**
 * Thrown when committing a formula would create a circular dependency
 * (e.g., a cell referencing itself, or a multi-cell loop).
 * The formula is discarded and the cell keeps its previous content.
 */
public class CircularReferenceException extends RuntimeException {
    public CircularReferenceException(String message) {
        super(message);
    }
}
