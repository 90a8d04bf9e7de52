package com.spreadsheet.formula.exceptions;

/**
 * Thrown while reducing a parsed formula to a value:
 * unknown function, wrong argument count, division by zero,
 * an invalid cell reference or a range used outside a function call.
 */
public class EvaluationException extends FormulaException {
    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
