package com.spreadsheet.formula.exceptions;

/**
 * Thrown when the token stream does not match the formula grammar,
 * e.g. "(2 + 3", "2 +", "A1:5" or a bare name like "PI".
 */
public class ParserException extends FormulaException {
    public ParserException(String message) {
        super(message);
    }
}
