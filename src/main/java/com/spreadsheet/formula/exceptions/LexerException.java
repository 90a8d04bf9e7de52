package com.spreadsheet.formula.exceptions;

/**
 * Thrown when formula text contains a character the lexer does not accept
 * (e.g. "@"), or a string literal that is never closed.
 */
public class LexerException extends FormulaException {

    private final int position;

    public LexerException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
