package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a request names a sheet id that SheetService never created.
 */
public class SheetNotFoundException extends RuntimeException {
    public SheetNotFoundException(long sheetId) {
        super("Sheet not found: " + sheetId);
    }
}
