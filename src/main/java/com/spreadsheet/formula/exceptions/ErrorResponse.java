package com.spreadsheet.formula.exceptions;

/**
 * Error body returned by the REST layer, for example:
 * {
 *   "code": "CIRCULAR_REFERENCE",
 *   "message": "Circular reference: =B1 in A1"
 * }
 */
public class ErrorResponse {
    private final String code;
    private final String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
