package com.spreadsheet.formula.exceptions;

/**
 * Thrown by a UrlFetcher when the request cannot be made or fails.
 */
public class UrlFetchException extends RuntimeException {
    public UrlFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
