package com.spreadsheet.formula.functions;

/**
 * Network capability used by the GET function. Keeping it behind an
 * interface lets evaluation run without I/O in tests, and lets the host
 * decide timeouts.
 */
@FunctionalInterface
public interface UrlFetcher {

    /**
     * Returns the body of the resource at the URL.
     *
     * @throws com.spreadsheet.formula.exceptions.UrlFetchException if the request fails
     */
    String fetch(String url);
}
