package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.EvaluationException;
import com.spreadsheet.formula.exceptions.UrlFetchException;
import com.spreadsheet.formula.models.Value;

/**
 * GET(url): the body of a web resource, as text.
 */
final class WebFunctions {

    private WebFunctions() {
    }

    static void registerAll(FunctionRegistry registry, UrlFetcher urlFetcher) {
        registry.register("GET", args -> {
            Arguments.requireExactly("GET", args, 1);
            String url = Arguments.text(args, 0).strip();
            if (url.isEmpty()) {
                throw new EvaluationException("GET requires a URL");
            }
            try {
                return Value.string(urlFetcher.fetch(url));
            } catch (UrlFetchException ex) {
                throw new EvaluationException("GET failed: " + ex.getMessage(), ex);
            }
        });
    }
}
