package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.UrlFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;

/**
 * Fetches URL bodies with a RestTemplate. Timeouts are whatever the
 * RestTemplate was built with (see FormulaConfiguration).
 */
public class RestTemplateUrlFetcher implements UrlFetcher {

    private static final Logger log = LoggerFactory.getLogger(RestTemplateUrlFetcher.class);

    private final RestTemplate restTemplate;

    public RestTemplateUrlFetcher(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public String fetch(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException ex) {
            throw new UrlFetchException("Invalid URL: " + url, ex);
        }
        if (!uri.isAbsolute() || uri.getHost() == null) {
            throw new UrlFetchException("URL must be absolute: " + url, null);
        }

        log.debug("GET {}", uri);
        try {
            String body = restTemplate.getForObject(uri, String.class);
            return body == null ? "" : body;
        } catch (RestClientException ex) {
            throw new UrlFetchException("Request to " + url + " failed: " + ex.getMessage(), ex);
        }
    }
}
