package com.spreadsheet.formula.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings bound from the "formula.*" keys of application.properties.
 */
@ConfigurationProperties(prefix = "formula")
public class FormulaProperties {

    /**
     * Nesting bound shared by the parser, the evaluator and the cycle checker.
     * For the parser it is also the largest tree height a formula may have.
     */
    private int maxDepth = 1024;

    /**
     * Most cells a single range argument may expand to during evaluation.
     */
    private long maxRangeCells = 1_000_000L;

    private final Fetch fetch = new Fetch();

    private final Sheet sheet = new Sheet();

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public long getMaxRangeCells() {
        return maxRangeCells;
    }

    public void setMaxRangeCells(long maxRangeCells) {
        this.maxRangeCells = maxRangeCells;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public Sheet getSheet() {
        return sheet;
    }

    /**
     * Timeouts of the HTTP client behind the GET function.
     */
    public static class Fetch {

        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }

    /**
     * Size of a sheet created without explicit dimensions.
     */
    public static class Sheet {

        private int defaultRows = 100;
        private int defaultCols = 26;

        public int getDefaultRows() {
            return defaultRows;
        }

        public void setDefaultRows(int defaultRows) {
            this.defaultRows = defaultRows;
        }

        public int getDefaultCols() {
            return defaultCols;
        }

        public void setDefaultCols(int defaultCols) {
            this.defaultCols = defaultCols;
        }
    }
}
