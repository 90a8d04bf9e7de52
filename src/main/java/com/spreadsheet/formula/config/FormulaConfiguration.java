package com.spreadsheet.formula.config;

import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.functions.RestTemplateUrlFetcher;
import com.spreadsheet.formula.functions.UrlFetcher;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Wires the function registry and the collaborators its built-ins need.
 */
@Configuration
@EnableConfigurationProperties(FormulaProperties.class)
public class FormulaConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate formulaRestTemplate(RestTemplateBuilder builder, FormulaProperties properties) {
        return builder
                .setConnectTimeout(properties.getFetch().getConnectTimeout())
                .setReadTimeout(properties.getFetch().getReadTimeout())
                .build();
    }

    @Bean
    public UrlFetcher urlFetcher(RestTemplate formulaRestTemplate) {
        return new RestTemplateUrlFetcher(formulaRestTemplate);
    }

    @Bean
    public FunctionRegistry functionRegistry(UrlFetcher urlFetcher, Clock clock) {
        return FunctionRegistry.withBuiltins(urlFetcher, clock);
    }
}
