package com.spreadsheet.formula.functions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name to implementation table of formula functions.
 * Names are uppercased on registration and on lookup, so lookup is
 * case-insensitive; registering a name again replaces the earlier function.
 */
public class FunctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(FunctionRegistry.class);

    private final Map<String, SpreadsheetFunction> functions = new ConcurrentHashMap<>();

    /**
     * Creates a registry holding every built-in function.
     *
     * @param urlFetcher used by GET
     * @param clock      seeds RAND and RANDBETWEEN
     */
    public static FunctionRegistry withBuiltins(UrlFetcher urlFetcher, Clock clock) {
        FunctionRegistry registry = new FunctionRegistry();
        AggregateFunctions.registerAll(registry);
        LogicalFunctions.registerAll(registry);
        MathFunctions.registerAll(registry);
        RandomFunctions.registerAll(registry, clock);
        TextFunctions.registerAll(registry);
        InformationFunctions.registerAll(registry);
        WebFunctions.registerAll(registry, urlFetcher);
        log.debug("Registered {} built-in functions", registry.functions.size());
        return registry;
    }

    public void register(String name, SpreadsheetFunction function) {
        Objects.requireNonNull(function, "function");
        SpreadsheetFunction previous = functions.put(normalize(name), function);
        if (previous != null) {
            log.debug("Function {} replaced", normalize(name));
        }
    }

    public Optional<SpreadsheetFunction> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(functions.get(normalize(name)));
    }

    public boolean contains(String name) {
        return lookup(name).isPresent();
    }

    /**
     * Registered names, uppercased and sorted.
     */
    public Set<String> getFunctionNames() {
        return new TreeSet<>(functions.keySet());
    }

    private static String normalize(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Function name must not be blank");
        }
        return name.toUpperCase(Locale.ROOT);
    }
}
