package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.models.Value;

import java.time.Clock;
import java.time.Instant;

/**
 * RAND and RANDBETWEEN. Both derive their value from the sub-second part
 * of the injected clock, so a fixed clock gives repeatable results.
 */
final class RandomFunctions {

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private RandomFunctions() {
    }

    static void registerAll(FunctionRegistry registry, Clock clock) {
        registry.register("RAND", args -> {
            Arguments.requireExactly("RAND", args, 0);
            return Value.number(fraction(clock));
        });

        registry.register("RANDBETWEEN", args -> {
            Arguments.requireExactly("RANDBETWEEN", args, 2);
            double low = Math.floor(Arguments.number(args, 0));
            double high = Math.floor(Arguments.number(args, 1));
            if (high < low) {
                return Value.number(low);
            }
            double span = high - low + 1;
            return Value.number(low + Math.floor(fraction(clock) * span));
        });
    }

    // In [0, 1)
    private static double fraction(Clock clock) {
        Instant now = clock.instant();
        return now.getNano() / NANOS_PER_SECOND;
    }
}
