package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.EvaluationException;
import com.spreadsheet.formula.models.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.function.DoubleUnaryOperator;

/**
 * Numeric functions. Every argument is coerced with Value#toNumber.
 */
final class MathFunctions {

    private MathFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registerUnary(registry, "ABS", Math::abs);
        registerUnary(registry, "CEILING", Math::ceil);
        registerUnary(registry, "FLOOR", Math::floor);
        registerUnary(registry, "INT", Math::floor);
        registerUnary(registry, "LN", Math::log);
        registerUnary(registry, "EXP", Math::exp);
        registerUnary(registry, "SIGN", MathFunctions::sign);

        registry.register("SQRT", args -> {
            Arguments.requireExactly("SQRT", args, 1);
            double value = Arguments.number(args, 0);
            if (value < 0) {
                throw new EvaluationException("SQRT of negative number: " + Value.formatNumber(value));
            }
            return Value.number(Math.sqrt(value));
        });

        registry.register("ROUND", args -> {
            Arguments.requireBetween("ROUND", args, 1, 2);
            double value = Arguments.number(args, 0);
            if (args.size() == 1) {
                return Value.number(round(value));
            }
            int places = (int) Arguments.number(args, 1);
            double multiplier = Math.pow(10, places);
            return Value.number(round(value * multiplier) / multiplier);
        });

        registry.register("MOD", args -> {
            Arguments.requireExactly("MOD", args, 2);
            double divisor = Arguments.number(args, 1);
            if (divisor == 0.0) {
                throw new EvaluationException("MOD by zero");
            }
            return Value.number(Arguments.number(args, 0) % divisor);
        });

        registry.register("LOG", args -> {
            Arguments.requireBetween("LOG", args, 1, 2);
            double value = Arguments.number(args, 0);
            if (args.size() == 1) {
                return Value.number(Math.log10(value));
            }
            return Value.number(Math.log(value) / Math.log(Arguments.number(args, 1)));
        });

        registry.register("POWER", args -> {
            Arguments.requireExactly("POWER", args, 2);
            return Value.number(Math.pow(Arguments.number(args, 0), Arguments.number(args, 1)));
        });
    }

    private static void registerUnary(FunctionRegistry registry, String name, DoubleUnaryOperator operator) {
        registry.register(name, args -> {
            Arguments.requireExactly(name, args, 1);
            return Value.number(operator.applyAsDouble(Arguments.number(args, 0)));
        });
    }

    private static double sign(double value) {
        if (value > 0) {
            return 1.0;
        }
        if (value < 0) {
            return -1.0;
        }
        return value;
    }

    /**
     * Rounds half away from zero: 2.5 -> 3, -2.5 -> -3.
     */
    static double round(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(0, RoundingMode.HALF_UP).doubleValue();
    }
}
