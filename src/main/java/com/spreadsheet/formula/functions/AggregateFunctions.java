package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.models.Value;

import java.util.List;
import java.util.function.DoubleBinaryOperator;

/**
 * SUM, AVERAGE, MIN, MAX, COUNT, COUNTA and SPARKLINE.
 * These take any number of arguments and are usually called with ranges.
 */
final class AggregateFunctions {

    // Nine heights, from empty to full block
    static final String SPARK_BLOCKS = " ▁▂▃▄▅▆▇█";

    private AggregateFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registry.register("SUM", args -> Value.number(sum(args)));

        registry.register("AVERAGE", args -> {
            Arguments.requireAtLeast("AVERAGE", args, 1);
            return Value.number(sum(args) / args.size());
        });

        registry.register("MIN", args -> {
            Arguments.requireAtLeast("MIN", args, 1);
            return Value.number(fold(args, AggregateFunctions::min));
        });

        registry.register("MAX", args -> {
            Arguments.requireAtLeast("MAX", args, 1);
            return Value.number(fold(args, AggregateFunctions::max));
        });

        registry.register("COUNT", args -> Value.number(args.stream().filter(Value::isNumber).count()));

        registry.register("COUNTA", args -> Value.number(args.stream()
                .filter(arg -> arg.isNumber() || !arg.toString().isEmpty())
                .count()));

        registry.register("SPARKLINE", AggregateFunctions::sparkline);
    }

    private static double sum(List<Value> args) {
        double total = 0.0;
        for (Value arg : args) {
            total += arg.toNumber();
        }
        return total;
    }

    private static double fold(List<Value> args, DoubleBinaryOperator operator) {
        double result = args.get(0).toNumber();
        for (int i = 1; i < args.size(); i++) {
            result = operator.applyAsDouble(result, args.get(i).toNumber());
        }
        return result;
    }

    // NaN loses against any number
    private static double min(double a, double b) {
        if (Double.isNaN(a)) {
            return b;
        }
        return b < a ? b : a;
    }

    private static double max(double a, double b) {
        if (Double.isNaN(a)) {
            return b;
        }
        return b > a ? b : a;
    }

    private static Value sparkline(List<Value> args) {
        Arguments.requireAtLeast("SPARKLINE", args, 1);
        double low = fold(args, AggregateFunctions::min);
        double high = fold(args, AggregateFunctions::max);
        int top = SPARK_BLOCKS.length() - 1;

        StringBuilder line = new StringBuilder(args.size());
        for (Value arg : args) {
            int index;
            if (high == low) {
                index = top / 2;
            } else {
                double scaled = (arg.toNumber() - low) / (high - low) * top;
                index = (int) Math.max(0, Math.min(top, Math.round(scaled)));
            }
            line.append(SPARK_BLOCKS.charAt(index));
        }
        return Value.string(line.toString());
    }
}
