package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.EvaluationException;
import com.spreadsheet.formula.models.Value;

import java.util.List;

/**
 * Arity checks and argument coercions shared by the built-in functions.
 */
final class Arguments {

    private Arguments() {
    }

    static void requireExactly(String function, List<Value> args, int count) {
        if (args.size() != count) {
            throw new EvaluationException(function + " requires exactly " + count
                    + (count == 1 ? " argument" : " arguments") + ", got " + args.size());
        }
    }

    static void requireAtLeast(String function, List<Value> args, int count) {
        if (args.size() < count) {
            throw new EvaluationException(function + " requires at least " + count
                    + (count == 1 ? " argument" : " arguments"));
        }
    }

    static void requireBetween(String function, List<Value> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            throw new EvaluationException(function + " requires " + min + " or " + max
                    + " arguments, got " + args.size());
        }
    }

    static double number(List<Value> args, int index) {
        return args.get(index).toNumber();
    }

    static String text(List<Value> args, int index) {
        return args.get(index).toString();
    }

    /**
     * Coerces to a non-negative count: the fraction is dropped,
     * negative numbers and NaN become 0.
     */
    static int count(List<Value> args, int index) {
        double value = args.get(index).toNumber();
        if (Double.isNaN(value) || value <= 0) {
            return 0;
        }
        return value >= Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) value;
    }
}
