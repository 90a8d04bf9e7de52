package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.EvaluationException;
import com.spreadsheet.formula.models.Value;

import java.util.function.Predicate;

/**
 * Type predicates and conversions: ISBLANK, ISNUMBER, ISTEXT, TYPE,
 * TEXT, VALUE, NUMBERVALUE.
 */
final class InformationFunctions {

    private InformationFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registerPredicate(registry, "ISBLANK", arg -> arg.isString() && arg.toString().isEmpty());
        registerPredicate(registry, "ISNUMBER", Value::isNumber);
        registerPredicate(registry, "ISTEXT", Value::isString);

        registry.register("TYPE", args -> {
            Arguments.requireExactly("TYPE", args, 1);
            return Value.number(args.get(0).isNumber() ? 1.0 : 2.0);
        });

        // The optional format argument is accepted but not applied
        registry.register("TEXT", args -> {
            Arguments.requireBetween("TEXT", args, 1, 2);
            return Value.string(Arguments.text(args, 0));
        });

        registerConversion(registry, "VALUE");
        registerConversion(registry, "NUMBERVALUE");
    }

    private static void registerPredicate(FunctionRegistry registry, String name, Predicate<Value> predicate) {
        registry.register(name, args -> {
            Arguments.requireExactly(name, args, 1);
            return Value.bool(predicate.test(args.get(0)));
        });
    }

    private static void registerConversion(FunctionRegistry registry, String name) {
        registry.register(name, args -> {
            Arguments.requireExactly(name, args, 1);
            Value arg = args.get(0);
            if (arg.isNumber()) {
                return arg;
            }
            Double parsed = Value.parseNumber(arg.toString().strip());
            if (parsed == null) {
                throw new EvaluationException(name + " cannot convert \"" + arg + "\" to a number");
            }
            return Value.number(parsed);
        });
    }
}
