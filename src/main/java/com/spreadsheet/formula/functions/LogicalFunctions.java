package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.models.Value;

/**
 * IF, AND, OR, NOT. Conditions use truthiness: a nonzero number or a
 * non-empty string is true.
 */
final class LogicalFunctions {

    private LogicalFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registry.register("IF", args -> {
            Arguments.requireExactly("IF", args, 3);
            return args.get(0).isTruthy() ? args.get(1) : args.get(2);
        });

        registry.register("AND", args -> Value.bool(args.stream().allMatch(Value::isTruthy)));

        registry.register("OR", args -> Value.bool(args.stream().anyMatch(Value::isTruthy)));

        registry.register("NOT", args -> {
            Arguments.requireExactly("NOT", args, 1);
            return Value.bool(!args.get(0).isTruthy());
        });
    }
}
