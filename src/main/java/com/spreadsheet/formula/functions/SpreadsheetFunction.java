package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.models.Value;

import java.util.List;

/**
 * A built-in or user-registered formula function.
 * Receives its arguments already evaluated, with ranges expanded in place,
 * and reports arity or domain problems by throwing EvaluationException.
 */
@FunctionalInterface
public interface SpreadsheetFunction {

    Value apply(List<Value> args);
}
