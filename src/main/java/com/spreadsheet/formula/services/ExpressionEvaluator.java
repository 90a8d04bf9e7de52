package com.spreadsheet.formula.services;

import com.spreadsheet.formula.ast.BinaryExpr;
import com.spreadsheet.formula.ast.CellRefExpr;
import com.spreadsheet.formula.ast.Expr;
import com.spreadsheet.formula.ast.ExprVisitor;
import com.spreadsheet.formula.ast.FunctionCallExpr;
import com.spreadsheet.formula.ast.NumberExpr;
import com.spreadsheet.formula.ast.RangeExpr;
import com.spreadsheet.formula.ast.StringExpr;
import com.spreadsheet.formula.ast.UnaryExpr;
import com.spreadsheet.formula.exceptions.EvaluationException;
import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.functions.SpreadsheetFunction;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.CellRange;
import com.spreadsheet.formula.models.Spreadsheet;
import com.spreadsheet.formula.models.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks an expression tree and reduces it to a Value.
 * <p>
 * Reads cells from the grid but never writes to it. Cell text is
 * numeric-sniffed on every read. A range may only appear as a direct
 * function argument, where it is expanded row by row into the argument list;
 * one larger than maxRangeCells is an error.
 * Evaluation is all-or-nothing: the first error aborts it.
 */
public class ExpressionEvaluator implements ExprVisitor<Value> {

    // f64 machine epsilon
    private static final double EPSILON = Math.ulp(1.0);

    private final Spreadsheet spreadsheet;
    private final FunctionRegistry functionRegistry;
    private final int maxDepth;
    private final long maxRangeCells;
    private int depth;

    public ExpressionEvaluator(Spreadsheet spreadsheet, FunctionRegistry functionRegistry,
                               int maxDepth, long maxRangeCells) {
        this.spreadsheet = spreadsheet;
        this.functionRegistry = functionRegistry;
        this.maxDepth = maxDepth;
        this.maxRangeCells = maxRangeCells;
    }

    public Value evaluate(Expr expr) {
        if (depth >= maxDepth) {
            throw new EvaluationException("Formula is nested deeper than " + maxDepth + " levels");
        }
        depth++;
        try {
            return expr.accept(this);
        } finally {
            depth--;
        }
    }

    @Override
    public Value visitNumber(NumberExpr expr) {
        return Value.number(expr.getValue());
    }

    @Override
    public Value visitString(StringExpr expr) {
        return Value.string(expr.getValue());
    }

    @Override
    public Value visitCellRef(CellRefExpr expr) {
        return readCell(resolve(expr.getReference()));
    }

    @Override
    public Value visitRange(RangeExpr expr) {
        throw new EvaluationException("Range " + expr.getStart() + ":" + expr.getEnd()
                + " can only be used as a function argument");
    }

    @Override
    public Value visitBinary(BinaryExpr expr) {
        Value left = evaluate(expr.getLeft());
        Value right = evaluate(expr.getRight());

        switch (expr.getOperator()) {
            case CONCATENATE:
                return Value.string(left.toString() + right.toString());
            case EQUAL:
                return Value.bool(valuesEqual(left, right));
            case NOT_EQUAL:
                return Value.bool(!valuesEqual(left, right));
            default:
                return arithmetic(expr, left.toNumber(), right.toNumber());
        }
    }

    @Override
    public Value visitUnary(UnaryExpr expr) {
        double operand = evaluate(expr.getOperand()).toNumber();
        switch (expr.getOperator()) {
            case MINUS:
                return Value.number(-operand);
            case PLUS:
            default:
                return Value.number(operand);
        }
    }

    @Override
    public Value visitFunctionCall(FunctionCallExpr expr) {
        SpreadsheetFunction function = functionRegistry.lookup(expr.getName())
                .orElseThrow(() -> new EvaluationException("Unknown function: " + expr.getName()));

        List<Value> args = new ArrayList<>();
        for (Expr argument : expr.getArguments()) {
            if (argument instanceof RangeExpr) {
                expandRange((RangeExpr) argument, args);
            } else {
                args.add(evaluate(argument));
            }
        }
        return function.apply(args);
    }

    private Value arithmetic(BinaryExpr expr, double left, double right) {
        switch (expr.getOperator()) {
            case ADD:
                return Value.number(left + right);
            case SUBTRACT:
                return Value.number(left - right);
            case MULTIPLY:
                return Value.number(left * right);
            case DIVIDE:
                if (right == 0.0) {
                    throw new EvaluationException("Division by zero");
                }
                return Value.number(left / right);
            case MODULO:
                if (right == 0.0) {
                    throw new EvaluationException("Modulo by zero");
                }
                return Value.number(left % right);
            case POWER:
                return Value.number(Math.pow(left, right));
            case LESS:
                return Value.bool(left < right);
            case LESS_EQUAL:
                return Value.bool(left <= right);
            case GREATER:
                return Value.bool(left > right);
            case GREATER_EQUAL:
                return Value.bool(left >= right);
            default:
                throw new EvaluationException("Unsupported operator: " + expr.getOperator());
        }
    }

    /**
     * Numbers compare within epsilon, strings exactly, and a number against
     * a string compares their display text.
     */
    private static boolean valuesEqual(Value left, Value right) {
        if (left.isNumber() && right.isNumber()) {
            return Math.abs(left.toNumber() - right.toNumber()) < EPSILON;
        }
        return left.toString().equals(right.toString());
    }

    // Row-major, both corners inclusive; an inverted range contributes nothing
    private void expandRange(RangeExpr expr, List<Value> into) {
        CellRange range = CellRange.of(resolve(expr.getStart()), resolve(expr.getEnd()));
        if (range.getCellCount() > maxRangeCells) {
            throw new EvaluationException("Range " + range + " covers more than " + maxRangeCells + " cells");
        }
        for (CellAddress address : range.cells()) {
            into.add(readCell(address));
        }
    }

    private Value readCell(CellAddress address) {
        return Value.fromCellText(spreadsheet.getCell(address).getValue());
    }

    private static CellAddress resolve(String reference) {
        return CellAddress.parse(reference)
                .orElseThrow(() -> new EvaluationException("Invalid cell reference: " + reference));
    }
}
