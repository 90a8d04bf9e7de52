package com.spreadsheet.formula.services;

import com.spreadsheet.formula.ast.Expr;
import com.spreadsheet.formula.config.FormulaProperties;
import com.spreadsheet.formula.exceptions.FormulaException;
import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.models.Spreadsheet;
import com.spreadsheet.formula.models.Value;
import com.spreadsheet.formula.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for formula evaluation:
 * - parse: formula text (without '=') into an expression tree
 * - evaluate: formula text against a grid, failing with a FormulaException
 * - evaluateFormula: cell text to display text, with failures shown as #ERROR
 */
@Service
public class FormulaEvaluator {

    public static final String ERROR_VALUE = "#ERROR";

    private static final Logger log = LoggerFactory.getLogger(FormulaEvaluator.class);

    private final FunctionRegistry functionRegistry;
    private final int maxDepth;
    private final long maxRangeCells;

    public FormulaEvaluator(FunctionRegistry functionRegistry, FormulaProperties properties) {
        this.functionRegistry = functionRegistry;
        this.maxDepth = properties.getMaxDepth();
        this.maxRangeCells = properties.getMaxRangeCells();
    }

    public Expr parse(String expression) {
        return new Parser(expression, maxDepth).parse();
    }

    public Value evaluate(String expression, Spreadsheet grid) {
        return evaluate(parse(expression), grid);
    }

    public Value evaluate(Expr expr, Spreadsheet grid) {
        return new ExpressionEvaluator(grid, functionRegistry, maxDepth, maxRangeCells).evaluate(expr);
    }

    /**
     * Text starting with '=' is evaluated and rendered for display;
     * anything else is returned as is.
     */
    public String evaluateFormula(String text, Spreadsheet grid) {
        if (!isFormula(text)) {
            return text;
        }
        try {
            return evaluate(text.substring(1), grid).toString();
        } catch (FormulaException ex) {
            log.debug("Formula {} evaluated to {}: {}", text, ERROR_VALUE, ex.getMessage());
            return ERROR_VALUE;
        }
    }

    public static boolean isFormula(String text) {
        return text != null && text.startsWith("=");
    }
}
