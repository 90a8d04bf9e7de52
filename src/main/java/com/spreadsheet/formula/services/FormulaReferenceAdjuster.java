package com.spreadsheet.formula.services;

import com.spreadsheet.formula.ast.BinaryExpr;
import com.spreadsheet.formula.ast.CellRefExpr;
import com.spreadsheet.formula.ast.Expr;
import com.spreadsheet.formula.ast.ExprVisitor;
import com.spreadsheet.formula.ast.FormulaPrinter;
import com.spreadsheet.formula.ast.FunctionCallExpr;
import com.spreadsheet.formula.ast.NumberExpr;
import com.spreadsheet.formula.ast.RangeExpr;
import com.spreadsheet.formula.ast.StringExpr;
import com.spreadsheet.formula.ast.UnaryExpr;
import com.spreadsheet.formula.exceptions.FormulaException;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.parser.Parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites the relative references of a formula for a copy to another cell.
 * E.g. "=SUM(B4:B6)" moved one column right becomes "=SUM(C4:C6)".
 * Shifted coordinates stop at the first row/column.
 */
public final class FormulaReferenceAdjuster implements ExprVisitor<Expr> {

    private final int rowOffset;
    private final int colOffset;

    private FormulaReferenceAdjuster(int rowOffset, int colOffset) {
        this.rowOffset = rowOffset;
        this.colOffset = colOffset;
    }

    /**
     * Returns the shifted formula; plain text and formulas that do not
     * parse come back unchanged.
     */
    public static String adjust(String formula, int rowOffset, int colOffset) {
        if (!FormulaEvaluator.isFormula(formula)) {
            return formula;
        }
        try {
            Expr expr = new Parser(formula.substring(1)).parse();
            return "=" + FormulaPrinter.print(expr.accept(new FormulaReferenceAdjuster(rowOffset, colOffset)));
        } catch (FormulaException ex) {
            return formula;
        }
    }

    @Override
    public Expr visitNumber(NumberExpr expr) {
        return expr;
    }

    @Override
    public Expr visitString(StringExpr expr) {
        return expr;
    }

    @Override
    public Expr visitCellRef(CellRefExpr expr) {
        return new CellRefExpr(shift(expr.getReference()));
    }

    @Override
    public Expr visitRange(RangeExpr expr) {
        return new RangeExpr(shift(expr.getStart()), shift(expr.getEnd()));
    }

    @Override
    public Expr visitBinary(BinaryExpr expr) {
        return new BinaryExpr(expr.getLeft().accept(this), expr.getOperator(), expr.getRight().accept(this));
    }

    @Override
    public Expr visitUnary(UnaryExpr expr) {
        return new UnaryExpr(expr.getOperator(), expr.getOperand().accept(this));
    }

    @Override
    public Expr visitFunctionCall(FunctionCallExpr expr) {
        List<Expr> arguments = new ArrayList<>();
        for (Expr argument : expr.getArguments()) {
            arguments.add(argument.accept(this));
        }
        return new FunctionCallExpr(expr.getName(), arguments);
    }

    // References that do not resolve (overflowing rows) are left as written
    private String shift(String reference) {
        return CellAddress.parse(reference)
                .map(address -> address.offset(rowOffset, colOffset).getLabel())
                .orElse(reference);
    }
}
