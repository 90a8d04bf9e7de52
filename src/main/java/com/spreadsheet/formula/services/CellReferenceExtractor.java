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
import com.spreadsheet.formula.exceptions.FormulaException;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.CellRange;
import com.spreadsheet.formula.models.Spreadsheet;
import com.spreadsheet.formula.parser.Parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Lists the cells a formula reads, in the order they appear.
 * A single reference is kept as a one-cell range; ranges are only expanded
 * on request, and then only the part that lies inside the grid.
 */
public final class CellReferenceExtractor implements ExprVisitor<Void> {

    private final List<CellRange> ranges = new ArrayList<>();

    private CellReferenceExtractor() {
    }

    /**
     * Formula text must start with '='. Plain text and formulas that do not
     * parse have no references.
     */
    public static List<CellRange> ranges(String formula) {
        if (!FormulaEvaluator.isFormula(formula)) {
            return Collections.emptyList();
        }
        Expr expr;
        try {
            expr = new Parser(formula.substring(1)).parse();
        } catch (FormulaException ex) {
            return Collections.emptyList();
        }
        CellReferenceExtractor extractor = new CellReferenceExtractor();
        expr.accept(extractor);
        return extractor.ranges;
    }

    /**
     * Every cell the formula reads that exists in the grid, ranges expanded
     * row by row. Throws EvaluationException when that is more than maxCells.
     */
    public static List<CellAddress> extract(String formula, Spreadsheet grid, long maxCells) {
        List<CellRange> clamped = new ArrayList<>();
        long total = 0;
        for (CellRange range : ranges(formula)) {
            CellRange inGrid = range.clampTo(grid.getRows(), grid.getCols());
            total += inGrid.getCellCount();
            if (total > maxCells) {
                throw new EvaluationException("Formula references more than " + maxCells + " cells");
            }
            clamped.add(inGrid);
        }
        List<CellAddress> references = new ArrayList<>();
        for (CellRange range : clamped) {
            references.addAll(range.cells());
        }
        return references;
    }

    @Override
    public Void visitNumber(NumberExpr expr) {
        return null;
    }

    @Override
    public Void visitString(StringExpr expr) {
        return null;
    }

    @Override
    public Void visitCellRef(CellRefExpr expr) {
        CellAddress.parse(expr.getReference()).ifPresent(address -> ranges.add(CellRange.of(address)));
        return null;
    }

    @Override
    public Void visitRange(RangeExpr expr) {
        Optional<CellAddress> start = CellAddress.parse(expr.getStart());
        Optional<CellAddress> end = CellAddress.parse(expr.getEnd());
        if (start.isPresent() && end.isPresent()) {
            ranges.add(CellRange.of(start.get(), end.get()));
        }
        return null;
    }

    @Override
    public Void visitBinary(BinaryExpr expr) {
        expr.getLeft().accept(this);
        expr.getRight().accept(this);
        return null;
    }

    @Override
    public Void visitUnary(UnaryExpr expr) {
        expr.getOperand().accept(this);
        return null;
    }

    @Override
    public Void visitFunctionCall(FunctionCallExpr expr) {
        for (Expr argument : expr.getArguments()) {
            argument.accept(this);
        }
        return null;
    }
}
