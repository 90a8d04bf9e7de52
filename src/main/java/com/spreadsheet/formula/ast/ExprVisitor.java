package com.spreadsheet.formula.ast;

public interface ExprVisitor<R> {

    R visitNumber(NumberExpr expr);

    R visitString(StringExpr expr);

    R visitCellRef(CellRefExpr expr);

    R visitRange(RangeExpr expr);

    R visitBinary(BinaryExpr expr);

    R visitUnary(UnaryExpr expr);

    R visitFunctionCall(FunctionCallExpr expr);
}
