package com.spreadsheet.formula.ast;

import com.spreadsheet.formula.models.Value;

import java.util.stream.Collectors;

/**
 * Prints an expression tree back to formula text (without the leading '=').
 * Parentheses are emitted only where precedence or associativity needs them,
 * so printing a parsed formula and parsing it again gives an equal tree.
 */
public final class FormulaPrinter implements ExprVisitor<String> {

    private static final FormulaPrinter INSTANCE = new FormulaPrinter();

    private static final int UNARY_PRECEDENCE = 7;
    private static final int PRIMARY_PRECEDENCE = 8;

    private FormulaPrinter() {
    }

    public static String print(Expr expr) {
        return expr.accept(INSTANCE);
    }

    @Override
    public String visitNumber(NumberExpr expr) {
        return Value.formatNumber(expr.getValue());
    }

    @Override
    public String visitString(StringExpr expr) {
        return "\"" + expr.getValue().replace("\"", "\"\"") + "\"";
    }

    @Override
    public String visitCellRef(CellRefExpr expr) {
        return expr.getReference();
    }

    @Override
    public String visitRange(RangeExpr expr) {
        return expr.getStart() + ":" + expr.getEnd();
    }

    @Override
    public String visitBinary(BinaryExpr expr) {
        BinaryOp op = expr.getOperator();
        int leftPrecedence = precedenceOf(expr.getLeft());
        int rightPrecedence = precedenceOf(expr.getRight());

        boolean wrapLeft = leftPrecedence < op.getPrecedence()
                || (leftPrecedence == op.getPrecedence() && op.isRightAssociative());
        boolean wrapRight = rightPrecedence < op.getPrecedence()
                || (rightPrecedence == op.getPrecedence() && !op.isRightAssociative());

        return wrap(expr.getLeft(), wrapLeft) + op.getSymbol() + wrap(expr.getRight(), wrapRight);
    }

    @Override
    public String visitUnary(UnaryExpr expr) {
        boolean wrapOperand = precedenceOf(expr.getOperand()) < UNARY_PRECEDENCE;
        return expr.getOperator().getSymbol() + wrap(expr.getOperand(), wrapOperand);
    }

    @Override
    public String visitFunctionCall(FunctionCallExpr expr) {
        return expr.getArguments().stream()
                .map(FormulaPrinter::print)
                .collect(Collectors.joining(",", expr.getName() + "(", ")"));
    }

    private static String wrap(Expr expr, boolean parenthesize) {
        String text = print(expr);
        return parenthesize ? "(" + text + ")" : text;
    }

    private static int precedenceOf(Expr expr) {
        if (expr instanceof BinaryExpr) {
            return ((BinaryExpr) expr).getOperator().getPrecedence();
        }
        if (expr instanceof UnaryExpr) {
            return UNARY_PRECEDENCE;
        }
        return PRIMARY_PRECEDENCE;
    }
}
