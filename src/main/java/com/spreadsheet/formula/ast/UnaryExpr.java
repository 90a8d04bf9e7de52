package com.spreadsheet.formula.ast;

import java.util.Objects;

public final class UnaryExpr extends Expr {

    private final UnaryOp operator;
    private final Expr operand;

    public UnaryExpr(UnaryOp operator, Expr operand) {
        super(1 + operand.getDepth());
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operand = operand;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expr getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof UnaryExpr)) {
            return false;
        }
        UnaryExpr that = (UnaryExpr) o;
        return operator == that.operator && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }
}
