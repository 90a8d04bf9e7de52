package com.spreadsheet.formula.ast;

import java.util.Objects;

public final class BinaryExpr extends Expr {

    private final Expr left;
    private final BinaryOp operator;
    private final Expr right;

    public BinaryExpr(Expr left, BinaryOp operator, Expr right) {
        super(1 + Math.max(left.getDepth(), right.getDepth()));
        this.left = left;
        this.operator = Objects.requireNonNull(operator, "operator");
        this.right = right;
    }

    public Expr getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expr getRight() {
        return right;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BinaryExpr)) {
            return false;
        }
        BinaryExpr that = (BinaryExpr) o;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }
}
