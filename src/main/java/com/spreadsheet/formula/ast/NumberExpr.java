package com.spreadsheet.formula.ast;

public final class NumberExpr extends Expr {

    private final double value;

    public NumberExpr(double value) {
        super(1);
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NumberExpr && Double.compare(value, ((NumberExpr) o).value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }
}
