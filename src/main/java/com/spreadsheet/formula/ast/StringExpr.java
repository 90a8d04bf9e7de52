package com.spreadsheet.formula.ast;

import java.util.Objects;

public final class StringExpr extends Expr {

    private final String value;

    public StringExpr(String value) {
        super(1);
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getValue() {
        return value;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitString(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StringExpr && value.equals(((StringExpr) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
