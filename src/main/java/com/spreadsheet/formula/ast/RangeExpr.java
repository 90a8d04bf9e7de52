package com.spreadsheet.formula.ast;

import java.util.Objects;

/**
 * Inclusive rectangle between two references, e.g. "A1:C3".
 * Only meaningful as a direct function argument.
 */
public final class RangeExpr extends Expr {

    private final String start;
    private final String end;

    public RangeExpr(String start, String end) {
        super(1);
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
    }

    public String getStart() {
        return start;
    }

    public String getEnd() {
        return end;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitRange(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RangeExpr)) {
            return false;
        }
        RangeExpr that = (RangeExpr) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }
}
