package com.spreadsheet.formula.ast;

import java.util.Objects;

/**
 * A single cell reference, kept as uppercased text ("B12"). It is resolved
 * to coordinates only when evaluated.
 */
public final class CellRefExpr extends Expr {

    private final String reference;

    public CellRefExpr(String reference) {
        super(1);
        this.reference = Objects.requireNonNull(reference, "reference");
    }

    public String getReference() {
        return reference;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCellRef(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CellRefExpr && reference.equals(((CellRefExpr) o).reference);
    }

    @Override
    public int hashCode() {
        return reference.hashCode();
    }
}
