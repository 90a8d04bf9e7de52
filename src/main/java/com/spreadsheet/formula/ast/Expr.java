package com.spreadsheet.formula.ast;

/**
 * Node of a parsed formula. Trees are immutable and acyclic; each node owns
 * its children. Nodes compare by value, so a parsed tree can be checked
 * against a hand-built one.
 */
public abstract class Expr {

    private final int depth;

    protected Expr(int depth) {
        this.depth = depth;
    }

    public abstract <R> R accept(ExprVisitor<R> visitor);

    /**
     * Height of the tree rooted here; a leaf is 1.
     */
    public int getDepth() {
        return depth;
    }

    @Override
    public String toString() {
        return FormulaPrinter.print(this);
    }
}
