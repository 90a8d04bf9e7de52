package com.spreadsheet.formula.ast;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public final class FunctionCallExpr extends Expr {

    private final String name;
    private final List<Expr> arguments;

    public FunctionCallExpr(String name, List<Expr> arguments) {
        super(1 + maxDepth(arguments));
        this.name = Objects.requireNonNull(name, "name");
        this.arguments = List.copyOf(arguments);
    }

    public FunctionCallExpr(String name, Expr... arguments) {
        this(name, Arrays.asList(arguments));
    }

    private static int maxDepth(List<Expr> arguments) {
        int depth = 0;
        for (Expr argument : arguments) {
            depth = Math.max(depth, argument.getDepth());
        }
        return depth;
    }

    public String getName() {
        return name;
    }

    public List<Expr> getArguments() {
        return arguments;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof FunctionCallExpr)) {
            return false;
        }
        FunctionCallExpr that = (FunctionCallExpr) o;
        return name.equals(that.name) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments);
    }
}
