package com.spreadsheet.formula.ast;

/**
 * Binary operators with their formula symbol and grammar precedence
 * (1 binds loosest). Only POWER is right-associative.
 */
public enum BinaryOp {
    EQUAL("=", 1),
    NOT_EQUAL("<>", 1),
    LESS("<", 2),
    LESS_EQUAL("<=", 2),
    GREATER(">", 2),
    GREATER_EQUAL(">=", 2),
    ADD("+", 3),
    SUBTRACT("-", 3),
    CONCATENATE("&", 4),
    MULTIPLY("*", 5),
    DIVIDE("/", 5),
    MODULO("%", 5),
    POWER("**", 6);

    private final String symbol;
    private final int precedence;

    BinaryOp(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isRightAssociative() {
        return this == POWER;
    }
}
