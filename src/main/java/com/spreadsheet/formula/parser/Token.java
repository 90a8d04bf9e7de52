package com.spreadsheet.formula.parser;

import java.util.Objects;

/**
 * Represents a token in a formula.
 * - type: token type
 * - text: source text (uppercased for names, unescaped for strings)
 * - number: parsed value, for NUMBER tokens only
 * - position: zero-based offset of the token in the formula
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final double number;
    private final int position;

    private Token(TokenType type, String text, double number, int position) {
        this.type = type;
        this.text = text;
        this.number = number;
        this.position = position;
    }

    public static Token of(TokenType type, String text, int position) {
        return new Token(type, text, 0.0, position);
    }

    public static Token number(double value, String text, int position) {
        return new Token(TokenType.NUMBER, text, value, position);
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public double getNumber() {
        return number;
    }

    public int getPosition() {
        return position;
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    // Position is not part of token identity
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Token)) {
            return false;
        }
        Token that = (Token) o;
        return type == that.type
                && Double.compare(number, that.number) == 0
                && Objects.equals(text, that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, number);
    }

    @Override
    public String toString() {
        switch (type) {
            case EOF:
                return "end of input";
            case STRING:
                return type + "(\"" + text + "\")";
            default:
                return type + "(" + text + ")";
        }
    }
}
