package com.spreadsheet.formula.models;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A formula value: either a Number (double) or a String.
 * Coercions between the two never fail; a String that is not numeric
 * counts as 0 in arithmetic.
 */
public final class Value {

    public enum Type {
        NUMBER,
        STRING
    }

    public static final Value ZERO = new Value(Type.NUMBER, 0.0, null);
    public static final Value ONE = new Value(Type.NUMBER, 1.0, null);
    public static final Value EMPTY = new Value(Type.STRING, 0.0, "");

    // Plain decimal floats, optional sign and exponent; no surrounding whitespace
    private static final Pattern FLOAT_PATTERN =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern SPECIAL_PATTERN =
            Pattern.compile("[+-]?(inf|infinity|nan)", Pattern.CASE_INSENSITIVE);

    private final Type type;
    private final double number;
    private final String text;

    private Value(Type type, double number, String text) {
        this.type = type;
        this.number = number;
        this.text = text;
    }

    public static Value number(double number) {
        return new Value(Type.NUMBER, number, null);
    }

    public static Value string(String text) {
        return new Value(Type.STRING, 0.0, Objects.requireNonNull(text, "text"));
    }

    public static Value bool(boolean condition) {
        return condition ? ONE : ZERO;
    }

    /**
     * Numeric sniffing of stored cell text: numeric text becomes a Number,
     * anything else (including the empty string) stays a String.
     */
    public static Value fromCellText(String text) {
        if (text == null) {
            return EMPTY;
        }
        Double parsed = parseNumber(text);
        return parsed != null ? number(parsed) : string(text);
    }

    /**
     * Parses text as a float, returning null when it is not one.
     */
    public static Double parseNumber(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        if (FLOAT_PATTERN.matcher(text).matches()) {
            return Double.parseDouble(text);
        }
        if (SPECIAL_PATTERN.matcher(text).matches()) {
            boolean negative = text.charAt(0) == '-';
            String body = text.replaceFirst("^[+-]", "").toLowerCase(Locale.ROOT);
            if (body.equals("nan")) {
                return Double.NaN;
            }
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return null;
    }

    /**
     * Renders a number the way cell values are displayed: the digits of
     * Double.toString written out in plain notation, no trailing ".0",
     * never an exponent. The text always parses back to the same double.
     * Before JDK 19 Double.toString can emit one digit more than the
     * shortest such decimal (JDK-4511638), and so can this.
     */
    public static String formatNumber(double number) {
        if (Double.isNaN(number)) {
            return "NaN";
        }
        if (Double.isInfinite(number)) {
            return number > 0 ? "inf" : "-inf";
        }
        if (number == 0.0) {
            return (1.0 / number < 0) ? "-0" : "0";
        }
        return new BigDecimal(Double.toString(number)).stripTrailingZeros().toPlainString();
    }

    public Type getType() {
        return type;
    }

    public boolean isNumber() {
        return type == Type.NUMBER;
    }

    public boolean isString() {
        return type == Type.STRING;
    }

    public double toNumber() {
        if (type == Type.NUMBER) {
            return number;
        }
        Double parsed = parseNumber(text);
        return parsed != null ? parsed : 0.0;
    }

    public boolean isTruthy() {
        if (type == Type.NUMBER) {
            return number != 0.0;
        }
        return !text.isEmpty();
    }

    @Override
    public String toString() {
        return type == Type.NUMBER ? formatNumber(number) : text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Value)) {
            return false;
        }
        Value that = (Value) o;
        if (type != that.type) {
            return false;
        }
        return type == Type.NUMBER
                ? Double.compare(number, that.number) == 0
                : text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return type == Type.NUMBER ? Double.hashCode(number) : text.hashCode();
    }
}
