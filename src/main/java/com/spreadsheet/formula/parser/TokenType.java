package com.spreadsheet.formula.parser;

/**
 * Token types for formula lexing.
 */
public enum TokenType {
    // Literals and names
    NUMBER,
    STRING,
    CELL_REF,
    IDENTIFIER,

    // Arithmetic operators
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,
    POWER,
    CARET,
    AMPERSAND,

    // Comparison operators
    LESS,
    LESS_EQUAL,
    GREATER,
    GREATER_EQUAL,
    NOT_EQUAL,
    EQUAL,

    // Delimiters
    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA,
    COLON,

    // Special
    EOF
}
