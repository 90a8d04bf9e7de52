package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.exceptions.LexerException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns formula text (without the leading '=') into tokens, one at a time.
 * Keeps a single current character; two-character operators peek one further.
 */
public class Lexer {

    // Letters strictly before digits, e.g. "A1", "AA12"; "A1B" and "1A" are not references
    private static final Pattern CELL_REF_PATTERN = Pattern.compile("[A-Z]+[0-9]+");

    private static final char NONE = '\0';

    private final String input;
    private int position;
    private char current;

    public Lexer(String input) {
        this.input = input == null ? "" : input;
        this.position = 0;
        this.current = this.input.isEmpty() ? NONE : this.input.charAt(0);
    }

    /**
     * Lexes the whole input. The last token is always EOF.
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (!token.is(TokenType.EOF));
        return tokens;
    }

    public Token nextToken() {
        skipWhitespace();
        if (atEnd()) {
            return Token.of(TokenType.EOF, "", position);
        }

        int start = position;
        char ch = current;

        if (isDigit(ch)) {
            return readNumber();
        }
        if (isAsciiLetter(ch)) {
            return readIdentifier();
        }
        if (ch == '"') {
            return readString();
        }

        advance();
        switch (ch) {
            case '+':
                return Token.of(TokenType.PLUS, "+", start);
            case '-':
                return Token.of(TokenType.MINUS, "-", start);
            case '*':
                if (current == '*' && !atEnd()) {
                    advance();
                    return Token.of(TokenType.POWER, "**", start);
                }
                return Token.of(TokenType.STAR, "*", start);
            case '/':
                return Token.of(TokenType.SLASH, "/", start);
            case '%':
                return Token.of(TokenType.PERCENT, "%", start);
            case '^':
                return Token.of(TokenType.CARET, "^", start);
            case '&':
                return Token.of(TokenType.AMPERSAND, "&", start);
            case '<':
                if (!atEnd() && current == '=') {
                    advance();
                    return Token.of(TokenType.LESS_EQUAL, "<=", start);
                }
                if (!atEnd() && current == '>') {
                    advance();
                    return Token.of(TokenType.NOT_EQUAL, "<>", start);
                }
                return Token.of(TokenType.LESS, "<", start);
            case '>':
                if (!atEnd() && current == '=') {
                    advance();
                    return Token.of(TokenType.GREATER_EQUAL, ">=", start);
                }
                return Token.of(TokenType.GREATER, ">", start);
            case '=':
                return Token.of(TokenType.EQUAL, "=", start);
            case '(':
                return Token.of(TokenType.LEFT_PAREN, "(", start);
            case ')':
                return Token.of(TokenType.RIGHT_PAREN, ")", start);
            case ',':
                return Token.of(TokenType.COMMA, ",", start);
            case ':':
                return Token.of(TokenType.COLON, ":", start);
            default:
                throw new LexerException("Unexpected character '"
                        + new String(Character.toChars(input.codePointAt(start))) + "'", start);
        }
    }

    private Token readNumber() {
        int start = position;
        while (!atEnd() && isDigit(current)) {
            advance();
        }
        if (!atEnd() && current == '.') {
            advance();
            while (!atEnd() && isDigit(current)) {
                advance();
            }
        }
        String text = input.substring(start, position);
        return Token.number(Double.parseDouble(text), text, start);
    }

    private Token readIdentifier() {
        int start = position;
        while (!atEnd() && (isAsciiLetter(current) || isDigit(current) || current == '_')) {
            advance();
        }
        String name = input.substring(start, position).toUpperCase(Locale.ROOT);
        TokenType type = CELL_REF_PATTERN.matcher(name).matches() ? TokenType.CELL_REF : TokenType.IDENTIFIER;
        return Token.of(type, name, start);
    }

    // A doubled quote inside the literal stands for one quote character
    private Token readString() {
        int start = position;
        advance();
        StringBuilder value = new StringBuilder();
        while (true) {
            if (atEnd()) {
                throw new LexerException("Unterminated string literal", start);
            }
            char ch = current;
            advance();
            if (ch == '"') {
                if (!atEnd() && current == '"') {
                    value.append('"');
                    advance();
                } else {
                    return Token.of(TokenType.STRING, value.toString(), start);
                }
            } else {
                value.append(ch);
            }
        }
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(current)) {
            advance();
        }
    }

    private void advance() {
        position++;
        current = position < input.length() ? input.charAt(position) : NONE;
    }

    private boolean atEnd() {
        return position >= input.length();
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isAsciiLetter(char ch) {
        return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z');
    }
}
