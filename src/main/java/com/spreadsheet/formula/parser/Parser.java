package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.ast.BinaryExpr;
import com.spreadsheet.formula.ast.BinaryOp;
import com.spreadsheet.formula.ast.CellRefExpr;
import com.spreadsheet.formula.ast.Expr;
import com.spreadsheet.formula.ast.FunctionCallExpr;
import com.spreadsheet.formula.ast.NumberExpr;
import com.spreadsheet.formula.ast.RangeExpr;
import com.spreadsheet.formula.ast.StringExpr;
import com.spreadsheet.formula.ast.UnaryExpr;
import com.spreadsheet.formula.ast.UnaryOp;
import com.spreadsheet.formula.exceptions.ParserException;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for formula text (without the leading '=').
 * <p>
 * Precedence, loosest first:
 * <ul>
 *   <li>Equality: =, &lt;&gt;</li>
 *   <li>Comparison: &lt;, &lt;=, &gt;, &gt;=</li>
 *   <li>Addition: +, -</li>
 *   <li>Concatenation: &amp;</li>
 *   <li>Multiplication: *, /, %</li>
 *   <li>Power: **, ^ (right-associative)</li>
 *   <li>Unary: prefix +, -</li>
 *   <li>Primary: number, string, cell reference, range, function call, ( ... )</li>
 * </ul>
 * All binary levels except Power are left-associative.
 * <p>
 * maxDepth bounds both the recursion of the parser and the height of the
 * tree it returns, so a long chain such as 1+1+...+1 fails here instead of
 * overflowing the stack of whatever walks the tree later.
 * <p>
 * The first token is read by the constructor, so an input whose first token
 * cannot be lexed (e.g. an unterminated string) fails when the parser is built.
 */
public class Parser {

    public static final int DEFAULT_MAX_DEPTH = 1024;

    private final Lexer lexer;
    private final int maxDepth;
    private Token current;
    private int depth;

    public Parser(String input) {
        this(input, DEFAULT_MAX_DEPTH);
    }

    public Parser(String input, int maxDepth) {
        this.lexer = new Lexer(input);
        this.maxDepth = maxDepth;
        this.current = lexer.nextToken();
    }

    /**
     * Parses a complete expression; anything left over is an error.
     */
    public Expr parse() {
        Expr expr = parseEquality();
        if (!current.is(TokenType.EOF)) {
            throw new ParserException("Unexpected " + current + " at position " + current.getPosition());
        }
        return expr;
    }

    private Expr parseEquality() {
        descend();
        try {
            Expr left = parseComparison();
            while (current.is(TokenType.EQUAL) || current.is(TokenType.NOT_EQUAL)) {
                BinaryOp op = current.is(TokenType.EQUAL) ? BinaryOp.EQUAL : BinaryOp.NOT_EQUAL;
                advance();
                left = bounded(new BinaryExpr(left, op, parseComparison()));
            }
            return left;
        } finally {
            ascend();
        }
    }

    private Expr parseComparison() {
        Expr left = parseAddition();
        while (true) {
            BinaryOp op;
            switch (current.getType()) {
                case LESS:
                    op = BinaryOp.LESS;
                    break;
                case LESS_EQUAL:
                    op = BinaryOp.LESS_EQUAL;
                    break;
                case GREATER:
                    op = BinaryOp.GREATER;
                    break;
                case GREATER_EQUAL:
                    op = BinaryOp.GREATER_EQUAL;
                    break;
                default:
                    return left;
            }
            advance();
            left = bounded(new BinaryExpr(left, op, parseAddition()));
        }
    }

    private Expr parseAddition() {
        Expr left = parseConcatenation();
        while (current.is(TokenType.PLUS) || current.is(TokenType.MINUS)) {
            BinaryOp op = current.is(TokenType.PLUS) ? BinaryOp.ADD : BinaryOp.SUBTRACT;
            advance();
            left = bounded(new BinaryExpr(left, op, parseConcatenation()));
        }
        return left;
    }

    private Expr parseConcatenation() {
        Expr left = parseMultiplication();
        while (current.is(TokenType.AMPERSAND)) {
            advance();
            left = bounded(new BinaryExpr(left, BinaryOp.CONCATENATE, parseMultiplication()));
        }
        return left;
    }

    private Expr parseMultiplication() {
        Expr left = parsePower();
        while (true) {
            BinaryOp op;
            switch (current.getType()) {
                case STAR:
                    op = BinaryOp.MULTIPLY;
                    break;
                case SLASH:
                    op = BinaryOp.DIVIDE;
                    break;
                case PERCENT:
                    op = BinaryOp.MODULO;
                    break;
                default:
                    return left;
            }
            advance();
            left = bounded(new BinaryExpr(left, op, parsePower()));
        }
    }

    // Right-associative: 2 ** 3 ** 2 is 2 ** (3 ** 2)
    private Expr parsePower() {
        Expr left = parseUnary();
        if (!current.is(TokenType.POWER) && !current.is(TokenType.CARET)) {
            return left;
        }
        advance();
        descend();
        try {
            return bounded(new BinaryExpr(left, BinaryOp.POWER, parsePower()));
        } finally {
            ascend();
        }
    }

    private Expr parseUnary() {
        if (!current.is(TokenType.PLUS) && !current.is(TokenType.MINUS)) {
            return parsePrimary();
        }
        UnaryOp op = current.is(TokenType.PLUS) ? UnaryOp.PLUS : UnaryOp.MINUS;
        advance();
        descend();
        try {
            return bounded(new UnaryExpr(op, parseUnary()));
        } finally {
            ascend();
        }
    }

    private Expr parsePrimary() {
        Token token = current;
        switch (token.getType()) {
            case NUMBER:
                advance();
                return new NumberExpr(token.getNumber());

            case STRING:
                advance();
                return new StringExpr(token.getText());

            case CELL_REF:
                advance();
                if (!current.is(TokenType.COLON)) {
                    return new CellRefExpr(token.getText());
                }
                advance();
                if (!current.is(TokenType.CELL_REF)) {
                    throw new ParserException("Expected cell reference after ':' but found " + current);
                }
                Token end = current;
                advance();
                return new RangeExpr(token.getText(), end.getText());

            case IDENTIFIER:
                advance();
                if (!current.is(TokenType.LEFT_PAREN)) {
                    throw new ParserException("Unknown identifier: " + token.getText());
                }
                advance();
                List<Expr> arguments = parseArguments();
                expect(TokenType.RIGHT_PAREN, "')' to close call to " + token.getText());
                return bounded(new FunctionCallExpr(token.getText(), arguments));

            case LEFT_PAREN:
                advance();
                Expr inner = parseEquality();
                expect(TokenType.RIGHT_PAREN, "')'");
                return inner;

            default:
                throw new ParserException("Unexpected " + token + " at position " + token.getPosition());
        }
    }

    private List<Expr> parseArguments() {
        List<Expr> arguments = new ArrayList<>();
        if (current.is(TokenType.RIGHT_PAREN)) {
            return arguments;
        }
        arguments.add(parseEquality());
        while (current.is(TokenType.COMMA)) {
            advance();
            arguments.add(parseEquality());
        }
        return arguments;
    }

    private void expect(TokenType type, String description) {
        if (!current.is(type)) {
            throw new ParserException("Expected " + description + " but found " + current);
        }
        advance();
    }

    private void advance() {
        current = lexer.nextToken();
    }

    private <T extends Expr> T bounded(T expr) {
        if (expr.getDepth() > maxDepth) {
            throw new ParserException("Formula is nested deeper than " + maxDepth + " levels");
        }
        return expr;
    }

    private void descend() {
        if (++depth > maxDepth) {
            throw new ParserException("Formula is nested deeper than " + maxDepth + " levels");
        }
    }

    private void ascend() {
        depth--;
    }
}
