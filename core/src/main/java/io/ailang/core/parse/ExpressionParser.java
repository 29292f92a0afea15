package io.ailang.core.parse;

import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.ailang.core.error.TaskSyntaxException;
import io.ailang.core.model.BinaryOp;
import io.ailang.core.model.Expression;
import io.ailang.core.value.JsValues;

/**
 * Recursive-descent parser for let-binding right-hand sides.
 *
 * <pre>
 * additive       := multiplicative (('+' | '-') multiplicative)*
 * multiplicative := primary (('*' | '/') primary)*
 * primary        := string | number | 'true' | 'false' | 'null' | identifier ('.' identifier)*
 * </pre>
 *
 * <p>No parentheses, unary operators or comparisons. Identifiers match {@code [A-Za-z_][\w-]*}, so
 * {@code a-b} is a single identifier. Trailing input after a complete expression is an error.
 *
 * <p>Not thread-safe; use {@link #parse(String)}, which creates a fresh instance per call.
 */
public final class ExpressionParser {

    private final String source;
    private int pos;

    private ExpressionParser(String source) {
        this.source = source;
    }

    /**
     * Parses an expression.
     *
     * @param text expression text, surrounding whitespace ignored
     * @return the expression tree
     * @throws TaskSyntaxException if the text is not a well-formed expression
     */
    public static Expression parse(String text) {
        ExpressionParser parser = new ExpressionParser(text.strip());
        Expression expr = parser.parseAdditive();
        parser.skipWhitespace();
        if (parser.pos < parser.source.length()) {
            throw parser.error("Unexpected tokens at end of expression");
        }
        return expr;
    }

    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (true) {
            skipWhitespace();
            BinaryOp op = peekOperator();
            if (op != BinaryOp.ADD && op != BinaryOp.SUB) {
                return left;
            }
            pos++;
            left = new Expression.Binary(op, left, parseMultiplicative());
        }
    }

    private Expression parseMultiplicative() {
        Expression left = parsePrimary();
        while (true) {
            skipWhitespace();
            BinaryOp op = peekOperator();
            if (op != BinaryOp.MUL && op != BinaryOp.DIV) {
                return left;
            }
            pos++;
            left = new Expression.Binary(op, left, parsePrimary());
        }
    }

    private Expression parsePrimary() {
        skipWhitespace();
        if (pos < source.length()) {
            char ch = source.charAt(pos);
            if (ch == '"' || ch == '\'') {
                return new Expression.Literal(JsValues.text(parseString()));
            }
            if (isDigit(ch) || ch == '+' || ch == '-') {
                return new Expression.Literal(JsValues.number(parseNumber()));
            }
        }
        String id = parseIdentifier();
        switch (id) {
            case "true":
                return new Expression.Literal(BooleanNode.TRUE);
            case "false":
                return new Expression.Literal(BooleanNode.FALSE);
            case "null":
                return new Expression.Literal(NullNode.getInstance());
            default:
                break;
        }
        Expression expr = new Expression.Identifier(id);
        while (true) {
            skipWhitespace();
            if (pos < source.length() && source.charAt(pos) == '.') {
                pos++;
                expr = new Expression.Member(expr, parseIdentifier());
            } else {
                return expr;
            }
        }
    }

    private double parseNumber() {
        int start = pos;
        boolean sawDigit = false;
        if (source.charAt(pos) == '+' || source.charAt(pos) == '-') {
            pos++;
        }
        while (pos < source.length() && isDigit(source.charAt(pos))) {
            pos++;
            sawDigit = true;
        }
        if (pos < source.length() && source.charAt(pos) == '.') {
            pos++;
            while (pos < source.length() && isDigit(source.charAt(pos))) {
                pos++;
                sawDigit = true;
            }
        }
        if (!sawDigit) {
            throw error("Invalid number in expression");
        }
        return Double.parseDouble(source.substring(start, pos));
    }

    private String parseString() {
        char quote = source.charAt(pos++);
        int start = pos;
        while (pos < source.length()) {
            if (source.charAt(pos) == quote) {
                return source.substring(start, pos++);
            }
            pos++;
        }
        throw error("Unterminated string");
    }

    private String parseIdentifier() {
        skipWhitespace();
        int start = pos;
        if (pos < source.length() && isIdentifierStart(source.charAt(pos))) {
            pos++;
            while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
                pos++;
            }
        }
        if (pos == start) {
            throw error("Expected identifier in expression");
        }
        return source.substring(start, pos);
    }

    private BinaryOp peekOperator() {
        return pos < source.length() ? BinaryOp.fromSymbol(source.charAt(pos)) : null;
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private TaskSyntaxException error(String message) {
        return new TaskSyntaxException(message + " at position " + pos + ": '" + source + "'", null, 0, source);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c) || c == '-';
    }
}
