package io.ailang.core.model;

/** Arithmetic operators of the expression sub-language. */
public enum BinaryOp {
    ADD('+'),
    SUB('-'),
    MUL('*'),
    DIV('/');

    private final char symbol;

    BinaryOp(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    /** Returns the operator for {@code c}, or {@code null} if {@code c} is not an operator. */
    public static BinaryOp fromSymbol(char c) {
        for (BinaryOp op : values()) {
            if (op.symbol == c) {
                return op;
            }
        }
        return null;
    }
}
