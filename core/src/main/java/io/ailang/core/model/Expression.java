package io.ailang.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Expression tree for let-binding right-hand sides. A sealed hierarchy: literals, identifiers,
 * member access and the four binary arithmetic operators.
 */
public sealed interface Expression {

    /** A string, number, boolean or null literal. */
    record Literal(JsonNode value) implements Expression {
        public Literal {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** A context lookup by name. */
    record Identifier(String name) implements Expression {}

    /** {@code object.property}; chains nest left-associatively. */
    record Member(Expression object, String property) implements Expression {}

    /** {@code left op right}. */
    record Binary(BinaryOp op, Expression left, Expression right) implements Expression {}
}
