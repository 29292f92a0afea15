package io.ailang.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * A condition over one context variable: either bare truthiness ({@code op} and {@code right} are
 * {@code null}) or a comparison against a scalar literal.
 *
 * @param left  name of the context variable
 * @param op    comparison operator, or {@code null} for a truthiness test
 * @param right scalar literal operand, or {@code null} for a truthiness test
 */
public record Condition(String left, ComparisonOp op, JsonNode right) {

    public Condition {
        Objects.requireNonNull(left, "left must not be null");
        if ((op == null) != (right == null)) {
            throw new IllegalArgumentException("op and right must be both present or both absent");
        }
    }

    /** Creates a bare truthiness condition. */
    public static Condition truthy(String left) {
        return new Condition(left, null, null);
    }

    /** Returns {@code true} if this condition compares against a literal. */
    public boolean isComparison() {
        return op != null;
    }
}
