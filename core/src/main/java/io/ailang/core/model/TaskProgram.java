package io.ailang.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/**
 * A parsed task. Immutable once built.
 *
 * <p>The bucketed fields ({@code input}, {@code model}, {@code out}, {@code nodes}, ...) answer
 * structural questions without rescanning; {@link #sourceOrder()} is the authoritative execution
 * order and contains every bucketed item exactly once, plus let-bindings.
 *
 * @param taskId      identifier from the {@code @id:} header
 * @param input       the {@code %in} payload, or {@code null}
 * @param model       the {@code %model} declaration, or {@code null}
 * @param out         the {@code %out} name, or {@code null}
 * @param nodes       graph node declarations
 * @param edges       graph edge declarations
 * @param conditions  bare conditions
 * @param actions     conditional actions
 * @param sourceOrder every statement in source order
 */
public record TaskProgram(
        String taskId,
        JsonNode input,
        ModelSpec model,
        String out,
        List<NodeDecl> nodes,
        List<EdgeDecl> edges,
        List<Condition> conditions,
        List<ConditionalAction> actions,
        List<Statement> sourceOrder) {

    public TaskProgram {
        Objects.requireNonNull(taskId, "taskId must not be null");
        input = input != null ? input.deepCopy() : null;
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
        actions = actions != null ? List.copyOf(actions) : List.of();
        sourceOrder = sourceOrder != null ? List.copyOf(sourceOrder) : List.of();
    }

    /** Returns {@code true} if the program declares an {@code %in} block. */
    public boolean hasInput() {
        return input != null;
    }

    /** Returns {@code true} if the program declares a {@code %model}. */
    public boolean hasModel() {
        return model != null;
    }

    /** Returns {@code true} if the program declares an {@code %out}. */
    public boolean hasOut() {
        return out != null;
    }

    /** Returns the program's input, deep-copied so callers cannot alter the program. */
    public JsonNode inputCopy() {
        return input != null ? input.deepCopy() : null;
    }
}
