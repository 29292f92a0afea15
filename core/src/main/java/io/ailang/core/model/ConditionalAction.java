package io.ailang.core.model;

import java.util.Objects;

/** An {@code !if <condition> then <action>} statement. */
public record ConditionalAction(Condition condition, Action action) {

    public ConditionalAction {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(action, "action must not be null");
    }
}
