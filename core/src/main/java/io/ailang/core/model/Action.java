package io.ailang.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/** Effect of a conditional action. All variants are known at compile time. */
public sealed interface Action {

    /** Captures the named value (falling back to the preferred value) under {@code name}. */
    record Emit(String name) implements Action {
        public Emit {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /** Emits a log message; no context or output change. */
    record Log(String message) implements Action {
        public Log {
            Objects.requireNonNull(message, "message must not be null");
        }
    }

    /** Writes a scalar literal into the context under {@code name}. */
    record Set(String name, JsonNode value) implements Action {
        public Set {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }
}
