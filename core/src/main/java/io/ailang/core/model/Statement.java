package io.ailang.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * One parsed statement, tagged by kind. {@link TaskProgram#sourceOrder()} holds these in source
 * order and is the only sequence executors walk.
 *
 * <p>Every variant records the 1-based source line it came from.
 */
public sealed interface Statement {

    /** 1-based source line of the statement. */
    int line();

    /** Kind tag: {@code input}, {@code model}, {@code out}, {@code node}, {@code edge}, {@code cond}, {@code action} or {@code let}. */
    String kind();

    /** {@code %in:} block. */
    record Input(int line, JsonNode value) implements Statement {
        public Input {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String kind() {
            return "input";
        }
    }

    /** {@code %model:} declaration. */
    record Model(int line, ModelSpec model) implements Statement {
        public Model {
            Objects.requireNonNull(model, "model must not be null");
        }

        @Override
        public String kind() {
            return "model";
        }
    }

    /** {@code %out:} declaration. */
    record Out(int line, String name) implements Statement {
        public Out {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String kind() {
            return "out";
        }
    }

    /** Graph node declaration. */
    record Node(int line, NodeDecl node) implements Statement {
        @Override
        public String kind() {
            return "node";
        }
    }

    /** Graph edge declaration. */
    record Edge(int line, EdgeDecl edge) implements Statement {
        @Override
        public String kind() {
            return "edge";
        }
    }

    /** Bare {@code ?condition}. Informational only. */
    record Cond(int line, Condition condition) implements Statement {
        @Override
        public String kind() {
            return "cond";
        }
    }

    /** {@code !if ... then ...}. */
    record Conditional(int line, ConditionalAction action) implements Statement {
        public Conditional {
            Objects.requireNonNull(action, "action must not be null");
        }

        @Override
        public String kind() {
            return "action";
        }
    }

    /** {@code let name = expr}. */
    record Let(int line, String name, Expression expression) implements Statement {
        public Let {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(expression, "expression must not be null");
        }

        @Override
        public String kind() {
            return "let";
        }
    }
}
