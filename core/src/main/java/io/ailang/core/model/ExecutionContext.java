package io.ailang.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ailang.core.value.JsValues;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable name-to-value store threaded through one execution. Never shared between executions;
 * not thread-safe.
 *
 * <p>Reading an unbound name yields {@link JsValues#UNDEFINED}.
 */
public final class ExecutionContext {

    /** Reserved key holding the raw input. */
    public static final String INPUT = "input";

    /** Reserved key the {@code sort} model writes its result to. */
    public static final String SORTED = "sorted";

    /** Conventional key holding the list to sort when the input is not itself an array. */
    public static final String LIST = "list";

    /** Key holding pending tool requests. */
    public static final String REQUESTS = "__requests";

    /** Key mirroring {@link #REQUESTS} for planners. */
    public static final String PLAN = "plan";

    private final Map<String, JsonNode> values = new LinkedHashMap<>();

    private ExecutionContext() {}

    /** Creates an empty context. */
    public static ExecutionContext empty() {
        return new ExecutionContext();
    }

    /**
     * Creates a context seeded from a raw input value: the input is stored under {@link #INPUT},
     * then, if it is an object, its top-level fields are merged over the context. The input is
     * deep-copied first. A {@code null} or undefined input leaves the context empty.
     */
    public static ExecutionContext seeded(JsonNode input) {
        ExecutionContext context = new ExecutionContext();
        if (JsValues.isUndefined(input)) {
            return context;
        }
        JsonNode copy = input.deepCopy();
        context.set(INPUT, copy);
        if (copy.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = copy.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                context.set(field.getKey(), field.getValue());
            }
        }
        return context;
    }

    /** Returns the value bound to {@code name}, or undefined. */
    public JsonNode get(String name) {
        return JsValues.orUndefined(values.get(name));
    }

    /** Binds {@code name}; a Java {@code null} is stored as undefined. */
    public void set(String name, JsonNode value) {
        values.put(name, JsValues.orUndefined(value));
    }

    /** Returns {@code true} if {@code name} has been bound (possibly to undefined). */
    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /** Read-only live view of the bindings in insertion order. */
    public Map<String, JsonNode> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /** Renders the context as a JSON object; undefined bindings are omitted. */
    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        values.forEach((name, value) -> {
            if (!JsValues.isUndefined(value)) {
                node.set(name, value);
            }
        });
        return node;
    }

    @Override
    public String toString() {
        return "ExecutionContext" + toJson();
    }
}
