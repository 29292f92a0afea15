package io.ailang.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ailang.core.value.JsValues;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one execution, whichever path produced it: the outputs mapping and the final
 * context.
 *
 * @param outputs output name to emitted value, in emission order
 * @param context the context as it stood when execution finished
 */
public record ExecutionResult(Map<String, JsonNode> outputs, ExecutionContext context) {

    public ExecutionResult {
        Objects.requireNonNull(context, "context must not be null");
        outputs = outputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(outputs)) : Map.of();
    }

    /** Returns the output named {@code name}, or undefined if none was emitted. */
    public JsonNode output(String name) {
        return JsValues.orUndefined(outputs.get(name));
    }

    /** Renders the outputs as a JSON object; undefined outputs are omitted. */
    public ObjectNode outputsAsJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        outputs.forEach((name, value) -> {
            if (!JsValues.isUndefined(value)) {
                node.set(name, value);
            }
        });
        return node;
    }

    /** Renders the final context as a JSON object. */
    public ObjectNode contextAsJson() {
        return context.toJson();
    }
}
