package io.ailang.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ailang.core.model.ExecutionContext;
import io.ailang.core.model.ModelSpec;
import io.ailang.core.spi.TaskModel;

/**
 * The {@code tool} model: records a tool request for an outer orchestrator instead of performing
 * any side effect.
 *
 * <p>Each application appends {@code {"kind":"tool","args":{...}}} to the context array
 * {@code __requests} (created when absent or not an array) and binds the same array under
 * {@code plan}.
 */
public final class ToolModel implements TaskModel {

    public static final String ID = "tool";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public void apply(ModelSpec spec, ExecutionContext context) {
        ObjectNode args = JsonNodeFactory.instance.objectNode();
        spec.args().forEach((name, value) -> args.set(name, value.deepCopy()));

        ObjectNode request = JsonNodeFactory.instance.objectNode();
        request.put("kind", ID);
        request.set("args", args);

        JsonNode existing = context.get(ExecutionContext.REQUESTS);
        ArrayNode requests = existing.isArray() ? (ArrayNode) existing : JsonNodeFactory.instance.arrayNode();
        requests.add(request);
        context.set(ExecutionContext.REQUESTS, requests);
        context.set(ExecutionContext.PLAN, requests);
    }
}
