package io.ailang.standalone.server;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ailang.core.engine.TaskEngine;
import io.ailang.core.model.ExecutionResult;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.util.Objects;

/**
 * {@code POST /run}: parses the request's task source and executes it on the tree-walking
 * executor. Responds with {@code {"outputs":{...},"context":{...}}}.
 */
public final class RunHandler implements Handler {

    private final TaskEngine engine;

    public RunHandler(TaskEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    @Override
    public void handle(Context ctx) {
        ExecutionResult result = engine.parseAndExecute(RequestBodies.source(ctx));
        RequestBodies.writeJson(ctx, 200, render(result));
    }

    static ObjectNode render(ExecutionResult result) {
        ObjectNode body = RequestBodies.MAPPER.createObjectNode();
        body.set("outputs", result.outputsAsJson());
        body.set("context", result.contextAsJson());
        return body;
    }
}
