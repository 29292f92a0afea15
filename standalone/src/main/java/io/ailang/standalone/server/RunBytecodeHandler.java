package io.ailang.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import io.ailang.core.bytecode.BytecodeModule;
import io.ailang.core.engine.TaskEngine;
import io.ailang.core.model.ExecutionResult;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.util.Objects;

/**
 * {@code POST /runbc}: runs base64 bytecode on the VM. The body is
 * {@code {"bytecode":"<base64>","input":<optional JSON>}}; without {@code input} the context
 * starts empty. Responds like {@code /run}.
 */
public final class RunBytecodeHandler implements Handler {

    private final TaskEngine engine;

    public RunBytecodeHandler(TaskEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    @Override
    public void handle(Context ctx) {
        JsonNode request = RequestBodies.readObject(ctx.body());
        JsonNode encoded = request.get("bytecode");
        if (encoded == null || !encoded.isTextual()) {
            throw new InvalidRequestException("Missing string field 'bytecode'");
        }
        BytecodeModule module;
        try {
            module = BytecodeModule.fromBase64(encoded.textValue());
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Field 'bytecode' is not valid base64", e);
        }
        ExecutionResult result = engine.run(module, request.get("input"));
        RequestBodies.writeJson(ctx, 200, RunHandler.render(result));
    }
}
