package io.ailang.standalone.server;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ailang.core.bytecode.BytecodeModule;
import io.ailang.core.engine.TaskEngine;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.util.Objects;

/**
 * {@code POST /compile}: parses the request's task source and compiles it. Responds with
 * {@code {"bytecode":"<base64>","bytes":N}}.
 */
public final class CompileHandler implements Handler {

    private final TaskEngine engine;

    public CompileHandler(TaskEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    @Override
    public void handle(Context ctx) {
        BytecodeModule module = engine.compile(engine.parse(RequestBodies.source(ctx)));
        ObjectNode body = RequestBodies.MAPPER.createObjectNode();
        body.put("bytecode", module.toBase64());
        body.put("bytes", module.size());
        RequestBodies.writeJson(ctx, 200, body);
    }
}
