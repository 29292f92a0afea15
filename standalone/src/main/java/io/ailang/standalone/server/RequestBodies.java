package io.ailang.standalone.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.http.Context;

/** Reads request payloads and writes JSON responses for the task handlers. */
final class RequestBodies {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private RequestBodies() {
        // utility class
    }

    /**
     * Returns the task source of a request: the {@code source} field of a JSON object body, or the
     * raw body text otherwise.
     *
     * @throws InvalidRequestException if there is no source
     */
    static String source(Context ctx) {
        String body = ctx.body();
        if (body.isBlank()) {
            throw new InvalidRequestException("Request body must carry task source");
        }
        if (!body.strip().startsWith("{")) {
            return body;
        }
        JsonNode source = readObject(body).get("source");
        if (source == null || !source.isTextual()) {
            throw new InvalidRequestException("Missing string field 'source'");
        }
        return source.textValue();
    }

    /**
     * Parses the body as a JSON object.
     *
     * @throws InvalidRequestException if the body is not a JSON object
     */
    static JsonNode readObject(String body) {
        JsonNode node;
        try {
            node = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new InvalidRequestException("Malformed JSON body: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new InvalidRequestException("Request body must be a JSON object");
        }
        return node;
    }

    static void writeJson(Context ctx, int status, JsonNode body) {
        ctx.status(status);
        ctx.contentType("application/json");
        ctx.result(body.toString());
    }

    static void writeProblem(Context ctx, JsonNode problem) {
        ctx.status(problem.path("status").asInt(500));
        ctx.contentType("application/problem+json");
        ctx.result(problem.toString());
    }
}
