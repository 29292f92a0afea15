package io.ailang.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ailang.core.error.BytecodeDecodeException;
import io.ailang.core.error.TaskException;
import io.ailang.core.error.TaskRuntimeException;
import io.ailang.core.error.TaskSyntaxException;

/**
 * Builds RFC 9457 Problem Details bodies for the HTTP service.
 *
 * <p>Language errors carry a {@code type} derived from the failing phase:
 *
 * <pre>{@code
 * {
 *   "type": "urn:ailang:error:syntax",
 *   "title": "Syntax Error",
 *   "status": 400,
 *   "detail": "Invalid %out directive (line 3)",
 *   "instance": "/run",
 *   "task_id": "demo",
 *   "line": 3
 * }
 * }</pre>
 *
 * <p>Thread-safe: all methods are stateless.
 */
public final class ProblemDetail {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String URN_SYNTAX = "urn:ailang:error:syntax";
    static final String URN_RUNTIME = "urn:ailang:error:runtime";
    static final String URN_BYTECODE_DECODE = "urn:ailang:error:bytecode-decode";
    static final String URN_BAD_REQUEST = "urn:ailang:error:bad-request";
    static final String URN_BODY_TOO_LARGE = "urn:ailang:error:body-too-large";
    static final String URN_INTERNAL_ERROR = "urn:ailang:error:internal";

    private ProblemDetail() {
        // utility class
    }

    /**
     * Maps a language error to a 400 problem, adding the fields that locate it: {@code task_id},
     * {@code line} for syntax errors, {@code statement} for tree-path runtime errors and
     * {@code offset} for decode errors.
     */
    public static JsonNode forTaskException(TaskException e, String instancePath) {
        ObjectNode node;
        if (e instanceof TaskSyntaxException syntax) {
            node = build(URN_SYNTAX, "Syntax Error", 400, e.detail(), instancePath);
            if (syntax.lineNumber() > 0) {
                node.put("line", syntax.lineNumber());
            }
        } else if (e instanceof BytecodeDecodeException decode) {
            node = build(URN_BYTECODE_DECODE, "Bytecode Decode Error", 400, e.detail(), instancePath);
            node.put("offset", decode.offset());
        } else {
            node = build(URN_RUNTIME, "Runtime Error", 400, e.detail(), instancePath);
            Integer index = ((TaskRuntimeException) e).statementIndex();
            if (index != null) {
                node.put("statement", index);
            }
        }
        if (e.taskId() != null) {
            node.put("task_id", e.taskId());
        }
        return node;
    }

    /** Missing or malformed request payload. */
    public static JsonNode badRequest(String detail, String instancePath) {
        return build(URN_BAD_REQUEST, "Bad Request", 400, detail, instancePath);
    }

    /** Request body larger than {@code server.max-body-bytes}. */
    public static JsonNode bodyTooLarge(String detail, String instancePath) {
        return build(URN_BODY_TOO_LARGE, "Payload Too Large", 413, detail, instancePath);
    }

    /** Unexpected failure. */
    public static JsonNode internalError(String detail, String instancePath) {
        return build(URN_INTERNAL_ERROR, "Internal Server Error", 500, detail, instancePath);
    }

    static ObjectNode build(String type, String title, int status, String detail, String instancePath) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        if (instancePath != null) {
            node.put("instance", instancePath);
        } else {
            node.putNull("instance");
        }
        return node;
    }
}
