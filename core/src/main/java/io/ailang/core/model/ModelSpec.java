package io.ailang.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named model invocation ({@code %model:type{key=value,...}}).
 *
 * @param type model type, e.g. {@code sort} or {@code tool}
 * @param args scalar arguments in declaration order
 */
public record ModelSpec(String type, Map<String, JsonNode> args) {

    public ModelSpec {
        Objects.requireNonNull(type, "type must not be null");
        args = args != null ? Collections.unmodifiableMap(new LinkedHashMap<>(args)) : Map.of();
    }

    /** Returns the argument value, or {@code null} if the argument was not declared. */
    public JsonNode arg(String name) {
        return args.get(name);
    }
}
