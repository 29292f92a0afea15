package io.ailang.core.bytecode;

import com.fasterxml.jackson.databind.JsonNode;
import io.ailang.core.value.JsValues;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Deduplicating table of scalar constants (null, boolean, number, string). Indices are assigned in
 * first-insertion order, so compiling the same program twice yields the same pool.
 *
 * <p>Two values share an entry when their runtime type and serialized form match: {@code 1} and
 * {@code 1.0} are one entry, the number {@code 1} and the string {@code "1"} are two.
 */
public final class ConstantPool {

    static final int TAG_NULL = 0;
    static final int TAG_BOOL = 1;
    static final int TAG_NUMBER = 2;
    static final int TAG_STRING = 3;

    private final List<JsonNode> entries = new ArrayList<>();
    private final Map<String, Integer> index = new HashMap<>();

    /**
     * Returns the index of {@code value}, adding it if not yet present.
     *
     * @param value a null, boolean, number or string node
     * @throws IllegalArgumentException for containers or undefined
     */
    public int add(JsonNode value) {
        String key = keyOf(value);
        Integer existing = index.get(key);
        if (existing != null) {
            return existing;
        }
        int id = entries.size();
        entries.add(canonical(value));
        index.put(key, id);
        return id;
    }

    /** Shorthand for {@code add(JsValues.text(value))}. */
    public int addString(String value) {
        return add(JsValues.text(value));
    }

    public JsonNode get(int i) {
        return entries.get(i);
    }

    public int size() {
        return entries.size();
    }

    /** Read-only view of the entries in index order. */
    public List<JsonNode> entries() {
        return Collections.unmodifiableList(entries);
    }

    /** Writes the pool: u32 count, then one tagged entry each. */
    void encode(ByteSink out) {
        out.u32(entries.size());
        for (JsonNode value : entries) {
            if (value.isNull()) {
                out.u8(TAG_NULL);
            } else if (value.isBoolean()) {
                out.u8(TAG_BOOL);
                out.u8(value.booleanValue() ? 1 : 0);
            } else if (value.isNumber()) {
                out.u8(TAG_NUMBER);
                out.f64(value.doubleValue());
            } else {
                out.u8(TAG_STRING);
                out.utf8(value.textValue());
            }
        }
    }

    private static String keyOf(JsonNode value) {
        if (JsValues.isUndefined(value)) {
            throw new IllegalArgumentException("undefined cannot be stored in the constant pool");
        }
        if (value.isNull()) {
            return "object:null";
        }
        if (value.isBoolean()) {
            return "boolean:" + value.booleanValue();
        }
        if (value.isNumber()) {
            return "number:" + JsValues.numberToString(value.doubleValue());
        }
        if (value.isTextual()) {
            return "string:" + value.textValue();
        }
        throw new IllegalArgumentException("Not a scalar constant: " + value.getNodeType());
    }

    private static JsonNode canonical(JsonNode value) {
        return value.isNumber() ? JsValues.number(value.doubleValue()) : value;
    }
}
