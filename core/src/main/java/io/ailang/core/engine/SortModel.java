package io.ailang.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.ailang.core.error.TaskRuntimeException;
import io.ailang.core.model.ExecutionContext;
import io.ailang.core.model.ModelSpec;
import io.ailang.core.spi.TaskModel;
import io.ailang.core.value.JsValues;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * The {@code sort} model. Sorts the list found in the context and binds the result under
 * {@code sorted}; the source list is never modified.
 *
 * <p>Arguments: {@code algorithm} ({@code bubble}, the default, or {@code native}) and an optional
 * {@code key} naming the member to compare by. Both are read with JavaScript truthiness and
 * converted to text, so {@code algorithm=0} selects {@code bubble}.
 *
 * <p>The list is inferred in this order: the input when it is an array, the context's {@code list}
 * binding when it is an array, the input's {@code list} member when it is an array.
 *
 * <p>The static helpers are shared with the bytecode VM so both execution paths sort identically.
 */
public final class SortModel implements TaskModel {

    public static final String ID = "sort";
    public static final String BUBBLE = "bubble";
    public static final String NATIVE = "native";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public void apply(ModelSpec spec, ExecutionContext context) {
        sortInto(context, algorithmName(spec.arg("algorithm")), keyName(spec.arg("key")));
    }

    /** Resolves the {@code algorithm} argument; absent or falsy means {@link #BUBBLE}. */
    public static String algorithmName(JsonNode arg) {
        return arg != null && JsValues.isTruthy(arg) ? JsValues.toJsString(arg) : BUBBLE;
    }

    /** Resolves the {@code key} argument; absent or falsy means no key ({@code null}). */
    public static String keyName(JsonNode arg) {
        return arg != null && JsValues.isTruthy(arg) ? JsValues.toJsString(arg) : null;
    }

    /**
     * Sorts the inferred list with the named algorithm and binds the result under {@code sorted}.
     *
     * @param context   the live context
     * @param algorithm {@link #BUBBLE} or {@link #NATIVE}
     * @param key       member to compare by, or {@code null} to compare elements directly
     * @throws TaskRuntimeException if no list is found or the algorithm is unknown
     */
    public static void sortInto(ExecutionContext context, String algorithm, String key) {
        ArrayNode list = inferList(context);
        if (list == null) {
            throw new TaskRuntimeException("Model \"sort\" requires an array input", null, null);
        }
        List<JsonNode> items = new ArrayList<>(list.size());
        list.forEach(items::add);

        if (BUBBLE.equals(algorithm)) {
            bubbleSort(items, key);
        } else if (NATIVE.equals(algorithm)) {
            items = mergeSort(items, comparator(key));
        } else {
            throw new TaskRuntimeException("Unknown sort algorithm: " + algorithm, null, null);
        }

        ArrayNode sorted = JsonNodeFactory.instance.arrayNode(items.size());
        sorted.addAll(items);
        context.set(ExecutionContext.SORTED, sorted);
    }

    /** Returns the list to sort, or {@code null} if the context holds none. */
    static ArrayNode inferList(ExecutionContext context) {
        JsonNode input = context.get(ExecutionContext.INPUT);
        if (input.isArray()) {
            return (ArrayNode) input;
        }
        JsonNode list = context.get(ExecutionContext.LIST);
        if (list.isArray()) {
            return (ArrayNode) list;
        }
        if (input.isObject() && input.path(ExecutionContext.LIST).isArray()) {
            return (ArrayNode) input.get(ExecutionContext.LIST);
        }
        return null;
    }

    private static JsonNode sortValue(JsonNode item, String key) {
        return key != null ? JsValues.member(item, key) : item;
    }

    /** Adjacent swaps while {@code key(a) > key(b)}, stopping after a pass without swaps. */
    private static void bubbleSort(List<JsonNode> items, String key) {
        int n = items.size();
        for (int i = 0; i < n - 1; i++) {
            boolean swapped = false;
            for (int j = 0; j < n - i - 1; j++) {
                if (JsValues.gt(sortValue(items.get(j), key), sortValue(items.get(j + 1), key))) {
                    JsonNode tmp = items.get(j);
                    items.set(j, items.get(j + 1));
                    items.set(j + 1, tmp);
                    swapped = true;
                }
            }
            if (!swapped) {
                break;
            }
        }
    }

    private static Comparator<JsonNode> comparator(String key) {
        return (a, b) -> {
            JsonNode va = sortValue(a, key);
            JsonNode vb = sortValue(b, key);
            if (JsValues.lt(va, vb)) {
                return -1;
            }
            if (JsValues.gt(va, vb)) {
                return 1;
            }
            return 0;
        };
    }

    /*
     * Stable top-down merge sort. List.sort is not used: the loose comparator is not a total order
     * for mixed values and TimSort may reject it.
     */
    private static List<JsonNode> mergeSort(List<JsonNode> items, Comparator<JsonNode> cmp) {
        if (items.size() <= 1) {
            return items;
        }
        int mid = items.size() / 2;
        List<JsonNode> left = mergeSort(new ArrayList<>(items.subList(0, mid)), cmp);
        List<JsonNode> right = mergeSort(new ArrayList<>(items.subList(mid, items.size())), cmp);
        List<JsonNode> merged = new ArrayList<>(items.size());
        int i = 0;
        int j = 0;
        while (i < left.size() && j < right.size()) {
            if (cmp.compare(right.get(j), left.get(i)) < 0) {
                merged.add(right.get(j++));
            } else {
                merged.add(left.get(i++));
            }
        }
        while (i < left.size()) {
            merged.add(left.get(i++));
        }
        while (j < right.size()) {
            merged.add(right.get(j++));
        }
        return merged;
    }
}
