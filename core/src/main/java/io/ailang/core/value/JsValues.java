package io.ailang.core.value;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Value semantics shared by the tree-walking executor and the bytecode VM. Values are Jackson
 * {@link JsonNode}s; {@link MissingNode} plays the role of "undefined" (an unbound name or an
 * absent member).
 *
 * <p>Coercion table (the only one in the codebase, both interpreters call into it):
 *
 * <ul>
 * <li><b>truthiness</b>: undefined, null, {@code false}, {@code 0}, {@code NaN} and {@code ""} are
 * falsy; everything else, including empty arrays and objects, is truthy.</li>
 * <li><b>to-primitive</b>: arrays become their elements joined with {@code ","} (null and undefined
 * elements as empty text), objects become {@code "[object Object]"}; scalars are unchanged.</li>
 * <li><b>to-number</b>: undefined → NaN, null → 0, booleans → 1/0, strings are trimmed then read as
 * a decimal, hex, octal or binary literal ({@code ""} → 0, anything else → NaN), containers go
 * through to-primitive first.</li>
 * <li><b>loose equality</b> ({@code =}, {@code ==}): null and undefined equal each other and nothing
 * else; booleans compare as numbers; number vs string compares numerically; container vs scalar
 * compares the container's primitive; two containers are equal only when they are the same
 * instance.</li>
 * <li><b>ordering</b> ({@code < <= > >=}): both sides go through to-primitive; two strings compare by
 * UTF-16 code units, otherwise both are converted to numbers and any NaN makes every ordering
 * false.</li>
 * <li><b>arithmetic</b>: {@code +} concatenates when either primitive is a string, otherwise adds
 * numbers; {@code - * /} always convert to numbers (IEEE-754, so {@code 1/0} is Infinity).</li>
 * </ul>
 *
 * <p>Numeric results are normalized by {@link #number(double)} so that both execution paths
 * produce value-equal nodes.
 *
 * <p>Thread-safe: stateless utility class.
 */
public final class JsValues {

    /** The "undefined" value. */
    public static final JsonNode UNDEFINED = MissingNode.getInstance();

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /** Largest integer a double holds exactly (2^53). */
    private static final double MAX_SAFE = 9007199254740992d;

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern HEX = Pattern.compile("0[xX][0-9a-fA-F]+");
    private static final Pattern OCTAL = Pattern.compile("0[oO][0-7]+");
    private static final Pattern BINARY = Pattern.compile("0[bB][01]+");
    private static final Pattern ARRAY_INDEX = Pattern.compile("0|[1-9]\\d{0,9}");

    private JsValues() {}

    // --- Classification ---

    /** Returns {@code true} for Java {@code null} and {@link MissingNode}. */
    public static boolean isUndefined(JsonNode node) {
        return node == null || node.isMissingNode();
    }

    /** Returns {@code true} for undefined and JSON null. */
    public static boolean isNullish(JsonNode node) {
        return isUndefined(node) || node.isNull();
    }

    /** Maps Java {@code null} to {@link #UNDEFINED}. */
    public static JsonNode orUndefined(JsonNode node) {
        return node == null ? UNDEFINED : node;
    }

    /**
     * Nullish coalescing: returns {@code first} unless it is null or undefined, in which case
     * {@code fallback} is returned.
     */
    public static JsonNode coalesce(JsonNode first, JsonNode fallback) {
        return isNullish(first) ? orUndefined(fallback) : first;
    }

    // --- Construction ---

    /**
     * Creates the canonical node for a numeric result. Integral values that a double represents
     * exactly become {@link IntNode} or {@link LongNode}; everything else (fractions, NaN,
     * infinities, negative zero) becomes a {@link DoubleNode}.
     */
    public static JsonNode number(double value) {
        boolean negativeZero = value == 0d && Double.doubleToRawLongBits(value) != 0L;
        if (!negativeZero && !Double.isInfinite(value) && value == Math.rint(value)) {
            if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return IntNode.valueOf((int) value);
            }
            if (Math.abs(value) <= MAX_SAFE) {
                return LongNode.valueOf((long) value);
            }
        }
        return DoubleNode.valueOf(value);
    }

    /** Creates a string node. */
    public static JsonNode text(String value) {
        return TextNode.valueOf(value);
    }

    /** Creates a boolean node. */
    public static JsonNode bool(boolean value) {
        return NODES.booleanNode(value);
    }

    // --- Truthiness ---

    /**
     * Determines if a node is truthy.
     *
     * <ul>
     * <li>{@code null}, {@code NullNode}, {@code MissingNode} → falsy</li>
     * <li>{@code BooleanNode} → its value</li>
     * <li>numbers → falsy when zero or NaN</li>
     * <li>{@code TextNode("")} → falsy</li>
     * <li>any other node, including empty arrays and objects → truthy</li>
     * </ul>
     */
    public static boolean isTruthy(JsonNode node) {
        if (isNullish(node)) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            double d = node.doubleValue();
            return d != 0d && !Double.isNaN(d);
        }
        if (node.isTextual()) {
            return !node.textValue().isEmpty();
        }
        return true;
    }

    // --- Conversions ---

    /** Converts a value to a number. */
    public static double toNumber(JsonNode node) {
        if (isUndefined(node)) {
            return Double.NaN;
        }
        if (node.isNull()) {
            return 0d;
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? 1d : 0d;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            return stringToNumber(node.textValue());
        }
        if (node.isContainerNode()) {
            return stringToNumber(toJsString(node));
        }
        return Double.NaN;
    }

    static double stringToNumber(String raw) {
        String s = raw.strip();
        if (s.isEmpty()) {
            return 0d;
        }
        switch (s) {
            case "Infinity", "+Infinity":
                return Double.POSITIVE_INFINITY;
            case "-Infinity":
                return Double.NEGATIVE_INFINITY;
            default:
                break;
        }
        if (DECIMAL.matcher(s).matches()) {
            return Double.parseDouble(s);
        }
        if (HEX.matcher(s).matches()) {
            return new BigInteger(s.substring(2), 16).doubleValue();
        }
        if (OCTAL.matcher(s).matches()) {
            return new BigInteger(s.substring(2), 8).doubleValue();
        }
        if (BINARY.matcher(s).matches()) {
            return new BigInteger(s.substring(2), 2).doubleValue();
        }
        return Double.NaN;
    }

    /** Converts a value to its string form ({@code undefined}, {@code null}, numbers without {@code .0}). */
    public static String toJsString(JsonNode node) {
        if (isUndefined(node)) {
            return "undefined";
        }
        if (node.isNull()) {
            return "null";
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? "true" : "false";
        }
        if (node.isNumber()) {
            return numberToString(node.doubleValue());
        }
        if (node.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < node.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                JsonNode element = node.get(i);
                if (!isNullish(element)) {
                    sb.append(toJsString(element));
                }
            }
            return sb.toString();
        }
        if (node.isObject()) {
            return "[object Object]";
        }
        return node.asText();
    }

    /** Formats a double the way a JavaScript engine prints it. */
    public static String numberToString(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value == 0d) {
            return "0";
        }
        String sign = value < 0 ? "-" : "";
        BigDecimal decimal = new BigDecimal(Double.toString(Math.abs(value))).stripTrailingZeros();
        String digits = decimal.unscaledValue().toString();
        int k = digits.length();
        int n = k - decimal.scale();

        StringBuilder sb = new StringBuilder(sign);
        if (k <= n && n <= 21) {
            sb.append(digits).append("0".repeat(n - k));
        } else if (0 < n && n <= 21) {
            sb.append(digits, 0, n).append('.').append(digits, n, k);
        } else if (-6 < n && n <= 0) {
            sb.append("0.").append("0".repeat(-n)).append(digits);
        } else {
            int exponent = n - 1;
            sb.append(digits.charAt(0));
            if (k > 1) {
                sb.append('.').append(digits, 1, k);
            }
            sb.append('e').append(exponent >= 0 ? "+" : "-").append(Math.abs(exponent));
        }
        return sb.toString();
    }

    private static JsonNode toPrimitive(JsonNode node) {
        if (!isUndefined(node) && node.isContainerNode()) {
            return text(toJsString(node));
        }
        return orUndefined(node);
    }

    // --- Comparison ---

    /** Loose equality ({@code ==}). */
    public static boolean looseEquals(JsonNode a, JsonNode b) {
        a = orUndefined(a);
        b = orUndefined(b);
        if (isNullish(a) || isNullish(b)) {
            return isNullish(a) && isNullish(b);
        }
        if (a.isContainerNode() && b.isContainerNode()) {
            return a == b;
        }
        if (a.isNumber() && b.isNumber()) {
            return a.doubleValue() == b.doubleValue();
        }
        if (a.isTextual() && b.isTextual()) {
            return a.textValue().equals(b.textValue());
        }
        if (a.isBoolean() && b.isBoolean()) {
            return a.booleanValue() == b.booleanValue();
        }
        if (a.isBoolean()) {
            return looseEquals(number(toNumber(a)), b);
        }
        if (b.isBoolean()) {
            return looseEquals(a, number(toNumber(b)));
        }
        if (a.isNumber() && b.isTextual()) {
            return a.doubleValue() == toNumber(b);
        }
        if (a.isTextual() && b.isNumber()) {
            return toNumber(a) == b.doubleValue();
        }
        if (a.isContainerNode() && (b.isNumber() || b.isTextual())) {
            return looseEquals(toPrimitive(a), b);
        }
        if (b.isContainerNode() && (a.isNumber() || a.isTextual())) {
            return looseEquals(a, toPrimitive(b));
        }
        return false;
    }

    /**
     * Abstract relational comparison {@code a < b}. Returns {@code null} when either side converts
     * to NaN, which every ordering operator treats as {@code false}.
     */
    private static Boolean lessThan(JsonNode a, JsonNode b) {
        JsonNode pa = toPrimitive(a);
        JsonNode pb = toPrimitive(b);
        if (pa.isTextual() && pb.isTextual()) {
            return pa.textValue().compareTo(pb.textValue()) < 0;
        }
        double na = toNumber(pa);
        double nb = toNumber(pb);
        if (Double.isNaN(na) || Double.isNaN(nb)) {
            return null;
        }
        return na < nb;
    }

    /** {@code a < b}. */
    public static boolean lt(JsonNode a, JsonNode b) {
        return Boolean.TRUE.equals(lessThan(a, b));
    }

    /** {@code a > b}. */
    public static boolean gt(JsonNode a, JsonNode b) {
        return Boolean.TRUE.equals(lessThan(b, a));
    }

    /** {@code a <= b}. */
    public static boolean le(JsonNode a, JsonNode b) {
        return Boolean.FALSE.equals(lessThan(b, a));
    }

    /** {@code a >= b}. */
    public static boolean ge(JsonNode a, JsonNode b) {
        return Boolean.FALSE.equals(lessThan(a, b));
    }

    // --- Arithmetic ---

    /** {@code a + b}: string concatenation if either primitive is a string, numeric addition otherwise. */
    public static JsonNode add(JsonNode a, JsonNode b) {
        JsonNode pa = toPrimitive(a);
        JsonNode pb = toPrimitive(b);
        if (pa.isTextual() || pb.isTextual()) {
            return text(toJsString(pa) + toJsString(pb));
        }
        return number(toNumber(pa) + toNumber(pb));
    }

    public static JsonNode subtract(JsonNode a, JsonNode b) {
        return number(toNumber(a) - toNumber(b));
    }

    public static JsonNode multiply(JsonNode a, JsonNode b) {
        return number(toNumber(a) * toNumber(b));
    }

    public static JsonNode divide(JsonNode a, JsonNode b) {
        return number(toNumber(a) / toNumber(b));
    }

    // --- Member access ---

    /**
     * Reads {@code object.property}. A null or undefined base yields undefined instead of failing.
     * Arrays and strings expose {@code length} and numeric indices; objects expose their fields.
     */
    public static JsonNode member(JsonNode object, String property) {
        if (isNullish(object)) {
            return UNDEFINED;
        }
        if (object.isObject()) {
            return orUndefined(object.get(property));
        }
        if (object.isArray()) {
            if ("length".equals(property)) {
                return number(object.size());
            }
            int index = arrayIndex(property);
            return index >= 0 && index < object.size() ? object.get(index) : UNDEFINED;
        }
        if (object.isTextual()) {
            String s = object.textValue();
            if ("length".equals(property)) {
                return number(s.length());
            }
            int index = arrayIndex(property);
            return index >= 0 && index < s.length() ? text(String.valueOf(s.charAt(index))) : UNDEFINED;
        }
        return UNDEFINED;
    }

    private static int arrayIndex(String property) {
        if (!ARRAY_INDEX.matcher(property).matches()) {
            return -1;
        }
        long index = Long.parseLong(property);
        return index > Integer.MAX_VALUE ? -1 : (int) index;
    }

    // --- Cloning ---

    /**
     * Structural clone with JSON round-trip semantics: non-finite numbers become null, undefined
     * array elements become null, undefined object members are dropped, and an undefined root stays
     * undefined. The result shares no container with the argument.
     */
    public static JsonNode cloneJson(JsonNode node) {
        if (isUndefined(node)) {
            return UNDEFINED;
        }
        if (node.isNumber() && !Double.isFinite(node.doubleValue())) {
            return NODES.nullNode();
        }
        if (node.isArray()) {
            ArrayNode copy = NODES.arrayNode(node.size());
            for (JsonNode element : node) {
                JsonNode cloned = cloneJson(element);
                copy.add(isUndefined(cloned) ? NODES.nullNode() : cloned);
            }
            return copy;
        }
        if (node.isObject()) {
            ObjectNode copy = NODES.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode cloned = cloneJson(field.getValue());
                if (!isUndefined(cloned)) {
                    copy.set(field.getKey(), cloned);
                }
            }
            return copy;
        }
        return node.isValueNode() ? node : node.deepCopy();
    }
}
