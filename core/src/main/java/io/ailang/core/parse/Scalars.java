package io.ailang.core.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.ailang.core.value.JsValues;
import java.util.regex.Pattern;

/**
 * Scalar literal rules shared by model arguments, condition operands and {@code set} actions.
 *
 * <ul>
 * <li>{@code true}, {@code false}, {@code null} → the literal</li>
 * <li>text wrapped in single or double quotes → the text without its quotes</li>
 * <li>{@code [+-]?digits(.digits)?} → a number</li>
 * <li>anything else → the bare text as a string ("symbol")</li>
 * </ul>
 *
 * <p>Thread-safe: stateless utility class.
 */
public final class Scalars {

    private static final Pattern NUMBER = Pattern.compile("[+-]?\\d+(\\.\\d+)?");

    private Scalars() {}

    /**
     * Parses one scalar literal. Never fails: unrecognized text is a symbol string.
     *
     * @param text raw literal text, surrounding whitespace ignored
     * @return a boolean, null, number or text node
     */
    public static JsonNode parse(String text) {
        String t = text.strip();
        switch (t) {
            case "true":
                return BooleanNode.TRUE;
            case "false":
                return BooleanNode.FALSE;
            case "null":
                return NullNode.getInstance();
            default:
                break;
        }
        if (isQuoted(t)) {
            return JsValues.text(stripQuotes(t));
        }
        if (NUMBER.matcher(t).matches()) {
            return JsValues.number(Double.parseDouble(t));
        }
        return JsValues.text(t);
    }

    /** Returns {@code true} if {@code t} starts and ends with the same kind of quote. */
    static boolean isQuoted(String t) {
        return !t.isEmpty()
                && ((t.startsWith("\"") && t.endsWith("\"")) || (t.startsWith("'") && t.endsWith("'")));
    }

    /** Removes one leading and one trailing quote character, of either kind. */
    static String stripQuotes(String s) {
        String result = s;
        if (!result.isEmpty() && isQuoteChar(result.charAt(0))) {
            result = result.substring(1);
        }
        if (!result.isEmpty() && isQuoteChar(result.charAt(result.length() - 1))) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static boolean isQuoteChar(char c) {
        return c == '"' || c == '\'';
    }
}
