package io.ailang.core.value;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("JsValues")
class JsValuesTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static JsonNode json(String text) throws Exception {
        return JSON.readTree(text);
    }

    @Nested
    @DisplayName("number normalization")
    class Numbers {

        @Test
        void integralValuesBecomeIntNodes() {
            assertThat(JsValues.number(42d)).isEqualTo(IntNode.valueOf(42));
            assertThat(JsValues.number(-7d)).isEqualTo(IntNode.valueOf(-7));
        }

        @Test
        void largeSafeIntegersBecomeLongNodes() {
            assertThat(JsValues.number(3_000_000_000d)).isEqualTo(LongNode.valueOf(3_000_000_000L));
        }

        @Test
        void fractionsAndSpecialValuesStayDoubles() {
            assertThat(JsValues.number(0.5)).isEqualTo(DoubleNode.valueOf(0.5));
            assertThat(JsValues.number(-0d)).isInstanceOf(DoubleNode.class);
            assertThat(JsValues.number(Double.NaN).doubleValue()).isNaN();
            assertThat(JsValues.number(Double.POSITIVE_INFINITY).doubleValue()).isInfinite();
        }

        @ParameterizedTest
        @CsvSource({"1, 1", "0.5, 0.5", "100, 100", "1e21, 1e+21", "0.000001, 0.000001", "1e-7, 1e-7", "-2.5, -2.5"})
        void formatsLikeJavaScript(double value, String expected) {
            assertThat(JsValues.numberToString(value)).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("truthiness")
    class Truthiness {

        @Test
        void falsyValues() throws Exception {
            assertThat(JsValues.isTruthy(null)).isFalse();
            assertThat(JsValues.isTruthy(JsValues.UNDEFINED)).isFalse();
            assertThat(JsValues.isTruthy(NullNode.getInstance())).isFalse();
            assertThat(JsValues.isTruthy(json("false"))).isFalse();
            assertThat(JsValues.isTruthy(json("0"))).isFalse();
            assertThat(JsValues.isTruthy(json("\"\""))).isFalse();
            assertThat(JsValues.isTruthy(JsValues.number(Double.NaN))).isFalse();
        }

        @Test
        void emptyContainersAreTruthy() throws Exception {
            assertThat(JsValues.isTruthy(json("[]"))).isTrue();
            assertThat(JsValues.isTruthy(json("{}"))).isTrue();
            assertThat(JsValues.isTruthy(json("\"0\""))).isTrue();
        }
    }

    @Nested
    @DisplayName("comparison")
    class Comparison {

        @Test
        void looseEqualityCoercesNumbersAndStrings() {
            assertThat(JsValues.looseEquals(JsValues.number(1), JsValues.text("1"))).isTrue();
            assertThat(JsValues.looseEquals(JsValues.bool(true), JsValues.number(1))).isTrue();
            assertThat(JsValues.looseEquals(JsValues.text("a"), JsValues.text("b"))).isFalse();
        }

        @Test
        void nullAndUndefinedOnlyEqualEachOther() {
            assertThat(JsValues.looseEquals(NullNode.getInstance(), JsValues.UNDEFINED)).isTrue();
            assertThat(JsValues.looseEquals(NullNode.getInstance(), JsValues.number(0))).isFalse();
            assertThat(JsValues.looseEquals(JsValues.UNDEFINED, JsValues.text(""))).isFalse();
        }

        @Test
        void containersEqualOnlyByIdentity() throws Exception {
            JsonNode a = json("[1]");
            assertThat(JsValues.looseEquals(a, a)).isTrue();
            assertThat(JsValues.looseEquals(a, json("[1]"))).isFalse();
            assertThat(JsValues.looseEquals(a, JsValues.text("1"))).isTrue();
        }

        @Test
        void orderingComparesStringsLexicographically() {
            assertThat(JsValues.lt(JsValues.text("10"), JsValues.text("9"))).isTrue();
            assertThat(JsValues.lt(JsValues.number(10), JsValues.text("9"))).isFalse();
        }

        @Test
        void orderingWithUndefinedIsAlwaysFalse() {
            assertThat(JsValues.lt(JsValues.UNDEFINED, JsValues.number(1))).isFalse();
            assertThat(JsValues.ge(JsValues.UNDEFINED, JsValues.number(1))).isFalse();
            assertThat(JsValues.le(JsValues.UNDEFINED, JsValues.number(1))).isFalse();
        }

        @Test
        void nullOrdersAsZero() {
            assertThat(JsValues.ge(NullNode.getInstance(), JsValues.number(0))).isTrue();
            assertThat(JsValues.gt(JsValues.number(0.92), JsValues.number(0.9))).isTrue();
        }
    }

    @Nested
    @DisplayName("arithmetic")
    class Arithmetic {

        @Test
        void plusConcatenatesWhenEitherSideIsText() {
            assertThat(JsValues.add(JsValues.text("a"), JsValues.number(1))).isEqualTo(JsValues.text("a1"));
            assertThat(JsValues.add(JsValues.number(1.5), JsValues.text("x"))).isEqualTo(JsValues.text("1.5x"));
        }

        @Test
        void plusAddsNumbers() {
            assertThat(JsValues.add(JsValues.number(2), JsValues.number(8))).isEqualTo(IntNode.valueOf(10));
            assertThat(JsValues.add(JsValues.bool(true), NullNode.getInstance())).isEqualTo(IntNode.valueOf(1));
        }

        @Test
        void otherOperatorsConvertToNumbers() {
            assertThat(JsValues.subtract(JsValues.text("5"), JsValues.number(2))).isEqualTo(IntNode.valueOf(3));
            assertThat(JsValues.multiply(JsValues.text("x"), JsValues.number(2)).doubleValue()).isNaN();
            assertThat(JsValues.divide(JsValues.number(1), JsValues.number(0)).doubleValue())
                    .isEqualTo(Double.POSITIVE_INFINITY);
        }

        @ParameterizedTest
        @ValueSource(strings = {"0x1F", "0o37", "0b11111", " 31 ", "31.0"})
        void stringsParseAsNumericLiterals(String text) {
            assertThat(JsValues.stringToNumber(text)).isEqualTo(31d);
        }
    }

    @Nested
    @DisplayName("member access")
    class MemberAccess {

        @Test
        void readsObjectFields() throws Exception {
            assertThat(JsValues.member(json("{\"a\":{\"b\":2}}"), "a").get("b").intValue()).isEqualTo(2);
            assertThat(JsValues.member(json("{\"a\":1}"), "missing").isMissingNode()).isTrue();
        }

        @Test
        void nullishBaseYieldsUndefined() {
            assertThat(JsValues.member(NullNode.getInstance(), "x").isMissingNode()).isTrue();
            assertThat(JsValues.member(JsValues.UNDEFINED, "x").isMissingNode()).isTrue();
        }

        @Test
        void arraysAndStringsExposeLengthAndIndices() throws Exception {
            assertThat(JsValues.member(json("[4,5,6]"), "length")).isEqualTo(IntNode.valueOf(3));
            assertThat(JsValues.member(json("[4,5,6]"), "1")).isEqualTo(IntNode.valueOf(5));
            assertThat(JsValues.member(JsValues.text("abc"), "length")).isEqualTo(IntNode.valueOf(3));
            assertThat(JsValues.member(JsValues.text("abc"), "2")).isEqualTo(JsValues.text("c"));
        }
    }

    @Nested
    @DisplayName("cloneJson")
    class CloneJson {

        @Test
        void producesAnIndependentCopy() throws Exception {
            JsonNode original = json("{\"a\":[1,2]}");
            JsonNode copy = JsValues.cloneJson(original);

            assertThat(copy).isEqualTo(original).isNotSameAs(original);
            assertThat(copy.get("a")).isNotSameAs(original.get("a"));
        }

        @Test
        void nonFiniteNumbersBecomeNull() {
            assertThat(JsValues.cloneJson(JsValues.number(Double.NaN)).isNull()).isTrue();
        }

        @Test
        void undefinedStaysUndefined() {
            assertThat(JsValues.cloneJson(JsValues.UNDEFINED).isMissingNode()).isTrue();
        }
    }
}
