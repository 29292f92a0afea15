package io.ailang.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ailang.core.error.TaskRuntimeException;
import io.ailang.core.model.ExecutionResult;
import io.ailang.core.parse.TaskParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("TreeExecutor")
class TreeExecutorTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final TaskParser parser = new TaskParser();
    private final TreeExecutor executor = new TreeExecutor(ModelRegistry.withBuiltins());

    private ExecutionResult run(String source) {
        return executor.execute(parser.parse(source));
    }

    private static JsonNode json(String text) throws Exception {
        return JSON.readTree(text);
    }

    @Nested
    @DisplayName("sort model")
    class Sort {

        @Test
        @DisplayName("bubble sort orders the input array")
        void bubbleSortsInput() throws Exception {
            ExecutionResult result = run("""
                    @sort_numbers:
                    %in: [9, 1, 5, 6, 2, 5]
                    %model:sort{algorithm=bubble}
                    %out: result
                    """);

            assertThat(result.output("result")).isEqualTo(json("[1,2,5,5,6,9]"));
            assertThat(result.context().get("input")).isEqualTo(json("[9,1,5,6,2,5]"));
        }

        @Test
        @DisplayName("native sort by key is stable")
        void nativeSortByKeyIsStable() throws Exception {
            ExecutionResult result = run("""
                    @t:
                    %in: {"list": [{"n":"b","p":2},{"n":"a","p":1},{"n":"c","p":2},{"n":"d","p":1}]}
                    %model:sort{algorithm=native, key=p}
                    %out: result
                    """);

            assertThat(result.output("result").findValuesAsText("n")).containsExactly("a", "d", "b", "c");
        }

        @Test
        @DisplayName("bubble sort by key keeps equal keys in input order")
        void bubbleSortByKeyKeepsEqualKeysInOrder() throws Exception {
            ExecutionResult result = run("""
                    @t:
                    %in: {"list": [{"n":"b","p":2},{"n":"a","p":1},{"n":"c","p":2},{"n":"d","p":1}]}
                    %model:sort{algorithm=bubble, key=p}
                    %out: result
                    """);

            assertThat(result.output("result").findValuesAsText("n")).containsExactly("a", "d", "b", "c");
        }

        @Test
        @DisplayName("a conditional emit after the sort captures the sorted list")
        void emitAfterSortCapturesSortedList() throws Exception {
            String source = """
                    @t:
                    %in: {"list": [9, 1, 5, 6, 2, 5], "confidence": CONFIDENCE}
                    %model:sort{algorithm=bubble}
                    !if confidence >= 0.8 then emit high
                    """;

            ExecutionResult confident = run(source.replace("CONFIDENCE", "0.92"));
            ExecutionResult unsure = run(source.replace("CONFIDENCE", "0.5"));

            assertThat(confident.output("high")).isEqualTo(json("[1,2,5,5,6,9]"));
            assertThat(unsure.outputs()).doesNotContainKey("high");
        }

        @Test
        void defaultsToBubbleWhenAlgorithmIsFalsy() throws Exception {
            ExecutionResult result = run("""
                    @t:
                    %in: [3, 1, 2]
                    %model:sort{algorithm=0}
                    %out: result
                    """);

            assertThat(result.output("result")).isEqualTo(json("[1,2,3]"));
        }

        @Test
        void contextListIsUsedWhenInputIsNotAnArray() throws Exception {
            ExecutionResult result = run("""
                    @t:
                    %in: {"items": [3, 1, 2]}
                    let list = items
                    %model:sort
                    %out: result
                    """);

            assertThat(result.output("result")).isEqualTo(json("[1,2,3]"));
        }

        @Test
        void sortWithoutListFails() {
            assertThatThrownBy(() -> run("""
                            @t:
                            %in: {"a": 1}
                            %model:sort
                            """))
                    .isInstanceOf(TaskRuntimeException.class)
                    .hasMessage("Model \"sort\" requires an array input")
                    .satisfies(e -> {
                        TaskRuntimeException ex = (TaskRuntimeException) e;
                        assertThat(ex.statementIndex()).isEqualTo(1);
                        assertThat(ex.taskId()).isEqualTo("t");
                    });
        }

        @Test
        void unknownAlgorithmFails() {
            assertThatThrownBy(() -> run("""
                            @t:
                            %in: [2, 1]
                            %model:sort{algorithm=quick}
                            """))
                    .isInstanceOf(TaskRuntimeException.class)
                    .hasMessage("Unknown sort algorithm: quick");
        }
    }

    @Nested
    @DisplayName("conditional actions")
    class Actions {

        @Test
        @DisplayName("let with member access feeds a comparison")
        void letWithMemberAccessFeedsComparison() throws Exception {
            ExecutionResult result = run("""
                    @t:
                    %in: {"x": 3, "obj": {"y": 4}}
                    let z = x * 2 + obj.y
                    !if z >= 10 then emit z
                    """);

            assertThat(result.output("z")).isEqualTo(json("10"));
            assertThat(result.context().get("z")).isEqualTo(json("10"));
        }

        private ExecutionResult classify(String confidence) {
            return run("@classify:\n%in: {\"confidence\": " + confidence + "}\n!if confidence >= 0.9 then emit high\n");
        }

        @Test
        void emitsWhenConditionHolds() {
            ExecutionResult result = classify("0.92");

            assertThat(result.outputs()).containsOnlyKeys("high");
            assertThat(result.output("high").get("confidence").doubleValue()).isEqualTo(0.92);
        }

        @Test
        void skipsWhenConditionFails() {
            ExecutionResult result = classify("0.5");

            assertThat(result.outputs()).isEmpty();
        }

        @Test
        void setWritesIntoTheContext() throws Exception {
            ExecutionResult result = run("""
                    @t:
                    %in: {"mode": "fast"}
                    !if mode = fast then set speed = 10
                    !if speed > 5 then emit speed
                    """);

            assertThat(result.context().get("speed")).isEqualTo(json("10"));
            assertThat(result.output("speed")).isEqualTo(json("10"));
        }

        @Test
        void emitOfUnknownNameWithoutInputIsUndefined() {
            ExecutionResult result = run("""
                    @t:
                    let go = true
                    !if go then emit nothing
                    """);

            assertThat(result.outputs()).containsKey("nothing");
            assertThat(result.output("nothing").isMissingNode()).isTrue();
            assertThat(result.outputsAsJson().size()).isZero();
        }
    }

    @Nested
    @DisplayName("log action")
    class LogAction {

        private Logger logger;
        private ListAppender<ILoggingEvent> appender;

        @BeforeEach
        void attach() {
            logger = (Logger) LoggerFactory.getLogger(TreeExecutor.class);
            appender = new ListAppender<>();
            appender.start();
            logger.addAppender(appender);
        }

        @AfterEach
        void detach() {
            logger.detachAppender(appender);
            appender.stop();
        }

        @Test
        void logsTheMessageAtInfo() {
            ExecutionResult result = run("""
                    @noisy:
                    %in: {"ready": true}
                    !if ready then log "starting"
                    """);

            assertThat(appender.list).hasSize(1);
            ILoggingEvent event = appender.list.get(0);
            assertThat(event.getLevel()).isEqualTo(Level.INFO);
            assertThat(event.getFormattedMessage()).contains("task_id=noisy").contains("message=starting");
            assertThat(result.outputs()).isEmpty();
        }
    }

    @Test
    @DisplayName("let evaluates against the live context")
    void letBinding() throws Exception {
        ExecutionResult result = run("""
                @t:
                %in: {"user": {"name": "ada"}}
                let z = 2 + 8
                let greeting = 'hi ' + user.name
                let w = z * 2
                """);

        assertThat(result.context().get("z")).isEqualTo(json("10"));
        assertThat(result.context().get("greeting")).isEqualTo(json("\"hi ada\""));
        assertThat(result.context().get("w")).isEqualTo(json("20"));
    }

    @Test
    void outWithoutInputOrModelIsNull() throws Exception {
        ExecutionResult result = run("@t:\n%out: result");

        assertThat(result.output("result")).isEqualTo(json("null"));
    }

    @Test
    void outputsAreIsolatedFromLaterMutation() throws Exception {
        ExecutionResult result = run("""
                @t:
                %in: {"__requests": []}
                %out: before
                %model:tool{name="x"}
                """);

        assertThat(result.output("before")).isEqualTo(json("{\"__requests\":[]}"));
        assertThat(result.context().get("__requests").size()).isEqualTo(1);
    }

    @Test
    void toolRecordsRequests() throws Exception {
        ExecutionResult result = run("""
                @plan:
                %model:tool{name="fs.write", file="out.txt"}
                """);

        JsonNode expected = json("[{\"kind\":\"tool\",\"args\":{\"name\":\"fs.write\",\"file\":\"out.txt\"}}]");
        assertThat(result.context().get("__requests")).isEqualTo(expected);
        assertThat(result.context().get("plan")).isSameAs(result.context().get("__requests"));
    }

    @Test
    void unknownModelTypeFails() {
        assertThatThrownBy(() -> run("@t:\n%in: 1\n%model:magic"))
                .isInstanceOf(TaskRuntimeException.class)
                .hasMessage("Unknown model type: magic")
                .satisfies(e -> assertThat(((TaskRuntimeException) e).statementIndex()).isEqualTo(1));
    }

    @Test
    void nodesEdgesAndBareConditionsHaveNoEffect() {
        ExecutionResult result = run("""
                @graph:
                +a:source
                +b:sink
                -> a => b
                ?a
                """);

        assertThat(result.outputs()).isEmpty();
        assertThat(result.contextAsJson().size()).isZero();
    }
}
