package io.ailang.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ailang.core.bytecode.BytecodeModule;
import io.ailang.core.model.ExecutionResult;
import io.ailang.core.model.TaskProgram;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Runs every sample program on both execution paths and checks that outputs and final context
 * agree.
 */
@DisplayName("Tree executor and bytecode VM agree")
class ExecutionParityTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final TaskEngine engine = new TaskEngine();

    private static String load(String name) throws IOException {
        try (InputStream in = ExecutionParityTest.class.getResourceAsStream("/programs/" + name)) {
            assertThat(in).as("resource %s", name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(
            strings = {
                "sort_bubble.ail",
                "sort_native_key.ail",
                "classify.ail",
                "let_arithmetic.ail",
                "graph_only.ail",
                "no_input.ail",
                "out_shadowed_by_input_field.ail",
                "out_after_let.ail",
                "out_without_input.ail",
                "sort_then_emit.ail",
                "let_member_arithmetic.ail"
            })
    void samePrograms(String name) throws IOException {
        TaskProgram program = engine.parse(load(name));
        BytecodeModule module = engine.compile(program);

        ExecutionResult tree = engine.execute(program);
        ExecutionResult vm = engine.run(module, program.input());

        assertThat(JSON.writeValueAsString(vm.outputsAsJson())).isEqualTo(JSON.writeValueAsString(tree.outputsAsJson()));
        assertThat(vm.outputs().keySet()).containsExactlyElementsOf(tree.outputs().keySet());
        assertThat(vm.contextAsJson()).isEqualTo(tree.contextAsJson());
    }

    @Test
    void sortedOutputsMatchExpectedValues() throws IOException {
        TaskProgram program = engine.parse(load("sort_native_key.ail"));
        ExecutionResult vm = engine.run(engine.compile(program), program.input());

        assertThat(vm.output("ranked").findValuesAsText("name")).containsExactly("alice", "dave", "bob", "carol");
        assertThat(vm.output("youngest_first")).isEqualTo(vm.output("ranked"));
    }

    @Test
    @DisplayName("out writes the preferred value on both paths")
    void outWritesThePreferredValue() throws IOException {
        assertBothPaths("out_shadowed_by_input_field.ail", "result", "{\"result\":5}");
        assertBothPaths("out_after_let.ail", "result", "[1,2,3]");
        assertBothPaths("out_without_input.ail", "result", "null");
    }

    @Test
    @DisplayName("a conditional emit after a sort captures the sorted list")
    void emitAfterSort() throws IOException {
        assertBothPaths("sort_then_emit.ail", "high", "[1,2,5,5,6,9]");

        TaskProgram program = engine.parse(load("sort_then_emit.ail").replace("0.92", "0.5"));
        assertThat(engine.execute(program).outputs()).isEmpty();
        assertThat(engine.run(engine.compile(program), program.input()).outputs()).isEmpty();
    }

    @Test
    @DisplayName("let with member access feeds a conditional emit")
    void letWithMemberAccess() throws IOException {
        assertBothPaths("let_member_arithmetic.ail", "z", "10");
    }

    private void assertBothPaths(String name, String output, String expectedJson) throws IOException {
        TaskProgram program = engine.parse(load(name));
        JsonNode expected = JSON.readTree(expectedJson);

        assertThat(engine.execute(program).output(output)).as("tree %s", name).isEqualTo(expected);
        assertThat(engine.run(engine.compile(program), program.input()).output(output))
                .as("vm %s", name)
                .isEqualTo(expected);
    }

    @Test
    @DisplayName("tool requests exist only on the tree path")
    void toolIsNotLoweredToBytecode() {
        TaskProgram program = engine.parse("""
                @plan:
                %in: {"file": "notes.txt"}
                %model:tool{name="fs.read"}
                %out: result
                """);

        ExecutionResult tree = engine.execute(program);
        ExecutionResult vm = engine.run(engine.compile(program), program.input());

        assertThat(tree.context().contains("__requests")).isTrue();
        assertThat(tree.context().get("plan").size()).isEqualTo(1);
        assertThat(vm.context().contains("__requests")).isFalse();
        assertThat(vm.context().contains("plan")).isFalse();
        assertThat(vm.outputsAsJson()).isEqualTo(tree.outputsAsJson());
    }

    @Test
    void bytecodeWithoutInputStartsFromAnEmptyContext() {
        TaskProgram program = engine.parse("""
                @t:
                %in: {"flag": true}
                !if flag then emit flag
                """);
        ExecutionResult vm = engine.run(engine.compile(program));

        assertThat(vm.context().contains("input")).isFalse();
        assertThat(vm.outputs()).isEmpty();
    }
}
