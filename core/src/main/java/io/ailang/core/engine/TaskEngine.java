package io.ailang.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.ailang.core.bytecode.BytecodeCompiler;
import io.ailang.core.bytecode.BytecodeModule;
import io.ailang.core.bytecode.BytecodeVm;
import io.ailang.core.model.ExecutionResult;
import io.ailang.core.model.TaskProgram;
import io.ailang.core.parse.TaskParser;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point to the AILang toolchain: parse source text, execute a program by tree-walking,
 * compile it to bytecode, or run bytecode on the VM.
 *
 * <p>Every failure is a {@link io.ailang.core.error.TaskException} subtype thrown synchronously.
 * While a program executes, its task id is available in the SLF4J MDC under {@code task_id}.
 *
 * <p>Thread-safe: the engine holds no per-call state, so one instance can serve concurrent callers.
 */
public final class TaskEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TaskEngine.class);

    /** MDC key carrying the id of the task being executed. */
    public static final String MDC_TASK_ID = "task_id";

    private final TaskParser parser = new TaskParser();
    private final TreeExecutor executor;
    private final BytecodeCompiler compiler = new BytecodeCompiler();
    private final BytecodeVm vm = new BytecodeVm();

    /** Creates an engine with the built-in {@code sort} and {@code tool} models. */
    public TaskEngine() {
        this(ModelRegistry.withBuiltins());
    }

    /** Creates an engine resolving tree-path models through {@code models}. */
    public TaskEngine(ModelRegistry models) {
        this.executor = new TreeExecutor(models);
    }

    /**
     * Parses source text.
     *
     * @throws io.ailang.core.error.TaskSyntaxException on the first malformed statement
     */
    public TaskProgram parse(String source) {
        long start = System.nanoTime();
        TaskProgram program = parser.parse(source);
        LOG.debug(
                "Parsed task: task_id={}, statements={}, duration_us={}",
                program.taskId(),
                program.sourceOrder().size(),
                micros(start));
        return program;
    }

    /**
     * Executes a parsed program on the tree-walking executor.
     *
     * @throws io.ailang.core.error.TaskRuntimeException if execution fails
     */
    public ExecutionResult execute(TaskProgram program) {
        Objects.requireNonNull(program, "program must not be null");
        long start = System.nanoTime();
        MDC.put(MDC_TASK_ID, program.taskId());
        try {
            ExecutionResult result = executor.execute(program);
            LOG.debug(
                    "Executed task: task_id={}, outputs={}, duration_us={}",
                    program.taskId(),
                    result.outputs().keySet(),
                    micros(start));
            return result;
        } finally {
            MDC.remove(MDC_TASK_ID);
        }
    }

    /** Compiles a parsed program to bytecode. Never fails for a parsed program. */
    public BytecodeModule compile(TaskProgram program) {
        Objects.requireNonNull(program, "program must not be null");
        long start = System.nanoTime();
        BytecodeModule module = compiler.compile(program);
        LOG.debug("Compiled task: task_id={}, bytes={}, duration_us={}", program.taskId(), module.size(), micros(start));
        return module;
    }

    /**
     * Runs bytecode on the VM.
     *
     * @param module   the encoded module
     * @param rawInput input to seed the context with, or {@code null} for an empty context
     * @throws io.ailang.core.error.BytecodeDecodeException if the module is malformed
     * @throws io.ailang.core.error.TaskRuntimeException if execution fails
     */
    public ExecutionResult run(BytecodeModule module, JsonNode rawInput) {
        Objects.requireNonNull(module, "module must not be null");
        long start = System.nanoTime();
        ExecutionResult result = vm.run(module, rawInput);
        LOG.debug(
                "Ran bytecode: bytes={}, outputs={}, duration_us={}",
                module.size(),
                result.outputs().keySet(),
                micros(start));
        return result;
    }

    /** Runs bytecode against an empty context. */
    public ExecutionResult run(BytecodeModule module) {
        return run(module, null);
    }

    /** Parses and executes source text on the tree-walking executor. */
    public ExecutionResult parseAndExecute(String source) {
        return execute(parse(source));
    }

    /**
     * Reads a UTF-8 source file, then parses and executes it.
     *
     * @throws UncheckedIOException if the file cannot be read
     */
    public ExecutionResult parseAndExecute(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read task source: " + file, e);
        }
        return parseAndExecute(source);
    }

    private static long micros(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000;
    }
}
