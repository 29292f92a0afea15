package io.ailang.standalone;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ailang.core.bytecode.BytecodeModule;
import io.ailang.core.engine.TaskEngine;
import io.ailang.core.error.TaskException;
import io.ailang.core.model.ExecutionResult;
import io.ailang.standalone.server.TaskServerApp;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point.
 *
 * <pre>
 *   run &lt;file.ail&gt;                          parse and execute, print outputs
 *   compile &lt;file.ail&gt; [-o &lt;out.albc&gt;]     write bytecode
 *   runbc &lt;file.albc&gt; [--input &lt;json&gt;]     run bytecode, print outputs
 *   serve [--config &lt;path&gt;]                 start the HTTP service
 * </pre>
 *
 * <p>A single output prints as compact JSON; any other number prints the whole outputs object
 * pretty-printed. Exit codes: 0 success, 1 usage or I/O error, 2 language error.
 */
public final class TaskMain {

    private static final Logger LOG = LoggerFactory.getLogger(TaskMain.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_TASK_ERROR = 2;

    static final String USAGE = String.join(
            System.lineSeparator(),
            "Usage:",
            "  ailang run <file.ail>",
            "  ailang compile <file.ail> [-o <out.albc>]",
            "  ailang runbc <file.albc> [--input <json>]",
            "  ailang serve [--config <path>]");

    private final TaskEngine engine;
    private final PrintStream out;
    private final PrintStream err;

    TaskMain(TaskEngine engine, PrintStream out, PrintStream err) {
        this.engine = engine;
        this.out = out;
        this.err = err;
    }

    /**
     * Application entry point. {@code serve} keeps the JVM alive; every other command exits with
     * its status code.
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        if (args.length > 0 && "serve".equals(args[0])) {
            try {
                TaskServerApp.start(Arrays.copyOfRange(args, 1, args.length));
            } catch (Exception e) {
                LOG.error("Startup failed: {}", e.getMessage(), e);
                System.exit(EXIT_USAGE);
            }
            return;
        }
        System.exit(new TaskMain(new TaskEngine(), System.out, System.err).execute(args));
    }

    /** Runs one non-server command and returns its exit code. */
    int execute(String[] args) {
        if (args.length == 0) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        String[] rest = Arrays.copyOfRange(args, 1, args.length);
        try {
            switch (args[0]) {
                case "run":
                    return run(rest);
                case "compile":
                    return compile(rest);
                case "runbc":
                    return runBytecode(rest);
                default:
                    err.println("Unknown command: " + args[0]);
                    err.println(USAGE);
                    return EXIT_USAGE;
            }
        } catch (TaskException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_TASK_ERROR;
        } catch (UsageException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        } catch (UncheckedIOException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    private int run(String[] args) {
        if (args.length != 1) {
            throw new UsageException("run expects exactly one source file");
        }
        printOutputs(engine.parseAndExecute(Path.of(args[0])));
        return EXIT_OK;
    }

    private int compile(String[] args) {
        if (args.length == 0) {
            throw new UsageException("compile expects a source file");
        }
        Path source = Path.of(args[0]);
        Path target = null;
        for (int i = 1; i < args.length; i++) {
            if ("-o".equals(args[i]) && i + 1 < args.length) {
                target = Path.of(args[++i]);
            } else {
                throw new UsageException("Unexpected argument: " + args[i]);
            }
        }
        if (target == null) {
            target = defaultTarget(source);
        }
        BytecodeModule module = engine.compile(engine.parse(readString(source)));
        try {
            Files.write(target, module.bytes());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write bytecode: " + target, e);
        }
        out.println("Wrote " + module.size() + " bytes to " + target);
        return EXIT_OK;
    }

    private int runBytecode(String[] args) {
        if (args.length == 0) {
            throw new UsageException("runbc expects a bytecode file");
        }
        Path file = Path.of(args[0]);
        JsonNode input = null;
        for (int i = 1; i < args.length; i++) {
            if ("--input".equals(args[i]) && i + 1 < args.length) {
                input = parseInput(args[++i]);
            } else {
                throw new UsageException("Unexpected argument: " + args[i]);
            }
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bytecode: " + file, e);
        }
        printOutputs(engine.run(BytecodeModule.of(bytes), input));
        return EXIT_OK;
    }

    private void printOutputs(ExecutionResult result) {
        Map<String, JsonNode> outputs = result.outputs();
        try {
            if (outputs.size() == 1) {
                JsonNode only = outputs.values().iterator().next();
                out.println(MAPPER.writeValueAsString(only.isMissingNode() ? null : only));
            } else {
                out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(result.outputsAsJson()));
            }
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render outputs", e);
        }
    }

    private static JsonNode parseInput(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new UsageException("--input is not valid JSON: " + e.getOriginalMessage());
        }
    }

    private static String readString(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read task source: " + file, e);
        }
    }

    /** {@code task.ail} becomes {@code task.albc} next to it. */
    static Path defaultTarget(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return source.resolveSibling(stem + ".albc");
    }

    /** Malformed command line. */
    static final class UsageException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        UsageException(String message) {
            super(message);
        }
    }
}
