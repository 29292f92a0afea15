package io.ailang.standalone.server;

import io.ailang.core.engine.TaskEngine;
import io.ailang.core.error.TaskException;
import io.ailang.standalone.config.ConfigLoader;
import io.ailang.standalone.config.ServerConfig;
import io.javalin.Javalin;
import io.javalin.http.HandlerType;
import io.javalin.http.HttpResponseException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP front end to a {@link TaskEngine}.
 *
 * <p>Startup sequence for {@link #start(String[])}:
 *
 * <ol>
 *   <li>Load configuration from YAML and the environment overlay
 *   <li>Configure Logback from {@code logging.format} and {@code logging.level}
 *   <li>Register the health, run, compile and run-bytecode routes
 *   <li>Start Javalin on {@code server.host:server.port}
 * </ol>
 *
 * <p>Language errors become 400 problem details, oversized bodies 413, anything else 500. One
 * engine serves all requests concurrently.
 */
public final class TaskServerApp {

    private static final Logger LOG = LoggerFactory.getLogger(TaskServerApp.class);

    static final String RUN_PATH = "/run";
    static final String COMPILE_PATH = "/compile";
    static final String RUN_BYTECODE_PATH = "/runbc";

    private final Javalin app;
    private final ServerConfig config;

    private TaskServerApp(Javalin app, ServerConfig config) {
        this.app = app;
        this.config = config;
    }

    /**
     * Loads configuration named by {@code args}, configures logging and starts the server.
     *
     * @param args command-line arguments, possibly containing {@code --config <path>}
     * @throws io.ailang.standalone.config.ConfigLoadException if the configuration is invalid
     */
    public static TaskServerApp start(String[] args) {
        ServerConfig config = ConfigLoader.load(args);
        LogbackConfigurator.configure(config);
        return start(config, new TaskEngine());
    }

    /** Starts the server with a default engine. Logging is left as configured. */
    public static TaskServerApp start(ServerConfig config) {
        return start(config, new TaskEngine());
    }

    /** Starts the server around {@code engine}. Logging is left as configured. */
    public static TaskServerApp start(ServerConfig config, TaskEngine engine) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(engine, "engine must not be null");
        long startTime = System.nanoTime();

        Javalin app = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;
            javalinConfig.http.maxRequestSize = config.maxBodyBytes();
        });

        if (config.healthEnabled()) {
            app.get(config.healthPath(), new HealthHandler());
        }

        int maxBodyBytes = config.maxBodyBytes();
        app.before(ctx -> {
            if (ctx.method() == HandlerType.POST && ctx.contentLength() > maxBodyBytes) {
                LOG.warn("Request body too large: bytes={}, limit={}", ctx.contentLength(), maxBodyBytes);
                RequestBodies.writeProblem(
                        ctx, ProblemDetail.bodyTooLarge("Request body exceeds " + maxBodyBytes + " bytes", ctx.path()));
                ctx.skipRemainingHandlers();
            }
        });

        app.post(RUN_PATH, new RunHandler(engine));
        app.post(COMPILE_PATH, new CompileHandler(engine));
        app.post(RUN_BYTECODE_PATH, new RunBytecodeHandler(engine));

        app.exception(TaskException.class, (e, ctx) -> {
            LOG.debug("Task failed: path={}, phase={}, detail={}", ctx.path(), e.phase(), e.detail());
            RequestBodies.writeProblem(ctx, ProblemDetail.forTaskException(e, ctx.path()));
        });
        app.exception(InvalidRequestException.class, (e, ctx) ->
                RequestBodies.writeProblem(ctx, ProblemDetail.badRequest(e.getMessage(), ctx.path())));
        app.exception(HttpResponseException.class, (e, ctx) -> {
            if (e.getStatus() == 413) {
                RequestBodies.writeProblem(
                        ctx, ProblemDetail.bodyTooLarge("Request body exceeds " + maxBodyBytes + " bytes", ctx.path()));
            } else {
                RequestBodies.writeProblem(
                        ctx, ProblemDetail.build(ProblemDetail.URN_BAD_REQUEST, e.getMessage(), e.getStatus(), e.getMessage(), ctx.path()));
            }
        });
        app.exception(Exception.class, (e, ctx) -> {
            LOG.error("Unexpected failure: path={}", ctx.path(), e);
            RequestBodies.writeProblem(ctx, ProblemDetail.internalError("Unexpected server error", ctx.path()));
        });

        app.start(config.host(), config.port());

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "ailang-server started: host={}, port={}, max_body_bytes={}, health={}, startup_ms={}",
                config.host(),
                app.port(),
                maxBodyBytes,
                config.healthEnabled() ? config.healthPath() : "disabled",
                elapsedMs);
        return new TaskServerApp(app, config);
    }

    /** Returns the port the server is listening on. */
    public int port() {
        return app.port();
    }

    public Javalin javalin() {
        return app;
    }

    public ServerConfig config() {
        return config;
    }

    /** Stops the Javalin server. */
    public void stop() {
        app.stop();
        LOG.info("ailang-server stopped");
    }
}
