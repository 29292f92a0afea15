package io.ailang.core.error;

/**
 * Abstract base for all AILang exceptions. Never thrown directly; use {@link TaskSyntaxException},
 * {@link TaskRuntimeException} or {@link BytecodeDecodeException}.
 */
public abstract class TaskException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Pipeline phase in which the error occurred. */
    public enum Phase {
        PARSE,
        EXECUTION,
        DECODE
    }

    private final String taskId;
    private final Phase phase;

    protected TaskException(String message, String taskId, Phase phase) {
        super(message);
        this.taskId = taskId;
        this.phase = phase;
    }

    protected TaskException(String message, Throwable cause, String taskId, Phase phase) {
        super(message, cause);
        this.taskId = taskId;
        this.phase = phase;
    }

    /** The task that triggered the error, or {@code null} if not yet identified. */
    public String taskId() {
        return taskId;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
