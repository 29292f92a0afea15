package io.ailang.core.error;

/**
 * Thrown when execution of a parsed task or compiled module fails (unknown model type, unknown
 * sort algorithm, sort without an array input). Outputs emitted before the failing statement are
 * not rolled back.
 */
public final class TaskRuntimeException extends TaskException {

    private static final long serialVersionUID = 1L;

    private final Integer statementIndex;

    public TaskRuntimeException(String message, String taskId, Integer statementIndex) {
        super(message, taskId, Phase.EXECUTION);
        this.statementIndex = statementIndex;
    }

    public TaskRuntimeException(String message, Throwable cause, String taskId, Integer statementIndex) {
        super(message, cause, taskId, Phase.EXECUTION);
        this.statementIndex = statementIndex;
    }

    /** Position of the failing statement in source order, or {@code null} for bytecode execution. */
    public Integer statementIndex() {
        return statementIndex;
    }
}
