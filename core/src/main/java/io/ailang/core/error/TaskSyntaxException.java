package io.ailang.core.error;

/**
 * Thrown when task source text cannot be parsed: malformed header, unknown statement, invalid
 * model/condition/action/let syntax, bad {@code %in} payload, or a duplicate singleton
 * declaration. Parsing stops at the first error.
 */
public final class TaskSyntaxException extends TaskException {

    private static final long serialVersionUID = 1L;

    private final int lineNumber;
    private final String line;

    public TaskSyntaxException(String message, String taskId, int lineNumber, String line) {
        super(message, taskId, Phase.PARSE);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public TaskSyntaxException(String message, Throwable cause, String taskId, int lineNumber, String line) {
        super(message, cause, taskId, Phase.PARSE);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    /** 1-based source line of the offending statement, or {@code 0} when not tied to a line. */
    public int lineNumber() {
        return lineNumber;
    }

    /** The offending source line, or {@code null} when not tied to a line. */
    public String line() {
        return line;
    }
}
