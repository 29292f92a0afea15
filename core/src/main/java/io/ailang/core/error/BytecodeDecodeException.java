package io.ailang.core.error;

/**
 * Thrown when a bytecode buffer cannot be decoded (bad magic, unsupported version, unknown constant
 * type, truncated data, out-of-range constant index or jump target).
 */
public final class BytecodeDecodeException extends TaskException {

    private static final long serialVersionUID = 1L;

    private final int offset;

    public BytecodeDecodeException(String message, int offset) {
        super(message, null, Phase.DECODE);
        this.offset = offset;
    }

    public BytecodeDecodeException(String message, Throwable cause, int offset) {
        super(message, cause, null, Phase.DECODE);
        this.offset = offset;
    }

    /** Byte offset at which decoding failed. */
    public int offset() {
        return offset;
    }
}
