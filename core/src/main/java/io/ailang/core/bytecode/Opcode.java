package io.ailang.core.bytecode;

/**
 * Instruction set of the bytecode VM. Multi-byte operands are little-endian; every index operand
 * refers to the constant pool.
 */
public enum Opcode {
    /** u32 index: push constant. */
    CONST(0x01, 4),
    /** u32 name index: push context value (undefined if unbound). */
    GET_CTX(0x02, 4),
    /** u32 name index: pop and bind. */
    SET_CTX(0x03, 4),
    /** u32 property index: pop base, push its member (undefined for a null or undefined base). */
    MEMBER(0x04, 4),
    ADD(0x10, 0),
    SUB(0x11, 0),
    MUL(0x12, 0),
    DIV(0x13, 0),
    CMP_EQ(0x20, 0),
    CMP_GE(0x21, 0),
    CMP_LE(0x22, 0),
    CMP_GT(0x23, 0),
    CMP_LT(0x24, 0),
    /** i32 offset relative to the next instruction: pop, jump when falsy. */
    JUMP_IF_FALSE(0x30, 4),
    /** u32 algorithm index, u32 key index or {@link #NO_KEY}: sort into {@code sorted}. */
    SORT(0x40, 8),
    /** u32 name index: capture the named value, else {@code sorted}, else {@code input}. */
    EMIT_PREFERRED(0x50, 4),
    /** u32 name index: pop and capture. */
    EMIT_TOP(0x51, 4),
    END(0xFF, 0);

    /** Key operand of {@link #SORT} meaning "compare elements directly". */
    public static final int NO_KEY = 0xFFFFFFFF;

    private static final Opcode[] BY_CODE = new Opcode[256];

    static {
        for (Opcode op : values()) {
            BY_CODE[op.code] = op;
        }
    }

    private final int code;
    private final int operandBytes;

    Opcode(int code, int operandBytes) {
        this.code = code;
        this.operandBytes = operandBytes;
    }

    /** The encoded byte, 0..255. */
    public int code() {
        return code;
    }

    /** Total width of the operands following the opcode byte. */
    public int operandBytes() {
        return operandBytes;
    }

    /** Returns the opcode for an encoded byte, or {@code null} if the byte is not an opcode. */
    public static Opcode fromCode(int code) {
        return code >= 0 && code < BY_CODE.length ? BY_CODE[code] : null;
    }
}
