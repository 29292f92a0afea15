package io.ailang.core.bytecode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.ailang.core.error.BytecodeDecodeException;
import io.ailang.core.value.JsValues;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Validates and decodes a {@link BytecodeModule}. Every structural problem is reported as a
 * {@link BytecodeDecodeException} before any instruction runs:
 *
 * <ul>
 *   <li>wrong magic ({@code "Bad bytecode magic"})
 *   <li>version other than 1 ({@code "Unsupported bytecode version: N"})
 *   <li>unknown constant tag ({@code "Unknown const type: N"})
 *   <li>data ending early ({@code "Truncated bytecode"})
 *   <li>an operand naming a missing constant, or a jump leaving the code section
 * </ul>
 *
 * <p>The instruction scan stops at the first unknown opcode, where the VM halts as well.
 */
final class BytecodeDecoder {

    private final byte[] bytes;
    private int pos;

    private BytecodeDecoder(byte[] bytes) {
        this.bytes = bytes;
    }

    static DecodedModule decode(BytecodeModule module) {
        return new BytecodeDecoder(module.rawBytes()).decode();
    }

    private DecodedModule decode() {
        if (bytes.length < BytecodeCompiler.MAGIC.length
                || !Arrays.equals(bytes, 0, BytecodeCompiler.MAGIC.length, BytecodeCompiler.MAGIC, 0,
                        BytecodeCompiler.MAGIC.length)) {
            throw new BytecodeDecodeException("Bad bytecode magic", 0);
        }
        pos = BytecodeCompiler.MAGIC.length;
        int version = u8();
        if (version != BytecodeCompiler.VERSION) {
            throw new BytecodeDecodeException("Unsupported bytecode version: " + version, pos - 1);
        }

        long count = u32();
        List<JsonNode> constants = new ArrayList<>();
        for (long i = 0; i < count; i++) {
            constants.add(constant());
        }

        long codeLength = u32();
        int codeStart = pos;
        if (codeLength > bytes.length - codeStart) {
            throw new BytecodeDecodeException("Truncated bytecode", codeStart);
        }
        int codeEnd = codeStart + (int) codeLength;
        scanInstructions(codeStart, codeEnd, constants.size());
        return new DecodedModule(bytes, constants, codeStart, codeEnd);
    }

    private JsonNode constant() {
        int at = pos;
        int tag = u8();
        switch (tag) {
            case ConstantPool.TAG_NULL:
                return NullNode.getInstance();
            case ConstantPool.TAG_BOOL:
                return JsValues.bool(u8() != 0);
            case ConstantPool.TAG_NUMBER:
                return JsValues.number(f64());
            case ConstantPool.TAG_STRING:
                long length = u32();
                require(length);
                String s = new String(bytes, pos, (int) length, StandardCharsets.UTF_8);
                pos += (int) length;
                return JsValues.text(s);
            default:
                throw new BytecodeDecodeException("Unknown const type: " + tag, at);
        }
    }

    private void scanInstructions(int codeStart, int codeEnd, int constantCount) {
        int ip = codeStart;
        while (ip < codeEnd) {
            Opcode op = Opcode.fromCode(bytes[ip] & 0xFF);
            if (op == null || op == Opcode.END) {
                return;
            }
            int next = ip + 1 + op.operandBytes();
            if (next > codeEnd) {
                throw new BytecodeDecodeException("Truncated bytecode", ip);
            }
            switch (op) {
                case JUMP_IF_FALSE:
                    long target = (long) next + readInt(ip + 1);
                    if (target < codeStart || target > codeEnd) {
                        throw new BytecodeDecodeException("Jump target out of range: " + target, ip);
                    }
                    break;
                case SORT:
                    checkIndex(readInt(ip + 1), constantCount, ip);
                    int key = readInt(ip + 5);
                    if (key != Opcode.NO_KEY) {
                        checkIndex(key, constantCount, ip);
                    }
                    break;
                default:
                    if (op.operandBytes() == 4) {
                        checkIndex(readInt(ip + 1), constantCount, ip);
                    }
                    break;
            }
            ip = next;
        }
    }

    private static void checkIndex(int index, int constantCount, int at) {
        long unsigned = Integer.toUnsignedLong(index);
        if (unsigned >= constantCount) {
            throw new BytecodeDecodeException("Constant index out of range: " + unsigned, at);
        }
    }

    private int u8() {
        require(1);
        return bytes[pos++] & 0xFF;
    }

    private long u32() {
        require(4);
        long value = Integer.toUnsignedLong(readInt(pos));
        pos += 4;
        return value;
    }

    private double f64() {
        require(8);
        long low = Integer.toUnsignedLong(readInt(pos));
        long high = Integer.toUnsignedLong(readInt(pos + 4));
        pos += 8;
        return Double.longBitsToDouble(low | (high << 32));
    }

    private void require(long n) {
        if (n > bytes.length - pos) {
            throw new BytecodeDecodeException("Truncated bytecode", pos);
        }
    }

    private int readInt(int at) {
        return (bytes[at] & 0xFF)
                | (bytes[at + 1] & 0xFF) << 8
                | (bytes[at + 2] & 0xFF) << 16
                | (bytes[at + 3] & 0xFF) << 24;
    }
}
