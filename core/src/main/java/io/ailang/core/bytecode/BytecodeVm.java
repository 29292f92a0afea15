package io.ailang.core.bytecode;

import com.fasterxml.jackson.databind.JsonNode;
import io.ailang.core.engine.SortModel;
import io.ailang.core.error.BytecodeDecodeException;
import io.ailang.core.model.ExecutionContext;
import io.ailang.core.model.ExecutionResult;
import io.ailang.core.value.JsValues;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stack machine executing a {@link BytecodeModule}.
 *
 * <p>The module is decoded and validated first; decoding problems surface as
 * {@link BytecodeDecodeException} before any instruction runs. The context is seeded only when a
 * raw input is supplied. Execution ends at the end of the code section or at the first byte that
 * is not an opcode, which halts without error.
 *
 * <p>Popping an empty stack yields undefined. Comparison results are pushed as {@code 1} or
 * {@code 0}. Thread-safe: all state is local to {@link #run(BytecodeModule, JsonNode)}.
 */
public final class BytecodeVm {

    /**
     * Runs the module.
     *
     * @param module   the encoded module
     * @param rawInput the input to seed the context with, or {@code null} for an empty context
     * @return the outputs and final context
     * @throws BytecodeDecodeException if the module is malformed
     * @throws io.ailang.core.error.TaskRuntimeException if a {@code SORT} instruction fails
     */
    public ExecutionResult run(BytecodeModule module, JsonNode rawInput) {
        DecodedModule decoded = BytecodeDecoder.decode(module);
        ExecutionContext context = rawInput != null ? ExecutionContext.seeded(rawInput) : ExecutionContext.empty();
        Map<String, JsonNode> outputs = new LinkedHashMap<>();
        new Frame(decoded, context, outputs).loop();
        return new ExecutionResult(outputs, context);
    }

    /** Registers and instruction pointer of one run. */
    private static final class Frame {

        private final byte[] code;
        private final List<JsonNode> constants;
        private final int codeEnd;
        private final ExecutionContext context;
        private final Map<String, JsonNode> outputs;
        private final Deque<JsonNode> stack = new ArrayDeque<>();
        private int ip;

        Frame(DecodedModule module, ExecutionContext context, Map<String, JsonNode> outputs) {
            this.code = module.bytes();
            this.constants = module.constants();
            this.codeEnd = module.codeEnd();
            this.ip = module.codeStart();
            this.context = context;
            this.outputs = outputs;
        }

        void loop() {
            while (ip < codeEnd) {
                Opcode op = Opcode.fromCode(code[ip] & 0xFF);
                if (op == null) {
                    return;
                }
                ip++;
                switch (op) {
                    case CONST:
                        stack.push(constant(u32()));
                        break;
                    case GET_CTX:
                        stack.push(context.get(name(u32())));
                        break;
                    case SET_CTX:
                        context.set(name(u32()), pop());
                        break;
                    case MEMBER: {
                        String property = name(u32());
                        stack.push(JsValues.member(pop(), property));
                        break;
                    }
                    case ADD: {
                        JsonNode b = pop();
                        stack.push(JsValues.add(pop(), b));
                        break;
                    }
                    case SUB: {
                        JsonNode b = pop();
                        stack.push(JsValues.subtract(pop(), b));
                        break;
                    }
                    case MUL: {
                        JsonNode b = pop();
                        stack.push(JsValues.multiply(pop(), b));
                        break;
                    }
                    case DIV: {
                        JsonNode b = pop();
                        stack.push(JsValues.divide(pop(), b));
                        break;
                    }
                    case CMP_EQ: {
                        JsonNode b = pop();
                        pushFlag(JsValues.looseEquals(pop(), b));
                        break;
                    }
                    case CMP_GE: {
                        JsonNode b = pop();
                        pushFlag(JsValues.ge(pop(), b));
                        break;
                    }
                    case CMP_LE: {
                        JsonNode b = pop();
                        pushFlag(JsValues.le(pop(), b));
                        break;
                    }
                    case CMP_GT: {
                        JsonNode b = pop();
                        pushFlag(JsValues.gt(pop(), b));
                        break;
                    }
                    case CMP_LT: {
                        JsonNode b = pop();
                        pushFlag(JsValues.lt(pop(), b));
                        break;
                    }
                    case JUMP_IF_FALSE: {
                        int offset = u32();
                        if (!JsValues.isTruthy(pop())) {
                            ip += offset;
                        }
                        break;
                    }
                    case SORT: {
                        String algorithm = name(u32());
                        int keyIndex = u32();
                        String key = keyIndex == Opcode.NO_KEY ? null : name(keyIndex);
                        SortModel.sortInto(context, algorithm, key == null || key.isEmpty() ? null : key);
                        break;
                    }
                    case EMIT_PREFERRED: {
                        String name = name(u32());
                        JsonNode value = JsValues.coalesce(
                                context.get(name),
                                JsValues.coalesce(
                                        context.get(ExecutionContext.SORTED), context.get(ExecutionContext.INPUT)));
                        outputs.put(name, JsValues.cloneJson(value));
                        break;
                    }
                    case EMIT_TOP: {
                        String name = name(u32());
                        outputs.put(name, JsValues.cloneJson(pop()));
                        break;
                    }
                    default:
                        // END
                        ip = codeEnd;
                        break;
                }
            }
        }

        private JsonNode pop() {
            JsonNode value = stack.poll();
            return value != null ? value : JsValues.UNDEFINED;
        }

        private void pushFlag(boolean flag) {
            stack.push(JsValues.number(flag ? 1 : 0));
        }

        private JsonNode constant(int index) {
            long unsigned = Integer.toUnsignedLong(index);
            if (unsigned >= constants.size()) {
                throw new BytecodeDecodeException("Constant index out of range: " + unsigned, ip - 4);
            }
            return constants.get((int) unsigned);
        }

        private String name(int index) {
            return JsValues.toJsString(constant(index));
        }

        private int u32() {
            if (ip + 4 > codeEnd) {
                throw new BytecodeDecodeException("Truncated bytecode", ip);
            }
            int value = (code[ip] & 0xFF)
                    | (code[ip + 1] & 0xFF) << 8
                    | (code[ip + 2] & 0xFF) << 16
                    | (code[ip + 3] & 0xFF) << 24;
            ip += 4;
            return value;
        }
    }
}
