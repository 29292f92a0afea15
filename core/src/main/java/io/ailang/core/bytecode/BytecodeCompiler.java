package io.ailang.core.bytecode;

import com.fasterxml.jackson.databind.node.NullNode;
import io.ailang.core.engine.SortModel;
import io.ailang.core.engine.ToolModel;
import io.ailang.core.model.Action;
import io.ailang.core.model.Condition;
import io.ailang.core.model.ConditionalAction;
import io.ailang.core.model.ExecutionContext;
import io.ailang.core.model.Expression;
import io.ailang.core.model.ModelSpec;
import io.ailang.core.model.Statement;
import io.ailang.core.model.TaskProgram;
import io.ailang.core.value.JsValues;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowers a {@link TaskProgram} to a {@link BytecodeModule} in one pass over its source order.
 *
 * <ul>
 *   <li>{@code model:sort}: {@code SORT algorithm key}.
 *   <li>{@code model:tool} and unknown model types: nothing; a WARN is logged.
 *   <li>{@code out}: the preferred value ({@code sorted}, else {@code input}, else null) selected
 *       with null tests and jumps, then {@code EMIT_TOP name}.
 *   <li>{@code let}: the expression, then {@code SET_CTX name}.
 *   <li>{@code action}: the condition, {@code JUMP_IF_FALSE} over the effect, the effect
 *       ({@code emit} and {@code set} only; {@code log} has no lowering).
 *   <li>{@code input}, {@code node}, {@code edge}, {@code cond}: nothing.
 * </ul>
 *
 * <p>The {@code %in} payload is not embedded; the VM receives input at run time. Output is
 * deterministic: the same program always compiles to the same bytes. Thread-safe: each call works
 * on its own buffers.
 */
public final class BytecodeCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(BytecodeCompiler.class);

    static final byte[] MAGIC = "ALBC".getBytes(StandardCharsets.US_ASCII);
    static final int VERSION = 1;

    /**
     * Compiles the program.
     *
     * @param program the parsed program
     * @return the encoded module
     */
    public BytecodeModule compile(TaskProgram program) {
        Objects.requireNonNull(program, "program must not be null");
        Unit unit = new Unit(program.taskId());
        for (Statement step : program.sourceOrder()) {
            unit.statement(step);
        }

        ByteSink out = new ByteSink();
        out.bytes(MAGIC);
        out.u8(VERSION);
        unit.pool.encode(out);
        byte[] code = unit.code.toByteArray();
        out.u32(code.length);
        out.bytes(code);
        out.u8(Opcode.END.code());
        return BytecodeModule.of(out.toByteArray());
    }

    /** State of one compilation. */
    private static final class Unit {

        private final String taskId;
        private final ConstantPool pool = new ConstantPool();
        private final ByteSink code = new ByteSink();

        Unit(String taskId) {
            this.taskId = taskId;
        }

        void statement(Statement step) {
            if (step instanceof Statement.Model model) {
                model(model.model());
            } else if (step instanceof Statement.Out out) {
                out(out.name());
            } else if (step instanceof Statement.Let let) {
                expression(let.expression());
                op(Opcode.SET_CTX, pool.addString(let.name()));
            } else if (step instanceof Statement.Conditional conditional) {
                conditional(conditional.action());
            }
        }

        private void model(ModelSpec spec) {
            if (SortModel.ID.equals(spec.type())) {
                String algorithm = SortModel.algorithmName(spec.arg("algorithm"));
                String key = SortModel.keyName(spec.arg("key"));
                code.u8(Opcode.SORT.code());
                code.u32(pool.addString(algorithm));
                code.u32(key != null ? pool.addString(key) : Opcode.NO_KEY);
                return;
            }
            if (ToolModel.ID.equals(spec.type())) {
                LOG.warn("Model has no bytecode lowering, tool requests are not recorded: task_id={}", taskId);
            } else {
                LOG.warn("Unknown model type skipped in bytecode: task_id={}, type={}", taskId, spec.type());
            }
        }

        /*
         *   GET_CTX sorted; CONST null; CMP_EQ; JUMP_IF_FALSE takeSorted
         *   GET_CTX input;  CONST null; CMP_EQ; JUMP_IF_FALSE takeInput
         *   CONST null; CONST 0; JUMP_IF_FALSE emit
         * takeInput:
         *   GET_CTX input; CONST 0; JUMP_IF_FALSE emit
         * takeSorted:
         *   GET_CTX sorted
         * emit:
         *   EMIT_TOP name
         */
        private void out(String name) {
            int sorted = pool.addString(ExecutionContext.SORTED);
            int input = pool.addString(ExecutionContext.INPUT);
            int nul = pool.add(NullNode.getInstance());
            int zero = pool.add(JsValues.number(0));

            op(Opcode.GET_CTX, sorted);
            op(Opcode.CONST, nul);
            code.u8(Opcode.CMP_EQ.code());
            int toSorted = jumpIfFalse();

            op(Opcode.GET_CTX, input);
            op(Opcode.CONST, nul);
            code.u8(Opcode.CMP_EQ.code());
            int toInput = jumpIfFalse();

            op(Opcode.CONST, nul);
            op(Opcode.CONST, zero);
            int nullToEmit = jumpIfFalse();

            patch(toInput);
            op(Opcode.GET_CTX, input);
            op(Opcode.CONST, zero);
            int inputToEmit = jumpIfFalse();

            patch(toSorted);
            op(Opcode.GET_CTX, sorted);

            patch(nullToEmit);
            patch(inputToEmit);
            op(Opcode.EMIT_TOP, pool.addString(name));
        }

        private void conditional(ConditionalAction conditional) {
            condition(conditional.condition());
            int placeholder = jumpIfFalse();

            Action action = conditional.action();
            if (action instanceof Action.Emit emit) {
                op(Opcode.EMIT_PREFERRED, pool.addString(emit.name()));
            } else if (action instanceof Action.Set set) {
                op(Opcode.CONST, pool.add(set.value()));
                op(Opcode.SET_CTX, pool.addString(set.name()));
            }

            patch(placeholder);
        }

        /** Writes {@code JUMP_IF_FALSE} with a zero offset and returns where the offset sits. */
        private int jumpIfFalse() {
            code.u8(Opcode.JUMP_IF_FALSE.code());
            int placeholder = code.position();
            code.i32(0);
            return placeholder;
        }

        /** Points the jump at {@code placeholder} to the current position. */
        private void patch(int placeholder) {
            code.patchI32(placeholder, code.position() - (placeholder + 4));
        }

        private void condition(Condition condition) {
            op(Opcode.GET_CTX, pool.addString(condition.left()));
            if (!condition.isComparison()) {
                return;
            }
            op(Opcode.CONST, pool.add(condition.right()));
            switch (condition.op()) {
                case EQ:
                case EQ_EQ:
                    code.u8(Opcode.CMP_EQ.code());
                    break;
                case GE:
                    code.u8(Opcode.CMP_GE.code());
                    break;
                case LE:
                    code.u8(Opcode.CMP_LE.code());
                    break;
                case GT:
                    code.u8(Opcode.CMP_GT.code());
                    break;
                case LT:
                    code.u8(Opcode.CMP_LT.code());
                    break;
                default:
                    throw new IllegalStateException("Unhandled comparison: " + condition.op());
            }
        }

        private void expression(Expression expression) {
            if (expression instanceof Expression.Literal literal) {
                op(Opcode.CONST, pool.add(literal.value()));
            } else if (expression instanceof Expression.Identifier identifier) {
                op(Opcode.GET_CTX, pool.addString(identifier.name()));
            } else if (expression instanceof Expression.Member member) {
                expression(member.object());
                op(Opcode.MEMBER, pool.addString(member.property()));
            } else {
                Expression.Binary binary = (Expression.Binary) expression;
                expression(binary.left());
                expression(binary.right());
                switch (binary.op()) {
                    case ADD:
                        code.u8(Opcode.ADD.code());
                        break;
                    case SUB:
                        code.u8(Opcode.SUB.code());
                        break;
                    case MUL:
                        code.u8(Opcode.MUL.code());
                        break;
                    case DIV:
                        code.u8(Opcode.DIV.code());
                        break;
                    default:
                        throw new IllegalStateException("Unhandled operator: " + binary.op());
                }
            }
        }

        private void op(Opcode opcode, int operand) {
            code.u8(opcode.code());
            code.u32(operand);
        }
    }
}
