package io.ailang.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.ailang.core.error.TaskRuntimeException;
import io.ailang.core.model.Action;
import io.ailang.core.model.Condition;
import io.ailang.core.model.ConditionalAction;
import io.ailang.core.model.ExecutionContext;
import io.ailang.core.model.ExecutionResult;
import io.ailang.core.model.Expression;
import io.ailang.core.model.ModelSpec;
import io.ailang.core.model.Statement;
import io.ailang.core.model.TaskProgram;
import io.ailang.core.spi.TaskModel;
import io.ailang.core.value.JsValues;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes a {@link TaskProgram} by walking its statements in source order against a fresh
 * context seeded from the program's input.
 *
 * <p>Statement semantics:
 *
 * <ul>
 *   <li>{@code model}: resolved through the {@link ModelRegistry} and applied to the context.
 *   <li>{@code out}: captures the preferred value ({@code sorted}, else {@code input}, else null).
 *   <li>{@code action}: evaluates the condition; when it holds, runs {@code emit} (named value,
 *       else {@code sorted}, else {@code input}), {@code log} (INFO log line) or {@code set}.
 *   <li>{@code let}: evaluates the expression against the live context and binds the result.
 *   <li>{@code input}, {@code node}, {@code edge}, {@code cond}: no effect.
 * </ul>
 *
 * <p>Outputs are deep-cloned when captured. Execution stops at the first failure. Thread-safe: no
 * state is kept between calls.
 */
public final class TreeExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(TreeExecutor.class);

    private final ModelRegistry models;

    public TreeExecutor(ModelRegistry models) {
        this.models = Objects.requireNonNull(models, "models must not be null");
    }

    /**
     * Executes the program.
     *
     * @param program the parsed program
     * @return the outputs and final context
     * @throws TaskRuntimeException if a model cannot be resolved or fails
     */
    public ExecutionResult execute(TaskProgram program) {
        Objects.requireNonNull(program, "program must not be null");
        ExecutionContext context = ExecutionContext.seeded(program.input());
        Map<String, JsonNode> outputs = new LinkedHashMap<>();

        List<Statement> steps = program.sourceOrder();
        for (int i = 0; i < steps.size(); i++) {
            Statement step = steps.get(i);
            if (step instanceof Statement.Model model) {
                applyModel(program.taskId(), i, model.model(), context);
            } else if (step instanceof Statement.Out out) {
                outputs.put(out.name(), JsValues.cloneJson(preferredValue(context)));
            } else if (step instanceof Statement.Conditional conditional) {
                ConditionalAction action = conditional.action();
                if (test(action.condition(), context)) {
                    runAction(program.taskId(), action.action(), context, outputs);
                }
            } else if (step instanceof Statement.Let let) {
                context.set(let.name(), evaluate(let.expression(), context));
            }
        }
        return new ExecutionResult(outputs, context);
    }

    private void applyModel(String taskId, int index, ModelSpec spec, ExecutionContext context) {
        TaskModel model = models.getModel(spec.type())
                .orElseThrow(() -> new TaskRuntimeException("Unknown model type: " + spec.type(), taskId, index));
        try {
            model.apply(spec, context);
        } catch (TaskRuntimeException e) {
            throw new TaskRuntimeException(e.getMessage(), e, taskId, index);
        }
    }

    private static void runAction(
            String taskId, Action action, ExecutionContext context, Map<String, JsonNode> outputs) {
        if (action instanceof Action.Emit emit) {
            JsonNode value = JsValues.coalesce(
                    context.get(emit.name()),
                    JsValues.coalesce(context.get(ExecutionContext.SORTED), context.get(ExecutionContext.INPUT)));
            outputs.put(emit.name(), JsValues.cloneJson(value));
        } else if (action instanceof Action.Log log) {
            LOG.info("task_id={} message={}", taskId, log.message());
        } else if (action instanceof Action.Set set) {
            context.set(set.name(), set.value().deepCopy());
        }
    }

    /** {@code sorted}, else {@code input}, else null. */
    static JsonNode preferredValue(ExecutionContext context) {
        JsonNode value = JsValues.coalesce(context.get(ExecutionContext.SORTED), context.get(ExecutionContext.INPUT));
        return JsValues.isNullish(value) ? NullNode.getInstance() : value;
    }

    /** Evaluates a condition: bare truthiness, or loose comparison against its literal. */
    static boolean test(Condition condition, ExecutionContext context) {
        JsonNode left = context.get(condition.left());
        if (!condition.isComparison()) {
            return JsValues.isTruthy(left);
        }
        JsonNode right = condition.right();
        switch (condition.op()) {
            case EQ:
            case EQ_EQ:
                return JsValues.looseEquals(left, right);
            case GE:
                return JsValues.ge(left, right);
            case LE:
                return JsValues.le(left, right);
            case GT:
                return JsValues.gt(left, right);
            case LT:
                return JsValues.lt(left, right);
            default:
                return false;
        }
    }

    /** Evaluates a let-binding expression against the live context. */
    static JsonNode evaluate(Expression expression, ExecutionContext context) {
        if (expression instanceof Expression.Literal literal) {
            return literal.value();
        }
        if (expression instanceof Expression.Identifier identifier) {
            return context.get(identifier.name());
        }
        if (expression instanceof Expression.Member member) {
            return JsValues.member(evaluate(member.object(), context), member.property());
        }
        Expression.Binary binary = (Expression.Binary) expression;
        JsonNode left = evaluate(binary.left(), context);
        JsonNode right = evaluate(binary.right(), context);
        switch (binary.op()) {
            case ADD:
                return JsValues.add(left, right);
            case SUB:
                return JsValues.subtract(left, right);
            case MUL:
                return JsValues.multiply(left, right);
            case DIV:
                return JsValues.divide(left, right);
            default:
                throw new IllegalStateException("Unhandled operator: " + binary.op());
        }
    }
}
