package io.ailang.core.spi;

import io.ailang.core.model.ExecutionContext;
import io.ailang.core.model.ModelSpec;

/**
 * Pluggable model invoked by a {@code %model:type{...}} statement. Implementations are looked up
 * by {@link #id()} and applied to the live execution context.
 *
 * <p>Implementations MUST be stateless and thread-safe; all per-execution state lives in the
 * {@link ExecutionContext}.
 */
public interface TaskModel {

    /**
     * Returns the model type this implementation handles, e.g. {@code "sort"}.
     *
     * @return a non-null, non-empty model type (the identifier after {@code %model:})
     */
    String id();

    /**
     * Applies the model to the context.
     *
     * @param spec    the declaration, including its scalar arguments
     * @param context the live context; the model reads and writes it in place
     * @throws io.ailang.core.error.TaskRuntimeException if the model cannot run against the
     *     current context
     */
    void apply(ModelSpec spec, ExecutionContext context);
}
