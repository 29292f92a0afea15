package io.ailang.core.engine;

import io.ailang.core.spi.TaskModel;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of task models, keyed by model type. Thread-safe: registration and lookup can happen
 * concurrently.
 */
public final class ModelRegistry {

    private final Map<String, TaskModel> models = new ConcurrentHashMap<>();

    /** Creates a registry holding the built-in {@code sort} and {@code tool} models. */
    public static ModelRegistry withBuiltins() {
        ModelRegistry registry = new ModelRegistry();
        registry.register(new SortModel());
        registry.register(new ToolModel());
        return registry;
    }

    /**
     * Registers a model. A model already registered under the same id is replaced.
     *
     * @param model the model to register
     * @throws NullPointerException if model is null
     * @throws IllegalArgumentException if model.id() is null or empty
     */
    public void register(TaskModel model) {
        if (model == null) {
            throw new NullPointerException("model must not be null");
        }
        String id = model.id();
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("model id must not be null or empty");
        }
        models.put(id, model);
    }

    /**
     * Looks up a model by type.
     *
     * @param type the model type (e.g. "sort")
     * @return the model, or empty if not registered
     */
    public Optional<TaskModel> getModel(String type) {
        return Optional.ofNullable(models.get(type));
    }

    /** Returns the number of registered models. */
    public int size() {
        return models.size();
    }

    /** Returns {@code true} if a model with the given type is registered. */
    public boolean hasModel(String type) {
        return models.containsKey(type);
    }
}
