package io.ailang.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.TextNode;
import io.ailang.core.model.ExecutionContext;
import io.ailang.core.model.ModelSpec;
import io.ailang.core.spi.TaskModel;
import org.junit.jupiter.api.Test;

class ModelRegistryTest {

    private static TaskModel stamping(String id) {
        return new TaskModel() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public void apply(ModelSpec spec, ExecutionContext context) {
                context.set("stamp", TextNode.valueOf(id));
            }
        };
    }

    @Test
    void builtinsAreRegistered() {
        var registry = ModelRegistry.withBuiltins();

        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.hasModel("sort")).isTrue();
        assertThat(registry.hasModel("tool")).isTrue();
        assertThat(registry.getModel("magic")).isEmpty();
    }

    @Test
    void laterRegistrationReplacesEarlier() {
        var registry = new ModelRegistry();
        var first = stamping("x");
        var second = stamping("x");
        registry.register(first);
        registry.register(second);

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.getModel("x")).hasValue(second);
    }

    @Test
    void rejectsNullAndBlankIds() {
        var registry = new ModelRegistry();

        assertThatThrownBy(() -> registry.register(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> registry.register(stamping("")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("model id");
    }

    @Test
    void customModelsRunOnTheTreePath() {
        var registry = ModelRegistry.withBuiltins();
        registry.register(stamping("stamp"));
        var engine = new TaskEngine(registry);

        var result = engine.parseAndExecute("@t:\n%model:stamp\n");

        assertThat(result.context().get("stamp")).isEqualTo(TextNode.valueOf("stamp"));
    }
}
