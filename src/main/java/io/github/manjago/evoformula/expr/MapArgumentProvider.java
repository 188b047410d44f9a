package io.github.manjago.evoformula.expr;

import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * Fixed, immutable mapping from variable names to values.
 */
public record MapArgumentProvider(Map<String, Double> bindings) implements ArgumentProvider {

    public MapArgumentProvider {
        bindings = Map.copyOf(bindings);
    }

    public static MapArgumentProvider of(String name, double value) {
        return new MapArgumentProvider(Map.of(name, value));
    }

    public static MapArgumentProvider of(String name1, double value1, String name2, double value2) {
        return new MapArgumentProvider(Map.of(name1, value1, name2, value2));
    }

    @Override
    public @Nullable Double get(String name) {
        return bindings.get(name);
    }
}
