package io.github.manjago.evoformula.expr;

import org.jetbrains.annotations.Nullable;

/**
 * Binds exactly one variable through a mutable slot.
 * <p>
 * Numeric sweeps create one instance and call {@link #set(double)} before
 * each sample instead of allocating a provider per point. Not thread-safe.
 */
public final class SingleVariableProvider implements ArgumentProvider {

    private final String name;
    private double value;

    public SingleVariableProvider(String name) {
        this.name = name;
    }

    public SingleVariableProvider(String name, double value) {
        this.name = name;
        this.value = value;
    }

    public void set(double value) {
        this.value = value;
    }

    public String getName() {
        return name;
    }

    @Override
    public @Nullable Double get(String name) {
        return this.name.equals(name) ? value : null;
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
