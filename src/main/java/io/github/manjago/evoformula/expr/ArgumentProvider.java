package io.github.manjago.evoformula.expr;

import org.jetbrains.annotations.Nullable;

/**
 * Binding context used during evaluation: resolves variable names to values.
 */
public interface ArgumentProvider {

    /**
     * Look up the value bound to a variable.
     *
     * @param name variable name
     * @return bound value, or null if this provider has no binding
     */
    @Nullable Double get(String name);

    /**
     * Provider without any bindings.
     */
    ArgumentProvider EMPTY = name -> null;
}
