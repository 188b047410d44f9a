package io.github.manjago.evoformula.expr;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Chain of providers; the first one with a binding wins.
 */
public final class FallbackProvider implements ArgumentProvider {

    private final List<ArgumentProvider> chain;

    public FallbackProvider(ArgumentProvider... chain) {
        this.chain = List.of(chain);
    }

    @Override
    public @Nullable Double get(String name) {
        for (ArgumentProvider provider : chain) {
            Double value = provider.get(name);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
