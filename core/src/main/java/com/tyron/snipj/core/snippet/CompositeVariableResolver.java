package com.tyron.snipj.core.snippet;

import com.tyron.snipj.api.snippet.VariableResolver;

import java.util.List;
import java.util.Optional;

/**
 * Asks each resolver in turn; the first one that knows the variable wins.
 */
public final class CompositeVariableResolver implements VariableResolver {

    private final List<VariableResolver> resolvers;

    public CompositeVariableResolver(List<? extends VariableResolver> resolvers) {
        this.resolvers = List.copyOf(resolvers);
    }

    public CompositeVariableResolver(VariableResolver... resolvers) {
        this(List.of(resolvers));
    }

    @Override
    public Optional<String> resolve(String name) {
        for (VariableResolver resolver : resolvers) {
            Optional<String> value = resolver.resolve(name);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }
}
