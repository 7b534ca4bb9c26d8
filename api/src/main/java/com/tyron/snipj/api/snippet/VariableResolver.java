package com.tyron.snipj.api.snippet;

import java.util.Optional;

/**
 * Supplies values for snippet variables such as {@code $TM_FILENAME} or {@code ${TM_SELECTED_TEXT}}.
 * <p>
 * Resolution is a pure lookup. It happens once, before the snippet is first inserted;
 * values are not refreshed afterwards.
 */
@FunctionalInterface
public interface VariableResolver {

    VariableResolver NONE = name -> Optional.empty();

    /**
     * @return the value of the variable, or empty when this resolver does not know it.
     *         An empty result makes the variable fall back to its declared default.
     */
    Optional<String> resolve(String name);
}
