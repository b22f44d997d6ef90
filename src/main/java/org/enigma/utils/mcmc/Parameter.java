package org.enigma.utils.mcmc;

import org.enigma.utils.Utils;

/**
 * A parameter value keyed by a {@link ParameterEnum} constant.
 * @param <T>   type of the {@link ParameterEnum} key
 * @param <U>   type of the value
 */
public final class Parameter<T extends Enum<T> & ParameterEnum, U> {
    private final T name;
    private final U value;

    /**
     * @param name  parameter key
     * @param value parameter value
     * @throws IllegalArgumentException if {@code name} or {@code value} is null
     */
    public Parameter(final T name, final U value) {
        this.name = Utils.nonNull(name, "The parameter name cannot be null.");
        this.value = Utils.nonNull(value, "The parameter value cannot be null.");
    }

    public T getName() {
        return name;
    }

    public U getValue() {
        return value;
    }
}
