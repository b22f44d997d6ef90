package org.enigma.utils.mcmc;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Draws a new value of one {@link Parameter} conditional on the rest of a {@link ParameterizedState}
 * and on a {@link DataCollection}.
 * @param <U>   type of parameter value to be sampled
 * @param <V>   type of enumerated parameters, see {@link ParameterEnum}
 * @param <S>   type of {@link ParameterizedState}
 * @param <T>   type of {@link DataCollection}
 */
@FunctionalInterface
public interface ParameterSampler<U, V extends Enum<V> & ParameterEnum, S extends ParameterizedState<V>, T extends DataCollection> {
    /**
     * @param rng               source of randomness; samplers must draw from no other source
     * @param state             current state, with every parameter earlier in the sweep already updated
     * @param dataCollection    data shared by the model
     * @return                  new value of the parameter
     */
    U sample(final RandomGenerator rng, final S state, final T dataCollection);
}
