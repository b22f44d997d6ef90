package org.enigma.utils.mcmc;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.enigma.utils.Utils;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Represents a parameterized model.  The parameterized state of the model is represented by a
 * {@link ParameterizedState}, while the data is represented by a {@link DataCollection}.
 * The state is updated by Gibbs sampling: each call to {@link #update(RandomGenerator)} visits every parameter
 * once, in the order of the {@link ParameterEnum} declaration, and replaces it with a draw from its
 * {@link ParameterSampler}.
 *
 * @param <V1>  type of the ParameterEnum
 * @param <S1>  type of the ParameterizedState
 * @param <T1>  type of the DataCollection
 */
public final class ParameterizedModel<V1 extends Enum<V1> & ParameterEnum, S1 extends ParameterizedState<V1>, T1 extends DataCollection> {
    private static final Logger logger = LogManager.getLogger(ParameterizedModel.class);

    private final S1 state;
    private final T1 dataCollection;
    private final Map<V1, ParameterSampler<?, V1, S1, T1>> samplerMap;

    /**
     * Builder for constructing a {@link ParameterizedModel} to be Gibbs sampled using {@link GibbsSampler}.
     * Given an initial state, a data collection and one {@link ParameterSampler} per parameter, a model is built as:
     *
     *  ParameterizedModel<ConcreteParameterEnum, ConcreteParameterizedState, ConcreteDataCollection> model =
     *      new ParameterizedModel.GibbsBuilder<>(initialState, dataset)
     *                            .addParameterSampler(PARAMETER_1, SAMPLER_1, TYPE_1.class)
     *                            .
     *                            .
     *                            .addParameterSampler(PARAMETER_N, SAMPLER_N, TYPE_N.class)
     *                            .build()
     *
     * The model takes ownership of {@code initialState} and updates it in place; pass a copy to keep the original.
     * @param <V2>  type of the ParameterEnum
     * @param <S2>  type of the ParameterizedState
     * @param <T2>  type of the DataCollection
     */
    public static final class GibbsBuilder<V2 extends Enum<V2> & ParameterEnum, S2 extends ParameterizedState<V2>, T2 extends DataCollection> {
        private final S2 state;
        private final T2 dataCollection;
        private final Map<V2, ParameterSampler<?, V2, S2, T2>> samplerMap = new HashMap<>();

        /**
         * @param state             ParameterizedState held by the model
         * @param dataCollection    DataCollection used by the model
         */
        public GibbsBuilder(final S2 state, final T2 dataCollection) {
            Utils.nonNull(state);
            Utils.nonNull(dataCollection);
            this.state = state;
            this.dataCollection = dataCollection;
        }

        /**
         * Adds a {@link ParameterSampler} to the collection of parameter samplers.
         * @param parameterName         name of parameter to sample
         * @param parameterSampler      ParameterSampler that returns random samples of the parameter
         * @param parameterValueClass   class of the parameter value to sample
         * @param <U>                   type of the parameter value to sample
         */
        public <U> GibbsBuilder<V2, S2, T2> addParameterSampler(final V2 parameterName,
                                                                final ParameterSampler<U, V2, S2, T2> parameterSampler,
                                                                final Class<U> parameterValueClass) {
            Utils.nonNull(parameterName);
            Utils.nonNull(parameterSampler);
            Utils.nonNull(parameterValueClass);
            if (samplerMap.containsKey(parameterName)) {
                throw new UnsupportedOperationException("Cannot add more than one sampler per parameter.");
            }
            try {
                state.get(parameterName, parameterValueClass);
            } catch (final IllegalArgumentException e) {
                throw new IllegalArgumentException("Cannot add sampler for parameter that returns type different " +
                        "than that specified for parameter in initial state.");
            }
            samplerMap.put(parameterName, parameterSampler);
            return this;
        }

        /**
         * @throws UnsupportedOperationException if there is not a one-to-one mapping between Parameters in the
         *                                       {@link ParameterizedState} and the {@link ParameterSampler}s
         */
        public ParameterizedModel<V2, S2, T2> build() {
            if (!samplerMap.keySet().equals(state.keySet())) {
                throw new UnsupportedOperationException("Each parameter must have a corresponding sampler specified.");
            }
            return new ParameterizedModel<>(this);
        }
    }

    private ParameterizedModel(final GibbsBuilder<V1, S1, T1> builder) {
        state = builder.state;
        dataCollection = builder.dataCollection;
        samplerMap = new EnumMap<>(builder.samplerMap);
    }

    /**
     * Returns a copy of the {@link ParameterizedState} held internally.
     */
    @SuppressWarnings("unchecked")
    public S1 state() {
        final ParameterizedState<V1> copy = state.copy();
        Utils.validate(state.getClass().isInstance(copy),
                () -> state.getClass().getSimpleName() + " must override copy() to return its own type.");
        return (S1) copy;
    }

    /**
     * Performs one Gibbs sweep over all parameters of the state held internally.
     * @param rng   {@link RandomGenerator} to pass to {@link ParameterSampler}s to generate samples
     */
    public void update(final RandomGenerator rng) {
        Utils.nonNull(rng);
        for (final V1 parameterName : state.keySet()) {
            state.update(parameterName, samplerMap.get(parameterName).sample(rng, state, dataCollection));
            if (logger.isDebugEnabled()) {
                logger.debug("Sampled " + parameterName.name() + ": " + state.get(parameterName, Object.class));
            }
        }
    }
}
