package org.enigma.utils.mcmc;

import org.enigma.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tests the bookkeeping of {@link GibbsSampler} with a deterministic two-parameter model in which
 * COUNTER records the sweep number and SHADOW copies COUNTER, so that the sweep order is observable.
 */
public final class GibbsSamplerUnitTest extends BaseTest {
    private enum CounterParameter implements ParameterEnum {
        COUNTER, SHADOW
    }

    private static final class CounterState extends ParameterizedState<CounterParameter> {
        CounterState(final double counter, final double shadow) {
            super(Arrays.<Parameter<CounterParameter, ?>>asList(
                    new Parameter<>(CounterParameter.SHADOW, shadow),
                    new Parameter<>(CounterParameter.COUNTER, counter)));
        }

        CounterState(final CounterState state) {
            super(state);
        }

        double counter() {
            return get(CounterParameter.COUNTER, Double.class);
        }

        double shadow() {
            return get(CounterParameter.SHADOW, Double.class);
        }

        @Override
        public CounterState copy() {
            return new CounterState(this);
        }
    }

    private static final class EmptyData implements DataCollection {}

    private static GibbsSampler<CounterParameter, CounterState, EmptyData> buildSampler(final int numSamples,
                                                                                         final int numBurnIn,
                                                                                         final int thinningInterval) {
        final ParameterizedModel<CounterParameter, CounterState, EmptyData> model =
                new ParameterizedModel.GibbsBuilder<CounterParameter, CounterState, EmptyData>(new CounterState(0., 0.), new EmptyData())
                        .addParameterSampler(CounterParameter.COUNTER, (rng, state, data) -> state.counter() + 1, Double.class)
                        .addParameterSampler(CounterParameter.SHADOW, (rng, state, data) -> state.counter(), Double.class)
                        .build();
        return new GibbsSampler<>(numSamples, numBurnIn, thinningInterval, model);
    }

    @DataProvider(name = "thinning")
    public Object[][] thinning() {
        return new Object[][] {
                {100, 20, 1, 80},
                {100, 20, 2, 40},
                {100, 20, 5, 16},
                {100, 0, 3, 33},
                {10, 9, 1, 1}
        };
    }

    @Test(dataProvider = "thinning")
    public void testRetainedSamples(final int numSamples, final int numBurnIn, final int thinningInterval,
                                    final int expectedNumRetained) {
        final GibbsSampler<CounterParameter, CounterState, EmptyData> sampler =
                buildSampler(numSamples, numBurnIn, thinningInterval);
        sampler.runMCMC(seededRandomGenerator(1));
        final List<Double> counters = sampler.getSamples(CounterParameter.COUNTER, Double.class);
        Assert.assertEquals(counters.size(), expectedNumRetained);
        for (int i = 0; i < counters.size(); i++) {
            Assert.assertEquals(counters.get(i).doubleValue(), numBurnIn + (i + 1) * thinningInterval, 0.);
        }
        Assert.assertEquals(sampler.getNumSamplesGenerated(), numSamples);
    }

    @Test
    public void testSweepOrderFollowsDeclaration() {
        final GibbsSampler<CounterParameter, CounterState, EmptyData> sampler = buildSampler(5, 0, 1);
        sampler.runMCMC(seededRandomGenerator(1));
        //SHADOW is sampled after COUNTER and so sees the value from the same sweep
        final List<Double> differences = sampler.getSamples().stream()
                .map(s -> s.counter() - s.shadow()).collect(Collectors.toList());
        Assert.assertEquals(differences, Collections.nCopies(5, 0.));
        Assert.assertEquals(sampler.getCurrentState().counter(), 5., 0.);
    }

    @Test
    public void testSamplesAreSnapshots() {
        final GibbsSampler<CounterParameter, CounterState, EmptyData> sampler = buildSampler(3, 0, 1);
        sampler.runMCMC(seededRandomGenerator(1));
        final List<CounterState> samples = sampler.getSamples();
        Assert.assertEquals(samples.stream().map(CounterState::counter).collect(Collectors.toList()),
                Arrays.asList(1., 2., 3.));
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testCannotRunTwice() {
        final GibbsSampler<CounterParameter, CounterState, EmptyData> sampler = buildSampler(3, 0, 1);
        sampler.runMCMC(seededRandomGenerator(1));
        sampler.runMCMC(seededRandomGenerator(1));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testBurnInMustBeLessThanSamples() {
        buildSampler(10, 10, 1);
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testMissingSampler() {
        new ParameterizedModel.GibbsBuilder<CounterParameter, CounterState, EmptyData>(new CounterState(0., 0.), new EmptyData())
                .addParameterSampler(CounterParameter.COUNTER, (rng, state, data) -> state.counter() + 1, Double.class)
                .build();
    }
}
