package org.enigma.utils.mcmc;

/**
 * Interface for tagging any class that holds the read-only data needed by the {@link ParameterSampler}s of a model.
 * Implementations are shared between chains and must not be mutated once constructed.
 */
public interface DataCollection {}
