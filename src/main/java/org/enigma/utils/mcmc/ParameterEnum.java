package org.enigma.utils.mcmc;

/**
 * Interface for tagging an enum that names every {@link Parameter} of a {@link ParameterizedState}.
 * The declaration order of the enum constants is the order in which a Gibbs sweep visits the parameters.
 */
public interface ParameterEnum {
}
