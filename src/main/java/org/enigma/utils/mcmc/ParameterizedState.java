package org.enigma.utils.mcmc;

import org.enigma.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Represents a mapped collection of {@link Parameter} objects, i.e., named, ordered, enumerated keys associated with
 * values of mixed type via a key -> key, value map.
 *
 * Parameter values are expected to be immutable, so that copying a state only copies the map.
 */
public class ParameterizedState<T extends Enum<T> & ParameterEnum> {
    private final LinkedHashMap<T, Parameter<T, ?>> parameterMap;     //must be a Map that gives a consistently ordered keySet

    /**
     * Constructs a {@link ParameterizedState} from a List of {@link Parameter} objects with values of mixed type,
     * checking that all parameters are present without duplicates.
     * @param parameters    List of Parameters
     * @throws IllegalArgumentException if {@code parameters} is null, empty, contains duplicate parameter names, or missing parameter names
     */
    public ParameterizedState(final List<Parameter<T, ?>> parameters) {
        Utils.nonNull(parameters, "List of parameters cannot be null.");
        Utils.nonEmpty(parameters, "List of parameters cannot be empty.");
        final int numUniqueParameters = (int) parameters.stream().map(Parameter::getName).distinct().count();
        Utils.validateArg(numUniqueParameters == parameters.size(), "List of parameters may not contain duplicates.");
        final LinkedHashMap<T, Parameter<T, ?>> map = new LinkedHashMap<>();
        //insert in enum declaration order so that the sweep order does not depend on the order of the list
        final Class<T> keyClass = parameters.get(0).getName().getDeclaringClass();
        final Set<T> keySet = EnumSet.allOf(keyClass);
        for (final T key : keySet) {
            parameters.stream().filter(p -> p.getName() == key).findFirst().ifPresent(p -> map.put(key, p));
        }
        Utils.validateArg(keySet.equals(map.keySet()), "List of parameters does not contain all parameters specified by ParameterEnum.");
        parameterMap = map;
    }

    /**
     * Copy constructor.
     * @param state state to be copied
     */
    public ParameterizedState(final ParameterizedState<T> state) {
        this(state.values());
    }

    /**
     * Returns the keys in sweep order.
     */
    public Set<T> keySet() {
        return Collections.unmodifiableSet(parameterMap.keySet());
    }

    /**
     * Returns a List of the {@link Parameter} objects held by this state, in sweep order.
     */
    public List<Parameter<T, ?>> values() {
        return Collections.unmodifiableList(new ArrayList<>(parameterMap.values()));
    }

    /**
     * Returns the value of a {@link Parameter}, given its key and value type.
     * @param parameterKey          {@link ParameterEnum} key of {@link Parameter}
     * @param parameterValueClass   class of {@link Parameter} value
     * @param <U>                   type of {@link Parameter} value
     * @return                      {@link Parameter} value
     * @throws IllegalArgumentException if {@code parameterValueClass} does not match that of the {@link Parameter} in the collection
     */
    public <U> U get(final T parameterKey, final Class<U> parameterValueClass) {
        try {
            return parameterValueClass.cast(parameterMap.get(parameterKey).getValue());
        } catch (final ClassCastException e) {
            throw new IllegalArgumentException("Type of parameter specified in getter does not match pre-existing type.");
        }
    }

    /**
     * Replaces the value of a {@link Parameter}.  Only {@link ParameterizedModel} updates states, and only
     * states it owns.
     * @throws IllegalArgumentException if {@code value} is not of the type of the current value
     */
    protected <U> void update(final T parameterName, final U value) {
        Utils.validateArg(parameterMap.get(parameterName).getValue().getClass().isInstance(value),
                "Cannot update parameter value with type different from that of current value.");
        parameterMap.put(parameterName, new Parameter<>(parameterName, value));
    }

    /**
     * Returns a copy of this state.  Subclasses must override this to return an instance of their own type.
     */
    public ParameterizedState<T> copy() {
        return new ParameterizedState<>(values());
    }
}
