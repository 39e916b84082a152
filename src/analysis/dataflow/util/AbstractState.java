package analysis.dataflow.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable mapping from variables to abstract values. Variables that are not mapped have a default value (usually
 * the top element, since nothing is known about them). A state is either reachable or the distinguished unreachable
 * state, which is the bottom of the state lattice; a reachable state never maps a variable to bottom, setting one to
 * bottom yields the unreachable state.
 * <p>
 * Entries equal to the default are not stored, so two states are equal exactly when they map every variable to the
 * same value.
 *
 * @param <T>
 *            type of abstract values
 */
public final class AbstractState<T extends AbstractValue<T>> implements AbstractValue<AbstractState<T>> {

    /**
     * Value of variables that are not in {@link #values}
     */
    private final T defaultValue;
    /**
     * Bottom element of the value lattice, the value of every variable in the unreachable state
     */
    private final T bottomValue;
    /**
     * Non-default values, never bottom
     */
    private final Map<String, T> values;
    /**
     * True for the bottom state
     */
    private final boolean unreachable;

    private AbstractState(T defaultValue, T bottomValue, Map<String, T> values, boolean unreachable) {
        this.defaultValue = defaultValue;
        this.bottomValue = bottomValue;
        this.values = values;
        this.unreachable = unreachable;
    }

    /**
     * State mapping every variable to the default value
     *
     * @param defaultValue
     *            value of every variable
     * @param bottomValue
     *            bottom element of the value lattice
     * @return new reachable state
     */
    public static <T extends AbstractValue<T>> AbstractState<T> initial(T defaultValue, T bottomValue) {
        return new AbstractState<>(defaultValue, bottomValue, Collections.<String, T> emptyMap(), false);
    }

    /**
     * The bottom state
     *
     * @param defaultValue
     *            default value shared by all states of the analysis
     * @param bottomValue
     *            bottom element of the value lattice
     * @return unreachable state
     */
    public static <T extends AbstractValue<T>> AbstractState<T> unreachable(T defaultValue, T bottomValue) {
        return new AbstractState<>(defaultValue, bottomValue, Collections.<String, T> emptyMap(), true);
    }

    public boolean isUnreachable() {
        return unreachable;
    }

    /**
     * Get the abstract value for a variable
     *
     * @param var
     *            variable name
     * @return abstract value, bottom if this state is unreachable
     */
    public T get(String var) {
        if (unreachable) {
            return bottomValue;
        }
        T v = values.get(var);
        return v == null ? defaultValue : v;
    }

    /**
     * Variables with a non-default value
     *
     * @return unmodifiable set of variable names
     */
    public Set<String> getVariables() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public T getDefaultValue() {
        return defaultValue;
    }

    /**
     * Get a new state with the value for a variable replaced
     *
     * @param var
     *            variable name
     * @param val
     *            new abstract value, bottom makes the state unreachable
     * @return new state (or this one if nothing changed)
     */
    public AbstractState<T> set(String var, T val) {
        if (val == null) {
            throw new RuntimeException("Null values are not allowed in an AbstractState.");
        }
        if (unreachable) {
            return this;
        }
        if (val.isBottom()) {
            return unreachable(defaultValue, bottomValue);
        }
        if (val.equals(get(var))) {
            return this;
        }
        Map<String, T> newValues = new LinkedHashMap<>(values);
        if (val.equals(defaultValue)) {
            newValues.remove(var);
        } else {
            newValues.put(var, val);
        }
        return new AbstractState<>(defaultValue, bottomValue, newValues, false);
    }

    private Set<String> allVariables(AbstractState<T> that) {
        Set<String> vars = new LinkedHashSet<>(values.keySet());
        vars.addAll(that.values.keySet());
        return vars;
    }

    @Override
    public boolean leq(AbstractState<T> that) {
        if (unreachable) {
            return true;
        }
        if (that.unreachable) {
            return false;
        }
        for (String var : allVariables(that)) {
            if (!get(var).leq(that.get(var))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean isBottom() {
        return unreachable;
    }

    @Override
    public AbstractState<T> join(AbstractState<T> that) {
        if (unreachable) {
            return that;
        }
        if (that.unreachable) {
            return this;
        }
        AbstractState<T> result = this;
        for (String var : allVariables(that)) {
            result = result.set(var, get(var).join(that.get(var)));
        }
        return result;
    }

    @Override
    public AbstractState<T> meet(AbstractState<T> that) {
        if (unreachable) {
            return this;
        }
        if (that.unreachable) {
            return that;
        }
        AbstractState<T> result = this;
        for (String var : allVariables(that)) {
            result = result.set(var, get(var).meet(that.get(var)));
        }
        return result;
    }

    @Override
    public AbstractState<T> widen(AbstractState<T> that) {
        if (unreachable) {
            return that;
        }
        if (that.unreachable) {
            return this;
        }
        AbstractState<T> result = this;
        for (String var : allVariables(that)) {
            result = result.set(var, get(var).widen(that.get(var)));
        }
        return result;
    }

    @Override
    public AbstractState<T> narrow(AbstractState<T> that) {
        if (unreachable || that.unreachable) {
            return that;
        }
        AbstractState<T> result = this;
        for (String var : allVariables(that)) {
            result = result.set(var, get(var).narrow(that.get(var)));
        }
        return result;
    }

    @Override
    public int hashCode() {
        return unreachable ? 17 : values.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof AbstractState)) {
            return false;
        }
        AbstractState<?> other = (AbstractState<?>) obj;
        if (unreachable || other.unreachable) {
            return unreachable == other.unreachable;
        }
        return values.equals(other.values);
    }

    @Override
    public String toString() {
        return unreachable ? "UNREACHABLE" : values.toString();
    }
}
