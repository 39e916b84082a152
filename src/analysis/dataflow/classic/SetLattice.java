package analysis.dataflow.classic;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import analysis.dataflow.Lattice;

/**
 * Powerset lattice over a finite universe, ordered by inclusion. States are unmodifiable sets.
 *
 * @param <E>
 *            type of set elements
 */
public class SetLattice<E> implements Lattice<Set<E>> {

    /**
     * Every element that can appear in a state
     */
    private final Set<E> universe;

    public SetLattice(Set<E> universe) {
        this.universe = Collections.unmodifiableSet(new LinkedHashSet<>(universe));
    }

    @Override
    public Set<E> bottom() {
        return Collections.emptySet();
    }

    @Override
    public Set<E> top() {
        return universe;
    }

    @Override
    public boolean leq(Set<E> a, Set<E> b) {
        return b.containsAll(a);
    }

    @Override
    public Set<E> join(Set<E> a, Set<E> b) {
        if (b.containsAll(a)) {
            return b;
        }
        if (a.containsAll(b)) {
            return a;
        }
        Set<E> result = new LinkedHashSet<>(a);
        result.addAll(b);
        return Collections.unmodifiableSet(result);
    }

    @Override
    public Set<E> meet(Set<E> a, Set<E> b) {
        if (b.containsAll(a)) {
            return a;
        }
        if (a.containsAll(b)) {
            return b;
        }
        Set<E> result = new LinkedHashSet<>(a);
        result.retainAll(b);
        return Collections.unmodifiableSet(result);
    }

    @Override
    public Set<E> widen(Set<E> previous, Set<E> next) {
        return join(previous, next);
    }

    @Override
    public Set<E> narrow(Set<E> previous, Set<E> next) {
        return next;
    }

    @Override
    public boolean isFiniteHeight() {
        return true;
    }

    /**
     * Length of the longest strictly ascending chain
     *
     * @return size of the universe plus one
     */
    public int height() {
        return universe.size() + 1;
    }

    /**
     * Unmodifiable copy of a set after removing and adding elements
     *
     * @param s
     *            original set
     * @param kill
     *            elements to remove
     * @param gen
     *            elements to add
     * @return (s - kill) + gen
     */
    public static <E> Set<E> killGen(Set<E> s, Set<? extends E> kill, Set<? extends E> gen) {
        Set<E> result = new LinkedHashSet<>(s);
        result.removeAll(kill);
        result.addAll(gen);
        if (result.equals(s)) {
            return s;
        }
        return Collections.unmodifiableSet(result);
    }
}
