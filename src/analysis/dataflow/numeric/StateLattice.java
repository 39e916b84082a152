package analysis.dataflow.numeric;

import analysis.dataflow.Lattice;
import analysis.dataflow.util.AbstractState;
import analysis.dataflow.util.AbstractValue;

/**
 * Pointwise lift of a numeric domain to abstract states
 *
 * @param <V>
 *            type of abstract values
 */
public class StateLattice<V extends AbstractValue<V>> implements Lattice<AbstractState<V>> {

    private final NumericDomain<V> domain;

    public StateLattice(NumericDomain<V> domain) {
        this.domain = domain;
    }

    @Override
    public AbstractState<V> bottom() {
        return AbstractState.unreachable(domain.top(), domain.bottom());
    }

    @Override
    public AbstractState<V> top() {
        return AbstractState.initial(domain.top(), domain.bottom());
    }

    @Override
    public boolean leq(AbstractState<V> a, AbstractState<V> b) {
        return a.leq(b);
    }

    @Override
    public AbstractState<V> join(AbstractState<V> a, AbstractState<V> b) {
        return a.join(b);
    }

    @Override
    public AbstractState<V> meet(AbstractState<V> a, AbstractState<V> b) {
        return a.meet(b);
    }

    @Override
    public AbstractState<V> widen(AbstractState<V> previous, AbstractState<V> next) {
        return previous.widen(next);
    }

    @Override
    public AbstractState<V> narrow(AbstractState<V> previous, AbstractState<V> next) {
        return previous.narrow(next);
    }

    @Override
    public boolean isFiniteHeight() {
        return domain.isFiniteHeight();
    }
}
