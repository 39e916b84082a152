package analysis.dataflow.numeric;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

import analysis.dataflow.util.AbstractValue;

/**
 * Set of at most <code>limit</code> integers. Any set that would grow past the limit becomes top.
 */
public final class ConstantSetValue implements AbstractValue<ConstantSetValue> {

    /**
     * Elements, null for top
     */
    private final SortedSet<Long> elements;
    private final int limit;

    private ConstantSetValue(SortedSet<Long> elements, int limit) {
        this.elements = elements == null ? null : Collections.unmodifiableSortedSet(elements);
        this.limit = limit;
    }

    static ConstantSetValue top(int limit) {
        return new ConstantSetValue(null, limit);
    }

    /**
     * Set of the given integers
     *
     * @param values
     *            elements
     * @param limit
     *            maximum number of elements before the set is replaced by top
     * @return abstract value
     */
    static ConstantSetValue of(Collection<Long> values, int limit) {
        if (values.size() > limit) {
            return top(limit);
        }
        return new ConstantSetValue(new TreeSet<>(values), limit);
    }

    public boolean isTop() {
        return elements == null;
    }

    /**
     * @return elements, only valid if not top
     */
    public SortedSet<Long> getElements() {
        assert elements != null : "Top has no element set";
        return elements;
    }

    int getLimit() {
        return limit;
    }

    @Override
    public boolean leq(ConstantSetValue that) {
        if (that.isTop()) {
            return true;
        }
        if (this.isTop()) {
            return false;
        }
        return that.elements.containsAll(this.elements);
    }

    @Override
    public boolean isBottom() {
        return elements != null && elements.isEmpty();
    }

    @Override
    public ConstantSetValue join(ConstantSetValue that) {
        if (this.isTop() || that.isTop()) {
            return top(limit);
        }
        TreeSet<Long> union = new TreeSet<>(this.elements);
        union.addAll(that.elements);
        return of(union, limit);
    }

    @Override
    public ConstantSetValue meet(ConstantSetValue that) {
        if (this.isTop()) {
            return that;
        }
        if (that.isTop()) {
            return this;
        }
        TreeSet<Long> intersection = new TreeSet<>(this.elements);
        intersection.retainAll(that.elements);
        return of(intersection, limit);
    }

    @Override
    public ConstantSetValue widen(ConstantSetValue that) {
        return join(that);
    }

    @Override
    public ConstantSetValue narrow(ConstantSetValue that) {
        return that;
    }

    @Override
    public String toString() {
        if (isTop()) {
            return "TOP";
        }
        if (isBottom()) {
            return "BOTTOM";
        }
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Long l : elements) {
            if (!first) {
                sb.append(",");
            }
            sb.append(l);
            first = false;
        }
        return sb.append("}").toString();
    }

    @Override
    public int hashCode() {
        return elements == null ? 0 : elements.hashCode() + 1;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ConstantSetValue)) {
            return false;
        }
        ConstantSetValue other = (ConstantSetValue) obj;
        if (elements == null) {
            return other.elements == null;
        }
        return elements.equals(other.elements);
    }
}
