package analysis.dataflow.numeric;

import analysis.dataflow.util.AbstractValue;

/**
 * Interval of integers with possibly infinite bounds. Bounds are stored as doubles so that the infinities can be
 * represented; finite bounds are always integral.
 */
public final class Interval implements AbstractValue<Interval> {

    /**
     * Lower bound, null for bottom
     */
    final Double min;
    /**
     * Upper bound, null for bottom
     */
    final Double max;

    public static final Interval TOP_ELEMENT = new Interval(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
    public static final Interval BOTTOM_ELEMENT = new Interval();

    /**
     * Create an interval, an empty range gives bottom through {@link #of(double, double)}
     */
    private Interval(double min, double max) {
        if (Double.isNaN(min) || Double.isNaN(max)) {
            throw new RuntimeException("NaN is not allowed as a max or min. " + max + " " + min);
        }
        // adding 0.0 turns -0.0 into 0.0 so equal intervals are equal objects
        this.min = min + 0.0;
        this.max = max + 0.0;
    }

    /**
     * Create the bottom element
     */
    private Interval() {
        this.min = null;
        this.max = null;
    }

    /**
     * Interval from min to max inclusive
     *
     * @param min
     *            lower bound, may be negative infinity
     * @param max
     *            upper bound, may be positive infinity
     * @return interval, bottom if min &gt; max
     */
    public static Interval of(double min, double max) {
        if (min > max || min == Double.POSITIVE_INFINITY || max == Double.NEGATIVE_INFINITY) {
            return BOTTOM_ELEMENT;
        }
        if (min == Double.NEGATIVE_INFINITY && max == Double.POSITIVE_INFINITY) {
            return TOP_ELEMENT;
        }
        return new Interval(min, max);
    }

    public static Interval constant(long c) {
        return new Interval(c, c);
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public boolean contains(long c) {
        return !isBottom() && min <= c && c <= max;
    }

    @Override
    public boolean leq(Interval that) {
        if (this.isBottom()) {
            return true;
        }
        if (that.isBottom()) {
            return false;
        }
        return this.min >= that.min && this.max <= that.max;
    }

    @Override
    public boolean isBottom() {
        return min == null;
    }

    @Override
    public Interval join(Interval that) {
        if (that.isBottom()) {
            return this;
        }
        if (this.isBottom()) {
            return that;
        }
        return of(Math.min(this.min, that.min), Math.max(this.max, that.max));
    }

    @Override
    public Interval meet(Interval that) {
        if (this.isBottom() || that.isBottom()) {
            return BOTTOM_ELEMENT;
        }
        return of(Math.max(this.min, that.min), Math.min(this.max, that.max));
    }

    /**
     * Bounds that grew since the previous iteration jump to infinity
     */
    @Override
    public Interval widen(Interval that) {
        if (this.isBottom()) {
            return that;
        }
        if (that.isBottom()) {
            return this;
        }
        double newMin = that.min < this.min ? Double.NEGATIVE_INFINITY : this.min;
        double newMax = that.max > this.max ? Double.POSITIVE_INFINITY : this.max;
        return of(newMin, newMax);
    }

    /**
     * Only infinite bounds are refined
     */
    @Override
    public Interval narrow(Interval that) {
        if (this.isBottom() || that.isBottom()) {
            return that;
        }
        double newMin = this.min == Double.NEGATIVE_INFINITY ? that.min : this.min;
        double newMax = this.max == Double.POSITIVE_INFINITY ? that.max : this.max;
        return of(newMin, newMax);
    }

    /**
     * Negation of the interval
     *
     * @return interval containing -x for every x in this
     */
    public Interval neg() {
        if (isBottom()) {
            return BOTTOM_ELEMENT;
        }
        return of(-max, -min);
    }

    /**
     * Constrain to be less than or equal to a number
     *
     * @param n
     *            upper bound
     * @return refined interval
     */
    public Interval lte(double n) {
        return meet(of(Double.NEGATIVE_INFINITY, n));
    }

    /**
     * Constrain to be greater than or equal to a number
     *
     * @param n
     *            lower bound
     * @return refined interval
     */
    public Interval gte(double n) {
        return meet(of(n, Double.POSITIVE_INFINITY));
    }

    @Override
    public String toString() {
        if (isBottom()) {
            return "BOTTOM";
        }
        return "[" + bound(min) + "," + bound(max) + "]";
    }

    private static String bound(double d) {
        if (Double.isInfinite(d)) {
            return d > 0 ? "+inf" : "-inf";
        }
        return Long.toString((long) d);
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + ((this.max == null) ? 0 : this.max.hashCode());
        result = prime * result + ((this.min == null) ? 0 : this.min.hashCode());
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Interval)) {
            return false;
        }
        Interval other = (Interval) obj;
        if (this.min == null) {
            return other.min == null;
        }
        return this.min.equals(other.min) && this.max.equals(other.max);
    }
}
