package analysis.dataflow;

import util.Deadline;

/**
 * Settings for {@link FixpointEngine}
 */
public class FixpointOptions {

    public static final int DEFAULT_MAX_VISITS_PER_BLOCK = 1000;
    public static final int DEFAULT_WIDENING_DELAY = 3;
    public static final int DEFAULT_NARROWING_PASSES = 2;

    /**
     * A block processed more often than this raises {@link NonConvergenceException}
     */
    private int maxVisitsPerBlock = DEFAULT_MAX_VISITS_PER_BLOCK;
    /**
     * Number of visits to a widening point before joins there are replaced by widening
     */
    private int wideningDelay = DEFAULT_WIDENING_DELAY;
    /**
     * Maximum number of narrowing sweeps after the widened fixpoint is reached
     */
    private int narrowingPasses = DEFAULT_NARROWING_PASSES;
    /**
     * Check that states only move in one direction
     */
    private boolean checkMonotonicity = false;
    private boolean widening = true;
    private Deadline deadline = Deadline.NONE;

    public int getMaxVisitsPerBlock() {
        return maxVisitsPerBlock;
    }

    public FixpointOptions setMaxVisitsPerBlock(int maxVisitsPerBlock) {
        if (maxVisitsPerBlock <= 0) {
            throw new IllegalArgumentException("maxVisitsPerBlock must be positive: " + maxVisitsPerBlock);
        }
        this.maxVisitsPerBlock = maxVisitsPerBlock;
        return this;
    }

    public int getWideningDelay() {
        return wideningDelay;
    }

    public FixpointOptions setWideningDelay(int wideningDelay) {
        if (wideningDelay < 0) {
            throw new IllegalArgumentException("wideningDelay must not be negative: " + wideningDelay);
        }
        this.wideningDelay = wideningDelay;
        return this;
    }

    public int getNarrowingPasses() {
        return narrowingPasses;
    }

    public FixpointOptions setNarrowingPasses(int narrowingPasses) {
        if (narrowingPasses < 0) {
            throw new IllegalArgumentException("narrowingPasses must not be negative: " + narrowingPasses);
        }
        this.narrowingPasses = narrowingPasses;
        return this;
    }

    public boolean isCheckMonotonicity() {
        return checkMonotonicity;
    }

    /**
     * Enable the (expensive) check that every recomputed state moves in the direction of the merge operator
     *
     * @param checkMonotonicity
     *            true to check
     * @return this
     */
    public FixpointOptions setCheckMonotonicity(boolean checkMonotonicity) {
        this.checkMonotonicity = checkMonotonicity;
        return this;
    }

    public boolean isWidening() {
        return widening;
    }

    /**
     * Turn widening off, an analysis over a lattice of infinite height may then fail to converge
     *
     * @param widening
     *            false to always use the plain merge operator
     * @return this
     */
    public FixpointOptions setWidening(boolean widening) {
        this.widening = widening;
        return this;
    }

    public Deadline getDeadline() {
        return deadline;
    }

    public FixpointOptions setDeadline(Deadline deadline) {
        this.deadline = deadline;
        return this;
    }
}
