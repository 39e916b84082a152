package util;

/**
 * Point in time after which a computation should stop and report what it has. Checked cooperatively.
 */
public final class Deadline {

    /**
     * Deadline that never expires
     */
    public static final Deadline NONE = new Deadline(Long.MAX_VALUE);

    /**
     * Value of {@link System#nanoTime()} at which the deadline expires, Long.MAX_VALUE for never
     */
    private final long expiresAtNanos;

    private Deadline(long expiresAtNanos) {
        this.expiresAtNanos = expiresAtNanos;
    }

    /**
     * Deadline the given number of milliseconds from now
     *
     * @param millis
     *            time budget, non-positive means no deadline
     * @return new deadline
     */
    public static Deadline afterMillis(long millis) {
        if (millis <= 0) {
            return NONE;
        }
        return new Deadline(System.nanoTime() + millis * 1000000L);
    }

    /**
     * @return true if the deadline has passed
     */
    public boolean isExpired() {
        return expiresAtNanos != Long.MAX_VALUE && System.nanoTime() - expiresAtNanos >= 0;
    }

    /**
     * Time left before the deadline
     *
     * @return milliseconds left (0 if expired), Long.MAX_VALUE if there is no deadline
     */
    public long remainingMillis() {
        if (expiresAtNanos == Long.MAX_VALUE) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, (expiresAtNanos - System.nanoTime()) / 1000000L);
    }

    @Override
    public String toString() {
        return expiresAtNanos == Long.MAX_VALUE ? "no deadline" : remainingMillis() + "ms left";
    }
}
