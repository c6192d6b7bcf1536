package rsb.util;

/**
 * Outstanding demand of a single subscriber.
 * <p>
 * The count never goes negative and {@code Long.MAX_VALUE} stands for unbounded demand:
 * it absorbs further increments and is never decremented.
 * <p>
 * All methods synchronize on the tracker itself. Subscriptions owning a tracker use the
 * same monitor to guard the rest of their mutable state (buffer, subscriber reference)
 * so that demand and delivery bookkeeping change together.
 */
public final class DemandTracker {

    long requested;

    /**
     * Adds to the outstanding demand, saturating at {@code Long.MAX_VALUE}.
     * @param n the amount to add, must be positive
     * @throws IllegalArgumentException if n is not positive
     */
    public synchronized void increment(long n) {
        if (n <= 0L) {
            throw new IllegalArgumentException("n > 0 required but it was " + n);
        }
        requested = BackpressureHelper.addCap(requested, n);
    }

    /**
     * Takes one unit of demand.
     * @return true if there was demand to take, false if the demand is zero
     */
    public synchronized boolean tryConsumeOne() {
        long r = requested;
        if (r == Long.MAX_VALUE) {
            return true;
        }
        if (r == 0L) {
            return false;
        }
        requested = r - 1;
        return true;
    }

    public synchronized boolean hasDemand() {
        return requested != 0L;
    }

    public synchronized boolean isUnbounded() {
        return requested == Long.MAX_VALUE;
    }

    public synchronized long get() {
        return requested;
    }

    @Override
    public synchronized String toString() {
        return requested == Long.MAX_VALUE ? "DemandTracker[unbounded]" : "DemandTracker[" + requested + "]";
    }
}
