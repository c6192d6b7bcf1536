package rsb.stream;

/**
 * How an {@link AsyncStream} or {@link AsyncThrowingStream} buffers elements emitted
 * while its consumer is not waiting for one.
 */
public final class BufferingPolicy {

    static final BufferingPolicy UNBOUNDED = new BufferingPolicy(Integer.MAX_VALUE, false);

    final int limit;

    final boolean keepNewest;

    BufferingPolicy(int limit, boolean keepNewest) {
        this.limit = limit;
        this.keepNewest = keepNewest;
    }

    /**
     * @return the policy keeping every element
     */
    public static BufferingPolicy unbounded() {
        return UNBOUNDED;
    }

    /**
     * Keeps at most {@code limit} elements and drops newly emitted ones when full.
     * @param limit the maximum number of buffered elements, non-negative
     * @return the policy
     */
    public static BufferingPolicy bufferingOldest(int limit) {
        return new BufferingPolicy(checkLimit(limit), false);
    }

    /**
     * Keeps at most {@code limit} elements and drops the oldest buffered one when full.
     * @param limit the maximum number of buffered elements, non-negative
     * @return the policy
     */
    public static BufferingPolicy bufferingNewest(int limit) {
        return new BufferingPolicy(checkLimit(limit), true);
    }

    static int checkLimit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit >= 0 required but it was " + limit);
        }
        return limit;
    }

    public int limit() {
        return limit;
    }

    public boolean isUnbounded() {
        return limit == Integer.MAX_VALUE;
    }

    @Override
    public String toString() {
        if (isUnbounded()) {
            return "BufferingPolicy[unbounded]";
        }
        return "BufferingPolicy[" + (keepNewest ? "newest " : "oldest ") + limit + "]";
    }
}
