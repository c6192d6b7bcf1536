package rsb.util;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff used by pull-based sources while they wait for downstream demand.
 * <p>
 * The first wait lasts {@code minDelay}, every following one doubles up to
 * {@code maxDelay}, and at most {@code maxRetries} waits happen before the source gives up
 * on the value it holds.
 * <p>
 * The {@link #DEFAULT} instance reads the {@code rsb.demandBackoff.minDelayMillis} (1),
 * {@code rsb.demandBackoff.maxDelayMillis} (50) and {@code rsb.demandBackoff.maxRetries} (10)
 * system properties once.
 */
public final class DemandBackoff {

    public static final DemandBackoff DEFAULT = new DemandBackoff(
            Duration.ofMillis(Long.getLong("rsb.demandBackoff.minDelayMillis", 1L)),
            Duration.ofMillis(Long.getLong("rsb.demandBackoff.maxDelayMillis", 50L)),
            Integer.getInteger("rsb.demandBackoff.maxRetries", 10));

    final long minDelayNanos;

    final long maxDelayNanos;

    final int maxRetries;

    DemandBackoff(Duration minDelay, Duration maxDelay, int maxRetries) {
        Objects.requireNonNull(minDelay, "minDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (minDelay.isNegative() || minDelay.isZero()) {
            throw new IllegalArgumentException("minDelay > 0 required but it was " + minDelay);
        }
        if (maxDelay.compareTo(minDelay) < 0) {
            throw new IllegalArgumentException("maxDelay >= minDelay required but it was " + maxDelay + " < " + minDelay);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries >= 0 required but it was " + maxRetries);
        }
        this.minDelayNanos = minDelay.toNanos();
        this.maxDelayNanos = maxDelay.toNanos();
        this.maxRetries = maxRetries;
    }

    public static DemandBackoff of(Duration minDelay, Duration maxDelay, int maxRetries) {
        return new DemandBackoff(minDelay, maxDelay, maxRetries);
    }

    public long minDelayNanos() {
        return minDelayNanos;
    }

    public long maxDelayNanos() {
        return maxDelayNanos;
    }

    public int maxRetries() {
        return maxRetries;
    }

    /**
     * Returns the delay following the given one: doubled, capped at the maximum delay.
     * @param currentNanos the current delay in nanoseconds
     * @return the next delay in nanoseconds
     */
    public long nextDelayNanos(long currentNanos) {
        long next = currentNanos << 1;
        if (next < 0L || next > maxDelayNanos) {
            return maxDelayNanos;
        }
        return next;
    }

    /**
     * Sums the delays of a full retry budget.
     * @return the longest time, in nanoseconds, a source waits for demand before giving up
     */
    public long totalDelayNanos() {
        long total = 0L;
        long d = Math.min(minDelayNanos, maxDelayNanos);
        for (int i = 0; i < maxRetries; i++) {
            total = BackpressureHelper.addCap(total, d);
            d = nextDelayNanos(d);
        }
        return total;
    }

    @Override
    public String toString() {
        return "DemandBackoff[minDelay=" + Duration.ofNanos(minDelayNanos)
                + ", maxDelay=" + Duration.ofNanos(maxDelayNanos)
                + ", maxRetries=" + maxRetries + "]";
    }
}
