package rsb.util;

import java.time.Duration;

import org.junit.Assert;
import org.junit.Test;

public class DemandBackoffTest {

    @Test
    public void defaults() {
        DemandBackoff b = DemandBackoff.DEFAULT;

        Assert.assertEquals(Duration.ofMillis(1).toNanos(), b.minDelayNanos());
        Assert.assertEquals(Duration.ofMillis(50).toNanos(), b.maxDelayNanos());
        Assert.assertEquals(10, b.maxRetries());
    }

    @Test
    public void delayDoublesUpToTheCap() {
        DemandBackoff b = DemandBackoff.of(Duration.ofMillis(1), Duration.ofMillis(50), 10);

        long d = b.minDelayNanos();
        long[] expected = { 1, 2, 4, 8, 16, 32, 50, 50 };
        for (long e : expected) {
            Assert.assertEquals(Duration.ofMillis(e).toNanos(), d);
            d = b.nextDelayNanos(d);
        }
    }

    @Test
    public void totalDelay() {
        DemandBackoff b = DemandBackoff.of(Duration.ofMillis(1), Duration.ofMillis(50), 10);

        Assert.assertEquals(Duration.ofMillis(1 + 2 + 4 + 8 + 16 + 32 + 50 + 50 + 50 + 50).toNanos(), b.totalDelayNanos());
    }

    @Test
    public void zeroRetries() {
        Assert.assertEquals(0L, DemandBackoff.of(Duration.ofMillis(1), Duration.ofMillis(1), 0).totalDelayNanos());
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroMinDelay() {
        DemandBackoff.of(Duration.ZERO, Duration.ofMillis(1), 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void maxBelowMin() {
        DemandBackoff.of(Duration.ofMillis(10), Duration.ofMillis(1), 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeRetries() {
        DemandBackoff.of(Duration.ofMillis(1), Duration.ofMillis(1), -1);
    }
}
