package rsb.util;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.reactivestreams.Subscription;

import rsb.test.TestSubscriber;

public class SubscriptionHelperTest {

    List<Throwable> dropped;

    volatile Subscription s;
    static final AtomicReferenceFieldUpdater<SubscriptionHelperTest, Subscription> S =
            AtomicReferenceFieldUpdater.newUpdater(SubscriptionHelperTest.class, Subscription.class, "s");

    static final class CountingSubscription implements Subscription {
        int cancelled;

        @Override
        public void request(long n) {
            // not tracked
        }

        @Override
        public void cancel() {
            cancelled++;
        }
    }

    @Before
    public void before() {
        dropped = new CopyOnWriteArrayList<>();
        UnsignalledExceptions.setErrorConsumer(dropped::add);
    }

    @After
    public void after() {
        UnsignalledExceptions.setErrorConsumer(null);
    }

    @Test
    public void validate() {
        Assert.assertTrue(SubscriptionHelper.validate(1));
        Assert.assertFalse(SubscriptionHelper.validate(0));
        Assert.assertFalse(SubscriptionHelper.validate(-1));

        Assert.assertEquals(2, dropped.size());
        Assert.assertEquals("request amount > 0 required but it was 0", dropped.get(0).getMessage());
    }

    @Test
    public void setOnceTwice() {
        CountingSubscription a = new CountingSubscription();
        CountingSubscription b = new CountingSubscription();

        Assert.assertTrue(SubscriptionHelper.setOnce(S, this, a));
        Assert.assertFalse(SubscriptionHelper.setOnce(S, this, b));

        Assert.assertEquals(0, a.cancelled);
        Assert.assertEquals(1, b.cancelled);
        Assert.assertEquals(1, dropped.size());
    }

    @Test
    public void terminateCancelsOnce() {
        CountingSubscription a = new CountingSubscription();
        SubscriptionHelper.setOnce(S, this, a);

        Assert.assertTrue(SubscriptionHelper.terminate(S, this));
        Assert.assertFalse(SubscriptionHelper.terminate(S, this));

        Assert.assertEquals(1, a.cancelled);
        Assert.assertSame(SubscriptionHelper.cancelled(), s);

        CountingSubscription late = new CountingSubscription();
        Assert.assertFalse(SubscriptionHelper.setOnce(S, this, late));
        Assert.assertEquals(1, late.cancelled);
        Assert.assertTrue(dropped.isEmpty());
    }

    @Test
    public void error() {
        TestSubscriber<Integer> ts = new TestSubscriber<>();
        SubscriptionHelper.error(ts, new IllegalStateException("failed"));
        ts.assertSubscribed().assertFailure(IllegalStateException.class);
    }
}
