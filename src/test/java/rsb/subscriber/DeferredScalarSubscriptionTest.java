package rsb.subscriber;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.Assert;
import org.junit.Test;

import rsb.test.TestSubscriber;

public class DeferredScalarSubscriptionTest {

    @Test
    public void valueThenRequest() {
        TestSubscriber<Integer> ts = new TestSubscriber<>(0);
        DeferredScalarSubscription<Integer> sds = new DeferredScalarSubscription<>(ts);
        ts.onSubscribe(sds);

        sds.complete(1);

        ts.assertNoEvents();

        ts.request(1);

        ts.assertResult(1);
        Assert.assertTrue(sds.isTerminated());
    }

    @Test
    public void requestThenValue() {
        TestSubscriber<Integer> ts = new TestSubscriber<>();
        DeferredScalarSubscription<Integer> sds = new DeferredScalarSubscription<>(ts);
        ts.onSubscribe(sds);

        ts.assertNoEvents();

        sds.complete(1);
        sds.complete(2);

        ts.assertResult(1);
    }

    @Test
    public void errorWithoutRequest() {
        TestSubscriber<Integer> ts = new TestSubscriber<>(0);
        DeferredScalarSubscription<Integer> sds = new DeferredScalarSubscription<>(ts);
        ts.onSubscribe(sds);

        sds.error(new IllegalStateException("failed"));
        sds.complete(1);
        ts.request(1);

        ts.assertFailure(IllegalStateException.class);
    }

    @Test
    public void cancelledReceivesNothing() {
        TestSubscriber<Integer> ts = new TestSubscriber<>(0);
        DeferredScalarSubscription<Integer> sds = new DeferredScalarSubscription<>(ts);
        ts.onSubscribe(sds);

        ts.cancel();
        Assert.assertTrue(sds.isCancelled());

        sds.complete(1);
        ts.request(1);
        sds.error(new IllegalStateException("ignored"));

        ts.assertNoEvents();
    }

    @Test
    public void completeRacesRequest() throws Exception {
        ExecutorService exec = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 1000; i++) {
                TestSubscriber<Integer> ts = new TestSubscriber<>(0);
                DeferredScalarSubscription<Integer> sds = new DeferredScalarSubscription<>(ts);
                ts.onSubscribe(sds);

                CountDownLatch start = new CountDownLatch(1);
                CountDownLatch done = new CountDownLatch(2);
                exec.execute(() -> {
                    await(start);
                    sds.complete(1);
                    done.countDown();
                });
                exec.execute(() -> {
                    await(start);
                    ts.request(1);
                    done.countDown();
                });
                start.countDown();

                Assert.assertTrue(done.await(5, TimeUnit.SECONDS));

                ts.assertResult(1);
            }
        } finally {
            exec.shutdownNow();
        }
    }

    static void await(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
