package rsb.publisher;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

import org.junit.Assert;
import org.junit.Test;

import rsb.test.TestSubscriber;

public class PublisherCompletableFutureTest {

    @Test(expected = NullPointerException.class)
    public void nullFuture() {
        new PublisherCompletableFuture<Integer>(null);
    }

    @Test
    public void normal() {
        TestSubscriber<Integer> ts = new TestSubscriber<>();
        CompletableFuture<Integer> f = new CompletableFuture<>();

        new PublisherCompletableFuture<>(f).subscribe(ts);

        ts.assertNoValues()
          .assertNoError()
          .assertNotComplete();

        f.complete(1);

        ts.assertResult(1);
    }

    @Test
    public void normalBackpressured() {
        TestSubscriber<Integer> ts = new TestSubscriber<>(0);
        CompletableFuture<Integer> f = new CompletableFuture<>();

        new PublisherCompletableFuture<>(f).subscribe(ts);

        ts.assertNoEvents();

        f.complete(1);

        ts.assertNoEvents();

        ts.request(1);

        ts.assertResult(1);
    }

    @Test
    public void everySubscriberObservesTheSameOutcome() {
        CompletableFuture<String> f = new CompletableFuture<>();
        Px<String> px = Px.fromFuture(f);

        TestSubscriber<String> ts1 = px.test();
        TestSubscriber<String> ts2 = px.test(0);

        f.complete("once");

        TestSubscriber<String> ts3 = px.test();

        ts1.assertResult("once");
        ts2.assertNoEvents();
        ts3.assertResult("once");

        ts2.request(1);
        ts2.assertResult("once");
    }

    @Test
    public void futureProducesNull() {
        TestSubscriber<Integer> ts = new TestSubscriber<>();
        CompletableFuture<Integer> f = new CompletableFuture<>();

        new PublisherCompletableFuture<>(f).subscribe(ts);

        f.complete(null);

        ts.assertNoValues()
          .assertError(NullPointerException.class)
          .assertNotComplete();
    }

    @Test
    public void futureProducesException() {
        TestSubscriber<Integer> ts = new TestSubscriber<>();
        CompletableFuture<Integer> f = new CompletableFuture<>();

        new PublisherCompletableFuture<>(f).subscribe(ts);

        f.completeExceptionally(new IOException("forced failure"));

        ts.assertNoValues()
          .assertError(IOException.class)
          .assertErrorMessage("forced failure")
          .assertNotComplete();
    }

    @Test
    public void failureOfDependentStageIsUnwrapped() {
        CompletableFuture<Integer> f = new CompletableFuture<>();
        CompletableFuture<Integer> dependent = f.thenApply(v -> v + 1);

        TestSubscriber<Integer> ts = Px.fromFuture(dependent).test();

        f.completeExceptionally(new IllegalStateException("forced failure"));

        ts.assertFailure(IllegalStateException.class);
    }

    @Test
    public void cancelDoesNotCancelTheFuture() {
        CompletableFuture<Integer> f = new CompletableFuture<>();

        TestSubscriber<Integer> ts = Px.fromFuture(f).test();

        ts.cancel();

        f.complete(1);

        Assert.assertFalse(f.isCancelled());
        ts.assertNoEvents();
    }
}
