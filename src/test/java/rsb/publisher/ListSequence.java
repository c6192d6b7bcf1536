package rsb.publisher;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;

import rsb.flow.AsyncIterator;
import rsb.flow.AsyncSequence;

/**
 * Yields the given values asynchronously, then completes or fails.
 */
final class ListSequence<T> implements AsyncSequence<T> {

    final List<T> values;

    final Throwable error;

    final AtomicInteger pulls = new AtomicInteger();

    final AtomicInteger cancellations = new AtomicInteger();

    ListSequence(List<T> values, Throwable error) {
        this.values = values;
        this.error = error;
    }

    @SafeVarargs
    static <T> ListSequence<T> of(T... values) {
        return new ListSequence<>(Arrays.asList(values), null);
    }

    @SafeVarargs
    static <T> ListSequence<T> failing(Throwable error, T... values) {
        return new ListSequence<>(Arrays.asList(values), error);
    }

    @Override
    public AsyncIterator<T> iterator() {
        AtomicInteger index = new AtomicInteger();
        return new AsyncIterator<T>() {
            @Override
            public CompletionStage<T> next() {
                pulls.incrementAndGet();
                int i = index.getAndIncrement();
                if (i < values.size()) {
                    return CompletableFuture.supplyAsync(() -> values.get(i));
                }
                if (error != null) {
                    return CompletableFuture.failedFuture(error);
                }
                return CompletableFuture.completedFuture(null);
            }

            @Override
            public void cancel() {
                cancellations.incrementAndGet();
            }
        };
    }
}
