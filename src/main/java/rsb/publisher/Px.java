package rsb.publisher;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import org.reactivestreams.Publisher;

import rsb.flow.AsyncSequence;
import rsb.flow.Disposable;
import rsb.scheduler.Scheduler;
import rsb.scheduler.Schedulers;
import rsb.scheduler.Task;
import rsb.scheduler.TaskPriority;
import rsb.subscriber.AsyncLambdaSubscriber;
import rsb.subscriber.AwaitLastOptionalSubscriber;
import rsb.subscriber.AwaitLastSubscriber;
import rsb.subscriber.LambdaSubscriber;
import rsb.test.TestSubscriber;
import rsb.util.DemandBackoff;
import rsb.util.UnsignalledExceptions;

/**
 * Base class with fluent API: (P)ublisher E(x)tensions, bridging asynchronous sequences,
 * streams and futures to Reactive Streams and back.
 *
 * <p>
 * Use {@link #wrap(Publisher)} to wrap any Publisher.
 *
 * @param <T> the output value type
 */
public abstract class Px<T> implements Publisher<T> {

    static final Consumer<Throwable> DROP_ERROR = UnsignalledExceptions::onErrorDropped;

    static final Runnable EMPTY_RUNNABLE = () -> { };

    // ------------------------------------------------------------------------------------------------

    /**
     * Blocks until this publisher terminates and returns its last value.
     * <p>
     * A thread already interrupted at entry does not subscribe at all; an interruption
     * while waiting cancels the subscription. Both throw a {@link CancellationException}
     * with the interrupt status kept.
     *
     * @return the last value
     * @throws rsb.util.NoOutputException if the publisher completed without values
     */
    public final T await() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Interrupted before awaiting the last value");
        }
        AwaitLastSubscriber<T> subscriber = new AwaitLastSubscriber<>();
        subscribe(subscriber);
        return subscriber.blockingGet();
    }

    public final T await(long timeout, TimeUnit unit) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Interrupted before awaiting the last value");
        }
        AwaitLastSubscriber<T> subscriber = new AwaitLastSubscriber<>();
        subscribe(subscriber);
        return subscriber.blockingGet(timeout, unit);
    }

    /**
     * Blocks until this publisher terminates and returns its last value, if any.
     * <p>
     * Errors are rethrown. An interruption while waiting returns the last value received so far.
     *
     * @return the last value or empty
     */
    public final Optional<T> awaitOptional() {
        if (Thread.currentThread().isInterrupted()) {
            return Optional.empty();
        }
        AwaitLastOptionalSubscriber<T> subscriber = new AwaitLastOptionalSubscriber<>();
        subscribe(subscriber);
        return subscriber.blockingGet();
    }

    public final Optional<T> awaitOptional(long timeout, TimeUnit unit) {
        if (Thread.currentThread().isInterrupted()) {
            return Optional.empty();
        }
        AwaitLastOptionalSubscriber<T> subscriber = new AwaitLastOptionalSubscriber<>();
        subscribe(subscriber);
        return subscriber.blockingGet(timeout, unit);
    }

    /**
     * Subscribes and returns a future completing with the last value; cancelling the future
     * cancels the subscription.
     * @return the future
     */
    public final CompletableFuture<T> toCompletableFuture() {
        AwaitLastSubscriber<T> subscriber = new AwaitLastSubscriber<>();
        subscribe(subscriber);
        return subscriber;
    }

    public final CompletableFuture<Optional<T>> toOptionalFuture() {
        AwaitLastOptionalSubscriber<T> subscriber = new AwaitLastOptionalSubscriber<>();
        subscribe(subscriber);
        return subscriber;
    }

    // ------------------------------------------------------------------------------------------------

    public final Disposable subscribe(Consumer<? super T> onNext) {
        return subscribe(onNext, DROP_ERROR, EMPTY_RUNNABLE);
    }

    public final Disposable subscribe(Consumer<? super T> onNext, Consumer<Throwable> onError) {
        return subscribe(onNext, onError, EMPTY_RUNNABLE);
    }

    public final Disposable subscribe(Consumer<? super T> onNext, Consumer<Throwable> onError, Runnable onComplete) {
        LambdaSubscriber<T> s = new LambdaSubscriber<>(onNext, onError, onComplete);
        subscribe(s);
        return s;
    }

    /**
     * Subscribes with unbounded demand and runs every callback as a separate task on the
     * shared {@link TaskPriority#MEDIUM} scheduler.
     * @param onNext called with each value
     * @return the Disposable cancelling the subscription
     */
    public final Disposable subscribeAsync(Consumer<? super T> onNext) {
        return subscribeAsync(TaskPriority.MEDIUM, onNext, DROP_ERROR, EMPTY_RUNNABLE);
    }

    public final Disposable subscribeAsync(Consumer<? super T> onNext, Consumer<Throwable> onError, Runnable onComplete) {
        return subscribeAsync(TaskPriority.MEDIUM, onNext, onError, onComplete);
    }

    public final Disposable subscribeAsync(TaskPriority priority, Consumer<? super T> onNext,
            Consumer<Throwable> onError, Runnable onComplete) {
        return subscribeAsync(Schedulers.forPriority(priority), onNext, onError, onComplete);
    }

    public final Disposable subscribeAsync(Scheduler scheduler, Consumer<? super T> onNext,
            Consumer<Throwable> onError, Runnable onComplete) {
        AsyncLambdaSubscriber<T> s = new AsyncLambdaSubscriber<>(scheduler, onNext, onError, onComplete);
        subscribe(s);
        return s;
    }

    public TestSubscriber<T> test() {
        TestSubscriber<T> ts = new TestSubscriber<>();
        subscribe(ts);
        return ts;
    }

    public TestSubscriber<T> test(long initialRequest) {
        TestSubscriber<T> ts = new TestSubscriber<>(initialRequest);
        subscribe(ts);
        return ts;
    }

    // ---------------------------------------------------------------------------------------

    @SuppressWarnings("unchecked")
    public static <T> Px<T> wrap(Publisher<? extends T> source) {
        if (source instanceof Px) {
            return (Px<T>) source;
        }
        return new PxWrapper<>(source);
    }

    /**
     * Pulls the sequence one element at a time on the shared background scheduler, polling
     * for demand with {@link DemandBackoff#DEFAULT}.
     * @param <T> the value type
     * @param sequence the sequence to emit
     * @return the publisher
     */
    public static <T> Px<T> fromSequence(AsyncSequence<? extends T> sequence) {
        return fromSequence(sequence, Schedulers.background(), DemandBackoff.DEFAULT);
    }

    public static <T> Px<T> fromSequence(AsyncSequence<? extends T> sequence, Scheduler scheduler, DemandBackoff backoff) {
        return new PublisherAsyncSequence<>(sequence, scheduler, backoff);
    }

    /**
     * Consumes a push-style source at the pace of its producer on the shared background
     * scheduler, buffering what has not been requested yet.
     * @param <T> the value type
     * @param stream the source to emit
     * @return the publisher
     */
    public static <T> Px<T> fromStream(AsyncSequence<? extends T> stream) {
        return fromStream(stream, Schedulers.background());
    }

    public static <T> Px<T> fromStream(AsyncSequence<? extends T> stream, Scheduler scheduler) {
        return new PublisherAsyncStream<>(stream, scheduler);
    }

    public static <T> Px<T> fromFuture(CompletableFuture<? extends T> future) {
        return new PublisherCompletableFuture<>(future);
    }

    public static <T> Px<T> fromTask(Task<? extends T> task) {
        Objects.requireNonNull(task, "task");
        return fromFuture(task.future());
    }

    /**
     * Launches the callable right away on the shared {@link TaskPriority#MEDIUM} scheduler and
     * emits its result to every Subscriber.
     * @param <T> the value type
     * @param callable the computation
     * @return the publisher
     */
    public static <T> Px<T> fromCallable(Callable<? extends T> callable) {
        return fromTask(Task.run(callable));
    }

    public static <T> Px<T> fromCallable(TaskPriority priority, Callable<? extends T> callable) {
        return fromTask(Task.run(priority, callable));
    }
}
