package rsb.publisher;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rsb.documentation.BackpressureMode;
import rsb.documentation.BackpressureSupport;
import rsb.flow.AsyncIterator;
import rsb.flow.AsyncSequence;
import rsb.flow.Disposable;
import rsb.scheduler.Scheduler;
import rsb.state.Cancellable;
import rsb.state.Completable;
import rsb.state.Requestable;
import rsb.util.DemandBackoff;
import rsb.util.DemandTracker;
import rsb.util.ExceptionHelper;
import rsb.util.SubscriptionHelper;
import rsb.util.UnsignalledExceptions;

/**
 * Emits the elements of an {@link AsyncSequence}, pulling the next element only after the
 * previous one was delivered.
 * <p>
 * Each Subscriber gets its own iteration, driven by a task on the given {@link Scheduler}.
 * When an element arrives while the Subscriber has no outstanding demand, the task polls
 * for demand following the {@link DemandBackoff}; once the backoff is exhausted the element
 * is dropped and the iteration stops without a terminal signal.
 *
 * @param <T> the value type
 */
@BackpressureSupport(input = BackpressureMode.NOT_APPLICABLE, output = BackpressureMode.BOUNDED)
public final class PublisherAsyncSequence<T> extends Px<T> {

    static final Logger LOGGER = LoggerFactory.getLogger(PublisherAsyncSequence.class);

    final AsyncSequence<? extends T> source;

    final Scheduler scheduler;

    final DemandBackoff backoff;

    public PublisherAsyncSequence(AsyncSequence<? extends T> source, Scheduler scheduler, DemandBackoff backoff) {
        this.source = Objects.requireNonNull(source, "source");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
    }

    @Override
    public void subscribe(Subscriber<? super T> s) {
        AsyncIterator<? extends T> it;

        try {
            it = Objects.requireNonNull(source.iterator(), "The source returned a null iterator");
        } catch (Throwable e) {
            ExceptionHelper.throwIfFatal(e);
            SubscriptionHelper.error(s, e);
            return;
        }

        AsyncSequenceSubscription<T> parent = new AsyncSequenceSubscription<>(s, it, backoff);

        s.onSubscribe(parent);

        if (!parent.cancelled) {
            parent.start(scheduler);
        }
    }

    static final class AsyncSequenceSubscription<T>
            implements Subscription, Runnable, Cancellable, Completable, Requestable {

        final AsyncIterator<? extends T> iterator;

        final DemandBackoff backoff;

        /** Holds the demand; its monitor also guards {@link #actual}. */
        final DemandTracker demand;

        Subscriber<? super T> actual;

        volatile boolean cancelled;

        volatile boolean started;

        volatile boolean done;

        volatile Disposable task;
        @SuppressWarnings("rawtypes")
        static final AtomicReferenceFieldUpdater<AsyncSequenceSubscription, Disposable> TASK =
                AtomicReferenceFieldUpdater.newUpdater(AsyncSequenceSubscription.class, Disposable.class, "task");

        static final Disposable DISPOSED = () -> { };

        AsyncSequenceSubscription(Subscriber<? super T> actual, AsyncIterator<? extends T> iterator,
                DemandBackoff backoff) {
            this.actual = actual;
            this.iterator = iterator;
            this.backoff = backoff;
            this.demand = new DemandTracker();
        }

        void start(Scheduler scheduler) {
            started = true;
            Disposable d = scheduler.schedule(this);
            if (d == Scheduler.REJECTED) {
                cancelIterator();
                error(new RejectedExecutionException("Scheduler rejected the iteration: " + scheduler));
                return;
            }
            if (!TASK.compareAndSet(this, null, d)) {
                d.dispose();
            }
        }

        @Override
        public void request(long n) {
            if (SubscriptionHelper.validate(n)) {
                demand.increment(n);
            }
        }

        @Override
        public void cancel() {
            if (cancelled) {
                return;
            }
            cancelled = true;
            LOGGER.trace("Iteration cancelled");
            Disposable d = TASK.getAndSet(this, DISPOSED);
            if (d != null && d != DISPOSED) {
                d.dispose();
            }
            cancelIterator();
            synchronized (demand) {
                actual = null;
            }
        }

        @Override
        public void run() {
            try {
                drive();
            } catch (InterruptedException ex) {
                if (cancelled) {
                    LOGGER.trace("Iteration interrupted after cancellation");
                } else {
                    Thread.currentThread().interrupt();
                    cancelIterator();
                    error(ex);
                }
            }
        }

        void drive() throws InterruptedException {
            for (;;) {
                if (cancelled) {
                    return;
                }

                T v;

                try {
                    v = iterator.next().toCompletableFuture().get();
                } catch (InterruptedException ex) {
                    throw ex;
                } catch (Throwable ex) {
                    ExceptionHelper.throwIfFatal(ex);
                    if (!cancelled) {
                        error(ExceptionHelper.unwrap(ex));
                    }
                    return;
                }

                if (cancelled) {
                    return;
                }

                if (v == null) {
                    complete();
                    return;
                }

                if (!awaitDemand()) {
                    if (!cancelled) {
                        abandon(v);
                    }
                    return;
                }

                Subscriber<? super T> a;
                synchronized (demand) {
                    a = actual;
                }
                if (a == null) {
                    return;
                }
                try {
                    a.onNext(v);
                } catch (Throwable ex) {
                    ExceptionHelper.throwIfFatal(ex);
                    UnsignalledExceptions.onErrorDropped(ex);
                    cancel();
                    return;
                }
            }
        }

        boolean awaitDemand() throws InterruptedException {
            if (demand.tryConsumeOne()) {
                return true;
            }
            long delay = backoff.minDelayNanos();
            for (int i = 0; i < backoff.maxRetries(); i++) {
                if (cancelled) {
                    return false;
                }
                TimeUnit.NANOSECONDS.sleep(delay);
                if (demand.tryConsumeOne()) {
                    return true;
                }
                delay = backoff.nextDelayNanos(delay);
            }
            return false;
        }

        void abandon(T v) {
            LOGGER.warn("No demand within {}, dropping {} and stopping the iteration", backoff, v);
            UnsignalledExceptions.onNextDropped(v);
            done = true;
            cancelIterator();
            synchronized (demand) {
                actual = null;
            }
        }

        void complete() {
            Subscriber<? super T> a;
            synchronized (demand) {
                a = actual;
                actual = null;
            }
            if (a != null) {
                done = true;
                a.onComplete();
            }
        }

        void error(Throwable e) {
            Subscriber<? super T> a;
            synchronized (demand) {
                a = actual;
                actual = null;
            }
            if (a != null) {
                done = true;
                a.onError(e);
            } else {
                UnsignalledExceptions.onErrorDropped(e);
            }
        }

        void cancelIterator() {
            try {
                iterator.cancel();
            } catch (Throwable e) {
                ExceptionHelper.throwIfFatal(e);
                UnsignalledExceptions.onErrorDropped(e);
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isStarted() {
            return started;
        }

        @Override
        public boolean isTerminated() {
            return done;
        }

        @Override
        public long requestedFromDownstream() {
            return demand.get();
        }
    }
}
