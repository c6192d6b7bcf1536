package rsb.publisher;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
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
import rsb.state.Backpressurable;
import rsb.state.Cancellable;
import rsb.state.Completable;
import rsb.state.Requestable;
import rsb.util.DemandTracker;
import rsb.util.ExceptionHelper;
import rsb.util.SubscriptionHelper;
import rsb.util.UnsignalledExceptions;

/**
 * Emits the elements of a push-style source, such as an {@link rsb.stream.AsyncStream},
 * consuming it at the pace of its producer.
 * <p>
 * Elements arriving without outstanding demand are kept in an unbounded buffer and
 * emitted once requested. When the source terminates, buffered elements are emitted
 * as far as the current demand allows, the rest are discarded and the terminal
 * signal is delivered right away.
 *
 * @param <T> the value type
 */
@BackpressureSupport(input = BackpressureMode.NONE, output = BackpressureMode.BOUNDED)
public final class PublisherAsyncStream<T> extends Px<T> {

    static final Logger LOGGER = LoggerFactory.getLogger(PublisherAsyncStream.class);

    final AsyncSequence<? extends T> source;

    final Scheduler scheduler;

    public PublisherAsyncStream(AsyncSequence<? extends T> source, Scheduler scheduler) {
        this.source = Objects.requireNonNull(source, "source");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
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

        AsyncStreamSubscription<T> parent = new AsyncStreamSubscription<>(s, it);

        s.onSubscribe(parent);

        if (!parent.cancelled) {
            parent.start(scheduler);
        }
    }

    /**
     * One outcome of the source: an element, a failure or the completion.
     *
     * @param <T> the value type
     */
    static final class StreamResult<T> {

        enum Kind { NEXT, ERROR, COMPLETE }

        static final StreamResult<Object> COMPLETE = new StreamResult<>(Kind.COMPLETE, null, null);

        final Kind kind;

        final T value;

        final Throwable error;

        StreamResult(Kind kind, T value, Throwable error) {
            this.kind = kind;
            this.value = value;
            this.error = error;
        }

        static <T> StreamResult<T> next(T value) {
            return new StreamResult<>(Kind.NEXT, value, null);
        }

        static <T> StreamResult<T> error(Throwable error) {
            return new StreamResult<>(Kind.ERROR, null, error);
        }

        @SuppressWarnings("unchecked")
        static <T> StreamResult<T> complete() {
            return (StreamResult<T>) COMPLETE;
        }
    }

    static final class AsyncStreamSubscription<T>
            implements Subscription, Runnable, Cancellable, Completable, Requestable, Backpressurable {

        final AsyncIterator<? extends T> iterator;

        /** Holds the demand; its monitor also guards the fields below up to {@link #emitting}. */
        final DemandTracker demand;

        final ArrayDeque<T> queue;

        Subscriber<? super T> actual;

        boolean done;

        Throwable error;

        boolean emitting;

        volatile boolean cancelled;

        volatile boolean started;

        volatile boolean terminated;

        volatile Disposable task;
        @SuppressWarnings("rawtypes")
        static final AtomicReferenceFieldUpdater<AsyncStreamSubscription, Disposable> TASK =
                AtomicReferenceFieldUpdater.newUpdater(AsyncStreamSubscription.class, Disposable.class, "task");

        static final Disposable DISPOSED = () -> { };

        AsyncStreamSubscription(Subscriber<? super T> actual, AsyncIterator<? extends T> iterator) {
            this.actual = actual;
            this.iterator = iterator;
            this.demand = new DemandTracker();
            this.queue = new ArrayDeque<>();
        }

        void start(Scheduler scheduler) {
            started = true;
            Disposable d = scheduler.schedule(this);
            if (d == Scheduler.REJECTED) {
                cancelIterator();
                onResult(StreamResult.error(new RejectedExecutionException("Scheduler rejected the iteration: " + scheduler)));
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
                drain();
            }
        }

        @Override
        public void cancel() {
            if (cancelled) {
                return;
            }
            cancelled = true;
            LOGGER.trace("Stream consumption cancelled");
            Disposable d = TASK.getAndSet(this, DISPOSED);
            if (d != null && d != DISPOSED) {
                d.dispose();
            }
            cancelIterator();
            synchronized (demand) {
                actual = null;
                queue.clear();
                error = null;
            }
        }

        @Override
        public void run() {
            try {
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
                        onResult(StreamResult.error(ExceptionHelper.unwrap(ex)));
                        return;
                    }

                    if (v == null) {
                        onResult(StreamResult.complete());
                        return;
                    }

                    onResult(StreamResult.next(v));
                }
            } catch (InterruptedException ex) {
                if (cancelled) {
                    LOGGER.trace("Stream consumption interrupted after cancellation");
                } else {
                    Thread.currentThread().interrupt();
                    cancelIterator();
                    onResult(StreamResult.error(ex));
                }
            }
        }

        void onResult(StreamResult<T> result) {
            synchronized (demand) {
                if (cancelled || done) {
                    if (result.kind == StreamResult.Kind.ERROR) {
                        UnsignalledExceptions.onErrorDropped(result.error);
                    }
                    return;
                }
                switch (result.kind) {
                    case NEXT:
                        queue.offer(result.value);
                        break;
                    case ERROR:
                        error = result.error;
                        done = true;
                        break;
                    default:
                        done = true;
                        break;
                }
            }
            drain();
        }

        void drain() {
            synchronized (demand) {
                if (emitting) {
                    return;
                }
                emitting = true;
            }

            for (;;) {
                Subscriber<? super T> a;
                T v = null;
                Throwable e = null;
                boolean terminal = false;

                synchronized (demand) {
                    a = actual;
                    if (a == null) {
                        emitting = false;
                        return;
                    }
                    if (!queue.isEmpty() && demand.tryConsumeOne()) {
                        v = queue.poll();
                    } else if (done) {
                        terminal = true;
                        e = error;
                        error = null;
                        actual = null;
                        queue.clear();
                        emitting = false;
                    } else {
                        emitting = false;
                        return;
                    }
                }

                if (terminal) {
                    terminated = true;
                    if (e != null) {
                        a.onError(e);
                    } else {
                        a.onComplete();
                    }
                    return;
                }

                try {
                    a.onNext(v);
                } catch (Throwable ex) {
                    ExceptionHelper.throwIfFatal(ex);
                    UnsignalledExceptions.onErrorDropped(ex);
                    cancel();
                    synchronized (demand) {
                        emitting = false;
                    }
                    return;
                }
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
            return terminated;
        }

        @Override
        public long requestedFromDownstream() {
            return demand.get();
        }

        @Override
        public long getCapacity() {
            return Long.MAX_VALUE;
        }

        @Override
        public long getPending() {
            synchronized (demand) {
                return queue.size();
            }
        }
    }
}
