package rsb.stream;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

import rsb.flow.AsyncIterator;
import rsb.flow.AsyncSequence;
import rsb.publisher.Px;
import rsb.util.ExceptionHelper;
import rsb.util.UnsignalledExceptions;

/**
 * Single-consumer buffer between a producer emitting at its own pace and one iterating consumer.
 * <p>
 * Elements emitted while the consumer waits are handed over directly, the others are buffered
 * according to the {@link BufferingPolicy}. Buffered elements are still delivered after the
 * producer terminated the stream.
 *
 * @param <T> the element type
 */
abstract class AbstractAsyncStream<T> implements AsyncSequence<T> {

    final BufferingPolicy policy;

    final ArrayDeque<T> buffer;

    /** The stage handed to the consumer while it waits for an element. */
    CompletableFuture<T> pending;

    boolean done;

    /** How the stream ended, once {@link #done} is set. */
    Termination termination;

    Throwable error;

    boolean iterating;

    Consumer<? super Termination> onTermination;

    AbstractAsyncStream(BufferingPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.buffer = new ArrayDeque<>();
    }

    /**
     * Starts the only iteration this stream supports.
     * @return the iterator
     * @throws IllegalStateException if the stream is iterated already
     */
    @Override
    public AsyncIterator<T> iterator() {
        synchronized (this) {
            if (iterating) {
                throw new IllegalStateException("This stream allows only a single consumer");
            }
            iterating = true;
        }
        return new StreamIterator();
    }

    /**
     * Returns a publisher that consumes this stream at the pace of the producer and
     * buffers the elements its subscriber has not requested yet.
     * @return the publisher
     */
    public Px<T> publisher() {
        return Px.fromStream(this);
    }

    EmitResult emit(T value) {
        Objects.requireNonNull(value, "value");
        CompletableFuture<T> p;
        EmitResult result = EmitResult.ENQUEUED;
        synchronized (this) {
            if (done) {
                return EmitResult.TERMINATED;
            }
            p = pending;
            if (p != null) {
                pending = null;
            } else if (buffer.size() < policy.limit) {
                buffer.offer(value);
            } else if (policy.keepNewest && policy.limit != 0) {
                buffer.poll();
                buffer.offer(value);
                result = EmitResult.DROPPED;
            } else {
                result = EmitResult.DROPPED;
            }
        }
        if (p != null) {
            p.complete(value);
        }
        return result;
    }

    void finish(Throwable e) {
        CompletableFuture<T> p;
        synchronized (this) {
            if (done) {
                return;
            }
            done = true;
            termination = Termination.FINISHED;
            p = pending;
            pending = null;
            if (p == null) {
                error = e;
            }
        }
        if (p != null) {
            if (e != null) {
                p.completeExceptionally(e);
            } else {
                p.complete(null);
            }
        }
        terminated(Termination.FINISHED);
    }

    void cancelIteration() {
        CompletableFuture<T> p;
        synchronized (this) {
            buffer.clear();
            error = null;
            if (done) {
                return;
            }
            done = true;
            termination = Termination.CANCELLED;
            p = pending;
            pending = null;
        }
        if (p != null) {
            p.complete(null);
        }
        terminated(Termination.CANCELLED);
    }

    void setOnTermination(Consumer<? super Termination> handler) {
        Objects.requireNonNull(handler, "handler");
        Termination reason;
        synchronized (this) {
            reason = termination;
            if (reason == null) {
                onTermination = handler;
            }
        }
        if (reason != null) {
            invoke(handler, reason);
        }
    }

    void terminated(Termination reason) {
        Consumer<? super Termination> h;
        synchronized (this) {
            h = onTermination;
            onTermination = null;
        }
        if (h != null) {
            invoke(h, reason);
        }
    }

    static void invoke(Consumer<? super Termination> handler, Termination reason) {
        try {
            handler.accept(reason);
        } catch (Throwable ex) {
            ExceptionHelper.throwIfFatal(ex);
            UnsignalledExceptions.onErrorDropped(ex);
        }
    }

    synchronized int buffered() {
        return buffer.size();
    }

    synchronized boolean isTerminated() {
        return done;
    }

    final class StreamIterator implements AsyncIterator<T> {

        @Override
        public CompletionStage<T> next() {
            synchronized (AbstractAsyncStream.this) {
                T v = buffer.poll();
                if (v != null) {
                    return CompletableFuture.completedFuture(v);
                }
                if (done) {
                    Throwable e = error;
                    if (e != null) {
                        error = null;
                        return CompletableFuture.failedFuture(e);
                    }
                    return CompletableFuture.completedFuture(null);
                }
                if (pending != null) {
                    return CompletableFuture.failedFuture(
                            new IllegalStateException("next() called before the previous element arrived"));
                }
                CompletableFuture<T> p = new CompletableFuture<>();
                pending = p;
                return p;
            }
        }

        @Override
        public void cancel() {
            cancelIteration();
        }
    }
}
