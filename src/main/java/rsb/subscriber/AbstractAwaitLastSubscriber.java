package rsb.subscriber;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

import rsb.documentation.BackpressureMode;
import rsb.documentation.BackpressureSupport;
import rsb.flow.Disposable;
import rsb.state.Cancellable;
import rsb.util.ExceptionHelper;
import rsb.util.SubscriptionHelper;
import rsb.util.UnsignalledExceptions;

/**
 * Consumes a Publisher with unbounded demand, remembers the very last value and resumes
 * this future exactly once with a result derived from it.
 *
 * @param <T> the value type
 * @param <R> the result type
 */
@BackpressureSupport(input = BackpressureMode.UNBOUNDED, output = BackpressureMode.NOT_APPLICABLE)
public abstract class AbstractAwaitLastSubscriber<T, R> extends CompletableFuture<R>
        implements Subscriber<T>, Disposable, Cancellable {

    volatile Subscription s;
    @SuppressWarnings("rawtypes")
    static final AtomicReferenceFieldUpdater<AbstractAwaitLastSubscriber, Subscription> S =
            AtomicReferenceFieldUpdater.newUpdater(AbstractAwaitLastSubscriber.class, Subscription.class, "s");

    volatile T value;

    volatile int once;
    @SuppressWarnings("rawtypes")
    static final AtomicIntegerFieldUpdater<AbstractAwaitLastSubscriber> ONCE =
            AtomicIntegerFieldUpdater.newUpdater(AbstractAwaitLastSubscriber.class, "once");

    @Override
    public final void onSubscribe(Subscription s) {
        if (SubscriptionHelper.setOnce(S, this, s)) {
            s.request(Long.MAX_VALUE);
        }
    }

    @Override
    public final void onNext(T t) {
        if (once == 0) {
            value = t;
        } else {
            UnsignalledExceptions.onNextDropped(t);
        }
    }

    @Override
    public final void onError(Throwable t) {
        if (tryResume()) {
            value = null;
            completeExceptionally(t);
        } else {
            UnsignalledExceptions.onErrorDropped(t);
        }
    }

    @Override
    public final void onComplete() {
        if (tryResume()) {
            T v = value;
            value = null;
            resumeWith(v);
        }
    }

    /**
     * Completes this future once the source completed.
     * @param last the last value, null if the source was empty
     */
    protected abstract void resumeWith(T last);

    /**
     * Called by {@link #blockingGet()} when the waiting thread got interrupted, after the
     * subscription has been cancelled and the interrupt status restored.
     * @param ex the interruption
     * @return the result to return instead
     */
    protected abstract R onInterrupted(InterruptedException ex);

    /**
     * Claims the right to resume this future and cancels the upstream.
     * @return true if the caller is the first to resume
     */
    final boolean tryResume() {
        if (ONCE.compareAndSet(this, 0, 1)) {
            SubscriptionHelper.terminate(S, this);
            return true;
        }
        return false;
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        if (tryResume()) {
            value = null;
            return super.cancel(mayInterruptIfRunning);
        }
        return false;
    }

    @Override
    public void dispose() {
        cancel(false);
    }

    /**
     * Blocks until the source terminated.
     * @return the result
     * @throws CancellationException if this future was cancelled
     */
    public R blockingGet() {
        try {
            return get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return onInterrupted(ex);
        } catch (ExecutionException ex) {
            throw ExceptionHelper.propagate(ex.getCause());
        }
    }

    /**
     * Blocks until the source terminated or the timeout elapsed; a timeout cancels the
     * subscription and is thrown wrapped into a {@link rsb.util.ReactiveException}.
     * @param timeout the maximum time to wait
     * @param unit the unit of the timeout
     * @return the result
     */
    public R blockingGet(long timeout, TimeUnit unit) {
        try {
            return get(timeout, unit);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return onInterrupted(ex);
        } catch (ExecutionException ex) {
            throw ExceptionHelper.propagate(ex.getCause());
        } catch (TimeoutException ex) {
            dispose();
            throw ExceptionHelper.propagate(ex);
        }
    }

    static CancellationException interrupted(InterruptedException ex) {
        CancellationException c = new CancellationException("Interrupted while awaiting the last value");
        c.initCause(ex);
        return c;
    }
}
