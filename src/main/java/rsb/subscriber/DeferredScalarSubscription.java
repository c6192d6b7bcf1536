package rsb.subscriber;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

import rsb.state.Cancellable;
import rsb.state.Completable;
import rsb.util.SubscriptionHelper;

/**
 * Emits a single value, available at some later point, once the Subscriber requested it.
 * <p>
 * {@link #complete(Object)} and {@link #error(Throwable)} may race with {@link #request(long)}
 * and {@link #cancel()}; the Subscriber receives at most one terminal signal.
 *
 * @param <T> the value type
 */
public final class DeferredScalarSubscription<T> implements Subscription, Cancellable, Completable {

    final Subscriber<? super T> actual;

    T value;

    volatile int state;
    @SuppressWarnings("rawtypes")
    static final AtomicIntegerFieldUpdater<DeferredScalarSubscription> STATE =
            AtomicIntegerFieldUpdater.newUpdater(DeferredScalarSubscription.class, "state");

    static final int NO_VALUE_NO_REQUEST = 0;
    static final int HAS_VALUE_NO_REQUEST = 1;
    static final int NO_VALUE_HAS_REQUEST = 2;
    static final int HAS_VALUE_HAS_REQUEST = 3;
    static final int CANCELLED = 4;

    public DeferredScalarSubscription(Subscriber<? super T> actual) {
        this.actual = Objects.requireNonNull(actual, "actual");
    }

    /**
     * Emits the value followed by onComplete, right away if requested, otherwise on the first request.
     * @param v the value, not null
     */
    public void complete(T v) {
        Objects.requireNonNull(v, "v");
        for (;;) {
            int s = state;
            if (s == HAS_VALUE_NO_REQUEST || s == HAS_VALUE_HAS_REQUEST || s == CANCELLED) {
                return;
            }
            if (s == NO_VALUE_HAS_REQUEST) {
                if (STATE.compareAndSet(this, NO_VALUE_HAS_REQUEST, HAS_VALUE_HAS_REQUEST)) {
                    Subscriber<? super T> a = actual;
                    a.onNext(v);
                    if (state != CANCELLED) {
                        a.onComplete();
                    }
                }
                return;
            }
            value = v;
            if (STATE.compareAndSet(this, NO_VALUE_NO_REQUEST, HAS_VALUE_NO_REQUEST)) {
                return;
            }
        }
    }

    /**
     * Signals the error unless a value was already set or the Subscriber cancelled.
     * @param e the error
     */
    public void error(Throwable e) {
        for (;;) {
            int s = state;
            if (s == HAS_VALUE_NO_REQUEST || s == HAS_VALUE_HAS_REQUEST || s == CANCELLED) {
                return;
            }
            if (STATE.compareAndSet(this, s, HAS_VALUE_HAS_REQUEST)) {
                actual.onError(e);
                return;
            }
        }
    }

    @Override
    public void request(long n) {
        if (SubscriptionHelper.validate(n)) {
            for (;;) {
                int s = state;
                if (s != NO_VALUE_NO_REQUEST && s != HAS_VALUE_NO_REQUEST) {
                    return;
                }
                if (s == HAS_VALUE_NO_REQUEST) {
                    if (STATE.compareAndSet(this, HAS_VALUE_NO_REQUEST, HAS_VALUE_HAS_REQUEST)) {
                        T v = value;
                        value = null;
                        Subscriber<? super T> a = actual;
                        a.onNext(v);
                        if (state != CANCELLED) {
                            a.onComplete();
                        }
                    }
                    return;
                }
                if (STATE.compareAndSet(this, NO_VALUE_NO_REQUEST, NO_VALUE_HAS_REQUEST)) {
                    return;
                }
            }
        }
    }

    @Override
    public void cancel() {
        state = CANCELLED;
    }

    @Override
    public boolean isCancelled() {
        return state == CANCELLED;
    }

    @Override
    public boolean isStarted() {
        return true;
    }

    @Override
    public boolean isTerminated() {
        return state == HAS_VALUE_HAS_REQUEST;
    }
}
