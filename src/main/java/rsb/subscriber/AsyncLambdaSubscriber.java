package rsb.subscriber;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;
import java.util.function.Consumer;

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rsb.flow.Disposable;
import rsb.scheduler.Scheduler;
import rsb.util.ExceptionHelper;
import rsb.util.SubscriptionHelper;
import rsb.util.UnsignalledExceptions;

/**
 * A subscriber that runs each callback as its own task on a {@link Scheduler}.
 * <p>
 * Callback bodies of different signals are not ordered with respect to each other;
 * exceptions they throw are routed to {@link UnsignalledExceptions}.
 *
 * @param <T> the value type
 */
public final class AsyncLambdaSubscriber<T> implements Subscriber<T>, Disposable {

    static final Logger LOGGER = LoggerFactory.getLogger(AsyncLambdaSubscriber.class);

    final Scheduler scheduler;

    final Consumer<? super T> onNextCall;

    final Consumer<Throwable> onErrorCall;

    final Runnable onCompleteCall;

    volatile Subscription s;
    @SuppressWarnings("rawtypes")
    static final AtomicReferenceFieldUpdater<AsyncLambdaSubscriber, Subscription> S =
            AtomicReferenceFieldUpdater.newUpdater(AsyncLambdaSubscriber.class, Subscription.class, "s");

    boolean done;

    public AsyncLambdaSubscriber(Scheduler scheduler, Consumer<? super T> onNextCall,
            Consumer<Throwable> onErrorCall, Runnable onCompleteCall) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.onNextCall = Objects.requireNonNull(onNextCall, "onNextCall");
        this.onErrorCall = Objects.requireNonNull(onErrorCall, "onErrorCall");
        this.onCompleteCall = Objects.requireNonNull(onCompleteCall, "onCompleteCall");
    }

    @Override
    public void dispose() {
        SubscriptionHelper.terminate(S, this);
    }

    public boolean isDisposed() {
        return s == SubscriptionHelper.cancelled();
    }

    @Override
    public void onSubscribe(Subscription s) {
        if (SubscriptionHelper.setOnce(S, this, s)) {
            s.request(Long.MAX_VALUE);
        }
    }

    @Override
    public void onNext(T t) {
        if (done) {
            UnsignalledExceptions.onNextDropped(t);
            return;
        }
        dispatch(() -> onNextCall.accept(t));
    }

    @Override
    public void onError(Throwable t) {
        if (done) {
            UnsignalledExceptions.onErrorDropped(t);
            return;
        }
        done = true;
        dispatch(() -> onErrorCall.accept(t));
    }

    @Override
    public void onComplete() {
        if (done) {
            return;
        }
        done = true;
        dispatch(onCompleteCall);
    }

    void dispatch(Runnable callback) {
        Disposable d = scheduler.schedule(() -> {
            try {
                callback.run();
            } catch (Throwable e) {
                ExceptionHelper.throwIfFatal(e);
                UnsignalledExceptions.onErrorDropped(e);
            }
        });
        if (d == Scheduler.REJECTED) {
            LOGGER.warn("Scheduler {} rejected a callback, cancelling the subscription", scheduler);
            dispose();
        }
    }
}
