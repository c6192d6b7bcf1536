package rsb.util;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

import rsb.state.Cancellable;

/**
 * Utility methods to help working with Subscriptions and their methods.
 */
public enum SubscriptionHelper {
    ;

    /**
     * Calls onSubscribe on the target Subscriber with the empty instance followed by a call to onError with the
     * supplied error.
     *
     * @param s the target subscriber
     * @param e the error to signal
     */
    public static void error(Subscriber<?> s, Throwable e) {
        s.onSubscribe(empty());
        s.onError(e);
    }

    /**
     * A singleton no-op Subscription that can be freely given out to clients.
     *
     * @return a singleton noop {@link Subscription}
     */
    public static Subscription empty() {
        return EmptySubscription.INSTANCE;
    }

    /**
     * A singleton Subscription that represents a cancelled subscription instance and should not be leaked to
     * clients as it represents a terminal state.
     *
     * @return a singleton noop {@link Subscription}
     */
    public static Subscription cancelled() {
        return CancelledSubscription.INSTANCE;
    }

    public static void reportSubscriptionSet() {
        UnsignalledExceptions.onErrorDropped(new IllegalStateException("Subscription already set"));
    }

    public static void reportBadRequest(long n) {
        UnsignalledExceptions.onErrorDropped(new IllegalArgumentException("request amount > 0 required but it was " + n));
    }

    /**
     * Validates a request amount, reporting non-positive amounts to {@link UnsignalledExceptions}.
     *
     * @param n the request amount
     * @return true if the amount is valid
     */
    public static boolean validate(long n) {
        if (n <= 0L) {
            reportBadRequest(n);
            return false;
        }
        return true;
    }

    /**
     * Atomically swaps in the single CancelledSubscription instance and returns true
     * if this was the first of such operation on the target field.
     * @param <F> the field type
     * @param field the field accessor
     * @param instance the parent instance of the field
     * @return true if the call triggered the cancellation of the underlying Subscription instance
     */
    public static <F> boolean terminate(AtomicReferenceFieldUpdater<F, Subscription> field, F instance) {
        Subscription a = field.get(instance);
        if (a != CancelledSubscription.INSTANCE) {
            a = field.getAndSet(instance, CancelledSubscription.INSTANCE);
            if (a != null && a != CancelledSubscription.INSTANCE) {
                a.cancel();
                return true;
            }
        }
        return false;
    }

    /**
     * Sets the given subscription once and returns true if successful, false
     * if the field has a subscription already or has been cancelled.
     * @param <F> the instance type containing the field
     * @param field the field accessor
     * @param instance the parent instance
     * @param s the subscription to set once
     * @return true if successful, false if the target was not empty or has been cancelled
     */
    public static <F> boolean setOnce(AtomicReferenceFieldUpdater<F, Subscription> field, F instance, Subscription s) {
        Objects.requireNonNull(s, "s");
        Subscription a = field.get(instance);
        if (a == CancelledSubscription.INSTANCE) {
            s.cancel();
            return false;
        }
        if (a != null) {
            s.cancel();
            reportSubscriptionSet();
            return false;
        }

        if (field.compareAndSet(instance, null, s)) {
            return true;
        }

        a = field.get(instance);

        s.cancel();
        if (a != CancelledSubscription.INSTANCE) {
            reportSubscriptionSet();
        }
        return false;
    }

    enum EmptySubscription implements Subscription {
        INSTANCE;

        @Override
        public void request(long n) {
            // deliberately no op
        }

        @Override
        public void cancel() {
            // deliberately no op
        }
    }

    enum CancelledSubscription implements Subscription, Cancellable {
        INSTANCE;

        @Override
        public boolean isCancelled() {
            return true;
        }

        @Override
        public void request(long n) {
            // deliberately no op
        }

        @Override
        public void cancel() {
            // deliberately no op
        }
    }
}
