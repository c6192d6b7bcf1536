package rsb.publisher;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.reactivestreams.Subscriber;

import rsb.documentation.BackpressureMode;
import rsb.documentation.BackpressureSupport;
import rsb.subscriber.DeferredScalarSubscription;
import rsb.util.ExceptionHelper;

/**
 * Emits the value or error produced by the wrapped CompletableFuture.
 * <p>
 * Every Subscriber observes the same outcome; the value is emitted only once requested.
 * Note that if Subscribers cancel their subscriptions, the CompletableFuture
 * is not cancelled.
 *
 * @param <T> the value type
 */
@BackpressureSupport(input = BackpressureMode.NOT_APPLICABLE, output = BackpressureMode.BOUNDED)
public final class PublisherCompletableFuture<T> extends Px<T> {

    final CompletableFuture<? extends T> future;

    public PublisherCompletableFuture(CompletableFuture<? extends T> future) {
        this.future = Objects.requireNonNull(future, "future");
    }

    @Override
    public void subscribe(Subscriber<? super T> s) {
        DeferredScalarSubscription<T> sds = new DeferredScalarSubscription<>(s);

        s.onSubscribe(sds);

        if (sds.isCancelled()) {
            return;
        }

        future.whenComplete((v, e) -> {
            if (e != null) {
                sds.error(ExceptionHelper.unwrap(e));
            } else if (v != null) {
                sds.complete(v);
            } else {
                sds.error(new NullPointerException("The future produced a null value"));
            }
        });
    }
}
