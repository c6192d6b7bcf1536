package rsb.publisher;

import java.util.Objects;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;

final class PxWrapper<T> extends Px<T> {

    final Publisher<? extends T> source;

    PxWrapper(Publisher<? extends T> source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    @Override
    public void subscribe(Subscriber<? super T> s) {
        source.subscribe(s);
    }

    @Override
    public String toString() {
        return "Px[" + source + "]";
    }
}
