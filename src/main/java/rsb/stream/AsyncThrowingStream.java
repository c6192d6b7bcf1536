package rsb.stream;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * A stream of elements pushed by a producer through a {@link Continuation}, which may end
 * with a failure.
 * <p>
 * The failure reaches the consumer after the elements buffered before it.
 *
 * @param <T> the element type
 */
public final class AsyncThrowingStream<T> extends AbstractAsyncStream<T> {

    AsyncThrowingStream(BufferingPolicy policy) {
        super(policy);
    }

    public static <T> AsyncThrowingStream<T> create(Consumer<? super Continuation<T>> builder) {
        return create(BufferingPolicy.unbounded(), builder);
    }

    public static <T> AsyncThrowingStream<T> create(BufferingPolicy policy, Consumer<? super Continuation<T>> builder) {
        Objects.requireNonNull(builder, "builder");
        AsyncThrowingStream<T> stream = new AsyncThrowingStream<>(policy);
        builder.accept(new Continuation<>(stream));
        return stream;
    }

    @Override
    public String toString() {
        return "AsyncThrowingStream[" + policy + ", buffered=" + buffered() + ", terminated=" + isTerminated() + "]";
    }

    /**
     * The producer side of an {@link AsyncThrowingStream}. Thread-safe.
     *
     * @param <T> the element type
     */
    public static final class Continuation<T> {

        final AsyncThrowingStream<T> stream;

        Continuation(AsyncThrowingStream<T> stream) {
            this.stream = stream;
        }

        public EmitResult emit(T value) {
            return stream.emit(value);
        }

        public void complete() {
            stream.finish(null);
        }

        /**
         * Ends the stream with a failure delivered after the already buffered elements.
         * @param error the failure, not null
         */
        public void error(Throwable error) {
            stream.finish(Objects.requireNonNull(error, "error"));
        }

        public void onTermination(Consumer<? super Termination> handler) {
            stream.setOnTermination(handler);
        }

        public boolean isTerminated() {
            return stream.isTerminated();
        }
    }
}
