package rsb.stream;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * A stream of elements pushed by a producer through a {@link Continuation}; it never fails.
 * <p>
 * The stream supports a single iterating consumer. Use {@link #publisher()} to consume it as
 * a Reactive Streams {@code Publisher}.
 *
 * <pre>{@code
 * AsyncStream<Integer> stream = AsyncStream.create(c -> {
 *     c.emit(1);
 *     c.emit(2);
 *     c.complete();
 * });
 * }</pre>
 *
 * @param <T> the element type
 */
public final class AsyncStream<T> extends AbstractAsyncStream<T> {

    AsyncStream(BufferingPolicy policy) {
        super(policy);
    }

    /**
     * Creates an unbounded stream and hands its continuation to the builder right away.
     * @param <T> the element type
     * @param builder receives the continuation; it may keep it and emit later
     * @return the stream
     */
    public static <T> AsyncStream<T> create(Consumer<? super Continuation<T>> builder) {
        return create(BufferingPolicy.unbounded(), builder);
    }

    public static <T> AsyncStream<T> create(BufferingPolicy policy, Consumer<? super Continuation<T>> builder) {
        Objects.requireNonNull(builder, "builder");
        AsyncStream<T> stream = new AsyncStream<>(policy);
        builder.accept(new Continuation<>(stream));
        return stream;
    }

    @Override
    public String toString() {
        return "AsyncStream[" + policy + ", buffered=" + buffered() + ", terminated=" + isTerminated() + "]";
    }

    /**
     * The producer side of an {@link AsyncStream}. Thread-safe.
     *
     * @param <T> the element type
     */
    public static final class Continuation<T> {

        final AsyncStream<T> stream;

        Continuation(AsyncStream<T> stream) {
            this.stream = stream;
        }

        /**
         * Emits the next element.
         * @param value the element, not null
         * @return the outcome of the emission
         */
        public EmitResult emit(T value) {
            return stream.emit(value);
        }

        /**
         * Ends the stream; elements emitted before are still delivered.
         */
        public void complete() {
            stream.finish(null);
        }

        /**
         * Registers the handler called once when the stream completes or its consumer cancels.
         * @param handler the handler
         */
        public void onTermination(Consumer<? super Termination> handler) {
            stream.setOnTermination(handler);
        }

        public boolean isTerminated() {
            return stream.isTerminated();
        }
    }
}
