package rsb.flow;

import java.util.concurrent.CompletionStage;

/**
 * Pulls the elements of an {@link AsyncSequence}.
 *
 * @param <T> the element type
 */
public interface AsyncIterator<T> {

    /**
     * Asks for the next element.
     * <p>
     * The returned stage completes with the element, with {@code null} once the sequence
     * is exhausted, or exceptionally with the failure of the producer. Implementations may
     * also throw directly, which counts as a producer failure.
     *
     * @return the stage holding the next element
     */
    CompletionStage<T> next();

    /**
     * Tells the producer that no more elements will be pulled.
     * <p>
     * Must be idempotent and may be called from any thread, including while a
     * {@link #next()} stage is outstanding.
     */
    default void cancel() {
        // no resources by default
    }
}
