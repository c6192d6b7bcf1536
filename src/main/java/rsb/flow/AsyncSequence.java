package rsb.flow;

/**
 * A sequence whose elements are pulled one at a time and may take a while to arrive.
 * <p>
 * Each call to {@link #iterator()} starts a fresh iteration; an iteration is driven by a
 * single consumer which never calls {@link AsyncIterator#next()} again before the previous
 * stage completed.
 *
 * @param <T> the element type
 */
@FunctionalInterface
public interface AsyncSequence<T> {

    /**
     * Starts a new iteration over this sequence.
     * @return the iterator, never null
     */
    AsyncIterator<T> iterator();
}
