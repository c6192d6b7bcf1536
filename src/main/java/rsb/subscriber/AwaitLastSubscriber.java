package rsb.subscriber;

import rsb.util.NoOutputException;

/**
 * Resumes with the last value of the source, with its error, or with a
 * {@link NoOutputException} if it completed empty.
 *
 * @param <T> the value type
 */
public final class AwaitLastSubscriber<T> extends AbstractAwaitLastSubscriber<T, T> {

    @Override
    protected void resumeWith(T last) {
        if (last == null) {
            completeExceptionally(new NoOutputException());
        } else {
            complete(last);
        }
    }

    @Override
    protected T onInterrupted(InterruptedException ex) {
        cancel(false);
        throw interrupted(ex);
    }
}
