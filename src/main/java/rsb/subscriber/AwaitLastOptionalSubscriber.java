package rsb.subscriber;

import java.util.Optional;
import java.util.concurrent.CompletionException;

import rsb.util.ExceptionHelper;

/**
 * Resumes with the last value of the source, or an empty Optional if it completed empty.
 * <p>
 * Errors are still surfaced. Disposing or interrupting the wait resumes with the
 * value seen so far.
 *
 * @param <T> the value type
 */
public final class AwaitLastOptionalSubscriber<T> extends AbstractAwaitLastSubscriber<T, Optional<T>> {

    @Override
    protected void resumeWith(T last) {
        complete(Optional.ofNullable(last));
    }

    /**
     * Cancels the subscription and resumes with the last value received so far.
     * @return true if this call resumed the future
     */
    public boolean cancelWithLatest() {
        T v = value;
        if (tryResume()) {
            value = null;
            complete(Optional.ofNullable(v));
            return true;
        }
        return false;
    }

    @Override
    public void dispose() {
        cancelWithLatest();
    }

    @Override
    protected Optional<T> onInterrupted(InterruptedException ex) {
        cancelWithLatest();
        try {
            return getNow(Optional.empty());
        } catch (CompletionException e) {
            throw ExceptionHelper.propagate(ExceptionHelper.unwrap(e));
        }
    }
}
