package rsb.util;

/**
 * Unchecked carrier for checked exceptions thrown out of blocking calls.
 * <p>
 * Use {@link ExceptionHelper#unwrap(Throwable)} to get the original exception back.
 */
public class ReactiveException extends RuntimeException {
    /** */
    private static final long serialVersionUID = -4167553196581090231L;

    public ReactiveException(Throwable cause) {
        super(cause);
    }

    public ReactiveException(String message) {
        super(message);
    }
}
