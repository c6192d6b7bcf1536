package rsb.util;

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class that let's the developer react to
 * exceptions and values that can't be signalled due to the state
 * of the streams.
 */
public final class UnsignalledExceptions {

    static final Logger LOGGER = LoggerFactory.getLogger(UnsignalledExceptions.class);

    /**
     * Utility class.
     */
    private UnsignalledExceptions() {
        throw new IllegalStateException("No instances!");
    }

    /**
     * The error consumer lambda, null will revert to the default behavior.
     */
    private static volatile Consumer<Throwable> errorConsumer;

    /**
     * The dropped value consumer lambda, null will revert to the default behavior.
     */
    private static volatile Consumer<Object> valueConsumer;

    /**
     * Prevents changing the consumers.
     * This can be used for environments which wants to preset a handler
     * but prevent others from changing it.
     */
    private static volatile boolean locked;

    /**
     * Returns the current error consumer instance or null if none is set.
     * <p>
     * This allows chaining of error consumers if necessary.
     *
     * @return the current error consumer instance or null if none is set
     */
    public static Consumer<Throwable> getErrorConsumer() {
        return errorConsumer;
    }

    /**
     * Sets the current error consumer if not locked down.
     * <p>
     * Setting it to null will reset the handling behavior to default.
     *
     * @param newConsumer the new consumer to set
     */
    public static void setErrorConsumer(Consumer<Throwable> newConsumer) {
        if (!locked) {
            errorConsumer = newConsumer;
        }
    }

    /**
     * Sets the consumer of values a source produced but could not deliver, if not locked down.
     * <p>
     * Setting it to null will reset the handling behavior to default.
     *
     * @param newConsumer the new consumer to set
     */
    public static void setValueConsumer(Consumer<Object> newConsumer) {
        if (!locked) {
            valueConsumer = newConsumer;
        }
    }

    /**
     * Locks down the consumers and prevents any further changes to
     * the handlers.
     */
    public static void lockdown() {
        locked = true;
    }

    /**
     * Take an unsignalled data and handle it.
     *
     * @param <T> the type of the value dropped
     * @param t the dropped data
     */
    public static <T> void onNextDropped(T t) {
        Consumer<Object> h = valueConsumer;
        if (h == null) {
            LOGGER.debug("onNextDropped: {}", t);
        } else {
            try {
                h.accept(t);
            } catch (Throwable ex) {
                ExceptionHelper.throwIfFatal(ex);
                LOGGER.error("The dropped value consumer failed", ex);
            }
        }
    }

    /**
     * Take an unsignalled exception that is masking another one due to callback failure.
     *
     * @param e the exception to handle, if null, a new NullPointerException is instantiated
     * @param root the original exception, attached as suppressed if not null
     */
    public static void onErrorDropped(Throwable e, Throwable root) {
        if (e != null && root != null) {
            e.addSuppressed(root);
        }
        onErrorDropped(e);
    }

    /**
     * Take an unsignalled exception and handle it.
     *
     * @param e the exception to handle, if null, a new NullPointerException is instantiated
     */
    public static void onErrorDropped(Throwable e) {
        if (e == null) {
            e = new NullPointerException();
        }
        ExceptionHelper.throwIfFatal(e);

        Consumer<Throwable> h = errorConsumer;

        if (h == null) {
            LOGGER.error("onErrorDropped", e);
        } else {
            try {
                h.accept(e);
            } catch (Throwable ex) {
                ExceptionHelper.throwIfFatal(ex);
                LOGGER.error("The error consumer failed", ex);
                LOGGER.error("onErrorDropped", e);
            }
        }
    }
}
