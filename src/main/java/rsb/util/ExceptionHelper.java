package rsb.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers to classify, wrap and unwrap exceptions crossing the bridges.
 */
public enum ExceptionHelper {
    ;

    /**
     * Throws a particular {@code Throwable} only if it belongs to a set of "fatal" error varieties. These
     * varieties are as follows:
     * <ul>
     * <li>{@code VirtualMachineError}</li>
     * <li>{@code LinkageError}</li>
     * </ul>
     *
     * @param t the exception to check
     */
    public static void throwIfFatal(Throwable t) {
        if (t instanceof VirtualMachineError) {
            throw (VirtualMachineError) t;
        } else if (t instanceof LinkageError) {
            throw (LinkageError) t;
        }
    }

    /**
     * Returns the exception as an unchecked one: RuntimeExceptions are returned as is,
     * Errors are thrown and checked exceptions get wrapped into a {@link ReactiveException}.
     * <p>
     * Intended usage: {@code throw ExceptionHelper.propagate(e);}
     *
     * @param t the exception to propagate
     * @return the unchecked exception to throw
     */
    public static RuntimeException propagate(Throwable t) {
        if (t instanceof RuntimeException) {
            return (RuntimeException) t;
        }
        if (t instanceof Error) {
            throw (Error) t;
        }
        return new ReactiveException(t);
    }

    /**
     * Strips the wrappers futures and {@link #propagate(Throwable)} put around the original exception.
     *
     * @param t the exception to unwrap
     * @return the root exception or t itself if it was not wrapped
     */
    public static Throwable unwrap(Throwable t) {
        Throwable e = t;
        while ((e instanceof CompletionException || e instanceof ExecutionException || e instanceof ReactiveException)
                && e.getCause() != null) {
            e = e.getCause();
        }
        return e;
    }
}
