package rsb.util;

import java.util.NoSuchElementException;

/**
 * Signals that a Publisher completed normally without producing any value
 * while exactly one was awaited.
 */
public final class NoOutputException extends NoSuchElementException {
    /** */
    private static final long serialVersionUID = 5817452187361254016L;

    public NoOutputException() {
        super("Publisher completed without producing any values");
    }
}
