package rsb.stream;

/**
 * Why a stream stopped, as reported to its {@code onTermination} handler.
 */
public enum Termination {
    /** The producer completed or failed the stream. */
    FINISHED,
    /** The consumer cancelled its iteration. */
    CANCELLED
}
