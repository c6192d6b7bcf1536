package rsb.stream;

/**
 * Outcome of emitting an element into a stream.
 */
public enum EmitResult {
    /** The element was handed to the waiting consumer or buffered. */
    ENQUEUED,
    /** The buffering policy dropped an element, either the emitted one or the oldest buffered one. */
    DROPPED,
    /** The stream already terminated; the element was discarded. */
    TERMINATED
}
