package rsb.documentation;

/**
 * Indicates the backpressure mode of a source or consumer.
 */
public enum BackpressureMode {
    /** Backpressure is not involved. */
    NOT_APPLICABLE,

    /** Backpressure is completely ignored. */
    NONE,

    /**
     * Requests Long.MAX_VALUE from the upstream and either
     * buffers the values or reduces them to a smaller number.
     */
    UNBOUNDED,

    /**
     * Honors the requests of the downstream.
     */
    BOUNDED
}
