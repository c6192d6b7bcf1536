package rsb.state;

/**
 * A component that holds the demand its downstream signalled.
 */
public interface Requestable {

    /**
     * Return the demand not yet fulfilled, {@code Long.MAX_VALUE} if unbounded
     * @return the demand not yet fulfilled
     */
    long requestedFromDownstream();
}
