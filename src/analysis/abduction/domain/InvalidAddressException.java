package analysis.abduction.domain;

/**
 * Thrown when an address that is accessed is known to be invalid
 */
public class InvalidAddressException extends Exception {

    private static final long serialVersionUID = -2373148617404462510L;

    /**
     * The invalid address
     */
    private final AbstractAddress address;
    /**
     * How the address became invalid
     */
    private final Trace<Invalidation> invalidatedBy;

    public InvalidAddressException(AbstractAddress address, Trace<Invalidation> invalidatedBy) {
        super("Access to invalid address " + address + ": " + invalidatedBy);
        this.address = address;
        this.invalidatedBy = invalidatedBy;
    }

    public AbstractAddress getAddress() {
        return address;
    }

    public Trace<Invalidation> getInvalidatedBy() {
        return invalidatedBy;
    }
}
