package analysis.abduction.interproc;

import analysis.abduction.domain.AbstractAddress;

/**
 * Raised when the pre/post pair and the caller state disagree on aliasing, i.e., some addresses that are distinct in
 * the pre/post are the same address in the caller. Typically raised when calling <code>foo(z, z)</code> where the
 * summary for <code>foo(x, y)</code> says that <code>x</code> and <code>y</code> are disjoint.
 */
public class AliasingException extends RuntimeException {

    private static final long serialVersionUID = 4506633811436453316L;

    /**
     * Caller address bound to two callee addresses
     */
    private final AbstractAddress callerAddress;

    public AliasingException(AbstractAddress callerAddress, AbstractAddress boundTo, AbstractAddress calleeAddress) {
        super("Address " + callerAddress + " in caller already bound to " + boundTo + ", not " + calleeAddress);
        this.callerAddress = callerAddress;
    }

    public AbstractAddress getCallerAddress() {
        return callerAddress;
    }
}
