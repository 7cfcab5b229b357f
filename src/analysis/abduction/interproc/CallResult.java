package analysis.abduction.interproc;

import analysis.abduction.domain.AbductiveState;
import analysis.abduction.domain.AddressAndHistory;
import analysis.abduction.report.AccessToInvalidAddress;

/**
 * Outcome of applying one pre/post pair at a call site
 */
public final class CallResult {

    /**
     * How the application went
     */
    public enum Outcome {
        /**
         * The pre/post pair was applied
         */
        APPLIED,
        /**
         * The caller aliases addresses the pre/post pair requires to be distinct, the pair does not apply
         */
        ALIASING,
        /**
         * The number of actuals does not match the number of formals, the pair does not apply
         */
        ARITY_MISMATCH,
        /**
         * The call requires an address to be valid that is invalid in the caller
         */
        INVALID_ACCESS
    }

    private final Outcome outcome;
    /**
     * Caller state after the call, the unmodified caller state unless the pair was applied
     */
    private final AbductiveState state;
    /**
     * Value returned by the call, null if there is none
     */
    private final AddressAndHistory returnValue;
    /**
     * Error found, null unless the outcome is {@link Outcome#INVALID_ACCESS}
     */
    private final AccessToInvalidAddress diagnostic;

    private CallResult(Outcome outcome, AbductiveState state, AddressAndHistory returnValue,
                       AccessToInvalidAddress diagnostic) {
        this.outcome = outcome;
        this.state = state;
        this.returnValue = returnValue;
        this.diagnostic = diagnostic;
    }

    /**
     * The pair was applied
     *
     * @param state
     *            new caller state
     * @param returnValue
     *            value returned by the call, null if none
     */
    public static CallResult applied(AbductiveState state, AddressAndHistory returnValue) {
        return new CallResult(Outcome.APPLIED, state, returnValue, null);
    }

    /**
     * The pair does not apply at this call site
     *
     * @param outcome
     *            reason
     * @param callerState
     *            unmodified caller state
     */
    public static CallResult notApplicable(Outcome outcome, AbductiveState callerState) {
        assert outcome == Outcome.ALIASING || outcome == Outcome.ARITY_MISMATCH;
        return new CallResult(outcome, callerState, null, null);
    }

    /**
     * The call misuses an invalid address
     *
     * @param callerState
     *            unmodified caller state
     * @param diagnostic
     *            the error
     */
    public static CallResult invalidAccess(AbductiveState callerState, AccessToInvalidAddress diagnostic) {
        assert diagnostic != null;
        return new CallResult(Outcome.INVALID_ACCESS, callerState, null, diagnostic);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public AbductiveState getState() {
        return state;
    }

    /**
     * @return value returned by the call, null if there is none
     */
    public AddressAndHistory getReturnValue() {
        return returnValue;
    }

    /**
     * @return the error, null unless the call accesses an invalid address
     */
    public AccessToInvalidAddress getDiagnostic() {
        return diagnostic;
    }

    /**
     * Is this an error the user should hear about, as opposed to a pre/post pair that simply does not apply
     */
    public boolean isError() {
        return outcome == Outcome.INVALID_ACCESS;
    }

    @Override
    public String toString() {
        return outcome + (returnValue == null ? "" : " returning " + returnValue)
                + (diagnostic == null ? "" : ": " + diagnostic);
    }
}
