package analysis.abduction.interproc;

import analysis.abduction.report.AccessToInvalidAddress;

/**
 * Raised when the precondition of a callee requires an address to be valid and the caller state shows it is invalid
 */
public class InvalidAccessException extends Exception {

    private static final long serialVersionUID = -6030312930412871427L;

    private final AccessToInvalidAddress diagnostic;

    public InvalidAccessException(AccessToInvalidAddress diagnostic) {
        super(diagnostic.toString());
        this.diagnostic = diagnostic;
    }

    public AccessToInvalidAddress getDiagnostic() {
        return diagnostic;
    }
}
