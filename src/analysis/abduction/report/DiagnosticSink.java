package analysis.abduction.report;

/**
 * Receives the errors found while applying summaries
 */
public interface DiagnosticSink {

    /**
     * Report an access to an invalid address
     *
     * @param diagnostic
     *            the error
     */
    void report(AccessToInvalidAddress diagnostic);
}
