package analysis.abduction.domain;

/**
 * Singleton payload for traces that only record <i>where</i> something happened, e.g., the trace of a
 * {@link Attribute#mustBeValid(Trace) must-be-valid} or {@link Attribute#writtenTo(Trace) written-to} fact.
 */
public final class Unit implements AbstractValue<Unit> {

    /**
     * The one and only value
     */
    public static final Unit VALUE = new Unit();

    /**
     * Constructor that is private to prevent external invocation
     */
    private Unit() {
        // Intentionally empty
    }

    @Override
    public boolean equals(Object obj) {
        return this == obj;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return "()";
    }

    @Override
    public boolean leq(Unit that) {
        return true;
    }

    @Override
    public boolean isBottom() {
        return true;
    }
}
