package analysis.abduction.domain;

/**
 * Explanation of how a fact came to hold: either it happened directly in the current procedure ({@link Immediate}), or
 * it happened inside a callee and was lifted to the call site ({@link ViaCall}).
 *
 * @param <T>
 *            payload describing what happened, e.g. an {@link Invalidation}, or {@link Unit} when only the location
 *            matters
 */
public abstract class Trace<T> {

    Trace() {
        // only the two subclasses below
    }

    /**
     * Fact established in the current procedure
     *
     * @param payload
     *            what happened
     * @param location
     *            where it happened
     * @param history
     *            history of the value involved
     * @return new trace
     */
    public static <T> Trace<T> immediate(T payload, CodeLocation location, ValueHistory history) {
        return new Immediate<>(payload, location, history);
    }

    /**
     * Lift a trace from a callee into a trace in the caller blaming the call
     *
     * @param callee
     *            procedure called
     * @param location
     *            location of the call
     * @param history
     *            history of the caller value the fact is about
     * @param inCall
     *            trace inside the callee
     * @return new trace
     */
    public static <T> Trace<T> viaCall(ProcedureName callee, CodeLocation location, ValueHistory history,
                                       Trace<T> inCall) {
        return new ViaCall<>(callee, location, history, inCall);
    }

    /**
     * Where the fact is visible in the current procedure (the call site for {@link ViaCall})
     */
    public abstract CodeLocation getOutermostLocation();

    /**
     * History of the value the fact is about, in the current procedure
     */
    public abstract ValueHistory getHistory();

    /**
     * The innermost payload, found by following the trace through all calls
     */
    public abstract T getImmediate();

    /**
     * Fact established in the current procedure
     */
    public static final class Immediate<T> extends Trace<T> {
        private final T payload;
        private final CodeLocation location;
        private final ValueHistory history;

        Immediate(T payload, CodeLocation location, ValueHistory history) {
            assert payload != null && location != null && history != null;
            this.payload = payload;
            this.location = location;
            this.history = history;
        }

        @Override
        public CodeLocation getOutermostLocation() {
            return location;
        }

        @Override
        public ValueHistory getHistory() {
            return history;
        }

        @Override
        public T getImmediate() {
            return payload;
        }

        @Override
        public int hashCode() {
            final int prime = 31;
            int result = payload.hashCode();
            result = prime * result + location.hashCode();
            result = prime * result + history.hashCode();
            return result;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof Immediate)) {
                return false;
            }
            Immediate<?> other = (Immediate<?>) obj;
            return payload.equals(other.payload) && location.equals(other.location) && history.equals(other.history);
        }

        @Override
        public String toString() {
            return payload + " at " + location;
        }
    }

    /**
     * Fact established inside a callee
     */
    public static final class ViaCall<T> extends Trace<T> {
        private final ProcedureName callee;
        private final CodeLocation location;
        private final ValueHistory history;
        private final Trace<T> inCall;

        ViaCall(ProcedureName callee, CodeLocation location, ValueHistory history, Trace<T> inCall) {
            assert callee != null && location != null && history != null && inCall != null;
            this.callee = callee;
            this.location = location;
            this.history = history;
            this.inCall = inCall;
        }

        public ProcedureName getCallee() {
            return callee;
        }

        /**
         * Trace inside the callee
         */
        public Trace<T> getInCall() {
            return inCall;
        }

        @Override
        public CodeLocation getOutermostLocation() {
            return location;
        }

        @Override
        public ValueHistory getHistory() {
            return history;
        }

        @Override
        public T getImmediate() {
            return inCall.getImmediate();
        }

        @Override
        public int hashCode() {
            final int prime = 31;
            int result = callee.hashCode();
            result = prime * result + location.hashCode();
            result = prime * result + history.hashCode();
            result = prime * result + inCall.hashCode();
            return result;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof ViaCall)) {
                return false;
            }
            ViaCall<?> other = (ViaCall<?>) obj;
            return callee.equals(other.callee) && location.equals(other.location) && history.equals(other.history)
                    && inCall.equals(other.inCall);
        }

        @Override
        public String toString() {
            return "call to " + callee + " at " + location + " (" + inCall + ")";
        }
    }
}
