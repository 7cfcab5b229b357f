package analysis.abduction.domain;

/**
 * Fact attached to an abstract address. An {@link Attributes} set holds at most one fact per {@link Kind}.
 */
public final class Attribute {

    /**
     * Tags of facts, the order is the order in which facts are printed
     */
    public enum Kind {
        /**
         * Address of a C++ temporary
         */
        ADDRESS_OF_CPP_TEMPORARY,
        /**
         * Address of a variable on the stack of the current procedure
         */
        ADDRESS_OF_STACK_VARIABLE,
        /**
         * Address returned by an allocation function
         */
        ALLOCATED,
        /**
         * Address of the closure of a procedure
         */
        CLOSURE,
        /**
         * Address holding a known constant
         */
        CONSTANT,
        /**
         * Address known to be invalid
         */
        INVALID,
        /**
         * Address required to be valid by the precondition
         */
        MUST_BE_VALID,
        /**
         * Vector whose capacity was reserved
         */
        STD_VECTOR_RESERVE,
        /**
         * Address whose contents were written
         */
        WRITTEN_TO
    }

    private static final Attribute STD_VECTOR_RESERVE = new Attribute(Kind.STD_VECTOR_RESERVE, null, null, null, null,
                                                                      null, null, null);

    private final Kind kind;
    private final Var var;
    private final CodeLocation location;
    private final ValueHistory history;
    private final ProcedureName procedure;
    private final String constant;
    private final Trace<Invalidation> invalidation;
    private final Trace<Unit> trace;

    private Attribute(Kind kind, Var var, CodeLocation location, ValueHistory history, ProcedureName procedure,
                      String constant, Trace<Invalidation> invalidation, Trace<Unit> trace) {
        this.kind = kind;
        this.var = var;
        this.location = location;
        this.history = history;
        this.procedure = procedure;
        this.constant = constant;
        this.invalidation = invalidation;
        this.trace = trace;
    }

    public static Attribute addressOfCppTemporary(Var var, ValueHistory history) {
        assert var != null && history != null;
        return new Attribute(Kind.ADDRESS_OF_CPP_TEMPORARY, var, null, history, null, null, null, null);
    }

    public static Attribute addressOfStackVariable(Var var, CodeLocation location, ValueHistory history) {
        assert var != null && location != null && history != null;
        return new Attribute(Kind.ADDRESS_OF_STACK_VARIABLE, var, location, history, null, null, null, null);
    }

    /**
     * Address allocated by the given procedure
     */
    public static Attribute allocated(ProcedureName allocator, Trace<Unit> trace) {
        assert allocator != null && trace != null;
        return new Attribute(Kind.ALLOCATED, null, null, null, allocator, null, null, trace);
    }

    public static Attribute closure(ProcedureName procedure) {
        assert procedure != null;
        return new Attribute(Kind.CLOSURE, null, null, null, procedure, null, null, null);
    }

    public static Attribute constant(String value) {
        assert value != null;
        return new Attribute(Kind.CONSTANT, null, null, null, null, value, null, null);
    }

    public static Attribute invalid(Trace<Invalidation> invalidation) {
        assert invalidation != null;
        return new Attribute(Kind.INVALID, null, null, null, null, null, invalidation, null);
    }

    public static Attribute mustBeValid(Trace<Unit> accessTrace) {
        assert accessTrace != null;
        return new Attribute(Kind.MUST_BE_VALID, null, null, null, null, null, null, accessTrace);
    }

    public static Attribute stdVectorReserve() {
        return STD_VECTOR_RESERVE;
    }

    public static Attribute writtenTo(Trace<Unit> writeTrace) {
        assert writeTrace != null;
        return new Attribute(Kind.WRITTEN_TO, null, null, null, null, null, null, writeTrace);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return variable for ADDRESS_OF_* facts, null otherwise
     */
    public Var getVar() {
        return var;
    }

    /**
     * @return declaration location for ADDRESS_OF_STACK_VARIABLE, null otherwise
     */
    public CodeLocation getLocation() {
        return location;
    }

    /**
     * @return history for ADDRESS_OF_* facts, null otherwise
     */
    public ValueHistory getHistory() {
        return history;
    }

    /**
     * @return allocator for ALLOCATED, procedure for CLOSURE, null otherwise
     */
    public ProcedureName getProcedure() {
        return procedure;
    }

    /**
     * @return constant value for CONSTANT, null otherwise
     */
    public String getConstant() {
        return constant;
    }

    /**
     * @return invalidation trace for INVALID, null otherwise
     */
    public Trace<Invalidation> getInvalidation() {
        return invalidation;
    }

    /**
     * @return trace for ALLOCATED, MUST_BE_VALID and WRITTEN_TO, null otherwise
     */
    public Trace<Unit> getTrace() {
        return trace;
    }

    /**
     * Does this fact record a change to the contents of the address
     */
    public boolean isModification() {
        return kind == Kind.WRITTEN_TO || kind == Kind.INVALID;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = kind.hashCode();
        result = prime * result + ((var == null) ? 0 : var.hashCode());
        result = prime * result + ((location == null) ? 0 : location.hashCode());
        result = prime * result + ((history == null) ? 0 : history.hashCode());
        result = prime * result + ((procedure == null) ? 0 : procedure.hashCode());
        result = prime * result + ((constant == null) ? 0 : constant.hashCode());
        result = prime * result + ((invalidation == null) ? 0 : invalidation.hashCode());
        result = prime * result + ((trace == null) ? 0 : trace.hashCode());
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Attribute)) {
            return false;
        }
        Attribute other = (Attribute) obj;
        return kind == other.kind && equal(var, other.var) && equal(location, other.location)
                && equal(history, other.history) && equal(procedure, other.procedure)
                && equal(constant, other.constant) && equal(invalidation, other.invalidation)
                && equal(trace, other.trace);
    }

    private static boolean equal(Object a, Object b) {
        return a == null ? b == null : a.equals(b);
    }

    @Override
    public String toString() {
        switch (kind) {
        case ADDRESS_OF_CPP_TEMPORARY:
            return "t&" + var;
        case ADDRESS_OF_STACK_VARIABLE:
            return "s&" + var;
        case ALLOCATED:
            return "Allocated(" + procedure + ")";
        case CLOSURE:
            return "Closure(" + procedure + ")";
        case CONSTANT:
            return "Constant(" + constant + ")";
        case INVALID:
            return "Invalid(" + invalidation + ")";
        case MUST_BE_VALID:
            return "MustBeValid(" + trace + ")";
        case STD_VECTOR_RESERVE:
            return "std::vector::reserve()";
        case WRITTEN_TO:
            return "WrittenTo(" + trace + ")";
        default:
            throw new RuntimeException("Unknown attribute " + kind);
        }
    }
}
