package analysis.abduction.domain;

/**
 * Reason why an address became invalid
 */
public final class Invalidation {

    /**
     * Kinds of invalidation
     */
    public enum Kind {
        C_FREE, CPP_DELETE, NULLPTR, GONE_OUT_OF_SCOPE, STD_VECTOR
    }

    public static final Invalidation C_FREE = new Invalidation(Kind.C_FREE, null, null);
    public static final Invalidation CPP_DELETE = new Invalidation(Kind.CPP_DELETE, null, null);
    public static final Invalidation NULLPTR = new Invalidation(Kind.NULLPTR, null, null);

    private final Kind kind;
    /**
     * For {@link Kind#GONE_OUT_OF_SCOPE} the variable and its type, for {@link Kind#STD_VECTOR} the vector operation in
     * {@code detail}
     */
    private final Var var;
    private final String detail;

    private Invalidation(Kind kind, Var var, String detail) {
        this.kind = kind;
        this.var = var;
        this.detail = detail;
    }

    /**
     * The address of the given variable is no longer valid since the variable went out of scope
     *
     * @param var
     *            local variable
     * @param type
     *            declared type of the variable
     */
    public static Invalidation goneOutOfScope(Var var, String type) {
        assert var != null && type != null;
        return new Invalidation(Kind.GONE_OUT_OF_SCOPE, var, type);
    }

    /**
     * The contents of a vector were reallocated by the given operation (e.g. "push_back")
     */
    public static Invalidation stdVector(String operation) {
        assert operation != null;
        return new Invalidation(Kind.STD_VECTOR, null, operation);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return variable that went out of scope, null for other kinds
     */
    public Var getVar() {
        return var;
    }

    /**
     * @return type of the variable that went out of scope or the vector operation, null for other kinds
     */
    public String getDetail() {
        return detail;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = kind.hashCode();
        result = prime * result + ((var == null) ? 0 : var.hashCode());
        result = prime * result + ((detail == null) ? 0 : detail.hashCode());
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Invalidation)) {
            return false;
        }
        Invalidation other = (Invalidation) obj;
        if (kind != other.kind) {
            return false;
        }
        if (var == null ? other.var != null : !var.equals(other.var)) {
            return false;
        }
        return detail == null ? other.detail == null : detail.equals(other.detail);
    }

    @Override
    public String toString() {
        switch (kind) {
        case C_FREE:
            return "was freed";
        case CPP_DELETE:
            return "was deleted";
        case NULLPTR:
            return "is the null pointer";
        case GONE_OUT_OF_SCOPE:
            return "is the address of " + var + " of type " + detail + " whose lifetime has ended";
        case STD_VECTOR:
            return "was potentially invalidated by std::vector::" + detail;
        default:
            throw new RuntimeException("Unknown invalidation " + kind);
        }
    }
}
