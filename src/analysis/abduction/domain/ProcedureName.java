package analysis.abduction.domain;

/**
 * Name of a procedure, used to blame callees in traces and histories
 */
public final class ProcedureName {

    /**
     * Fully qualified name
     */
    private final String name;

    public ProcedureName(String name) {
        assert name != null;
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ProcedureName)) {
            return false;
        }
        return name.equals(((ProcedureName) obj).name);
    }

    @Override
    public String toString() {
        return name;
    }
}
