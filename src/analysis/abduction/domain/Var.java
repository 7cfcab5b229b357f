package analysis.abduction.domain;

/**
 * Variable bound in an abstract stack. Whether a program variable is a formal or a local is not recorded here: formals
 * are the program variables pre-registered in the precondition stack (see
 * {@link AbductiveState#mkInitial(ProcedureDescription)}).
 */
public final class Var {

    /**
     * Kinds of variables
     */
    public enum Kind {
        /**
         * Formal or local variable of the procedure being analyzed
         */
        PROGRAM,
        /**
         * Global (static) variable
         */
        GLOBAL,
        /**
         * Pseudo-variable holding the return value of a procedure
         */
        RETURN,
        /**
         * Program variable introduced by the front end
         */
        FRONTEND_TEMPORARY,
        /**
         * Logical variable of the intermediate representation
         */
        LOGICAL
    }

    private final Kind kind;
    private final String name;
    /**
     * Procedure returning into this variable, null unless this is a return variable
     */
    private final ProcedureName procedure;

    private Var(Kind kind, String name, ProcedureName procedure) {
        assert name != null;
        this.kind = kind;
        this.name = name;
        this.procedure = procedure;
    }

    /**
     * Formal parameter or local variable with the given name
     */
    public static Var ofProgramVar(String name) {
        return new Var(Kind.PROGRAM, name, null);
    }

    public static Var ofGlobal(String name) {
        return new Var(Kind.GLOBAL, name, null);
    }

    /**
     * Variable holding the return value of the given procedure
     */
    public static Var ofReturn(ProcedureName procedure) {
        assert procedure != null;
        return new Var(Kind.RETURN, "return", procedure);
    }

    public static Var ofFrontendTemporary(String name) {
        return new Var(Kind.FRONTEND_TEMPORARY, name, null);
    }

    public static Var ofLogical(String name) {
        return new Var(Kind.LOGICAL, name, null);
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public boolean isGlobal() {
        return kind == Kind.GLOBAL;
    }

    public boolean isReturn() {
        return kind == Kind.RETURN;
    }

    /**
     * Program variables can have their address taken and go out of scope
     *
     * @return true if this is a formal or local program variable
     */
    public boolean isProgramVar() {
        return kind == Kind.PROGRAM;
    }

    /**
     * Whether the user could have written this variable
     *
     * @return false for variables introduced by the front end or the intermediate representation
     */
    public boolean appearsInSourceCode() {
        return kind != Kind.FRONTEND_TEMPORARY && kind != Kind.LOGICAL;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + kind.hashCode();
        result = prime * result + name.hashCode();
        result = prime * result + ((procedure == null) ? 0 : procedure.hashCode());
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null) {
            return false;
        }
        if (getClass() != obj.getClass()) {
            return false;
        }
        Var other = (Var) obj;
        if (kind != other.kind || !name.equals(other.name)) {
            return false;
        }
        if (procedure == null) {
            return other.procedure == null;
        }
        return procedure.equals(other.procedure);
    }

    @Override
    public String toString() {
        switch (kind) {
        case GLOBAL:
            return "#" + name;
        case RETURN:
            return procedure + "." + name;
        case LOGICAL:
            return "n$" + name;
        default:
            return name;
        }
    }
}
