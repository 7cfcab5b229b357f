package analysis.abduction.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What the analysis needs to know about a procedure: its name, location, formal parameters, and declared locals
 */
public final class ProcedureDescription {

    private final ProcedureName name;
    private final CodeLocation location;
    private final List<Var> formals;
    private final List<LocalVariable> locals;

    public ProcedureDescription(ProcedureName name, CodeLocation location, List<Var> formals,
                                List<LocalVariable> locals) {
        this.name = name;
        this.location = location;
        this.formals = Collections.unmodifiableList(new ArrayList<>(formals));
        this.locals = Collections.unmodifiableList(new ArrayList<>(locals));
    }

    public ProcedureName getName() {
        return name;
    }

    public CodeLocation getLocation() {
        return location;
    }

    /**
     * @return formal parameters, in order
     */
    public List<Var> getFormals() {
        return formals;
    }

    public List<LocalVariable> getLocals() {
        return locals;
    }

    /**
     * The variable the procedure returns into
     */
    public Var getReturnVar() {
        return Var.ofReturn(name);
    }

    /**
     * Find the declared type of a local variable
     *
     * @param var
     *            variable to look up
     * @return the type or null if the variable is not a declared local
     */
    public String getLocalType(Var var) {
        for (LocalVariable l : locals) {
            if (l.getVar().equals(var)) {
                return l.getType();
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return name + formals.toString();
    }

    /**
     * Local variable declaration
     */
    public static final class LocalVariable {
        private final Var var;
        private final String type;

        public LocalVariable(Var var, String type) {
            assert var != null && type != null;
            this.var = var;
            this.type = type;
        }

        public Var getVar() {
            return var;
        }

        public String getType() {
            return type;
        }

        @Override
        public String toString() {
            return type + " " + var;
        }
    }
}
