package analysis.abduction;

import analysis.abduction.domain.AbductiveState;
import analysis.abduction.domain.AbstractAddress;
import analysis.abduction.domain.Access;
import analysis.abduction.domain.AddressAndHistory;
import analysis.abduction.domain.Attribute;
import analysis.abduction.domain.CodeLocation;
import analysis.abduction.domain.InvalidAddressException;
import analysis.abduction.domain.Invalidation;
import analysis.abduction.domain.ProcedureDescription;
import analysis.abduction.domain.Trace;
import analysis.abduction.domain.Unit;
import analysis.abduction.domain.ValueHistory;
import analysis.abduction.domain.Var;

import com.ibm.wala.util.collections.Pair;

/**
 * Drives an {@link AbductiveState} through the steps of a small C-like procedure body, for building caller states and
 * callee summaries in tests
 */
public final class SymbolicExecution {

    private final CodeLocation location;
    private AbductiveState state;

    public SymbolicExecution(AbductiveState state, CodeLocation location) {
        this.state = state;
        this.location = location;
    }

    /**
     * Start the analysis of the given procedure
     */
    public static SymbolicExecution start(ProcedureDescription proc) {
        return new SymbolicExecution(AbductiveState.mkInitial(proc), proc.getLocation());
    }

    public AbductiveState getState() {
        return state;
    }

    public void setState(AbductiveState state) {
        this.state = state;
    }

    /**
     * <code>&amp;x</code>
     */
    public AddressAndHistory addressOf(Var x) {
        ValueHistory origin = ValueHistory.of(ValueHistory.VariableEvent.variableAccessed(x, location));
        Pair<AbductiveState, AddressAndHistory> p = state.eval(origin, x);
        state = p.fst;
        return p.snd;
    }

    /**
     * <code>x</code>
     */
    public AddressAndHistory load(Var x) {
        Pair<AbductiveState, AddressAndHistory> p = state.evalEdge(addressOf(x), Access.DEREFERENCE);
        state = p.fst;
        return p.snd;
    }

    /**
     * <code>x = v</code>
     */
    public void assign(Var x, AddressAndHistory v) {
        state = state.addEdge(addressOf(x), Access.DEREFERENCE, v, location);
    }

    /**
     * <code>*ptr</code>
     */
    public AddressAndHistory deref(AddressAndHistory ptr) throws InvalidAddressException {
        return follow(ptr, Access.DEREFERENCE);
    }

    /**
     * <code>ptr-&gt;field</code> (read)
     */
    public AddressAndHistory field(AddressAndHistory ptr, String field) throws InvalidAddressException {
        return follow(ptr, Access.field(field));
    }

    private AddressAndHistory follow(AddressAndHistory ptr, Access access) throws InvalidAddressException {
        state = state.checkValid(Trace.immediate(Unit.VALUE, location, ptr.getHistory()), ptr.getAddress());
        Pair<AbductiveState, AddressAndHistory> p = state.evalEdge(ptr, access);
        state = p.fst;
        return p.snd;
    }

    /**
     * <code>*ptr = v</code>
     */
    public void store(AddressAndHistory ptr, AddressAndHistory v) throws InvalidAddressException {
        state = state.checkValid(Trace.immediate(Unit.VALUE, location, ptr.getHistory()), ptr.getAddress());
        state = state.addEdge(ptr, Access.DEREFERENCE, v, location);
    }

    /**
     * <code>free(ptr)</code>
     */
    public void free(AddressAndHistory ptr) throws InvalidAddressException {
        state = state.checkValid(Trace.immediate(Unit.VALUE, location, ptr.getHistory()), ptr.getAddress());
        state = state.invalidate(ptr, Invalidation.C_FREE, location);
    }

    /**
     * A fresh value holding the given constant
     */
    public AddressAndHistory constant(String value) {
        AddressAndHistory v = new AddressAndHistory(AbstractAddress.mkFresh(),
                                                    ValueHistory.of(new ValueHistory.Assignment(location)));
        state = state.addAttribute(v.getAddress(), Attribute.constant(value));
        return v;
    }

    /**
     * <code>&amp;local</code> for a stack variable, the address is marked as belonging to the stack frame
     */
    public AddressAndHistory addressOfLocal(Var local) {
        AddressAndHistory addr = addressOf(local);
        state = state.addAttribute(addr.getAddress(),
                                   Attribute.addressOfStackVariable(local, location, addr.getHistory()));
        return addr;
    }
}
