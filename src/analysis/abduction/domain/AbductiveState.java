package analysis.abduction.domain;

import java.io.Writer;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import org.json.JSONException;
import org.json.JSONObject;

import analysis.abduction.serialization.JSONSerializable;
import analysis.abduction.serialization.JSONUtil;

import com.ibm.wala.util.collections.Pair;
import com.ibm.wala.util.intset.IntSet;
import com.ibm.wala.util.intset.MutableIntSet;
import com.ibm.wala.util.intset.MutableSparseIntSet;

/**
 * Biabductive pre/post pair: the abstract memory at the current program point (the post) together with the
 * precondition inferred so far (the pre). The pre grows lazily as the procedure reads memory it did not allocate.
 * <p>
 * The pre is ordered the other way around from the post: a smaller precondition is a weaker requirement, so it is
 * <i>greater</i> in the order of this domain.
 * <p>
 * States are immutable. Every operation returns the receiver when it changes nothing.
 */
public final class AbductiveState implements AbstractValue<AbductiveState>, JSONSerializable {

    /**
     * State with empty pre and post
     */
    public static final AbductiveState EMPTY = new AbductiveState(BaseState.EMPTY, BaseState.EMPTY);

    /**
     * Inferred precondition
     */
    private final BaseState pre;
    /**
     * State at the current program point
     */
    private final BaseState post;

    private AbductiveState(BaseState pre, BaseState post) {
        this.pre = pre;
        this.post = post;
    }

    public static AbductiveState make(BaseState pre, BaseState post) {
        assert pre != null && post != null;
        if (pre == BaseState.EMPTY && post == BaseState.EMPTY) {
            return EMPTY;
        }
        return new AbductiveState(pre, post);
    }

    /**
     * Replace the pre, the post, or both
     *
     * @param newPre
     *            new pre, null to keep the current one
     * @param newPost
     *            new post, null to keep the current one
     * @return new state, or this if both are identical to the current ones
     */
    public AbductiveState update(BaseState newPre, BaseState newPost) {
        BaseState p = newPre == null ? pre : newPre;
        BaseState q = newPost == null ? post : newPost;
        if (p == pre && q == post) {
            return this;
        }
        return new AbductiveState(p, q);
    }

    private AbductiveState withPostStack(BaseStack stack) {
        return update(null, post.update(stack, null));
    }

    private AbductiveState withPostHeap(BaseHeap heap) {
        return update(null, post.update(null, heap));
    }

    /**
     * Initial state of the analysis of a procedure. The formals are bound to fresh addresses in the stacks of both the
     * pre and the post, and those addresses are registered in the pre heap, which is how formals are later told apart
     * from locals.
     *
     * @param proc
     *            procedure about to be analyzed
     * @return initial state
     */
    public static AbductiveState mkInitial(ProcedureDescription proc) {
        BaseStack stack = BaseStack.EMPTY;
        BaseHeap preHeap = BaseHeap.EMPTY;
        for (Var formal : proc.getFormals()) {
            AbstractAddress addr = AbstractAddress.mkFresh();
            ValueHistory hist = ValueHistory.of(ValueHistory.VariableEvent.formalDeclared(formal, proc.getLocation()));
            stack = stack.add(formal, new AddressAndHistory(addr, hist));
            preHeap = preHeap.registerAddress(addr);
        }
        return make(BaseState.make(stack, preHeap), BaseState.make(stack, BaseHeap.EMPTY));
    }

    /**
     * Inferred precondition
     */
    public BaseState getPre() {
        return pre;
    }

    /**
     * State at the current program point
     */
    public BaseState getPost() {
        return post;
    }

    /**
     * This is below that if the pre of that maps into the pre of this and, with the same mapping, the post of this is
     * isomorphic to the post of that.
     */
    @Override
    public boolean leq(AbductiveState that) {
        // inverted order on the pre
        IsographMapping footMapping = IsographMapping.map(IsographMapping.EMPTY, that.pre, this.pre);
        if (footMapping == null) {
            return false;
        }
        return IsographMapping.isIsograph(footMapping.inverse(), this.post, that.post);
    }

    @Override
    public boolean isBottom() {
        return pre.isBottom() && post.isBottom();
    }

    /*
     * Stack operations
     */

    /**
     * Can a value for this variable be added to the precondition when it is first read: formals (pre-registered in the
     * pre stack) and globals
     */
    public boolean isAbducible(Var var) {
        return pre.getStack().contains(var) || var.isGlobal();
    }

    /**
     * Locals are the variables that are neither abducible nor the return variable
     */
    public boolean isLocal(Var var) {
        return !(var.isReturn() || isAbducible(var));
    }

    /**
     * Get the value of a variable, binding it to a fresh address if it has no value yet. If the variable is abducible
     * and not yet in the pre, the fresh address is also added to the pre: this is how new footprint is discovered.
     *
     * @param origin
     *            history to give the value if it is fresh
     * @param var
     *            variable to read
     * @return the new state and the value of the variable
     */
    public Pair<AbductiveState, AddressAndHistory> eval(ValueHistory origin, Var var) {
        AddressAndHistory existing = post.getStack().find(var);
        if (existing != null) {
            return Pair.make(this, existing);
        }
        AbstractAddress addr = AbstractAddress.mkFresh();
        AddressAndHistory addrHist = new AddressAndHistory(addr, origin);
        BaseState newPost = post.update(post.getStack().add(var, addrHist), null);
        BaseState newPre = pre;
        if (!pre.getStack().contains(var) && isAbducible(var)) {
            // histories of values in the pre are not used
            BaseStack footStack = pre.getStack().add(var, new AddressAndHistory(addr, ValueHistory.EMPTY));
            BaseHeap footHeap = pre.getHeap().registerAddress(addr);
            newPre = pre.update(footStack, footHeap);
        }
        return Pair.make(update(newPre, newPost), addrHist);
    }

    /**
     * Bind a variable in the post
     */
    public AbductiveState addVar(Var var, AddressAndHistory value) {
        return withPostStack(post.getStack().add(var, value));
    }

    /**
     * Remove variables from the post. Variables bound in the pre are kept.
     *
     * @param vars
     *            variables to remove
     * @return new state
     */
    public AbductiveState removeVars(Collection<Var> vars) {
        final Set<Var> toRemove = new LinkedHashSet<>();
        for (Var v : vars) {
            if (!pre.getStack().contains(v)) {
                toRemove.add(v);
            }
        }
        if (toRemove.isEmpty()) {
            return this;
        }
        return withPostStack(post.getStack().filter(new BaseStack.BindingFilter() {
            @Override
            public boolean keep(Var var, AddressAndHistory value) {
                return !toRemove.contains(var);
            }
        }));
    }

    /**
     * @return value of the variable in the post, null if it is not bound
     */
    public AddressAndHistory findVar(Var var) {
        return post.getStack().find(var);
    }

    public boolean containsVar(Var var) {
        return post.getStack().contains(var);
    }

    /*
     * Memory operations
     */

    /**
     * Check that the address is not known to be invalid. If the address is in the pre, it is recorded there that it
     * must be valid, so that callers will check it too.
     *
     * @param accessTrace
     *            trace of the access
     * @param address
     *            address accessed
     * @return new state
     * @throws InvalidAddressException
     *             if the address is invalid in the post
     */
    public AbductiveState checkValid(Trace<Unit> accessTrace, AbstractAddress address) throws InvalidAddressException {
        Trace<Invalidation> invalidatedBy = post.getHeap().getInvalidation(address);
        if (invalidatedBy != null) {
            throw new InvalidAddressException(address, invalidatedBy);
        }
        if (!pre.getHeap().hasEdges(address)) {
            return this;
        }
        BaseHeap footHeap = pre.getHeap().addAttribute(address, Attribute.mustBeValid(accessTrace));
        return update(pre.update(null, footHeap), null);
    }

    /**
     * Write an edge in the post and record the write on the source address
     *
     * @param src
     *            source address
     * @param access
     *            label
     * @param dest
     *            new destination
     * @param location
     *            location of the write
     * @return new state
     */
    public AbductiveState addEdge(AddressAndHistory src, Access access, AddressAndHistory dest, CodeLocation location) {
        Attribute written = Attribute.writtenTo(Trace.immediate(Unit.VALUE, location, src.getHistory()));
        BaseHeap heap = post.getHeap().addEdge(src.getAddress(), access, dest).addAttribute(src.getAddress(), written);
        return withPostHeap(heap);
    }

    /**
     * @return destination of the edge in the post, null if there is none
     */
    public AddressAndHistory findEdge(AbstractAddress address, Access access) {
        return post.getHeap().findEdge(address, access);
    }

    /**
     * Follow an edge, creating it with a fresh destination if it does not exist yet. If the source is in the pre the
     * new edge is added to the pre as well.
     *
     * @param src
     *            source address
     * @param access
     *            label
     * @return the new state and the destination
     */
    public Pair<AbductiveState, AddressAndHistory> evalEdge(AddressAndHistory src, Access access) {
        AddressAndHistory existing = findEdge(src.getAddress(), access);
        if (existing != null) {
            return Pair.make(this, existing);
        }
        AbstractAddress addrDest = AbstractAddress.mkFresh();
        AddressAndHistory addrHistDest = new AddressAndHistory(addrDest, src.getHistory());
        BaseHeap postHeap = post.getHeap().addEdge(src.getAddress(), access, addrHistDest);
        BaseHeap footHeap = pre.getHeap();
        if (footHeap.hasEdges(src.getAddress())) {
            footHeap = footHeap.addEdge(src.getAddress(), access, new AddressAndHistory(addrDest, ValueHistory.EMPTY))
                               .registerAddress(addrDest);
        }
        return Pair.make(update(pre.update(null, footHeap), post.update(null, postHeap)), addrHistDest);
    }

    public AbductiveState invalidate(AddressAndHistory address, Invalidation invalidation, CodeLocation location) {
        return withPostHeap(post.getHeap().invalidate(address, invalidation, location));
    }

    public AbductiveState addAttribute(AbstractAddress address, Attribute attr) {
        return withPostHeap(post.getHeap().addAttribute(address, attr));
    }

    public String getConstant(AbstractAddress address) {
        return post.getHeap().getConstant(address);
    }

    public ProcedureName getClosureProcName(AbstractAddress address) {
        return post.getHeap().getClosureProcName(address);
    }

    public AbductiveState stdVectorReserve(AbstractAddress address) {
        return withPostHeap(post.getHeap().stdVectorReserve(address));
    }

    public boolean isStdVectorReserved(AbstractAddress address) {
        return post.getHeap().isStdVectorReserved(address);
    }

    /**
     * @return the cell in the post, null if there is none
     */
    public Cell findCell(AbstractAddress address) {
        return post.getHeap().findCell(address);
    }

    /**
     * Replace a whole cell in the post and record the write
     */
    public AbductiveState setCell(AddressAndHistory address, Cell cell, CodeLocation location) {
        Attribute written = Attribute.writtenTo(Trace.immediate(Unit.VALUE, location, address.getHistory()));
        BaseHeap heap = post.getHeap().setCell(address.getAddress(), cell).addAttribute(address.getAddress(), written);
        return withPostHeap(heap);
    }

    /**
     * Garbage collect: drop the cells of the pre not reachable from the pre stack, and the cells of the post reachable
     * neither from the pre stack nor from the post stack.
     *
     * @return new state, or this if nothing was dropped
     */
    public AbductiveState discardUnreachable() {
        IntSet preAddresses = pre.reachableAddresses();
        BaseHeap preNewHeap = pre.getHeap().restrictTo(preAddresses);
        MutableIntSet allAddresses = MutableSparseIntSet.make(preAddresses);
        allAddresses.addAll(post.reachableAddresses());
        BaseHeap postNewHeap = post.getHeap().restrictTo(allAddresses);
        return update(pre.update(null, preNewHeap), post.update(null, postNewHeap));
    }

    @Override
    public JSONObject toJSON() {
        return JSONUtil.toJSON(this);
    }

    @Override
    public void writeJSON(Writer out, int indentFactor) throws JSONException {
        toJSON().write(out, indentFactor, 0);
    }

    @Override
    public int hashCode() {
        return 31 * pre.hashCode() + post.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof AbductiveState)) {
            return false;
        }
        AbductiveState other = (AbductiveState) obj;
        return pre.equals(other.pre) && post.equals(other.post);
    }

    @Override
    public String toString() {
        return post + "\nPRE=[" + pre + "]";
    }
}
