package analysis.abduction.interproc;

import java.util.List;
import java.util.Map;

import main.AbductionOptions;
import analysis.abduction.domain.AbductiveState;
import analysis.abduction.domain.AbstractAddress;
import analysis.abduction.domain.Access;
import analysis.abduction.domain.AddressAndHistory;
import analysis.abduction.domain.Attribute;
import analysis.abduction.domain.Attributes;
import analysis.abduction.domain.BaseHeap;
import analysis.abduction.domain.BaseState;
import analysis.abduction.domain.Cell;
import analysis.abduction.domain.CodeLocation;
import analysis.abduction.domain.Edges;
import analysis.abduction.domain.InvalidAddressException;
import analysis.abduction.domain.ProcedureName;
import analysis.abduction.domain.Trace;
import analysis.abduction.domain.Unit;
import analysis.abduction.domain.ValueHistory;
import analysis.abduction.domain.Var;
import analysis.abduction.report.AccessToInvalidAddress;
import analysis.abduction.report.DiagnosticSink;

import com.ibm.wala.util.collections.Pair;

/**
 * Applies a pre/post pair summarizing a callee to the abstract state of a caller at a call site.
 * <p>
 * This happens in two phases. First the pre of the callee is matched against the caller state: the graph reachable
 * from each formal (and each global) in the pre is walked together with the graph of the corresponding actual in the
 * caller, building a translation from callee addresses to caller addresses. Whatever the pre needs that the caller does
 * not have yet is discovered on the fly and, where possible, becomes footprint of the caller's own pre. Second, the post
 * of the callee is replayed on the caller: every cell the callee may have modified is rewritten in the caller, the
 * return value is found, and any remaining facts are copied over.
 */
public class PrePostApplier {

    /**
     * Level of console output
     */
    private int outputLevel;
    /**
     * Whether a cell with no recorded modification whose edges changed is an internal error
     */
    private final boolean strictReadOnly;
    /**
     * Where to report invalid accesses, may be null
     */
    private final DiagnosticSink sink;

    /**
     * Create an applier configured from the command line options
     *
     * @param options
     *            options
     * @param sink
     *            where to report invalid accesses, may be null
     */
    public PrePostApplier(AbductionOptions options, DiagnosticSink sink) {
        this(options.getOutputLevel(), options.isStrictReadOnly(), sink);
    }

    /**
     * Create an applier
     *
     * @param outputLevel
     *            level of console output
     * @param strictReadOnly
     *            whether a cell with no recorded modification whose edges changed is an internal error
     * @param sink
     *            where to report invalid accesses, may be null
     */
    public PrePostApplier(int outputLevel, boolean strictReadOnly, DiagnosticSink sink) {
        this.outputLevel = outputLevel;
        this.strictReadOnly = strictReadOnly;
        this.sink = sink;
    }

    public int getOutputLevel() {
        return outputLevel;
    }

    /**
     * Set the level of console output: 1 for calls where the pre/post pair does not apply or that access an invalid
     * address, 2 for each application, 3 for each caller cell rewritten and the resulting states, 4 for the full
     * workspace after the pre is read
     *
     * @param outputLevel
     *            level of console output
     */
    public void setOutputLevel(int outputLevel) {
        this.outputLevel = outputLevel;
    }

    /**
     * Apply a pre/post pair at a call site
     *
     * @param callee
     *            procedure called
     * @param callLocation
     *            location of the call in the caller
     * @param prePost
     *            summary of the callee
     * @param formals
     *            formal parameters of the callee
     * @param actuals
     *            values passed by the caller, in the same order as the formals
     * @param callerState
     *            state of the caller just before the call
     * @return the new caller state and return value, a reason the pair does not apply, or an invalid access
     */
    public CallResult apply(ProcedureName callee, CodeLocation callLocation, AbductiveState prePost,
                            List<Var> formals, List<AddressAndHistory> actuals, AbductiveState callerState) {
        if (outputLevel >= 2) {
            System.err.println("Applying pre/post for " + callee + " at " + callLocation + ":\n" + prePost);
        }
        try {
            CallState callState;
            try {
                callState = materializePre(callee, callLocation, prePost, formals, actuals, callerState);
            }
            catch (InvalidAccessException e) {
                AccessToInvalidAddress diagnostic = e.getDiagnostic();
                if (outputLevel >= 1) {
                    System.err.println("Call to " + callee + " at " + callLocation + " accesses invalid address: "
                            + diagnostic);
                }
                if (sink != null) {
                    sink.report(diagnostic);
                }
                return CallResult.invalidAccess(callerState, diagnostic);
            }
            if (callState == null) {
                if (outputLevel >= 1) {
                    System.err.println("Arity mismatch calling " + callee + " at " + callLocation + ": "
                            + formals.size() + " formals, " + actuals.size() + " actuals");
                }
                return CallResult.notApplicable(CallResult.Outcome.ARITY_MISMATCH, callerState);
            }
            // the post is walked independently of the pre
            callState.resetVisited();
            Pair<AbductiveState, AddressAndHistory> post = applyPost(callee, callLocation, prePost, formals, actuals,
                                                                     callState);
            if (outputLevel >= 3) {
                System.err.println("State after call to " + callee + ":\n" + post.fst);
            }
            return CallResult.applied(post.fst, post.snd);
        }
        catch (AliasingException e) {
            if (outputLevel >= 1) {
                System.err.println("Pre/post for " + callee + " does not apply at " + callLocation + ": "
                        + e.getMessage());
            }
            return CallResult.notApplicable(CallResult.Outcome.ALIASING, callerState);
        }
    }

    /*
     * Phase 1: match the pre of the callee against the caller state
     */

    /**
     * Walk the pre of the callee together with the caller state, building the translation from callee addresses to
     * caller addresses and growing the caller state with what the pre requires.
     *
     * @return workspace holding the translation and the grown caller state, null if the number of formals and actuals
     *         differ
     * @throws AliasingException
     *             if two distinct callee addresses correspond to the same caller address
     * @throws InvalidAccessException
     *             if the callee requires a caller address to be valid and it is not
     */
    public CallState materializePre(ProcedureName callee, CodeLocation callLocation, AbductiveState prePost,
                                    List<Var> formals, List<AddressAndHistory> actuals, AbductiveState callerState)
                                                                                                                   throws InvalidAccessException {
        if (formals.size() != actuals.size()) {
            return null;
        }
        CallState callState = new CallState(callerState);
        BaseState pre = prePost.getPre();
        for (int i = 0; i < formals.size(); i++) {
            AddressAndHistory formalSlot = pre.getStack().find(formals.get(i));
            if (formalSlot == null) {
                // the callee never read this formal
                continue;
            }
            AddressAndHistory formalPre = pre.getHeap().findEdge(formalSlot.getAddress(), Access.DEREFERENCE);
            if (formalPre == null) {
                continue;
            }
            materializePreFromAddress(callee, callLocation, pre, formalPre.getAddress(), actuals.get(i), callState);
        }
        for (Map.Entry<Var, AddressAndHistory> e : pre.getStack().entrySet()) {
            Var var = e.getKey();
            if (!var.isGlobal()) {
                continue;
            }
            AddressAndHistory global = evalGlobal(callLocation, var, callState);
            materializePreFromAddress(callee, callLocation, pre, e.getValue().getAddress(), global, callState);
        }
        if (outputLevel >= 4) {
            System.err.println("After pre of " + callee + ": " + callState);
        }
        return callState;
    }

    private void materializePreFromAddress(ProcedureName callee, CodeLocation callLocation, BaseState pre,
                                           AbstractAddress addrPre, AddressAndHistory addrHistCaller,
                                           CallState callState) throws InvalidAccessException {
        if (callState.visit(addrPre, addrHistCaller) == CallState.Visit.ALREADY_VISITED) {
            return;
        }
        Cell cellPre = pre.getHeap().findCell(addrPre);
        if (cellPre == null) {
            return;
        }
        Trace<Unit> mustBeValid = cellPre.getAttributes().getMustBeValid();
        if (mustBeValid != null) {
            Trace<Unit> accessTrace = Trace.viaCall(callee, callLocation, addrHistCaller.getHistory(), mustBeValid);
            try {
                callState.setState(callState.getState().checkValid(accessTrace, addrHistCaller.getAddress()));
            }
            catch (InvalidAddressException e) {
                throw new InvalidAccessException(new AccessToInvalidAddress(e.getAddress(), e.getInvalidatedBy(),
                                                                            accessTrace));
            }
        }
        for (Map.Entry<Access, AddressAndHistory> edge : cellPre.getEdges().entrySet()) {
            Pair<AbductiveState, AddressAndHistory> p = callState.getState().evalEdge(addrHistCaller, edge.getKey());
            callState.setState(p.fst);
            materializePreFromAddress(callee, callLocation, pre, edge.getValue().getAddress(), p.snd, callState);
        }
    }

    /**
     * Value of the stack slot of a global in the caller
     */
    private static AddressAndHistory evalGlobal(CodeLocation callLocation, Var global, CallState callState) {
        ValueHistory origin = ValueHistory.of(ValueHistory.VariableEvent.variableAccessed(global, callLocation));
        Pair<AbductiveState, AddressAndHistory> p = callState.getState().eval(origin, global);
        callState.setState(p.fst);
        return p.snd;
    }

    /*
     * Phase 2: replay the post of the callee on the caller
     */

    /**
     * Replay the post of the callee on the caller state held by the workspace. The workspace must hold the translation
     * built by {@link #materializePre} and no visited addresses.
     *
     * @return the new caller state and the value returned by the call, null if the callee returns nothing
     * @throws AliasingException
     *             if two distinct callee addresses correspond to the same caller address
     */
    public Pair<AbductiveState, AddressAndHistory> applyPost(ProcedureName callee, CodeLocation callLocation,
                                                             AbductiveState prePost, List<Var> formals,
                                                             List<AddressAndHistory> actuals, CallState callState) {
        if (formals.size() != actuals.size()) {
            // this was checked when reading the pre
            throw new IllegalStateException("Arity mismatch for " + callee + " after the pre was applied: "
                    + formals.size() + " formals, " + actuals.size() + " actuals");
        }
        // the root of a formal is its value on entry: the callee may have reassigned the formal itself
        BaseState pre = prePost.getPre();
        for (int i = 0; i < formals.size(); i++) {
            AddressAndHistory formalSlot = pre.getStack().find(formals.get(i));
            if (formalSlot == null) {
                continue;
            }
            AddressAndHistory formalPre = pre.getHeap().findEdge(formalSlot.getAddress(), Access.DEREFERENCE);
            if (formalPre == null) {
                continue;
            }
            recordPostForAddress(callee, callLocation, prePost, formalPre.getAddress(), actuals.get(i), callState);
        }
        for (Map.Entry<Var, AddressAndHistory> e : prePost.getPre().getStack().entrySet()) {
            Var var = e.getKey();
            if (!var.isGlobal()) {
                continue;
            }
            AddressAndHistory global = evalGlobal(callLocation, var, callState);
            recordPostForAddress(callee, callLocation, prePost, e.getValue().getAddress(), global, callState);
        }
        AddressAndHistory returnValue = recordPostForReturn(callee, callLocation, prePost, callState);
        recordPostRemainingAttributes(callee, callLocation, prePost, callState);
        return Pair.make(callState.getState(), returnValue);
    }

    private void recordPostForAddress(ProcedureName callee, CodeLocation callLocation, AbductiveState prePost,
                                      AbstractAddress addrCallee, AddressAndHistory addrHistCaller,
                                      CallState callState) {
        if (callState.visit(addrCallee, addrHistCaller) == CallState.Visit.ALREADY_VISITED) {
            return;
        }
        Cell cellPost = prePost.getPost().getHeap().findCell(addrCallee);
        if (cellPost == null) {
            return;
        }
        Cell cellPre = prePost.getPre().getHeap().findCell(addrCallee);
        if (!isCellReadOnly(addrCallee, cellPre, cellPost)) {
            recordPostCell(callee, callLocation, cellPre, cellPost, addrHistCaller, callState);
        }
        for (Map.Entry<Access, AddressAndHistory> edge : cellPost.getEdges().entrySet()) {
            AddressAndHistory destCaller = callState.substFindOrNew(edge.getValue().getAddress(),
                                                                    addrHistCaller.getHistory());
            recordPostForAddress(callee, callLocation, prePost, edge.getValue().getAddress(), destCaller, callState);
        }
    }

    /**
     * A cell is read-only if it was in the pre, no fact of the post records a modification, and the edges point to the
     * same addresses before and after.
     */
    private boolean isCellReadOnly(AbstractAddress addrCallee, Cell cellPre, Cell cellPost) {
        if (cellPre == null || cellPost.getAttributes().isModified()) {
            return false;
        }
        boolean unchanged = cellPre.getEdges().equalsModuloHistories(cellPost.getEdges());
        if (!unchanged && strictReadOnly) {
            throw new IllegalStateException("Edges of " + addrCallee + " changed without a recorded modification: "
                    + cellPre + " became " + cellPost);
        }
        return unchanged;
    }

    /**
     * Replace the caller cell for a callee cell that may have been modified by the call
     */
    private void recordPostCell(ProcedureName callee, CodeLocation callLocation, Cell cellPre, Cell cellPost,
                                AddressAndHistory addrHistCaller, CallState callState) {
        AbstractAddress addrCaller = addrHistCaller.getAddress();
        ValueHistory histCaller = addrHistCaller.getHistory();
        if (outputLevel >= 3) {
            System.err.println("\tRewriting " + addrCaller + " with " + cellPost);
        }
        BaseState post = callState.getState().getPost();
        BaseHeap heap = post.getHeap();

        // edges the callee knew about are replaced wholesale, the others are kept
        Edges oldEdges = heap.findEdges(addrCaller);
        if (oldEdges == null) {
            oldEdges = Edges.EMPTY;
        }
        Edges kept = cellPre == null ? oldEdges : oldEdges.removeAll(cellPre.getEdges());

        Edges translatedPost = Edges.EMPTY;
        for (Map.Entry<Access, AddressAndHistory> e : cellPost.getEdges().entrySet()) {
            AddressAndHistory destCaller = callState.substFindOrNew(e.getValue().getAddress(), histCaller);
            ValueHistory hist = destCaller.getHistory().prepend(new ValueHistory.Call(callee, callLocation,
                                                                                      e.getValue().getHistory()));
            translatedPost = translatedPost.put(e.getKey(), destCaller.withHistory(hist));
        }

        Attributes oldAttrs = heap.findAttributes(addrCaller);
        Attributes calleeAttrs = translateAttributes(callee, callLocation, histCaller, cellPost.getAttributes());
        Attributes newAttrs = oldAttrs == null ? calleeAttrs : oldAttrs.addAll(calleeAttrs);

        Trace<Unit> inCall = newAttrs.getWrittenTo();
        if (inCall == null) {
            inCall = Trace.immediate(Unit.VALUE, callLocation, ValueHistory.EMPTY);
        }
        Attribute written = Attribute.writtenTo(Trace.viaCall(callee, callLocation, histCaller, inCall));

        heap = heap.setEdges(addrCaller, kept.union(translatedPost)).setAttributes(addrCaller, newAttrs.add(written));
        callState.setState(callState.getState().update(null, post.update(null, heap)));
    }

    /**
     * Find the value returned by the callee and replay the post from it
     *
     * @return caller value returned by the call, null if the callee returns nothing
     */
    private AddressAndHistory recordPostForReturn(ProcedureName callee, CodeLocation callLocation,
                                                  AbductiveState prePost, CallState callState) {
        BaseState post = prePost.getPost();
        AddressAndHistory returnSlot = post.getStack().find(Var.ofReturn(callee));
        if (returnSlot == null) {
            return null;
        }
        AddressAndHistory returnCallee = post.getHeap().findEdge(returnSlot.getAddress(), Access.DEREFERENCE);
        if (returnCallee == null) {
            return null;
        }
        AddressAndHistory returnCaller = callState.findSubst(returnCallee.getAddress());
        if (returnCaller == null) {
            returnCaller = new AddressAndHistory(AbstractAddress.mkFresh(), ValueHistory.EMPTY);
        }
        recordPostForAddress(callee, callLocation, prePost, returnCallee.getAddress(), returnCaller, callState);
        return returnCaller;
    }

    /**
     * Copy the facts of callee addresses that are known in the caller but were not reached from the formals, globals or
     * return value
     */
    private void recordPostRemainingAttributes(ProcedureName callee, CodeLocation callLocation,
                                               AbductiveState prePost, CallState callState) {
        for (Map.Entry<AbstractAddress, Attributes> e : prePost.getPost().getHeap().getAttributesMap().entrySet()) {
            AbstractAddress addrCallee = e.getKey();
            if (callState.isVisited(addrCallee)) {
                continue;
            }
            AddressAndHistory addrHistCaller = callState.findSubst(addrCallee);
            if (addrHistCaller == null) {
                continue;
            }
            Attributes translated = translateAttributes(callee, callLocation, addrHistCaller.getHistory(),
                                                        e.getValue());
            if (translated.isEmpty()) {
                continue;
            }
            BaseState post = callState.getState().getPost();
            BaseHeap heap = post.getHeap();
            Attributes old = heap.findAttributes(addrHistCaller.getAddress());
            Attributes merged = old == null ? translated : old.addAll(translated);
            if (merged.equals(old)) {
                continue;
            }
            heap = heap.setAttributes(addrHistCaller.getAddress(), merged);
            callState.setState(callState.getState().update(null, post.update(null, heap)));
        }
    }

    /**
     * Translate the facts of a callee address into facts of the corresponding caller address. Traces explaining
     * invalidity and validity requirements are wrapped so that they blame the call, facts about the callee's own stack
     * frame and temporaries are dropped, and the others carry over unchanged.
     */
    static Attributes translateAttributes(final ProcedureName callee, final CodeLocation callLocation,
                                          final ValueHistory callerHistory, Attributes attrs) {
        return attrs.map(new Attributes.AttributeTranslator() {
            @Override
            public Attribute translate(Attribute attr) {
                switch (attr.getKind()) {
                case INVALID:
                    return Attribute.invalid(Trace.viaCall(callee, callLocation, callerHistory,
                                                           attr.getInvalidation()));
                case MUST_BE_VALID:
                    return Attribute.mustBeValid(Trace.viaCall(callee, callLocation, callerHistory, attr.getTrace()));
                case ALLOCATED:
                case CLOSURE:
                case CONSTANT:
                case WRITTEN_TO:
                    return attr;
                case ADDRESS_OF_CPP_TEMPORARY:
                case ADDRESS_OF_STACK_VARIABLE:
                case STD_VECTOR_RESERVE:
                    return null;
                }
                throw new IllegalArgumentException("Unknown attribute kind " + attr.getKind());
            }
        });
    }
}
