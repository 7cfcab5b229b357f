package analysis.abduction.summary;

import java.util.Map;

import analysis.abduction.domain.AbductiveState;
import analysis.abduction.domain.AbstractAddress;
import analysis.abduction.domain.AddressAndHistory;
import analysis.abduction.domain.Attribute;
import analysis.abduction.domain.Attributes;
import analysis.abduction.domain.BaseHeap;
import analysis.abduction.domain.BaseStack;
import analysis.abduction.domain.BaseState;
import analysis.abduction.domain.Edges;
import analysis.abduction.domain.Invalidation;
import analysis.abduction.domain.ProcedureDescription;
import analysis.abduction.domain.Trace;
import analysis.abduction.domain.Var;

/**
 * Turns the abstract state reached at the exit of a procedure into a summary that can be applied at call sites
 */
public final class SummaryFinalizer {

    private SummaryFinalizer() {
        // Only static methods
    }

    /**
     * Make a summary from the state at the exit of a procedure: drop what callers cannot see, garbage collect, and
     * mark the addresses of locals that escape as invalid.
     *
     * @param proc
     *            procedure being summarized
     * @param state
     *            state at the exit of the procedure
     * @return summary
     */
    public static AbductiveState ofPost(ProcedureDescription proc, AbductiveState state) {
        AbductiveState summary = filterForSummary(state);
        summary = summary.discardUnreachable();
        return invalidateLocals(proc, summary);
    }

    /**
     * Remove the variables of the post that the caller will never see (locals and compiler temporaries) and the empty
     * edge maps of both the pre and the post
     *
     * @param state
     *            state to filter
     * @return filtered state
     */
    public static AbductiveState filterForSummary(final AbductiveState state) {
        BaseStack postStack = state.getPost().getStack().filter(new BaseStack.BindingFilter() {
            @Override
            public boolean keep(Var var, AddressAndHistory value) {
                return var.appearsInSourceCode() && !state.isLocal(var);
            }
        });
        BaseHeap.EdgesFilter nonEmpty = new BaseHeap.EdgesFilter() {
            @Override
            public boolean keep(AbstractAddress address, Edges edges) {
                return !edges.isEmpty();
            }
        };
        BaseState pre = state.getPre();
        BaseState post = state.getPost();
        return state.update(pre.update(null, pre.getHeap().filterEdges(nonEmpty)),
                            post.update(postStack, post.getHeap().filterEdges(nonEmpty)));
    }

    /**
     * Drop cells unreachable from the stacks
     *
     * @param state
     *            state to collect
     * @return collected state
     */
    public static AbductiveState discardUnreachable(AbductiveState state) {
        return state.discardUnreachable();
    }

    /**
     * Mark as invalid the addresses of the locals of the procedure that are still in the post, they have gone out of
     * scope once the procedure returns.
     *
     * @param proc
     *            procedure being summarized
     * @param state
     *            state at the exit of the procedure
     * @return new state
     */
    public static AbductiveState invalidateLocals(ProcedureDescription proc, AbductiveState state) {
        BaseState post = state.getPost();
        BaseHeap heap = post.getHeap();
        for (Map.Entry<AbstractAddress, Attributes> e : post.getHeap().getAttributesMap().entrySet()) {
            Attribute addressOf = e.getValue().getAddressOfStackVariable();
            if (addressOf == null) {
                continue;
            }
            Var var = addressOf.getVar();
            if (!var.isProgramVar()) {
                continue;
            }
            String type = proc.getLocalType(var);
            if (type == null) {
                continue;
            }
            Trace<Invalidation> gone = Trace.immediate(Invalidation.goneOutOfScope(var, type),
                                                       addressOf.getLocation(), addressOf.getHistory());
            heap = heap.addAttribute(e.getKey(), Attribute.invalid(gone));
        }
        if (heap == post.getHeap()) {
            return state;
        }
        return state.update(null, post.update(null, heap));
    }
}
