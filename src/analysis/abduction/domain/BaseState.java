package analysis.abduction.domain;

import java.io.Writer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

import org.json.JSONException;
import org.json.JSONObject;

import analysis.abduction.serialization.JSONSerializable;
import analysis.abduction.serialization.JSONUtil;

import com.ibm.wala.util.intset.IntSet;
import com.ibm.wala.util.intset.MutableIntSet;
import com.ibm.wala.util.intset.MutableSparseIntSet;

/**
 * Abstract memory: a stack and a heap. Used both for the postcondition at the current program point and, ordered the
 * other way around, for the inferred precondition (see {@link AbductiveState}).
 */
public final class BaseState implements AbstractValue<BaseState>, JSONSerializable {

    /**
     * State with no variables and no cells
     */
    public static final BaseState EMPTY = new BaseState(BaseStack.EMPTY, BaseHeap.EMPTY);

    private final BaseStack stack;
    private final BaseHeap heap;

    private BaseState(BaseStack stack, BaseHeap heap) {
        this.stack = stack;
        this.heap = heap;
    }

    public static BaseState make(BaseStack stack, BaseHeap heap) {
        assert stack != null && heap != null;
        if (stack == BaseStack.EMPTY && heap == BaseHeap.EMPTY) {
            return EMPTY;
        }
        return new BaseState(stack, heap);
    }

    /**
     * Replace the stack, the heap, or both
     *
     * @param newStack
     *            new stack, null to keep the current one
     * @param newHeap
     *            new heap, null to keep the current one
     * @return new state, or this if both are identical to the current ones
     */
    public BaseState update(BaseStack newStack, BaseHeap newHeap) {
        BaseStack s = newStack == null ? stack : newStack;
        BaseHeap h = newHeap == null ? heap : newHeap;
        if (s == stack && h == heap) {
            return this;
        }
        return new BaseState(s, h);
    }

    public BaseStack getStack() {
        return stack;
    }

    public BaseHeap getHeap() {
        return heap;
    }

    /**
     * Compute the addresses reachable from the stack by following edges. Addresses used as array indices on the way
     * are reachable too.
     *
     * @return ids of the reachable addresses
     */
    public IntSet reachableAddresses() {
        MutableIntSet visited = MutableSparseIntSet.makeEmpty();
        Deque<AbstractAddress> work = new ArrayDeque<>();
        for (AddressAndHistory v : stack.values()) {
            work.push(v.getAddress());
        }
        while (!work.isEmpty()) {
            AbstractAddress a = work.pop();
            if (!visited.add(a.getId())) {
                continue;
            }
            Edges edges = heap.findEdges(a);
            if (edges == null) {
                continue;
            }
            for (Map.Entry<Access, AddressAndHistory> e : edges.entrySet()) {
                if (e.getKey().getKind() == Access.Kind.ARRAY_ACCESS) {
                    work.push(e.getKey().getIndex());
                }
                work.push(e.getValue().getAddress());
            }
        }
        return visited;
    }

    /**
     * States are ordered by isomorphism: this is below that if they are the same up to renaming of addresses
     */
    @Override
    public boolean leq(BaseState that) {
        return IsographMapping.isIsograph(IsographMapping.EMPTY, this, that);
    }

    @Override
    public boolean isBottom() {
        return stack.isEmpty() && heap.isEmpty();
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
        return 31 * stack.hashCode() + heap.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof BaseState)) {
            return false;
        }
        BaseState other = (BaseState) obj;
        return stack.equals(other.stack) && heap.equals(other.heap);
    }

    @Override
    public String toString() {
        return "roots=" + stack + "\nmem=\n" + heap;
    }
}
