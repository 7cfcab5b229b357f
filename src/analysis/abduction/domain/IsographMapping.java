package analysis.abduction.domain;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structure-preserving partial bijection between the addresses of two abstract states, the "left" and the "right" one.
 * Used to compare states that were built with different fresh addresses.
 */
public final class IsographMapping {

    /**
     * Mapping with no pairs
     */
    public static final IsographMapping EMPTY = new IsographMapping(Collections.<AbstractAddress, AbstractAddress> emptyMap(),
                                                                    Collections.<AbstractAddress, AbstractAddress> emptyMap());

    private final Map<AbstractAddress, AbstractAddress> lhsToRhs;
    private final Map<AbstractAddress, AbstractAddress> rhsToLhs;

    private IsographMapping(Map<AbstractAddress, AbstractAddress> lhsToRhs,
                            Map<AbstractAddress, AbstractAddress> rhsToLhs) {
        this.lhsToRhs = lhsToRhs;
        this.rhsToLhs = rhsToLhs;
    }

    /**
     * Same pairs with the sides swapped
     */
    public IsographMapping inverse() {
        return new IsographMapping(rhsToLhs, lhsToRhs);
    }

    /**
     * @return the right address paired with the given left address, null if there is none
     */
    public AbstractAddress getRhs(AbstractAddress lhs) {
        return lhsToRhs.get(lhs);
    }

    /**
     * @return the left address paired with the given right address, null if there is none
     */
    public AbstractAddress getLhs(AbstractAddress rhs) {
        return rhsToLhs.get(rhs);
    }

    public int size() {
        return lhsToRhs.size();
    }

    /**
     * Extend the given mapping so that it relates the parts of <code>lhs</code> and <code>rhs</code> reachable from
     * their stacks. Both stacks must bind the same variables, related cells must have the same facts and the same edge
     * labels, and the mapping must stay injective in both directions.
     *
     * @param initial
     *            pairs already related
     * @param lhs
     *            left state
     * @param rhs
     *            right state
     * @return the extended mapping, or null if the states are not isomorphic up to that mapping
     */
    public static IsographMapping map(IsographMapping initial, BaseState lhs, BaseState rhs) {
        if (lhs.getStack().size() != rhs.getStack().size()) {
            return null;
        }
        Map<AbstractAddress, AbstractAddress> l2r = new LinkedHashMap<>(initial.lhsToRhs);
        Map<AbstractAddress, AbstractAddress> r2l = new LinkedHashMap<>(initial.rhsToLhs);

        // pairs of (lhs address, rhs address) still to relate
        Deque<AbstractAddress[]> work = new ArrayDeque<>();
        for (Map.Entry<Var, AddressAndHistory> e : lhs.getStack().entrySet()) {
            AddressAndHistory rhsValue = rhs.getStack().find(e.getKey());
            if (rhsValue == null) {
                return null;
            }
            work.push(new AbstractAddress[] { e.getValue().getAddress(), rhsValue.getAddress() });
        }

        while (!work.isEmpty()) {
            AbstractAddress[] pair = work.pop();
            AbstractAddress addrLhs = pair[0];
            AbstractAddress addrRhs = pair[1];
            AbstractAddress previous = l2r.get(addrLhs);
            if (previous != null) {
                if (previous.equals(addrRhs)) {
                    continue;
                }
                return null;
            }
            if (r2l.containsKey(addrRhs)) {
                return null;
            }
            l2r.put(addrLhs, addrRhs);
            r2l.put(addrRhs, addrLhs);

            Cell cellLhs = nonEmptyCell(lhs.getHeap(), addrLhs);
            Cell cellRhs = nonEmptyCell(rhs.getHeap(), addrRhs);
            if (cellLhs == null && cellRhs == null) {
                continue;
            }
            if (cellLhs == null || cellRhs == null) {
                return null;
            }
            if (!cellLhs.getAttributes().equals(cellRhs.getAttributes())) {
                return null;
            }
            Edges edgesLhs = cellLhs.getEdges();
            Edges edgesRhs = cellRhs.getEdges();
            if (edgesLhs.size() != edgesRhs.size()) {
                return null;
            }
            for (Map.Entry<Access, AddressAndHistory> edge : edgesLhs.entrySet()) {
                AddressAndHistory destRhs = edgesRhs.get(edge.getKey());
                if (destRhs == null) {
                    return null;
                }
                work.push(new AbstractAddress[] { edge.getValue().getAddress(), destRhs.getAddress() });
            }
        }
        return new IsographMapping(l2r, r2l);
    }

    /**
     * Are the two states isomorphic up to the given mapping, i.e., does {@link #map(IsographMapping, BaseState,
     * BaseState)} succeed and relate every non-empty cell of both heaps
     *
     * @param initial
     *            pairs already related
     * @param lhs
     *            left state
     * @param rhs
     *            right state
     * @return true if the states are isomorphic
     */
    public static boolean isIsograph(IsographMapping initial, BaseState lhs, BaseState rhs) {
        IsographMapping m = map(initial, lhs, rhs);
        if (m == null) {
            return false;
        }
        for (AbstractAddress a : lhs.getHeap().getAddresses()) {
            if (!m.lhsToRhs.containsKey(a) && nonEmptyCell(lhs.getHeap(), a) != null) {
                return false;
            }
        }
        for (AbstractAddress a : rhs.getHeap().getAddresses()) {
            if (!m.rhsToLhs.containsKey(a) && nonEmptyCell(rhs.getHeap(), a) != null) {
                return false;
            }
        }
        return true;
    }

    private static Cell nonEmptyCell(BaseHeap heap, AbstractAddress address) {
        Cell c = heap.findCell(address);
        return c == null || c.isEmpty() ? null : c;
    }

    @Override
    public String toString() {
        return lhsToRhs.toString();
    }
}
