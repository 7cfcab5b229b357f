package analysis.abduction.interproc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import analysis.abduction.domain.AbductiveState;
import analysis.abduction.domain.AbstractAddress;
import analysis.abduction.domain.AddressAndHistory;
import analysis.abduction.domain.ValueHistory;

import com.ibm.wala.util.intset.MutableIntSet;
import com.ibm.wala.util.intset.MutableSparseIntSet;

/**
 * Workspace for applying one pre/post pair at one call site. This is mutable: it only lives for the duration of one
 * call to {@link PrePostApplier#apply} and only the caller state computed in it survives.
 */
public final class CallState {

    /**
     * Result of {@link CallState#visit(AbstractAddress, AddressAndHistory)}
     */
    public enum Visit {
        ALREADY_VISITED, NOT_ALREADY_VISITED
    }

    /**
     * Caller state computed so far
     */
    private AbductiveState state;
    /**
     * Translation from callee addresses to caller addresses and their caller histories
     */
    private final Map<AbstractAddress, AddressAndHistory> subst = new LinkedHashMap<>();
    /**
     * Inverse of {@link #subst}, from caller addresses to callee addresses
     */
    private final Map<AbstractAddress, AbstractAddress> revSubst = new LinkedHashMap<>();
    /**
     * Callee addresses already visited by the current traversal. This is not always the domain of {@link #revSubst}:
     * it is reset between reading the pre and applying the post.
     */
    private MutableIntSet visited = MutableSparseIntSet.makeEmpty();

    public CallState(AbductiveState state) {
        this.state = state;
    }

    public AbductiveState getState() {
        return state;
    }

    public void setState(AbductiveState state) {
        assert state != null;
        this.state = state;
    }

    /**
     * Relate a callee address to a caller address, unless the callee address was already visited
     *
     * @param addrCallee
     *            address in the pre/post
     * @param addrHistCaller
     *            value in the caller
     * @return whether the callee address had already been visited
     * @throws AliasingException
     *             if the caller address is already related to a different callee address
     */
    public Visit visit(AbstractAddress addrCallee, AddressAndHistory addrHistCaller) {
        AbstractAddress addrCaller = addrHistCaller.getAddress();
        AbstractAddress boundTo = revSubst.get(addrCaller);
        if (boundTo != null && !boundTo.equals(addrCallee)) {
            throw new AliasingException(addrCaller, boundTo, addrCallee);
        }
        if (!visited.add(addrCallee.getId())) {
            return Visit.ALREADY_VISITED;
        }
        subst.put(addrCallee, addrHistCaller);
        revSubst.put(addrCaller, addrCallee);
        return Visit.NOT_ALREADY_VISITED;
    }

    public boolean isVisited(AbstractAddress addrCallee) {
        return visited.contains(addrCallee.getId());
    }

    /**
     * Start a new, independent traversal
     */
    public void resetVisited() {
        visited = MutableSparseIntSet.makeEmpty();
    }

    /**
     * @return caller value for the callee address, null if there is none yet
     */
    public AddressAndHistory findSubst(AbstractAddress addrCallee) {
        return subst.get(addrCallee);
    }

    /**
     * Get the caller value for a callee address, making up a fresh caller address if there is none yet
     *
     * @param addrCallee
     *            address in the pre/post
     * @param defaultHistCaller
     *            history of the value if it is fresh
     * @return caller value
     */
    public AddressAndHistory substFindOrNew(AbstractAddress addrCallee, ValueHistory defaultHistCaller) {
        AddressAndHistory addrHistCaller = subst.get(addrCallee);
        if (addrHistCaller == null) {
            addrHistCaller = new AddressAndHistory(AbstractAddress.mkFresh(), defaultHistCaller);
            subst.put(addrCallee, addrHistCaller);
        }
        return addrHistCaller;
    }

    /**
     * @return unmodifiable view of the translation from callee to caller addresses
     */
    public Map<AbstractAddress, AddressAndHistory> getSubst() {
        return Collections.unmodifiableMap(subst);
    }

    /**
     * @return unmodifiable view of the translation from caller to callee addresses
     */
    public Map<AbstractAddress, AbstractAddress> getRevSubst() {
        return Collections.unmodifiableMap(revSubst);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("{ astate=").append(state).append(";\n");
        sb.append("  subst=").append(subst).append(";\n");
        sb.append("  rev_subst=").append(revSubst).append(";\n");
        sb.append("  visited=").append(visited).append(" }");
        return sb.toString();
    }
}
