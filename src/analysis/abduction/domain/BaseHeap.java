package analysis.abduction.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.ibm.wala.util.intset.IntSet;

/**
 * Immutable abstract heap: a map from addresses to outgoing edges and a map from addresses to facts. An address has a
 * cell if either map has an entry for it. Every update returns the receiver when nothing changed, so callers can detect
 * no-ops with <code>==</code>.
 */
public final class BaseHeap {

    /**
     * Heap with no cells
     */
    public static final BaseHeap EMPTY = new BaseHeap(Collections.<AbstractAddress, Edges> emptyMap(),
                                                      Collections.<AbstractAddress, Attributes> emptyMap());

    /**
     * Outgoing edges of each registered address
     */
    private final Map<AbstractAddress, Edges> edgesMap;
    /**
     * Facts about each address
     */
    private final Map<AbstractAddress, Attributes> attrsMap;

    private BaseHeap(Map<AbstractAddress, Edges> edgesMap, Map<AbstractAddress, Attributes> attrsMap) {
        this.edgesMap = edgesMap;
        this.attrsMap = attrsMap;
    }

    private BaseHeap withEdgesMap(Map<AbstractAddress, Edges> newEdgesMap) {
        return new BaseHeap(newEdgesMap, attrsMap);
    }

    private BaseHeap withAttrsMap(Map<AbstractAddress, Attributes> newAttrsMap) {
        return new BaseHeap(edgesMap, newAttrsMap);
    }

    /**
     * Get the cell for the given address
     *
     * @param address
     *            address to look up
     * @return the cell, null if the address has neither edges nor facts
     */
    public Cell findCell(AbstractAddress address) {
        Edges edges = edgesMap.get(address);
        Attributes attrs = attrsMap.get(address);
        if (edges == null && attrs == null) {
            return null;
        }
        return new Cell(edges == null ? Edges.EMPTY : edges, attrs == null ? Attributes.EMPTY : attrs);
    }

    /**
     * @return edges of the address, null if it is not registered
     */
    public Edges findEdges(AbstractAddress address) {
        return edgesMap.get(address);
    }

    /**
     * @return destination of the edge from the address, null if there is no such edge
     */
    public AddressAndHistory findEdge(AbstractAddress address, Access access) {
        Edges edges = edgesMap.get(address);
        return edges == null ? null : edges.get(access);
    }

    /**
     * @return facts about the address, null if there are none
     */
    public Attributes findAttributes(AbstractAddress address) {
        return attrsMap.get(address);
    }

    /**
     * Is the address registered, i.e., does it have a (possibly empty) edge map
     */
    public boolean hasEdges(AbstractAddress address) {
        return edgesMap.containsKey(address);
    }

    /**
     * Make sure the address has a (possibly empty) edge map
     */
    public BaseHeap registerAddress(AbstractAddress address) {
        if (edgesMap.containsKey(address)) {
            return this;
        }
        return setEdges(address, Edges.EMPTY);
    }

    public BaseHeap addEdge(AbstractAddress address, Access access, AddressAndHistory dest) {
        Edges old = edgesMap.get(address);
        Edges newEdges = (old == null ? Edges.EMPTY : old).put(access, dest);
        if (newEdges == old) {
            return this;
        }
        return setEdges(address, newEdges);
    }

    public BaseHeap removeEdge(AbstractAddress address, Access access) {
        Edges old = edgesMap.get(address);
        if (old == null) {
            return this;
        }
        return setEdges(address, old.remove(access));
    }

    /**
     * Replace the edges of the address
     */
    public BaseHeap setEdges(AbstractAddress address, Edges edges) {
        assert edges != null;
        if (edges == edgesMap.get(address)) {
            return this;
        }
        Map<AbstractAddress, Edges> newEdgesMap = new LinkedHashMap<>(edgesMap);
        newEdgesMap.put(address, edges);
        return withEdgesMap(newEdgesMap);
    }

    /**
     * Replace the facts about the address
     */
    public BaseHeap setAttributes(AbstractAddress address, Attributes attrs) {
        assert attrs != null;
        Attributes old = attrsMap.get(address);
        if (attrs == old || (old == null && attrs.isEmpty())) {
            return this;
        }
        Map<AbstractAddress, Attributes> newAttrsMap = new LinkedHashMap<>(attrsMap);
        newAttrsMap.put(address, attrs);
        return withAttrsMap(newAttrsMap);
    }

    /**
     * Add a fact about the address, replacing any fact with the same tag
     */
    public BaseHeap addAttribute(AbstractAddress address, Attribute attr) {
        Attributes old = attrsMap.get(address);
        return setAttributes(address, (old == null ? Attributes.EMPTY : old).add(attr));
    }

    /**
     * Replace both the edges and the facts of the address
     */
    public BaseHeap setCell(AbstractAddress address, Cell cell) {
        return setEdges(address, cell.getEdges()).setAttributes(address, cell.getAttributes());
    }

    /**
     * Record that the address was invalidated
     *
     * @param addrHist
     *            the address and its history
     * @param invalidation
     *            cause
     * @param location
     *            where it was invalidated
     */
    public BaseHeap invalidate(AddressAndHistory addrHist, Invalidation invalidation, CodeLocation location) {
        Trace<Invalidation> trace = Trace.immediate(invalidation, location, addrHist.getHistory());
        return addAttribute(addrHist.getAddress(), Attribute.invalid(trace));
    }

    /**
     * Check whether the address is valid
     *
     * @return the trace of the invalidation, or null if the address is not known to be invalid
     */
    public Trace<Invalidation> getInvalidation(AbstractAddress address) {
        Attributes attrs = attrsMap.get(address);
        return attrs == null ? null : attrs.getInvalid();
    }

    public String getConstant(AbstractAddress address) {
        Attributes attrs = attrsMap.get(address);
        return attrs == null ? null : attrs.getConstant();
    }

    public ProcedureName getClosureProcName(AbstractAddress address) {
        Attributes attrs = attrsMap.get(address);
        return attrs == null ? null : attrs.getClosureProcName();
    }

    public BaseHeap stdVectorReserve(AbstractAddress address) {
        return addAttribute(address, Attribute.stdVectorReserve());
    }

    public boolean isStdVectorReserved(AbstractAddress address) {
        Attributes attrs = attrsMap.get(address);
        return attrs != null && attrs.isStdVectorReserved();
    }

    /**
     * Keep only the cells of addresses satisfying the filter
     *
     * @param filter
     *            which addresses to keep
     * @return new heap, or this if every address is kept
     */
    public BaseHeap filter(AddressFilter filter) {
        Map<AbstractAddress, Edges> newEdgesMap = new LinkedHashMap<>();
        for (Map.Entry<AbstractAddress, Edges> e : edgesMap.entrySet()) {
            if (filter.keep(e.getKey())) {
                newEdgesMap.put(e.getKey(), e.getValue());
            }
        }
        Map<AbstractAddress, Attributes> newAttrsMap = new LinkedHashMap<>();
        for (Map.Entry<AbstractAddress, Attributes> e : attrsMap.entrySet()) {
            if (filter.keep(e.getKey())) {
                newAttrsMap.put(e.getKey(), e.getValue());
            }
        }
        if (newEdgesMap.size() == edgesMap.size() && newAttrsMap.size() == attrsMap.size()) {
            return this;
        }
        return new BaseHeap(newEdgesMap, newAttrsMap);
    }

    /**
     * Keep only the cells of the addresses in the given set
     *
     * @param addresses
     *            ids of the addresses to keep
     * @return new heap, or this if every address is kept
     */
    public BaseHeap restrictTo(final IntSet addresses) {
        return filter(new AddressFilter() {
            @Override
            public boolean keep(AbstractAddress address) {
                return addresses.contains(address.getId());
            }
        });
    }

    /**
     * Keep only the edge maps satisfying the filter, facts are untouched
     *
     * @param filter
     *            which edge maps to keep
     * @return new heap, or this if every edge map is kept
     */
    public BaseHeap filterEdges(EdgesFilter filter) {
        Map<AbstractAddress, Edges> newEdgesMap = new LinkedHashMap<>();
        for (Map.Entry<AbstractAddress, Edges> e : edgesMap.entrySet()) {
            if (filter.keep(e.getKey(), e.getValue())) {
                newEdgesMap.put(e.getKey(), e.getValue());
            }
        }
        if (newEdgesMap.size() == edgesMap.size()) {
            return this;
        }
        return withEdgesMap(newEdgesMap);
    }

    /**
     * @return unmodifiable view of the edge maps
     */
    public Map<AbstractAddress, Edges> getEdgesMap() {
        return Collections.unmodifiableMap(edgesMap);
    }

    /**
     * @return unmodifiable view of the facts
     */
    public Map<AbstractAddress, Attributes> getAttributesMap() {
        return Collections.unmodifiableMap(attrsMap);
    }

    /**
     * @return every address that has a cell
     */
    public Set<AbstractAddress> getAddresses() {
        Set<AbstractAddress> s = new LinkedHashSet<>(edgesMap.keySet());
        s.addAll(attrsMap.keySet());
        return s;
    }

    public boolean isEmpty() {
        return edgesMap.isEmpty() && attrsMap.isEmpty();
    }

    @Override
    public int hashCode() {
        return 31 * edgesMap.hashCode() + attrsMap.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof BaseHeap)) {
            return false;
        }
        BaseHeap other = (BaseHeap) obj;
        return edgesMap.equals(other.edgesMap) && attrsMap.equals(other.attrsMap);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (AbstractAddress a : getAddresses()) {
            sb.append(a).append(" -> ").append(findCell(a)).append("\n");
        }
        return sb.toString();
    }

    /**
     * Selects addresses for {@link BaseHeap#filter(AddressFilter)}
     */
    public interface AddressFilter {
        boolean keep(AbstractAddress address);
    }

    /**
     * Selects edge maps for {@link BaseHeap#filterEdges(EdgesFilter)}
     */
    public interface EdgesFilter {
        boolean keep(AbstractAddress address, Edges edges);
    }
}
