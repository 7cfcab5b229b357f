package analysis.abduction.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable map from edge labels to destination values for one heap cell. Updates that do not change the map return
 * the receiver.
 */
public final class Edges {

    /**
     * Cell with no outgoing edges
     */
    public static final Edges EMPTY = new Edges(Collections.<Access, AddressAndHistory> emptyMap());

    private final Map<Access, AddressAndHistory> edges;

    private Edges(Map<Access, AddressAndHistory> edges) {
        this.edges = edges;
    }

    /**
     * Get the destination of the edge with the given label
     *
     * @return destination or null if there is no such edge
     */
    public AddressAndHistory get(Access access) {
        return edges.get(access);
    }

    public boolean containsKey(Access access) {
        return edges.containsKey(access);
    }

    /**
     * Add or replace an edge
     *
     * @return new edges, or this if the edge was already present
     */
    public Edges put(Access access, AddressAndHistory dest) {
        assert access != null && dest != null;
        if (dest.equals(edges.get(access))) {
            return this;
        }
        Map<Access, AddressAndHistory> newEdges = new LinkedHashMap<>(edges);
        newEdges.put(access, dest);
        return new Edges(newEdges);
    }

    /**
     * Remove the edge with the given label
     *
     * @return new edges, or this if there was no such edge
     */
    public Edges remove(Access access) {
        if (!edges.containsKey(access)) {
            return this;
        }
        Map<Access, AddressAndHistory> newEdges = new LinkedHashMap<>(edges);
        newEdges.remove(access);
        return newEdges.isEmpty() ? EMPTY : new Edges(newEdges);
    }

    /**
     * Remove every edge whose label is also a label in the given edges
     *
     * @param other
     *            edges whose labels are removed
     * @return new edges, or this if no label is shared
     */
    public Edges removeAll(Edges other) {
        Edges result = this;
        for (Access a : other.edges.keySet()) {
            result = result.remove(a);
        }
        return result;
    }

    /**
     * Union of this and the given edges, the given edges win when both have the same label
     *
     * @param overriding
     *            edges taking precedence
     * @return new edges, or this if nothing changed
     */
    public Edges union(Edges overriding) {
        Edges result = this;
        for (Map.Entry<Access, AddressAndHistory> e : overriding.edges.entrySet()) {
            result = result.put(e.getKey(), e.getValue());
        }
        return result;
    }

    /**
     * Do both edge maps have the same labels pointing to the same destination addresses (histories are ignored)
     *
     * @param other
     *            edges to compare to
     * @return true if the edges agree on labels and destination addresses
     */
    public boolean equalsModuloHistories(Edges other) {
        if (edges.size() != other.edges.size()) {
            return false;
        }
        for (Map.Entry<Access, AddressAndHistory> e : edges.entrySet()) {
            AddressAndHistory otherDest = other.edges.get(e.getKey());
            if (otherDest == null || !otherDest.getAddress().equals(e.getValue().getAddress())) {
                return false;
            }
        }
        return true;
    }

    public boolean isEmpty() {
        return edges.isEmpty();
    }

    public int size() {
        return edges.size();
    }

    public Set<Access> accesses() {
        return Collections.unmodifiableSet(edges.keySet());
    }

    /**
     * @return unmodifiable view of the edges
     */
    public Set<Map.Entry<Access, AddressAndHistory>> entrySet() {
        return Collections.unmodifiableMap(edges).entrySet();
    }

    @Override
    public int hashCode() {
        return edges.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Edges)) {
            return false;
        }
        return edges.equals(((Edges) obj).edges);
    }

    @Override
    public String toString() {
        return edges.toString();
    }
}
