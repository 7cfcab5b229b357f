package analysis.abduction.domain;

/**
 * Contents of the heap at one address: outgoing edges and facts
 */
public final class Cell {

    private final Edges edges;
    private final Attributes attributes;

    public Cell(Edges edges, Attributes attributes) {
        assert edges != null && attributes != null;
        this.edges = edges;
        this.attributes = attributes;
    }

    public Edges getEdges() {
        return edges;
    }

    public Attributes getAttributes() {
        return attributes;
    }

    /**
     * A cell with no edges and no facts carries no information
     */
    public boolean isEmpty() {
        return edges.isEmpty() && attributes.isEmpty();
    }

    @Override
    public int hashCode() {
        return 31 * edges.hashCode() + attributes.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Cell)) {
            return false;
        }
        Cell other = (Cell) obj;
        return edges.equals(other.edges) && attributes.equals(other.attributes);
    }

    @Override
    public String toString() {
        return "(" + edges + ", " + attributes + ")";
    }
}
