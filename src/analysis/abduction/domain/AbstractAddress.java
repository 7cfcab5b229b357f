package analysis.abduction.domain;

/**
 * Opaque symbolic memory location. Addresses are minted by {@link #mkFresh()} and never reused, so two addresses are
 * equal if and only if they were produced by the same call to {@link #mkFresh()}. The integer identifier makes them
 * usable as members of WALA int sets.
 */
public final class AbstractAddress implements Comparable<AbstractAddress> {

    /**
     * Counter used to ensure every address gets a unique integer
     */
    private static int addressCounter = 1;

    /**
     * Unique identifier
     */
    private final int id;

    /**
     * Create an address with the given identifier, use {@link #mkFresh()}
     *
     * @param id
     *            unique identifier
     */
    private AbstractAddress(int id) {
        this.id = id;
    }

    /**
     * Get a new address, distinct from every address created so far
     *
     * @return fresh address
     */
    public static AbstractAddress mkFresh() {
        return new AbstractAddress(addressCounter++);
    }

    /**
     * Unique integer for this address
     *
     * @return identifier of this address
     */
    public int getId() {
        return id;
    }

    @Override
    public int compareTo(AbstractAddress o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof AbstractAddress)) {
            return false;
        }
        return id == ((AbstractAddress) obj).id;
    }

    @Override
    public String toString() {
        return "v" + id;
    }
}
