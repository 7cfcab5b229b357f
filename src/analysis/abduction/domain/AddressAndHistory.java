package analysis.abduction.domain;

/**
 * Abstract value: an address together with the history of how the value was obtained
 */
public final class AddressAndHistory {

    private final AbstractAddress address;
    private final ValueHistory history;

    public AddressAndHistory(AbstractAddress address, ValueHistory history) {
        assert address != null && history != null;
        this.address = address;
        this.history = history;
    }

    public AbstractAddress getAddress() {
        return address;
    }

    public ValueHistory getHistory() {
        return history;
    }

    /**
     * Same address with a different history
     *
     * @return new value, or this if the history is the same
     */
    public AddressAndHistory withHistory(ValueHistory newHistory) {
        if (newHistory.equals(history)) {
            return this;
        }
        return new AddressAndHistory(address, newHistory);
    }

    @Override
    public int hashCode() {
        return 31 * address.hashCode() + history.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof AddressAndHistory)) {
            return false;
        }
        AddressAndHistory other = (AddressAndHistory) obj;
        return address.equals(other.address) && history.equals(other.history);
    }

    @Override
    public String toString() {
        return address.toString();
    }
}
