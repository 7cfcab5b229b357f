package analysis.abduction.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Causal history of a value: an immutable list of events, most recent first. Histories are only ever extended at the
 * front, so extending one never affects values that share it.
 */
public final class ValueHistory implements Iterable<ValueHistory.Event> {

    /**
     * History with no events
     */
    public static final ValueHistory EMPTY = new ValueHistory(null, null, 0);

    /**
     * Most recent event, null for the empty history
     */
    private final Event head;
    /**
     * Older events, null for the empty history
     */
    private final ValueHistory tail;
    private final int size;
    private final int memoizedHashCode;

    private ValueHistory(Event head, ValueHistory tail, int size) {
        this.head = head;
        this.tail = tail;
        this.size = size;
        this.memoizedHashCode = head == null ? 0 : 31 * tail.hashCode() + head.hashCode();
    }

    /**
     * History containing a single event
     *
     * @param event
     *            the event
     * @return new history
     */
    public static ValueHistory of(Event event) {
        return EMPTY.prepend(event);
    }

    /**
     * Get a history with the given event added as the most recent one
     *
     * @param event
     *            new event
     * @return new history
     */
    public ValueHistory prepend(Event event) {
        assert event != null;
        return new ValueHistory(event, this, size + 1);
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int size() {
        return size;
    }

    /**
     * Most recent event
     *
     * @return most recent event or null if the history is empty
     */
    public Event getLatest() {
        return head;
    }

    /**
     * Events, most recent first
     *
     * @return unmodifiable list of the events
     */
    public List<Event> getEvents() {
        List<Event> l = new ArrayList<>(size);
        for (Event e : this) {
            l.add(e);
        }
        return Collections.unmodifiableList(l);
    }

    @Override
    public Iterator<Event> iterator() {
        return new Iterator<Event>() {
            private ValueHistory current = ValueHistory.this;

            @Override
            public boolean hasNext() {
                return current.head != null;
            }

            @Override
            public Event next() {
                if (current.head == null) {
                    throw new java.util.NoSuchElementException();
                }
                Event e = current.head;
                current = current.tail;
                return e;
            }
        };
    }

    @Override
    public int hashCode() {
        return memoizedHashCode;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ValueHistory)) {
            return false;
        }
        ValueHistory other = (ValueHistory) obj;
        if (size != other.size || memoizedHashCode != other.memoizedHashCode) {
            return false;
        }
        ValueHistory a = this;
        ValueHistory b = other;
        while (a.head != null) {
            if (a == b) {
                return true;
            }
            if (!a.head.equals(b.head)) {
                return false;
            }
            a = a.tail;
            b = b.tail;
        }
        return true;
    }

    @Override
    public String toString() {
        return getEvents().toString();
    }

    /**
     * Kinds of events recorded in a history
     */
    public enum EventKind {
        ASSIGNMENT, CALL, FORMAL_DECLARED, VARIABLE_ACCESSED, VARIABLE_DECLARED
    }

    /**
     * Something that happened to a value
     */
    public static abstract class Event {

        /**
         * Where the event happened
         */
        private final CodeLocation location;

        Event(CodeLocation location) {
            assert location != null;
            this.location = location;
        }

        public CodeLocation getLocation() {
            return location;
        }

        public abstract EventKind getKind();
    }

    /**
     * Value was assigned
     */
    public static final class Assignment extends Event {

        public Assignment(CodeLocation location) {
            super(location);
        }

        @Override
        public EventKind getKind() {
            return EventKind.ASSIGNMENT;
        }

        @Override
        public int hashCode() {
            return getLocation().hashCode();
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Assignment && getLocation().equals(((Assignment) obj).getLocation());
        }

        @Override
        public String toString() {
            return "assigned at " + getLocation();
        }
    }

    /**
     * Value was returned from a call, the history of the value inside the callee is kept
     */
    public static final class Call extends Event {

        private final ProcedureName callee;
        /**
         * History of the value in the callee
         */
        private final ValueHistory inCall;

        public Call(ProcedureName callee, CodeLocation location, ValueHistory inCall) {
            super(location);
            assert callee != null && inCall != null;
            this.callee = callee;
            this.inCall = inCall;
        }

        public ProcedureName getCallee() {
            return callee;
        }

        public ValueHistory getInCall() {
            return inCall;
        }

        @Override
        public EventKind getKind() {
            return EventKind.CALL;
        }

        @Override
        public int hashCode() {
            final int prime = 31;
            int result = getLocation().hashCode();
            result = prime * result + callee.hashCode();
            result = prime * result + inCall.hashCode();
            return result;
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof Call)) {
                return false;
            }
            Call other = (Call) obj;
            return getLocation().equals(other.getLocation()) && callee.equals(other.callee)
                    && inCall.equals(other.inCall);
        }

        @Override
        public String toString() {
            return "returned from call to " + callee + " at " + getLocation();
        }
    }

    /**
     * Event about a variable: declaration of a formal, declaration of a local, or read of a variable
     */
    public static final class VariableEvent extends Event {

        private final EventKind kind;
        private final Var var;

        private VariableEvent(EventKind kind, Var var, CodeLocation location) {
            super(location);
            assert var != null;
            this.kind = kind;
            this.var = var;
        }

        public static VariableEvent formalDeclared(Var formal, CodeLocation location) {
            return new VariableEvent(EventKind.FORMAL_DECLARED, formal, location);
        }

        public static VariableEvent variableAccessed(Var var, CodeLocation location) {
            return new VariableEvent(EventKind.VARIABLE_ACCESSED, var, location);
        }

        public static VariableEvent variableDeclared(Var var, CodeLocation location) {
            return new VariableEvent(EventKind.VARIABLE_DECLARED, var, location);
        }

        public Var getVar() {
            return var;
        }

        @Override
        public EventKind getKind() {
            return kind;
        }

        @Override
        public int hashCode() {
            final int prime = 31;
            int result = getLocation().hashCode();
            result = prime * result + kind.hashCode();
            result = prime * result + var.hashCode();
            return result;
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof VariableEvent)) {
                return false;
            }
            VariableEvent other = (VariableEvent) obj;
            return kind == other.kind && var.equals(other.var) && getLocation().equals(other.getLocation());
        }

        @Override
        public String toString() {
            switch (kind) {
            case FORMAL_DECLARED:
                return "parameter " + var + " of procedure at " + getLocation();
            case VARIABLE_ACCESSED:
                return var + " accessed at " + getLocation();
            case VARIABLE_DECLARED:
                return var + " declared at " + getLocation();
            default:
                throw new RuntimeException("Not a variable event: " + kind);
            }
        }
    }
}
