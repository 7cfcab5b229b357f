package analysis.abduction.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable abstract stack: the value currently bound to each variable. Updates that do not change the stack return
 * the receiver.
 */
public final class BaseStack {

    /**
     * Stack with no bindings
     */
    public static final BaseStack EMPTY = new BaseStack(Collections.<Var, AddressAndHistory> emptyMap());

    private final Map<Var, AddressAndHistory> bindings;

    private BaseStack(Map<Var, AddressAndHistory> bindings) {
        this.bindings = bindings;
    }

    /**
     * Get the value bound to the variable
     *
     * @return the value or null if the variable is not bound
     */
    public AddressAndHistory find(Var var) {
        return bindings.get(var);
    }

    public boolean contains(Var var) {
        return bindings.containsKey(var);
    }

    /**
     * Bind the variable, replacing any previous binding
     */
    public BaseStack add(Var var, AddressAndHistory value) {
        assert var != null && value != null;
        if (value.equals(bindings.get(var))) {
            return this;
        }
        Map<Var, AddressAndHistory> newBindings = new LinkedHashMap<>(bindings);
        newBindings.put(var, value);
        return new BaseStack(newBindings);
    }

    public BaseStack remove(Var var) {
        if (!bindings.containsKey(var)) {
            return this;
        }
        Map<Var, AddressAndHistory> newBindings = new LinkedHashMap<>(bindings);
        newBindings.remove(var);
        return new BaseStack(newBindings);
    }

    /**
     * Keep only the bindings satisfying the filter
     *
     * @return new stack, or this if every binding is kept
     */
    public BaseStack filter(BindingFilter filter) {
        Map<Var, AddressAndHistory> newBindings = new LinkedHashMap<>();
        for (Map.Entry<Var, AddressAndHistory> e : bindings.entrySet()) {
            if (filter.keep(e.getKey(), e.getValue())) {
                newBindings.put(e.getKey(), e.getValue());
            }
        }
        if (newBindings.size() == bindings.size()) {
            return this;
        }
        return new BaseStack(newBindings);
    }

    /**
     * @return unmodifiable view of the bindings, in the order the variables were first bound
     */
    public Set<Map.Entry<Var, AddressAndHistory>> entrySet() {
        return Collections.unmodifiableMap(bindings).entrySet();
    }

    public Set<Var> vars() {
        return Collections.unmodifiableSet(bindings.keySet());
    }

    public Collection<AddressAndHistory> values() {
        return Collections.unmodifiableCollection(bindings.values());
    }

    public int size() {
        return bindings.size();
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    @Override
    public int hashCode() {
        return bindings.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof BaseStack)) {
            return false;
        }
        return bindings.equals(((BaseStack) obj).bindings);
    }

    @Override
    public String toString() {
        return bindings.toString();
    }

    /**
     * Selects bindings for {@link BaseStack#filter(BindingFilter)}
     */
    public interface BindingFilter {
        boolean keep(Var var, AddressAndHistory value);
    }
}
