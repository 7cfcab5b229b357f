package analysis.abduction.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Immutable set of facts about one address, holding at most one {@link Attribute} per {@link Attribute.Kind}. Updates
 * that do not change the set return the receiver.
 */
public final class Attributes implements Iterable<Attribute> {

    /**
     * The set with no facts
     */
    public static final Attributes EMPTY = new Attributes(new EnumMap<Attribute.Kind, Attribute>(Attribute.Kind.class));

    /**
     * Map from tag to the fact with that tag
     */
    private final EnumMap<Attribute.Kind, Attribute> byKind;

    private Attributes(EnumMap<Attribute.Kind, Attribute> byKind) {
        this.byKind = byKind;
    }

    /**
     * Set containing the given facts, later facts replace earlier ones with the same tag
     */
    public static Attributes of(Attribute... attrs) {
        Attributes result = EMPTY;
        for (Attribute a : attrs) {
            result = result.add(a);
        }
        return result;
    }

    /**
     * Get the fact with the given tag
     *
     * @param kind
     *            tag
     * @return the fact or null if there is none
     */
    public Attribute get(Attribute.Kind kind) {
        return byKind.get(kind);
    }

    /**
     * Add a fact, replacing any fact with the same tag
     *
     * @param attr
     *            new fact
     * @return new set of facts, or this if the fact was already present
     */
    public Attributes add(Attribute attr) {
        assert attr != null;
        if (attr.equals(byKind.get(attr.getKind()))) {
            return this;
        }
        EnumMap<Attribute.Kind, Attribute> newMap = new EnumMap<>(byKind);
        newMap.put(attr.getKind(), attr);
        return new Attributes(newMap);
    }

    /**
     * Add all the facts in the given set, replacing facts with the same tag
     *
     * @param attrs
     *            facts to add
     * @return new set of facts, or this if nothing changed
     */
    public Attributes addAll(Attributes attrs) {
        Attributes result = this;
        for (Attribute a : attrs) {
            result = result.add(a);
        }
        return result;
    }

    /**
     * Remove the fact with the given tag
     *
     * @return new set of facts, or this if there was no such fact
     */
    public Attributes remove(Attribute.Kind kind) {
        if (!byKind.containsKey(kind)) {
            return this;
        }
        EnumMap<Attribute.Kind, Attribute> newMap = new EnumMap<>(byKind);
        newMap.remove(kind);
        return new Attributes(newMap);
    }

    /**
     * Apply a translation to every fact
     *
     * @param translator
     *            translation, returning null drops the fact
     * @return translated facts
     */
    public Attributes map(AttributeTranslator translator) {
        EnumMap<Attribute.Kind, Attribute> newMap = new EnumMap<>(Attribute.Kind.class);
        boolean changed = false;
        for (Attribute a : byKind.values()) {
            Attribute translated = translator.translate(a);
            if (translated != a) {
                changed = true;
            }
            if (translated != null) {
                newMap.put(translated.getKind(), translated);
            }
        }
        return changed ? new Attributes(newMap) : this;
    }

    /**
     * Does this set show that the contents of the address were changed, i.e., it was written to or invalidated
     *
     * @return true if some fact records a modification
     */
    public boolean isModified() {
        for (Attribute a : byKind.values()) {
            if (a.isModification()) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return byKind.isEmpty();
    }

    public int size() {
        return byKind.size();
    }

    /**
     * @return invalidation trace, null if the address is not known to be invalid
     */
    public Trace<Invalidation> getInvalid() {
        Attribute a = byKind.get(Attribute.Kind.INVALID);
        return a == null ? null : a.getInvalidation();
    }

    /**
     * @return trace of the access requiring validity, null if there is none
     */
    public Trace<Unit> getMustBeValid() {
        Attribute a = byKind.get(Attribute.Kind.MUST_BE_VALID);
        return a == null ? null : a.getTrace();
    }

    /**
     * @return trace of the last write, null if there is none
     */
    public Trace<Unit> getWrittenTo() {
        Attribute a = byKind.get(Attribute.Kind.WRITTEN_TO);
        return a == null ? null : a.getTrace();
    }

    /**
     * @return the ADDRESS_OF_STACK_VARIABLE fact, null if there is none
     */
    public Attribute getAddressOfStackVariable() {
        return byKind.get(Attribute.Kind.ADDRESS_OF_STACK_VARIABLE);
    }

    /**
     * @return constant value, null if there is none
     */
    public String getConstant() {
        Attribute a = byKind.get(Attribute.Kind.CONSTANT);
        return a == null ? null : a.getConstant();
    }

    /**
     * @return procedure of the closure, null if there is none
     */
    public ProcedureName getClosureProcName() {
        Attribute a = byKind.get(Attribute.Kind.CLOSURE);
        return a == null ? null : a.getProcedure();
    }

    public boolean isStdVectorReserved() {
        return byKind.containsKey(Attribute.Kind.STD_VECTOR_RESERVE);
    }

    /**
     * @return unmodifiable view of the facts
     */
    public Collection<Attribute> asCollection() {
        return Collections.unmodifiableCollection(byKind.values());
    }

    @Override
    public Iterator<Attribute> iterator() {
        return asCollection().iterator();
    }

    @Override
    public int hashCode() {
        return byKind.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Attributes)) {
            return false;
        }
        return byKind.equals(((Attributes) obj).byKind);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<Attribute.Kind, Attribute> e : byKind.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append(e.getValue());
        }
        return sb.append("}").toString();
    }

    /**
     * Translation applied to each fact by {@link Attributes#map(AttributeTranslator)}
     */
    public interface AttributeTranslator {
        /**
         * Translate a fact
         *
         * @param attr
         *            fact to translate
         * @return the translated fact, the same object if it is unchanged, or null to drop it
         */
        Attribute translate(Attribute attr);
    }
}
