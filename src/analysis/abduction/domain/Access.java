package analysis.abduction.domain;

/**
 * Label of an edge in the abstract heap: a field or array selector, taking the address of a value, or the distinguished
 * dereference used for the pointee of a pointer-typed variable or value.
 */
public final class Access {

    /**
     * Kinds of edge labels
     */
    public enum Kind {
        FIELD, ARRAY_ACCESS, TAKE_ADDRESS, DEREFERENCE
    }

    /**
     * Pointee of a pointer
     */
    public static final Access DEREFERENCE = new Access(Kind.DEREFERENCE, null, null);
    /**
     * Address of a value
     */
    public static final Access TAKE_ADDRESS = new Access(Kind.TAKE_ADDRESS, null, null);

    private final Kind kind;
    /**
     * Field name, null unless this is a field access
     */
    private final String fieldName;
    /**
     * Address holding the index, null unless this is an array access
     */
    private final AbstractAddress index;

    private Access(Kind kind, String fieldName, AbstractAddress index) {
        this.kind = kind;
        this.fieldName = fieldName;
        this.index = index;
    }

    /**
     * Access to the field with the given name
     *
     * @param fieldName
     *            name of the field
     * @return field access
     */
    public static Access field(String fieldName) {
        assert fieldName != null;
        return new Access(Kind.FIELD, fieldName, null);
    }

    /**
     * Access to the array element at the index stored at the given address
     *
     * @param index
     *            address of the index value
     * @return array access
     */
    public static Access arrayAccess(AbstractAddress index) {
        assert index != null;
        return new Access(Kind.ARRAY_ACCESS, null, index);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Get the field name (null unless this is a field access)
     *
     * @return name of the field
     */
    public String getFieldName() {
        return fieldName;
    }

    /**
     * Get the index address (null unless this is an array access)
     *
     * @return address of the index
     */
    public AbstractAddress getIndex() {
        return index;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + kind.hashCode();
        result = prime * result + ((fieldName == null) ? 0 : fieldName.hashCode());
        result = prime * result + ((index == null) ? 0 : index.hashCode());
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null) {
            return false;
        }
        if (getClass() != obj.getClass()) {
            return false;
        }
        Access other = (Access) obj;
        if (kind != other.kind) {
            return false;
        }
        if (fieldName == null) {
            if (other.fieldName != null) {
                return false;
            }
        }
        else if (!fieldName.equals(other.fieldName)) {
            return false;
        }
        if (index == null) {
            if (other.index != null) {
                return false;
            }
        }
        else if (!index.equals(other.index)) {
            return false;
        }
        return true;
    }

    @Override
    public String toString() {
        switch (kind) {
        case FIELD:
            return "." + fieldName;
        case ARRAY_ACCESS:
            return "[" + index + "]";
        case TAKE_ADDRESS:
            return "&";
        case DEREFERENCE:
            return "*";
        default:
            throw new RuntimeException("Unknown access kind " + kind);
        }
    }
}
