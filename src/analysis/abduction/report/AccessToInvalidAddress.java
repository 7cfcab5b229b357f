package analysis.abduction.report;

import java.io.Writer;

import org.json.JSONException;
import org.json.JSONObject;

import analysis.abduction.domain.AbstractAddress;
import analysis.abduction.domain.Invalidation;
import analysis.abduction.domain.Trace;
import analysis.abduction.domain.Unit;
import analysis.abduction.serialization.JSONSerializable;
import analysis.abduction.serialization.JSONUtil;

/**
 * A call requires an address to be valid but the caller state shows it is invalid. Rendering this is left to whoever
 * receives it through a {@link DiagnosticSink}.
 */
public final class AccessToInvalidAddress implements JSONSerializable {

    /**
     * Address in the caller that is accessed
     */
    private final AbstractAddress address;
    /**
     * How the address became invalid
     */
    private final Trace<Invalidation> invalidatedBy;
    /**
     * How the address is accessed, through the call
     */
    private final Trace<Unit> accessedBy;

    public AccessToInvalidAddress(AbstractAddress address, Trace<Invalidation> invalidatedBy, Trace<Unit> accessedBy) {
        assert address != null && invalidatedBy != null && accessedBy != null;
        this.address = address;
        this.invalidatedBy = invalidatedBy;
        this.accessedBy = accessedBy;
    }

    public AbstractAddress getAddress() {
        return address;
    }

    public Trace<Invalidation> getInvalidatedBy() {
        return invalidatedBy;
    }

    public Trace<Unit> getAccessedBy() {
        return accessedBy;
    }

    @Override
    public JSONObject toJSON() {
        return JSONUtil.toJSON(this);
    }

    @Override
    public void writeJSON(Writer out, int indentFactor) throws JSONException {
        toJSON().write(out, indentFactor, 0);
    }

    @Override
    public String toString() {
        return "access to invalid address " + address + ": invalidated by " + invalidatedBy + ", accessed by "
                + accessedBy;
    }
}
