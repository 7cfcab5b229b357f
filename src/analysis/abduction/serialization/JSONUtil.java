package analysis.abduction.serialization;

import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;

import analysis.abduction.domain.AbductiveState;
import analysis.abduction.domain.AbstractAddress;
import analysis.abduction.domain.Access;
import analysis.abduction.domain.AddressAndHistory;
import analysis.abduction.domain.Attribute;
import analysis.abduction.domain.Attributes;
import analysis.abduction.domain.BaseState;
import analysis.abduction.domain.Edges;
import analysis.abduction.domain.Trace;
import analysis.abduction.domain.ValueHistory;
import analysis.abduction.domain.Var;
import analysis.abduction.report.AccessToInvalidAddress;

/**
 * Serialization of abstract states and diagnostics to JSON. Addresses are written as their integer identifiers.
 */
public class JSONUtil {

    /**
     * Serialize a pre/post pair
     *
     * @param state
     *            state to serialize
     * @return {@link JSONObject} with a "pre" and a "post" entry
     */
    public static JSONObject toJSON(AbductiveState state) {
        JSONObject json = new JSONObject();
        json.put("pre", toJSON(state.getPre()));
        json.put("post", toJSON(state.getPost()));
        return json;
    }

    /**
     * Serialize a stack and heap
     *
     * @param state
     *            state to serialize
     * @return {@link JSONObject} with a "stack" and a "heap" entry
     */
    public static JSONObject toJSON(BaseState state) {
        JSONObject json = new JSONObject();
        JSONArray stack = new JSONArray();
        for (Map.Entry<Var, AddressAndHistory> e : state.getStack().entrySet()) {
            JSONObject binding = new JSONObject();
            binding.put("var", e.getKey().toString());
            binding.put("kind", e.getKey().getKind().toString());
            binding.put("address", e.getValue().getAddress().getId());
            stack.put(binding);
        }
        json.put("stack", stack);

        JSONArray heap = new JSONArray();
        for (AbstractAddress a : state.getHeap().getAddresses()) {
            JSONObject cell = new JSONObject();
            cell.put("address", a.getId());
            Edges edges = state.getHeap().findEdges(a);
            if (edges != null) {
                JSONArray edgesJson = new JSONArray();
                for (Map.Entry<Access, AddressAndHistory> e : edges.entrySet()) {
                    JSONObject edge = new JSONObject();
                    edge.put("access", e.getKey().toString());
                    edge.put("address", e.getValue().getAddress().getId());
                    edgesJson.put(edge);
                }
                cell.put("edges", edgesJson);
            }
            Attributes attrs = state.getHeap().findAttributes(a);
            if (attrs != null) {
                JSONArray attrsJson = new JSONArray();
                for (Attribute attr : attrs) {
                    attrsJson.put(toJSON(attr));
                }
                cell.put("attributes", attrsJson);
            }
            heap.put(cell);
        }
        json.put("heap", heap);
        return json;
    }

    /**
     * Serialize an access to an invalid address
     *
     * @param d
     *            diagnostic to serialize
     * @return {@link JSONObject} containing the serialized form
     */
    public static JSONObject toJSON(AccessToInvalidAddress d) {
        JSONObject json = new JSONObject();
        json.put("kind", "ACCESS_TO_INVALID_ADDRESS");
        json.put("address", d.getAddress().getId());
        json.put("invalidatedBy", toJSON(d.getInvalidatedBy()));
        json.put("accessedBy", toJSON(d.getAccessedBy()));
        return json;
    }

    /**
     * Serialize one fact
     */
    public static JSONObject toJSON(Attribute attr) {
        JSONObject json = new JSONObject();
        json.put("kind", attr.getKind().toString());
        switch (attr.getKind()) {
        case ADDRESS_OF_CPP_TEMPORARY:
        case ADDRESS_OF_STACK_VARIABLE:
            json.put("var", attr.getVar().toString());
            break;
        case ALLOCATED:
            json.put("procedure", attr.getProcedure().toString());
            json.put("trace", toJSON(attr.getTrace()));
            break;
        case CLOSURE:
            json.put("procedure", attr.getProcedure().toString());
            break;
        case CONSTANT:
            json.put("value", attr.getConstant());
            break;
        case INVALID:
            json.put("trace", toJSON(attr.getInvalidation()));
            break;
        case MUST_BE_VALID:
        case WRITTEN_TO:
            json.put("trace", toJSON(attr.getTrace()));
            break;
        case STD_VECTOR_RESERVE:
            break;
        default:
            throw new RuntimeException("Unknown attribute kind " + attr.getKind());
        }
        return json;
    }

    /**
     * Serialize a trace, calls are nested under "inCall"
     */
    public static JSONObject toJSON(Trace<?> trace) {
        JSONObject json = new JSONObject();
        json.put("location", trace.getOutermostLocation().toString());
        json.put("history", toJSON(trace.getHistory()));
        if (trace instanceof Trace.ViaCall) {
            Trace.ViaCall<?> call = (Trace.ViaCall<?>) trace;
            json.put("kind", "call");
            json.put("callee", call.getCallee().toString());
            json.put("inCall", toJSON(call.getInCall()));
        }
        else {
            json.put("kind", "immediate");
            json.put("what", trace.getImmediate().toString());
        }
        return json;
    }

    /**
     * Serialize a history as an array of event descriptions, most recent first
     */
    public static JSONArray toJSON(ValueHistory history) {
        JSONArray json = new JSONArray();
        for (ValueHistory.Event e : history) {
            json.put(e.toString());
        }
        return json;
    }
}
