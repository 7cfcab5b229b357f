package analysis.abduction.serialization;

import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;

import junit.framework.TestCase;
import analysis.abduction.SymbolicExecution;
import analysis.abduction.domain.AbductiveState;
import analysis.abduction.domain.AbstractAddress;
import analysis.abduction.domain.AddressAndHistory;
import analysis.abduction.domain.CodeLocation;
import analysis.abduction.domain.InvalidAddressException;
import analysis.abduction.domain.Invalidation;
import analysis.abduction.domain.ProcedureDescription;
import analysis.abduction.domain.ProcedureName;
import analysis.abduction.domain.Trace;
import analysis.abduction.domain.Unit;
import analysis.abduction.domain.ValueHistory;
import analysis.abduction.domain.Var;
import analysis.abduction.report.AccessToInvalidAddress;

import org.json.JSONArray;
import org.json.JSONObject;

public class TestJSONUtil extends TestCase {

    private static final Var X = Var.ofProgramVar("x");
    private static final CodeLocation LOC = new CodeLocation("f.c", 4);

    private static SymbolicExecution start() {
        return SymbolicExecution.start(new ProcedureDescription(new ProcedureName("f"), new CodeLocation("f.c", 1),
                                                                Arrays.asList(X),
                                                                Collections.<ProcedureDescription.LocalVariable> emptyList()));
    }

    public void testState() throws InvalidAddressException {
        SymbolicExecution exec = start();
        AddressAndHistory vx = exec.load(X);
        exec.free(vx);
        AbductiveState s = exec.getState();

        JSONObject json = JSONUtil.toJSON(s);
        JSONObject post = json.getJSONObject("post");
        JSONArray stack = post.getJSONArray("stack");
        assertEquals(1, stack.length());
        assertEquals("PROGRAM", stack.getJSONObject(0).getString("kind"));
        assertEquals(s.findVar(X).getAddress().getId(), stack.getJSONObject(0).getInt("address"));

        JSONArray heap = post.getJSONArray("heap");
        JSONObject freed = null;
        for (int i = 0; i < heap.length(); i++) {
            if (heap.getJSONObject(i).getInt("address") == vx.getAddress().getId()) {
                freed = heap.getJSONObject(i);
            }
        }
        assertNotNull(freed);
        JSONObject attr = freed.getJSONArray("attributes").getJSONObject(0);
        assertEquals("INVALID", attr.getString("kind"));
        assertEquals("immediate", attr.getJSONObject("trace").getString("kind"));

        assertTrue(json.getJSONObject("pre").has("heap"));
        assertTrue(json.similar(s.toJSON()));
    }

    public void testDiagnostic() {
        AddressAndHistory v = new AddressAndHistory(AbstractAddress.mkFresh(),
                                                    ValueHistory.EMPTY);
        Trace<Invalidation> freed = Trace.immediate(Invalidation.C_FREE, LOC, ValueHistory.EMPTY);
        Trace<Unit> inner = Trace.immediate(Unit.VALUE, new CodeLocation("g.c", 2), ValueHistory.EMPTY);
        ValueHistory hist = ValueHistory.of(new ValueHistory.Assignment(LOC));
        Trace<Unit> access = Trace.viaCall(new ProcedureName("g"), LOC, hist, inner);
        AccessToInvalidAddress d = new AccessToInvalidAddress(v.getAddress(), freed, access);

        JSONObject json = JSONUtil.toJSON(d);
        assertEquals("ACCESS_TO_INVALID_ADDRESS", json.getString("kind"));
        assertEquals(v.getAddress().getId(), json.getInt("address"));
        JSONObject accessedBy = json.getJSONObject("accessedBy");
        assertEquals("call", accessedBy.getString("kind"));
        assertEquals("g", accessedBy.getString("callee"));
        assertEquals(1, accessedBy.getJSONArray("history").length());
        assertEquals("immediate", accessedBy.getJSONObject("inCall").getString("kind"));

        StringWriter out = new StringWriter();
        d.writeJSON(out, 2);
        assertTrue(json.similar(new JSONObject(out.toString())));
    }
}
