package analysis.abduction.interproc;

import junit.framework.TestCase;
import analysis.abduction.domain.AbductiveState;
import analysis.abduction.domain.AbstractAddress;
import analysis.abduction.domain.AddressAndHistory;
import analysis.abduction.domain.CodeLocation;
import analysis.abduction.domain.ValueHistory;

public class TestCallState extends TestCase {

    private static AddressAndHistory fresh() {
        return new AddressAndHistory(AbstractAddress.mkFresh(), ValueHistory.EMPTY);
    }

    public void testVisit() {
        CallState cs = new CallState(AbductiveState.EMPTY);
        AbstractAddress callee = AbstractAddress.mkFresh();
        AddressAndHistory caller = fresh();

        assertEquals(CallState.Visit.NOT_ALREADY_VISITED, cs.visit(callee, caller));
        assertTrue(cs.isVisited(callee));
        assertEquals(caller, cs.findSubst(callee));
        assertEquals(callee, cs.getRevSubst().get(caller.getAddress()));
        assertEquals(CallState.Visit.ALREADY_VISITED, cs.visit(callee, caller));
    }

    public void testTwoCalleeAddressesForOneCallerAddress() {
        CallState cs = new CallState(AbductiveState.EMPTY);
        AddressAndHistory caller = fresh();
        cs.visit(AbstractAddress.mkFresh(), caller);
        try {
            cs.visit(AbstractAddress.mkFresh(), caller);
        }
        catch (AliasingException e) {
            assertEquals(caller.getAddress(), e.getCallerAddress());
            return;
        }
        fail("Should have thrown exception");
    }

    public void testResetKeepsTranslation() {
        CallState cs = new CallState(AbductiveState.EMPTY);
        AbstractAddress callee = AbstractAddress.mkFresh();
        AddressAndHistory caller = fresh();
        cs.visit(callee, caller);
        cs.resetVisited();

        assertFalse(cs.isVisited(callee));
        assertEquals(caller, cs.findSubst(callee));
        // revisiting with the same pair is fine
        assertEquals(CallState.Visit.NOT_ALREADY_VISITED, cs.visit(callee, caller));
    }

    public void testSubstFindOrNew() {
        CallState cs = new CallState(AbductiveState.EMPTY);
        AbstractAddress callee = AbstractAddress.mkFresh();
        ValueHistory hist = ValueHistory.of(new ValueHistory.Assignment(CodeLocation.NONE));
        assertNull(cs.findSubst(callee));

        AddressAndHistory made = cs.substFindOrNew(callee, hist);
        assertEquals(hist, made.getHistory());
        assertSame(made, cs.substFindOrNew(callee, ValueHistory.EMPTY));
        // minting does not bind the caller address yet
        assertTrue(cs.getRevSubst().isEmpty());
    }
}
