package analysis.abduction.domain;

import java.util.Arrays;
import java.util.Collections;

import junit.framework.TestCase;
import analysis.abduction.SymbolicExecution;

import com.ibm.wala.util.collections.Pair;

public class TestAbductiveState extends TestCase {

    private static final CodeLocation LOC = new CodeLocation("f.c", 3);
    private static final Var X = Var.ofProgramVar("x");
    private static final Var L = Var.ofProgramVar("l");

    private static ProcedureDescription f() {
        return new ProcedureDescription(new ProcedureName("f"), new CodeLocation("f.c", 1), Arrays.asList(X),
                                        Collections.<ProcedureDescription.LocalVariable> emptyList());
    }

    public void testInitialState() {
        AbductiveState s = AbductiveState.mkInitial(f());
        AddressAndHistory slot = s.findVar(X);
        assertNotNull(slot);
        assertEquals(ValueHistory.EventKind.FORMAL_DECLARED, slot.getHistory().getLatest().getKind());
        assertEquals(slot.getAddress(), s.getPre().getStack().find(X).getAddress());
        assertTrue(s.getPre().getHeap().hasEdges(slot.getAddress()));
        assertTrue(s.getPost().getHeap().isEmpty());

        assertTrue(s.isAbducible(X));
        assertTrue(s.isAbducible(Var.ofGlobal("g")));
        assertFalse(s.isAbducible(L));
        assertTrue(s.isLocal(L));
        assertFalse(s.isLocal(Var.ofReturn(new ProcedureName("f"))));
    }

    public void testEvalLocal() {
        AbductiveState s = AbductiveState.mkInitial(f());
        ValueHistory origin = ValueHistory.of(ValueHistory.VariableEvent.variableDeclared(L, LOC));
        Pair<AbductiveState, AddressAndHistory> p = s.eval(origin, L);
        assertEquals(origin, p.snd.getHistory());
        assertEquals(p.snd, p.fst.findVar(L));
        assertFalse(p.fst.getPre().getStack().contains(L));

        // reading again gives the same value and the same state
        Pair<AbductiveState, AddressAndHistory> q = p.fst.eval(ValueHistory.EMPTY, L);
        assertSame(p.fst, q.fst);
        assertEquals(p.snd, q.snd);
    }

    public void testEvalGlobalExtendsFootprint() {
        Var g = Var.ofGlobal("g");
        Pair<AbductiveState, AddressAndHistory> p = AbductiveState.mkInitial(f()).eval(ValueHistory.EMPTY, g);
        AddressAndHistory footprint = p.fst.getPre().getStack().find(g);
        assertNotNull(footprint);
        assertEquals(p.snd.getAddress(), footprint.getAddress());
        assertTrue(p.fst.getPre().getHeap().hasEdges(footprint.getAddress()));
    }

    public void testEvalEdge() {
        SymbolicExecution exec = SymbolicExecution.start(f());
        AddressAndHistory slotX = exec.addressOf(X);
        AddressAndHistory vx = exec.load(X);
        AbductiveState s = exec.getState();

        // discovered from the footprint: recorded in the pre
        assertEquals(vx.getAddress(), s.getPre().getHeap().findEdge(slotX.getAddress(), Access.DEREFERENCE)
                                       .getAddress());
        assertTrue(s.getPre().getHeap().hasEdges(vx.getAddress()));

        // discovered from a local: not in the pre
        AddressAndHistory slotL = exec.addressOf(L);
        exec.load(L);
        assertFalse(exec.getState().getPre().getHeap().hasEdges(slotL.getAddress()));

        Pair<AbductiveState, AddressAndHistory> again = s.evalEdge(slotX, Access.DEREFERENCE);
        assertSame(s, again.fst);
        assertEquals(vx, again.snd);
    }

    public void testCheckValid() throws InvalidAddressException {
        SymbolicExecution exec = SymbolicExecution.start(f());
        AddressAndHistory vx = exec.load(X);
        Trace<Unit> access = Trace.immediate(Unit.VALUE, LOC, vx.getHistory());

        AbductiveState s = exec.getState().checkValid(access, vx.getAddress());
        assertEquals(access, s.getPre().getHeap().findAttributes(vx.getAddress()).getMustBeValid());

        // not in the pre: nothing to record
        AbstractAddress other = AbstractAddress.mkFresh();
        assertSame(s, s.checkValid(access, other));

        AbductiveState freed = s.invalidate(vx, Invalidation.CPP_DELETE, LOC);
        try {
            freed.checkValid(access, vx.getAddress());
        }
        catch (InvalidAddressException e) {
            assertEquals(vx.getAddress(), e.getAddress());
            assertEquals(Invalidation.CPP_DELETE, e.getInvalidatedBy().getImmediate());
            return;
        }
        fail("Should have thrown exception");
    }

    public void testAddEdgeRecordsWrite() {
        SymbolicExecution exec = SymbolicExecution.start(f());
        AddressAndHistory vx = exec.load(X);
        AddressAndHistory dest = new AddressAndHistory(AbstractAddress.mkFresh(), ValueHistory.EMPTY);
        AbductiveState s = exec.getState().addEdge(vx, Access.field("next"), dest, LOC);
        assertEquals(dest, s.findEdge(vx.getAddress(), Access.field("next")));
        assertEquals(LOC, s.getPost().getHeap().findAttributes(vx.getAddress()).getWrittenTo()
                           .getOutermostLocation());
        // the pre is not affected by writes
        assertNull(s.getPre().getHeap().findEdge(vx.getAddress(), Access.field("next")));
    }

    public void testRemoveVars() {
        SymbolicExecution exec = SymbolicExecution.start(f());
        exec.addressOf(L);
        AbductiveState s = exec.getState().removeVars(Arrays.asList(X, L));
        assertTrue(s.containsVar(X));
        assertFalse(s.containsVar(L));
        assertSame(s, s.removeVars(Arrays.asList(L)));
    }

    public void testDiscardUnreachable() {
        SymbolicExecution exec = SymbolicExecution.start(f());
        exec.load(X);
        AddressAndHistory c = exec.constant("1");
        AbductiveState s = exec.getState();
        assertNotNull(s.findCell(c.getAddress()));

        AbductiveState collected = s.discardUnreachable();
        assertNull(collected.findCell(c.getAddress()));
        assertSame(collected, collected.discardUnreachable());
    }

    public void testLeqUpToRenaming() {
        ProcedureDescription proc = f();
        SymbolicExecution e1 = SymbolicExecution.start(proc);
        e1.assign(L, e1.load(X));
        SymbolicExecution e2 = SymbolicExecution.start(proc);
        e2.assign(L, e2.load(X));

        AbductiveState s1 = e1.getState();
        AbductiveState s2 = e2.getState();
        assertFalse(s1.equals(s2));
        assertTrue(s1.leq(s2));
        assertTrue(s2.leq(s1));

        SymbolicExecution e3 = SymbolicExecution.start(proc);
        e3.load(X);
        e3.addressOf(L);
        assertFalse(e3.getState().leq(s1));
        assertFalse(s1.leq(e3.getState()));
    }

    public void testSetCell() {
        SymbolicExecution exec = SymbolicExecution.start(f());
        AddressAndHistory vx = exec.load(X);
        Cell cell = new Cell(Edges.EMPTY.put(Access.DEREFERENCE, vx), Attributes.of(Attribute.constant("c")));
        AbductiveState s = exec.getState().setCell(vx, cell, LOC);
        assertEquals("c", s.getConstant(vx.getAddress()));
        assertEquals(vx, s.findEdge(vx.getAddress(), Access.DEREFERENCE));
        assertNotNull(s.findCell(vx.getAddress()).getAttributes().getWrittenTo());
    }
}
