package analysis.abduction.domain;

import junit.framework.TestCase;

public class TestIsographMapping extends TestCase {

    private static final Var X = Var.ofProgramVar("x");
    private static final Var Y = Var.ofProgramVar("y");

    private static AddressAndHistory at(AbstractAddress a) {
        return new AddressAndHistory(a, ValueHistory.EMPTY);
    }

    /**
     * x and y both point to one cell, or each to its own
     */
    private static BaseState pointers(boolean shared) {
        AbstractAddress sx = AbstractAddress.mkFresh();
        AbstractAddress sy = AbstractAddress.mkFresh();
        AbstractAddress cx = AbstractAddress.mkFresh();
        AbstractAddress cy = shared ? cx : AbstractAddress.mkFresh();
        BaseStack stack = BaseStack.EMPTY.add(X, at(sx)).add(Y, at(sy));
        BaseHeap heap = BaseHeap.EMPTY.addEdge(sx, Access.DEREFERENCE, at(cx)).addEdge(sy, Access.DEREFERENCE, at(cy));
        return BaseState.make(stack, heap);
    }

    public void testRenaming() {
        BaseState a = pointers(true);
        BaseState b = pointers(true);
        IsographMapping m = IsographMapping.map(IsographMapping.EMPTY, a, b);
        assertNotNull(m);
        assertEquals(3, m.size());
        AbstractAddress slotX = a.getStack().find(X).getAddress();
        assertEquals(b.getStack().find(X).getAddress(), m.getRhs(slotX));
        assertEquals(slotX, m.inverse().getRhs(b.getStack().find(X).getAddress()));
        assertTrue(a.leq(b));
    }

    public void testSharingMatters() {
        BaseState shared = pointers(true);
        BaseState separate = pointers(false);
        assertNull(IsographMapping.map(IsographMapping.EMPTY, shared, separate));
        assertNull(IsographMapping.map(IsographMapping.EMPTY, separate, shared));
        assertFalse(shared.leq(separate));
    }

    public void testAttributesMatter() {
        BaseState a = pointers(false);
        BaseState b = pointers(false);
        AbstractAddress slotX = b.getStack().find(X).getAddress();
        BaseState c = b.update(null, b.getHeap().addAttribute(slotX, Attribute.constant("0")));
        assertTrue(a.leq(b));
        assertFalse(a.leq(c));
    }

    public void testInitialMappingIsRespected() {
        BaseState a = pointers(false);
        BaseState b = pointers(false);
        AbstractAddress xa = a.getStack().find(X).getAddress();
        AbstractAddress yb = b.getStack().find(Y).getAddress();
        IsographMapping crossed = IsographMapping.map(IsographMapping.EMPTY, a, b);
        assertNotNull(crossed);
        // relate x's slot on the left to y's slot on the right beforehand
        BaseState single = BaseState.make(BaseStack.EMPTY.add(X, at(xa)), BaseHeap.EMPTY);
        BaseState other = BaseState.make(BaseStack.EMPTY.add(X, at(yb)), BaseHeap.EMPTY);
        IsographMapping pre = IsographMapping.map(IsographMapping.EMPTY, single, other);
        assertNull(IsographMapping.map(pre, a, b));
    }

    public void testUnrelatedCellsBreakIsograph() {
        BaseState a = pointers(false);
        AbstractAddress stray = AbstractAddress.mkFresh();
        BaseState withStray = a.update(null, a.getHeap().addAttribute(stray, Attribute.constant("1")));
        assertNotNull(IsographMapping.map(IsographMapping.EMPTY, a, withStray));
        assertFalse(IsographMapping.isIsograph(IsographMapping.EMPTY, a, withStray));
        // empty cells do not count
        BaseState withEmpty = a.update(null, a.getHeap().registerAddress(stray));
        assertTrue(IsographMapping.isIsograph(IsographMapping.EMPTY, a, withEmpty));
    }

    public void testDifferentVariables() {
        BaseState a = pointers(false);
        BaseState b = BaseState.make(a.getStack().remove(Y), a.getHeap());
        assertNull(IsographMapping.map(IsographMapping.EMPTY, a, b));
    }
}
