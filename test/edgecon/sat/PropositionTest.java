package edgecon.sat;

import org.junit.Test;

import static org.junit.Assert.*;

public class PropositionTest {

    @Test
    public void translatorIgnoresEdgeDirection() {
        Proposition forward = Proposition.isIthTranslator(1, 4, 2);
        Proposition backward = Proposition.isIthTranslator(4, 1, 2);
        assertEquals(forward, backward);
        assertEquals(forward.hashCode(), backward.hashCode());
        assertEquals(1, backward.getFirst());
        assertEquals(4, backward.getSecond());
        assertEquals("x_[(1,4),2]", backward.toString());
    }

    @Test
    public void translatorNumberMatters() {
        assertNotEquals(Proposition.isIthTranslator(0, 1, 0), Proposition.isIthTranslator(0, 1, 1));
    }

    @Test
    public void parentIsOrdered() {
        assertNotEquals(Proposition.parent(1, 2), Proposition.parent(2, 1));
        assertEquals("p_[1,2]", Proposition.parent(1, 2).toString());
    }

    @Test
    public void levelTakesLevelThenComponent() {
        Proposition level = Proposition.levelInSpanningTree(3, 5);
        assertEquals(Proposition.Family.LEVEL, level.getFamily());
        assertEquals(5, level.getFirst());
        assertEquals(3, level.getSecond());
        assertEquals("l_[5,3]", level.toString());
        assertNotEquals(level, Proposition.levelInSpanningTree(5, 3));
    }

    @Test
    public void familiesNeverCollide() {
        assertNotEquals(Proposition.parent(0, 1), Proposition.levelInSpanningTree(1, 0));
        assertNotEquals(Proposition.parent(0, 1), Proposition.isIthTranslator(0, 1, 0));
    }
}
