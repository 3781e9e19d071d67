package edgecon;

import edgecon.sat.BooleanSolver;
import edgecon.sat.Proposition;
import org.junit.Test;

import static org.junit.Assert.*;

public class VariableNamerTest {

    @Test
    public void namesAreMemoized() {
        BooleanSolver solver = new BooleanSolver();
        VariableNamer namer = new VariableNamer(solver);
        assertSame(namer.isIthTranslator(0, 1, 0), namer.isIthTranslator(1, 0, 0));
        assertSame(namer.parent(2, 1), namer.parent(2, 1));
        assertNotSame(namer.parent(2, 1), namer.parent(1, 2));
        assertSame(namer.levelInSpanningTree(1, 2), namer.levelInSpanningTree(1, 2));
        assertNotSame(namer.levelInSpanningTree(1, 2), namer.levelInSpanningTree(2, 1));
        assertEquals(5, solver.numVariables());
    }

    @Test
    public void variablesMapBackToTheirProposition() {
        BooleanSolver solver = new BooleanSolver();
        VariableNamer namer = new VariableNamer(solver);
        int var = namer.levelInSpanningTree(3, 1).getVariable();
        assertEquals(Proposition.levelInSpanningTree(3, 1), solver.getProposition(var));
        assertEquals("l_[1,3]", solver.getProposition(var).toString());
    }
}
