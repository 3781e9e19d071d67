// This is the naming scheme for the three families of variables of the EdgeCon reduction.

package edgecon;

import edgecon.sat.BooleanSolver;
import edgecon.sat.Formula;
import edgecon.sat.Proposition;

public class VariableNamer {
    private final BooleanSolver solver;

    public VariableNamer(BooleanSolver solver) {
        this.solver = solver;
    }

    // x_[(n1,n2),i]: the edge (n1, n2) carries the i-th translator, (n1, n2) and (n2, n1) name the same variable
    public Formula isIthTranslator(int node1, int node2, int number) {
        return solver.createVariable(Proposition.isIthTranslator(node1, node2, number));
    }

    // p_[child,parent]
    public Formula parent(int child, int parent) {
        return solver.createVariable(Proposition.parent(child, parent));
    }

    // l_[component,level]
    public Formula levelInSpanningTree(int level, int component) {
        return solver.createVariable(Proposition.levelInSpanningTree(level, component));
    }
}
