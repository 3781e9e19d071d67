// This is a read-only satisfying assignment returned by the BooleanSolver.

package edgecon.sat;

import org.apache.commons.lang3.Validate;

public class Model {
    private final BooleanSolver solver;
    private final boolean[] values;  // indexed by variable number, slot 0 unused

    Model(BooleanSolver solver, int[] assignments, int numVariables) {
        this.solver = solver;
        this.values = new boolean[numVariables + 1];
        for (int literal : assignments) {
            if (literal > 0 && literal <= numVariables)
                values[literal] = true;
        }
    }

    public boolean valueOf(Formula variable) {
        Validate.isTrue(variable.getType() == Formula.Type.VAR, "Not a variable: %s", variable);
        return variable.getVariable() < values.length && values[variable.getVariable()];
    }

    // a proposition that was never turned into a variable cannot be true
    public boolean valueOf(Proposition proposition) {
        int var = solver.lookup(proposition);
        return var != 0 && var < values.length && values[var];
    }
}
