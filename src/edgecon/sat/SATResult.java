// This is the outcome of a single BooleanSolver.solve() call.

package edgecon.sat;

import org.apache.commons.lang3.Validate;

public class SATResult {
    public enum Status {
        SATISFIABLE, UNSATISFIABLE, TIMEOUT
    }

    private final Status status;
    private final Model model;

    private SATResult(Status status, Model model) {
        this.status = status;
        this.model = model;
    }

    static SATResult satisfiable(Model model) {
        return new SATResult(Status.SATISFIABLE, Validate.notNull(model));
    }

    static SATResult unsatisfiable() {
        return new SATResult(Status.UNSATISFIABLE, null);
    }

    static SATResult timeout() {
        return new SATResult(Status.TIMEOUT, null);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSatisfiable() {
        return status == Status.SATISFIABLE;
    }

    /**
     * @return the satisfying assignment
     * @throws IllegalStateException if the solver did not report SAT
     */
    public Model getModel() {
        Validate.validState(status == Status.SATISFIABLE, "No model available, solver answered %s", status);
        return model;
    }

    @Override
    public String toString() {
        return status.toString();
    }
}
