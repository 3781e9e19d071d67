// This is the expression tree handed to the BooleanSolver.

package edgecon.sat;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An immutable NOT/AND/OR tree whose leaves are variables or constants.
 * Instances are only created through {@link BooleanSolver}, which also memoizes the variables.
 */
public final class Formula {
    public enum Type {
        VAR, NOT, AND, OR, TRUE, FALSE
    }

    private final Type type;
    private final int variable;  // only meaningful for VAR, 1-based like the DIMACS numbering
    private final List<Formula> children;

    Formula(Type type, int variable, List<Formula> children) {
        this.type = type;
        this.variable = variable;
        this.children = Collections.unmodifiableList(children);
    }

    public Type getType() {
        return type;
    }

    public int getVariable() {
        return variable;
    }

    public List<Formula> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        switch (type) {
            case VAR:
                return "v" + variable;
            case TRUE:
                return "true";
            case FALSE:
                return "false";
            case NOT:
                return "!" + children.get(0);
            default:
                String op = type == Type.AND ? " & " : " | ";
                return children.stream().map(Formula::toString).collect(Collectors.joining(op, "(", ")"));
        }
    }
}
