// This is the adapter between the reduction's formula trees and the SAT4J solver.

package edgecon.sat;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.apache.commons.lang3.Validate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sat4j.core.VecInt;
import org.sat4j.minisat.SolverFactory;
import org.sat4j.specs.ContradictionException;
import org.sat4j.specs.ISolver;
import org.sat4j.specs.TimeoutException;
import org.sat4j.tools.ModelIterator;

import java.util.*;

/**
 * Creates memoized variables, builds NOT/AND/OR formulas over them and decides their satisfiability.
 * <p>
 * Equal {@link Proposition}s always resolve to the very same variable handle. The handle numbering
 * doubles as the SAT4J variable numbering, Tseitin auxiliaries are numbered after it on every solve.
 * Not thread-safe, one instance per reduction.
 */
public class BooleanSolver {
    private static final Logger log = LogManager.getFormatterLogger();

    private final Object2IntOpenHashMap<Proposition> proposition2Numeric;
    private final ObjectArrayList<Proposition> numeric2Proposition;  // slot 0 unused
    private final ObjectArrayList<Formula> variables;  // slot 0 unused
    private final Formula constantTrue, constantFalse;
    private final int timeoutSeconds;

    // statistics of the last solve() call
    public int numCNFVariables = -1, numCNFClauses = -1;
    public long satTime = -1;

    public BooleanSolver() {
        this(0);
    }

    // timeoutSeconds <= 0 keeps the SAT4J default
    public BooleanSolver(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
        proposition2Numeric = new Object2IntOpenHashMap<>();
        proposition2Numeric.defaultReturnValue(0);
        numeric2Proposition = new ObjectArrayList<>();
        numeric2Proposition.add(null);
        variables = new ObjectArrayList<>();
        variables.add(null);
        constantTrue = new Formula(Formula.Type.TRUE, 0, Collections.emptyList());
        constantFalse = new Formula(Formula.Type.FALSE, 0, Collections.emptyList());
    }

    public Formula createVariable(Proposition proposition) {
        Validate.notNull(proposition, "proposition");
        int var = proposition2Numeric.getInt(proposition);
        if (var == 0) {
            var = variables.size();
            proposition2Numeric.put(proposition, var);
            numeric2Proposition.add(proposition);
            variables.add(new Formula(Formula.Type.VAR, var, Collections.emptyList()));
        }
        return variables.get(var);
    }

    // 0 if no variable was ever created for the proposition
    public int lookup(Proposition proposition) {
        return proposition2Numeric.getInt(proposition);
    }

    public Proposition getProposition(int var) {
        Validate.inclusiveBetween(1, numVariables(), var, "Unknown variable %d", var);
        return numeric2Proposition.get(var);
    }

    public int numVariables() {
        return variables.size() - 1;
    }

    public Formula constantTrue() {
        return constantTrue;
    }

    public Formula constantFalse() {
        return constantFalse;
    }

    public Formula not(Formula f) {
        switch (f.getType()) {
            case TRUE:
                return constantFalse;
            case FALSE:
                return constantTrue;
            case NOT:
                return f.getChildren().get(0);
            default:
                return new Formula(Formula.Type.NOT, 0, Collections.singletonList(f));
        }
    }

    public Formula and(Formula... operands) {
        return and(Arrays.asList(operands));
    }

    // the empty conjunction is true
    public Formula and(List<Formula> operands) {
        List<Formula> kept = new ArrayList<>(operands.size());
        for (Formula f : operands) {
            if (f.getType() == Formula.Type.FALSE)
                return constantFalse;
            if (f.getType() != Formula.Type.TRUE)
                kept.add(f);
        }
        if (kept.isEmpty())
            return constantTrue;
        if (kept.size() == 1)
            return kept.get(0);
        return new Formula(Formula.Type.AND, 0, kept);
    }

    public Formula or(Formula... operands) {
        return or(Arrays.asList(operands));
    }

    // the empty disjunction is false
    public Formula or(List<Formula> operands) {
        List<Formula> kept = new ArrayList<>(operands.size());
        for (Formula f : operands) {
            if (f.getType() == Formula.Type.TRUE)
                return constantTrue;
            if (f.getType() != Formula.Type.FALSE)
                kept.add(f);
        }
        if (kept.isEmpty())
            return constantFalse;
        if (kept.size() == 1)
            return kept.get(0);
        return new Formula(Formula.Type.OR, 0, kept);
    }

    public SATResult solve(Formula formula) {
        long startTime = System.nanoTime();
        try {
            ISolver solver;
            try {
                solver = loadSolver(formula);
            } catch (ContradictionException e) {
                log.warn("Contradiction while loading clauses, formula is trivially unsatisfiable: %s", e.getMessage());
                return SATResult.unsatisfiable();
            }

            try {
                if (solver.isSatisfiable()) {
                    log.info("SAT (%d variables, %d clauses)", numCNFVariables, numCNFClauses);
                    return SATResult.satisfiable(new Model(this, solver.model(), numVariables()));
                }
                log.info("UNSAT (%d variables, %d clauses)", numCNFVariables, numCNFClauses);
                return SATResult.unsatisfiable();
            } catch (TimeoutException e) {
                log.warn("Time limit exceeded after %d s: %s", timeoutSeconds, e.getMessage());
                return SATResult.timeout();
            }
        } finally {
            satTime = System.nanoTime() - startTime;
        }
    }

    /**
     * Lists distinct satisfying assignments of the formula, at most {@code limit} of them.
     *
     * @return an empty list if the formula is unsatisfiable
     * @throws TimeoutException if the solver runs out of time before the enumeration ends
     */
    public List<Model> enumerateModels(Formula formula, int limit) throws TimeoutException {
        Validate.isTrue(limit > 0, "limit must be positive, got %d", limit);
        List<Model> models = new ArrayList<>();
        ISolver solver;
        try {
            solver = loadSolver(formula);
        } catch (ContradictionException e) {
            log.debug("Contradiction while loading clauses: %s", e.getMessage());
            return models;
        }
        ModelIterator iterator = new ModelIterator(solver);
        while (models.size() < limit && iterator.isSatisfiable()) {
            models.add(new Model(this, iterator.model(), numVariables()));
        }
        log.debug("Enumerated %d models", models.size());
        return models;
    }

    private ISolver loadSolver(Formula formula) throws ContradictionException {
        TseitinEncoder encoder = new TseitinEncoder(numVariables());
        encoder.assertFormula(formula);
        numCNFVariables = encoder.getNumVariables();
        numCNFClauses = encoder.getClauses().size();
        log.debug("Encoded formula into %d variables and %d clauses", numCNFVariables, numCNFClauses);

        ISolver solver = SolverFactory.newDefault();
        if (timeoutSeconds > 0)
            solver.setTimeout(timeoutSeconds);
        solver.newVar(numCNFVariables);
        solver.setExpectedNumberOfClauses(numCNFClauses);
        for (int[] clause : encoder.getClauses()) {
            solver.addClause(new VecInt(clause));
        }
        return solver;
    }
}


// Tseitin transformation of a formula tree into CNF clauses over integer literals
class TseitinEncoder {
    private int satVariableCounter;
    private int trueVariable;  // created on demand for the constants
    private final List<int[]> clauses;
    private final Map<Formula, Integer> encoded;  // shared sub-formulas are encoded once

    TseitinEncoder(int numVariables) {
        satVariableCounter = numVariables;
        clauses = new ArrayList<>();
        encoded = new IdentityHashMap<>();
    }

    // top-level conjunctions become separate clauses, top-level disjunctions a single clause
    void assertFormula(Formula f) {
        switch (f.getType()) {
            case AND:
                for (Formula child : f.getChildren()) {
                    assertFormula(child);
                }
                break;
            case OR:
                IntArrayList clause = new IntArrayList(f.getChildren().size());
                for (Formula child : f.getChildren()) {
                    clause.add(encode(child));
                }
                clauses.add(clause.toIntArray());
                break;
            case TRUE:
                break;
            default:
                clauses.add(new int[]{encode(f)});
        }
    }

    private int encode(Formula f) {
        switch (f.getType()) {
            case VAR:
                return f.getVariable();
            case TRUE:
                return trueLiteral();
            case FALSE:
                return -trueLiteral();
            case NOT:
                return -encode(f.getChildren().get(0));
            default:
                Integer known = encoded.get(f);
                if (known != null)
                    return known;

                List<Formula> children = f.getChildren();
                int[] literals = new int[children.size()];
                for (int i = 0; i < literals.length; i++) {
                    literals[i] = encode(children.get(i));
                }

                int aux = ++satVariableCounter;
                int[] longClause = new int[literals.length + 1];
                if (f.getType() == Formula.Type.AND) {
                    // aux <-> (l1 & ... & lk)
                    longClause[0] = aux;
                    for (int i = 0; i < literals.length; i++) {
                        clauses.add(new int[]{-aux, literals[i]});
                        longClause[i + 1] = -literals[i];
                    }
                } else {
                    // aux <-> (l1 | ... | lk)
                    longClause[0] = -aux;
                    for (int i = 0; i < literals.length; i++) {
                        clauses.add(new int[]{aux, -literals[i]});
                        longClause[i + 1] = literals[i];
                    }
                }
                clauses.add(longClause);
                encoded.put(f, aux);
                return aux;
        }
    }

    private int trueLiteral() {
        if (trueVariable == 0) {
            trueVariable = ++satVariableCounter;
            clauses.add(new int[]{trueVariable});
        }
        return trueVariable;
    }

    int getNumVariables() {
        return satVariableCounter;
    }

    List<int[]> getClauses() {
        return clauses;
    }
}
