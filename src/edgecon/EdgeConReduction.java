// This is the reduction of the EdgeCon problem to SAT.
//
// Given the homogeneous components X_0 .. X_{C_H-1} of a graph and a bound k, the formula asks for
// a tree over the components, rooted at X_0, whose parent links are all bridged by an edge holding
// one of N = C_H - 1 translators, and whose depth goes beyond k. Three families of variables:
//   x_[(u,v),i]  the edge (u, v) holds the i-th translator
//   p_[j1,j2]    X_j2 is the parent of X_j1
//   l_[j,h]      X_j sits at level h of the tree

package edgecon;

import edgecon.sat.BooleanSolver;
import edgecon.sat.Formula;
import org.apache.commons.lang3.Validate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class EdgeConReduction {
    private static final Logger log = LogManager.getFormatterLogger();

    /**
     * The constraint groups of the formula, each with the exact number of clauses (or literals for
     * the depth bound, pair constraints for the parent consistency) it must produce.
     */
    public enum ConstraintGroup {
        TRANSLATOR_ON_ONE_EDGE {
            long expectedCount(ReductionContext ctx) {
                long m = ctx.getNumEdges();
                return ctx.getNumTranslators() * (m * (m - 1) / 2);
            }
        },
        ONE_TRANSLATOR_PER_EDGE {
            long expectedCount(ReductionContext ctx) {
                long N = ctx.getNumTranslators();
                return ctx.getNumEdges() * (N * (N - 1) / 2);
            }
        },
        AT_LEAST_ONE_PARENT {
            long expectedCount(ReductionContext ctx) {
                return ctx.getNumComponents() - 1;
            }
        },
        AT_MOST_ONE_PARENT {
            long expectedCount(ReductionContext ctx) {
                long others = ctx.getNumComponents() - 1;
                return others * (others * (others - 1) / 2);
            }
        },
        AT_LEAST_ONE_LEVEL {
            long expectedCount(ReductionContext ctx) {
                return ctx.getNumComponents();
            }
        },
        AT_MOST_ONE_LEVEL {
            long expectedCount(ReductionContext ctx) {
                long N = ctx.getNumTranslators();
                return ctx.getNumComponents() * (N * (N - 1) / 2);
            }
        },
        DEPTH_BOUND {
            long expectedCount(ReductionContext ctx) {
                return (long) ctx.getNumComponents() * Math.max(0, ctx.getNumTranslators() - ctx.getDepthBound());
            }
        },
        PARENT_CONSISTENCY {
            long expectedCount(ReductionContext ctx) {
                long nonRoot = ctx.getNumComponents() - 1;
                return nonRoot * nonRoot;
            }
        };

        abstract long expectedCount(ReductionContext ctx);
    }

    private final ReductionContext ctx;
    private final BooleanSolver solver;
    private final VariableNamer namer;
    private final Map<ConstraintGroup, Integer> clauseCounts;

    public long reductionTime = -1;

    public EdgeConReduction(BooleanSolver solver, EdgeConGraph graph, int depthBound) {
        this.ctx = new ReductionContext(solver, graph, depthBound);
        this.solver = solver;
        this.namer = ctx.getNamer();
        this.clauseCounts = new EnumMap<>(ConstraintGroup.class);
    }

    public static Formula buildReductionFormula(BooleanSolver solver, EdgeConGraph graph, int depthBound) {
        return new EdgeConReduction(solver, graph, depthBound).buildFormula();
    }

    public Formula buildFormula() {
        long startTime = System.nanoTime();
        log.debug("Building EdgeCon formula for %s", ctx);

        Formula formula = solver.and(
                translatorUniqueness(),
                parentStructure(),
                levelAssignment(),
                depthExceedsBound(),
                parentConsistency());

        checkClauseCounts();
        reductionTime = System.nanoTime() - startTime;
        log.debug("Built formula with %d variables in %d ms, clause counts %s",
                solver.numVariables(), reductionTime / 1_000_000, clauseCounts);
        return formula;
    }

    public ReductionContext getContext() {
        return ctx;
    }

    // counts of the groups built so far
    public Map<ConstraintGroup, Integer> getClauseCounts() {
        return clauseCounts;
    }

    Formula translatorUniqueness() {
        return solver.and(translatorOnAtMostOneEdge(), edgeHasAtMostOneTranslator());
    }

    // a translator is put on at most one edge
    Formula translatorOnAtMostOneEdge() {
        List<Edge> edges = ctx.getEdges();
        List<Formula> clauses = new ArrayList<>();
        for (int i = 0; i < ctx.getNumTranslators(); i++) {
            for (int a = 0; a < edges.size(); a++) {
                Edge e = edges.get(a);
                for (int b = a + 1; b < edges.size(); b++) {
                    Edge f = edges.get(b);
                    clauses.add(solver.or(
                            solver.not(namer.isIthTranslator(e.getStart(), e.getEnd(), i)),
                            solver.not(namer.isIthTranslator(f.getStart(), f.getEnd(), i))));
                }
            }
        }
        return record(ConstraintGroup.TRANSLATOR_ON_ONE_EDGE, clauses);
    }

    // an edge holds at most one translator
    Formula edgeHasAtMostOneTranslator() {
        List<Formula> clauses = new ArrayList<>();
        for (Edge e : ctx.getEdges()) {
            for (int i = 0; i < ctx.getNumTranslators(); i++) {
                for (int j = i + 1; j < ctx.getNumTranslators(); j++) {
                    clauses.add(solver.or(
                            solver.not(namer.isIthTranslator(e.getStart(), e.getEnd(), i)),
                            solver.not(namer.isIthTranslator(e.getStart(), e.getEnd(), j))));
                }
            }
        }
        return record(ConstraintGroup.ONE_TRANSLATOR_PER_EDGE, clauses);
    }

    Formula parentStructure() {
        return solver.and(atLeastOneParent(), atMostOneParent());
    }

    // every component but the root has a parent
    Formula atLeastOneParent() {
        List<Formula> clauses = new ArrayList<>();
        for (int j = 0; j < ctx.getNumComponents(); j++) {
            if (ctx.isRoot(j))
                continue;
            List<Formula> candidates = new ArrayList<>();
            for (int j1 = 0; j1 < ctx.getNumComponents(); j1++) {
                if (j1 != j)
                    candidates.add(namer.parent(j, j1));
            }
            clauses.add(solver.or(candidates));
        }
        return record(ConstraintGroup.AT_LEAST_ONE_PARENT, clauses);
    }

    // no component has two parents
    Formula atMostOneParent() {
        List<Formula> clauses = new ArrayList<>();
        for (int j = 0; j < ctx.getNumComponents(); j++) {
            if (ctx.isRoot(j))
                continue;
            for (int j1 = 0; j1 < ctx.getNumComponents(); j1++) {
                if (j1 == j)
                    continue;
                for (int j2 = j1 + 1; j2 < ctx.getNumComponents(); j2++) {
                    if (j2 == j)
                        continue;
                    clauses.add(solver.or(
                            solver.not(namer.parent(j, j1)),
                            solver.not(namer.parent(j, j2))));
                }
            }
        }
        return record(ConstraintGroup.AT_MOST_ONE_PARENT, clauses);
    }

    Formula levelAssignment() {
        return solver.and(atLeastOneLevel(), atMostOneLevel());
    }

    // every component, root included, sits at some level in [0, N)
    Formula atLeastOneLevel() {
        List<Formula> clauses = new ArrayList<>();
        for (int i = 0; i < ctx.getNumComponents(); i++) {
            List<Formula> levels = new ArrayList<>();
            for (int n = 0; n < ctx.getNumTranslators(); n++) {
                levels.add(namer.levelInSpanningTree(n, i));
            }
            clauses.add(solver.or(levels));
        }
        return record(ConstraintGroup.AT_LEAST_ONE_LEVEL, clauses);
    }

    Formula atMostOneLevel() {
        List<Formula> clauses = new ArrayList<>();
        for (int i = 0; i < ctx.getNumComponents(); i++) {
            for (int n = 0; n < ctx.getNumTranslators(); n++) {
                for (int nPrime = n + 1; nPrime < ctx.getNumTranslators(); nPrime++) {
                    clauses.add(solver.or(
                            solver.not(namer.levelInSpanningTree(n, i)),
                            solver.not(namer.levelInSpanningTree(nPrime, i))));
                }
            }
        }
        return record(ConstraintGroup.AT_MOST_ONE_LEVEL, clauses);
    }

    // some component sits at a level >= k, i.e. the tree is deeper than k; false when k >= N
    Formula depthExceedsBound() {
        List<Formula> literals = new ArrayList<>();
        for (int i = 0; i < ctx.getNumComponents(); i++) {
            for (int n = ctx.getDepthBound(); n < ctx.getNumTranslators(); n++) {
                literals.add(namer.levelInSpanningTree(n, i));
            }
        }
        clauseCounts.put(ConstraintGroup.DEPTH_BOUND, literals.size());
        return solver.or(literals);
    }

    // some edge (u, v), u < v, with v in the child X_j1 and u in the parent X_j2 holds a translator;
    // false when there is no such edge
    Formula crossingEdgeHasTranslator(int j1, int j2) {
        EdgeConGraph graph = ctx.getGraph();
        List<Formula> literals = new ArrayList<>();
        for (Edge e : ctx.getEdges()) {
            int u = e.getStart(), v = e.getEnd();
            if (graph.isNodeInComponent(v, j1) && graph.isNodeInComponent(u, j2)) {
                for (int i = 0; i < ctx.getNumTranslators(); i++) {
                    literals.add(namer.isIthTranslator(u, v, i));
                }
            }
        }
        return solver.or(literals);
    }

    // if X_j1 is at level h then X_j2 is at level h - 1
    Formula levelCompatibility(int j1, int j2) {
        List<Formula> clauses = new ArrayList<>();
        for (int h = 1; h < ctx.getNumTranslators(); h++) {
            clauses.add(solver.or(
                    solver.not(namer.levelInSpanningTree(h, j1)),
                    namer.levelInSpanningTree(h - 1, j2)));
        }
        return solver.and(clauses);
    }

    // p_[j1,j2] implies both a translator edge between X_j1 and X_j2 and compatible levels
    Formula parentConsistency() {
        List<Formula> constraints = new ArrayList<>();
        for (int j1 = 0; j1 < ctx.getNumComponents(); j1++) {
            if (ctx.isRoot(j1))
                continue;
            for (int j2 = 0; j2 < ctx.getNumComponents(); j2++) {
                if (j1 == j2)
                    continue;
                Formula notParent = solver.not(namer.parent(j1, j2));
                constraints.add(solver.and(
                        solver.or(notParent, crossingEdgeHasTranslator(j1, j2)),
                        solver.or(notParent, levelCompatibility(j1, j2))));
            }
        }
        return record(ConstraintGroup.PARENT_CONSISTENCY, constraints);
    }

    private Formula record(ConstraintGroup group, List<Formula> clauses) {
        clauseCounts.put(group, clauses.size());
        return solver.and(clauses);
    }

    private void checkClauseCounts() {
        for (Map.Entry<ConstraintGroup, Integer> entry : clauseCounts.entrySet()) {
            long expected = entry.getKey().expectedCount(ctx);
            Validate.validState(entry.getValue() == expected,
                    "%s produced %d clauses, expected %d", entry.getKey(), entry.getValue(), expected);
        }
    }
}
