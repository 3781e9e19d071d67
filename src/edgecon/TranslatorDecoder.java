// This class reads the translators (and the component tree) back out of a model of the EdgeCon formula.

package edgecon;

import edgecon.sat.Model;
import edgecon.sat.Proposition;
import edgecon.sat.SATResult;
import org.apache.commons.lang3.Validate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class TranslatorDecoder {
    private static final Logger log = LogManager.getFormatterLogger();

    /**
     * Puts a translator on every edge the model assigned one to, then recomputes the homogeneous
     * components of the graph.
     *
     * @param result the answer of the solver for the formula built on {@code graph}
     * @return the edges that received a translator, in increasing order
     * @throws IllegalStateException if the solver did not answer SAT
     */
    public static List<Edge> decodeTranslatorAssignment(SATResult result, EdgeConGraph graph) {
        Validate.notNull(result, "result");
        Validate.validState(result.isSatisfiable(), "Cannot decode translators from a %s answer", result.getStatus());
        return decodeTranslatorAssignment(result.getModel(), graph);
    }

    // the model must come from a SAT answer for the formula built on this graph, before any recomputation
    public static List<Edge> decodeTranslatorAssignment(Model model, EdgeConGraph graph) {
        Validate.notNull(model, "model");
        Validate.notNull(graph, "graph");
        int N = graph.numHomogeneousComponents() - 1;

        List<Edge> decoded = new ArrayList<>();
        for (Edge e : graph.edges()) {
            for (int i = 0; i < N; i++) {
                if (isTheIthTranslator(model, e, i)) {
                    log.debug("val(x_[%s,%d]) = 1", e, i);
                    graph.addTranslatorEdge(e.getStart(), e.getEnd());
                    decoded.add(e);
                }
            }
        }
        graph.recomputeHomogeneousComponents();
        log.info("Decoded %d translators, %d homogeneous components left", decoded.size(), graph.numHomogeneousComponents());
        return decoded;
    }

    // parents[j] is the parent of X_j in the model, -1 for the root or when none is set
    public static int[] decodeParents(Model model, int numComponents) {
        int[] parents = new int[numComponents];
        Arrays.fill(parents, -1);
        for (int j = 0; j < numComponents; j++) {
            if (j == ReductionContext.ROOT_COMPONENT)
                continue;
            for (int j1 = 0; j1 < numComponents; j1++) {
                if (j1 != j && model.valueOf(Proposition.parent(j, j1))) {
                    parents[j] = j1;
                    break;
                }
            }
        }
        return parents;
    }

    // levels[j] is the level of X_j in the model, -1 when none is set
    public static int[] decodeLevels(Model model, int numComponents) {
        int[] levels = new int[numComponents];
        Arrays.fill(levels, -1);
        for (int j = 0; j < numComponents; j++) {
            for (int h = 0; h < numComponents - 1; h++) {
                if (model.valueOf(Proposition.levelInSpanningTree(h, j))) {
                    levels[j] = h;
                    break;
                }
            }
        }
        return levels;
    }

    private static boolean isTheIthTranslator(Model model, Edge e, int i) {
        return model.valueOf(Proposition.isIthTranslator(e.getStart(), e.getEnd(), i));
    }
}
