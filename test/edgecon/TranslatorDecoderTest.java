package edgecon;

import edgecon.sat.BooleanSolver;
import edgecon.sat.Model;
import edgecon.sat.SATResult;
import org.junit.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class TranslatorDecoderTest {

    @Test
    public void singleEdgeGetsTheTranslator() {
        EdgeConGraph graph = TestGraphs.singleEdge();
        BooleanSolver solver = new BooleanSolver();
        SATResult result = solver.solve(EdgeConReduction.buildReductionFormula(solver, graph, 0));

        List<Edge> translators = TranslatorDecoder.decodeTranslatorAssignment(result, graph);
        assertEquals(Collections.singletonList(new Edge(0, 1)), translators);
        assertTrue(graph.isTranslator(0, 1));
        assertEquals(1, graph.numHomogeneousComponents());
    }

    @Test
    public void decodedTranslatorsMatchTheModel() {
        EdgeConGraph graph = TestGraphs.star5();
        BooleanSolver solver = new BooleanSolver();
        SATResult result = solver.solve(EdgeConReduction.buildReductionFormula(solver, graph, 1));
        assertTrue(result.isSatisfiable());
        int N = graph.numHomogeneousComponents() - 1;
        int[] parents = TranslatorDecoder.decodeParents(result.getModel(), graph.numHomogeneousComponents());

        List<Edge> translators = TranslatorDecoder.decodeTranslatorAssignment(result, graph);
        assertTrue(translators.size() <= N);
        assertEquals(graph.translatorEdges(), translators);
        for (Edge e : translators) {
            assertTrue(graph.isEdge(e.getStart(), e.getEnd()));
        }
        // every child hangs off node 0, the only node touching the other components
        assertEquals(-1, parents[ReductionContext.ROOT_COMPONENT]);
        for (int j = 1; j < parents.length; j++) {
            assertEquals(0, parents[j]);
        }
        assertEquals(1, graph.numHomogeneousComponents());
    }

    @Test
    public void decodingTwiceGivesTheSameTranslators() {
        EdgeConGraph graph = TestGraphs.path4();
        BooleanSolver solver = new BooleanSolver();
        Model model = solver.solve(EdgeConReduction.buildReductionFormula(solver, graph, 1)).getModel();
        EdgeConGraph copy = new EdgeConGraph(graph);

        List<Edge> first = TranslatorDecoder.decodeTranslatorAssignment(model, graph);
        graph.clearTranslators();
        List<Edge> second = TranslatorDecoder.decodeTranslatorAssignment(model, graph);
        List<Edge> third = TranslatorDecoder.decodeTranslatorAssignment(model, copy);

        assertFalse(first.isEmpty());
        assertEquals(first, second);
        assertEquals(first, third);
        assertEquals(graph.translatorEdges(), copy.translatorEdges());
    }

    @Test(expected = IllegalStateException.class)
    public void refusesUnsatAnswer() {
        EdgeConGraph graph = TestGraphs.singleEdge();
        BooleanSolver solver = new BooleanSolver();
        SATResult result = solver.solve(EdgeConReduction.buildReductionFormula(solver, graph, 1));
        assertFalse(result.isSatisfiable());
        TranslatorDecoder.decodeTranslatorAssignment(result, graph);
    }

    @Test(expected = NullPointerException.class)
    public void refusesMissingModel() {
        TranslatorDecoder.decodeTranslatorAssignment((Model) null, TestGraphs.singleEdge());
    }
}
