// This class holds everything the EdgeCon reduction reads while it builds its formula.

package edgecon;

import edgecon.sat.BooleanSolver;
import org.apache.commons.lang3.Validate;

import java.util.Collections;
import java.util.List;

public class ReductionContext {
    // the component that needs no parent
    public static final int ROOT_COMPONENT = 0;

    private final EdgeConGraph graph;
    private final VariableNamer namer;
    private final List<Edge> edges;  // canonical edge list, computed once
    private final int n;  // number of nodes
    private final int m;  // number of edges
    private final int C_H;  // number of homogeneous components
    private final int N;  // number of translators, C_H - 1
    private final int k;  // depth bound

    public ReductionContext(BooleanSolver solver, EdgeConGraph graph, int depthBound) {
        this.graph = Validate.notNull(graph, "graph");
        Validate.isTrue(depthBound >= 0, "Depth bound must not be negative, got %d", depthBound);
        Validate.isTrue(graph.numNodes() > 0, "Cannot reduce an empty graph");
        this.namer = new VariableNamer(Validate.notNull(solver, "solver"));
        this.edges = Collections.unmodifiableList(graph.edges());
        this.n = graph.numNodes();
        this.m = graph.numEdges();
        this.C_H = graph.numHomogeneousComponents();
        this.N = C_H - 1;
        this.k = depthBound;
    }

    public EdgeConGraph getGraph() {
        return graph;
    }

    public VariableNamer getNamer() {
        return namer;
    }

    public List<Edge> getEdges() {
        return edges;
    }

    public int getNumNodes() {
        return n;
    }

    public int getNumEdges() {
        return m;
    }

    public int getNumComponents() {
        return C_H;
    }

    public int getNumTranslators() {
        return N;
    }

    public int getDepthBound() {
        return k;
    }

    public boolean isRoot(int component) {
        return component == ROOT_COMPONENT;
    }

    @Override
    public String toString() {
        return "ReductionContext{n=" + n + ", m=" + m + ", C_H=" + C_H + ", N=" + N + ", k=" + k + '}';
    }
}
