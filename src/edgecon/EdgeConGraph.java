// This is the graph of the EdgeCon problem: an undirected graph whose edges are either homogeneous
// (both ends share a protocol) or heterogeneous, plus the set of edges that received a translator.

package edgecon;

import org.apache.commons.lang3.Validate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.lucene.util.OpenBitSet;

import java.util.*;

/**
 * Homogeneous components are the connected components of the subgraph made of the homogeneous
 * edges and the translator edges. They are a snapshot: edge and translator updates only show up
 * in the components after {@link #recomputeHomogeneousComponents()}.
 * <p>
 * Components are numbered in the order a DFS discovers them when started from the lowest
 * unvisited node, so component 0 always holds node 0.
 */
public class EdgeConGraph {
    private static final Logger log = LogManager.getFormatterLogger();

    private final int numNodes;
    private final List<Set<Integer>> adj;
    private final Set<Edge> homogeneousEdges;
    private final Set<Edge> translators;
    private int numEdges;

    private List<OpenBitSet> components;
    private int[] componentNumber;

    public EdgeConGraph(int numNodes) {
        Validate.isTrue(numNodes >= 0, "Negative number of nodes: %d", numNodes);
        this.numNodes = numNodes;
        adj = new ArrayList<>(numNodes);
        for (int i = 0; i < numNodes; i++) {
            adj.add(new HashSet<>());
        }
        homogeneousEdges = new HashSet<>();
        translators = new TreeSet<>();
        numEdges = 0;
        recomputeHomogeneousComponents();
    }

    // independent copy with the same edges, translators and components
    public EdgeConGraph(EdgeConGraph other) {
        this(other.numNodes);
        for (int u = 0; u < numNodes; u++) {
            for (int v : other.adj.get(u)) {
                if (u < v)
                    addEdge(u, v, other.isHomogeneous(u, v));
            }
        }
        translators.addAll(other.translators);
        recomputeHomogeneousComponents();
    }

    public void addEdge(int u, int v, boolean homogeneous) {
        checkNode(u);
        checkNode(v);
        Validate.isTrue(u != v, "Self loop on node %d", u);
        Validate.isTrue(!adj.get(u).contains(v), "Duplicate edge (%d, %d)", u, v);
        adj.get(u).add(v);
        adj.get(v).add(u);
        if (homogeneous)
            homogeneousEdges.add(new Edge(u, v));
        numEdges++;
    }

    public int numNodes() {
        return numNodes;
    }

    public int numEdges() {
        return numEdges;
    }

    public boolean isEdge(int u, int v) {
        checkNode(u);
        checkNode(v);
        return adj.get(u).contains(v);
    }

    public boolean isHomogeneous(int u, int v) {
        return homogeneousEdges.contains(new Edge(u, v));
    }

    // all edges, smaller endpoint first, in lexicographic order
    public List<Edge> edges() {
        List<Edge> edges = new ArrayList<>(numEdges);
        for (int u = 0; u < numNodes; u++) {
            for (int v : adj.get(u)) {
                if (u < v)
                    edges.add(new Edge(u, v));
            }
        }
        Collections.sort(edges);
        return edges;
    }

    public int numHomogeneousComponents() {
        return components.size();
    }

    public boolean isNodeInComponent(int node, int component) {
        checkNode(node);
        Validate.validIndex(components, component, "Unknown component %d", component);
        return components.get(component).get(node);
    }

    public int componentOf(int node) {
        checkNode(node);
        return componentNumber[node];
    }

    // nodes of the component in increasing order
    public List<Integer> componentNodes(int component) {
        Validate.validIndex(components, component, "Unknown component %d", component);
        List<Integer> nodes = new ArrayList<>();
        OpenBitSet members = components.get(component);
        for (int i = members.nextSetBit(0); i >= 0; i = members.nextSetBit(i + 1)) {
            nodes.add(i);
        }
        return nodes;
    }

    public void addTranslatorEdge(int u, int v) {
        Validate.isTrue(isEdge(u, v), "Cannot put a translator on the missing edge (%d, %d)", u, v);
        translators.add(new Edge(u, v));
    }

    public boolean isTranslator(int u, int v) {
        return translators.contains(new Edge(u, v));
    }

    public List<Edge> translatorEdges() {
        return new ArrayList<>(translators);
    }

    public int numTranslators() {
        return translators.size();
    }

    public void clearTranslators() {
        translators.clear();
        recomputeHomogeneousComponents();
    }

    public void recomputeHomogeneousComponents() {
        components = new ArrayList<>();
        componentNumber = new int[numNodes];
        Arrays.fill(componentNumber, -1);

        Deque<Integer> stack = new ArrayDeque<>();
        for (int start = 0; start < numNodes; start++) {
            if (componentNumber[start] != -1)
                continue;
            int currCCNumber = components.size();
            OpenBitSet members = new OpenBitSet(numNodes);
            components.add(members);

            stack.push(start);
            componentNumber[start] = currCCNumber;
            while (!stack.isEmpty()) {
                int v = stack.pop();
                members.set(v);
                for (int x : adj.get(v)) {
                    if (componentNumber[x] == -1 && isConnecting(v, x)) {
                        componentNumber[x] = currCCNumber;
                        stack.push(x);
                    }
                }
            }
        }
        log.debug("%d homogeneous components over %d nodes (%d translators)", components.size(), numNodes, translators.size());
    }

    // an edge joins two nodes into the same component if it is homogeneous or carries a translator
    private boolean isConnecting(int u, int v) {
        Edge e = new Edge(u, v);
        return homogeneousEdges.contains(e) || translators.contains(e);
    }

    private void checkNode(int node) {
        Validate.isTrue(node >= 0 && node < numNodes, "Node %d out of range [0, %d)", node, numNodes);
    }

    @Override
    public String toString() {
        return "EdgeConGraph{" +
                "nodes=" + numNodes +
                ", edges=" + edges() +
                ", homogeneous=" + new TreeSet<>(homogeneousEdges) +
                ", translators=" + translators +
                ", components=" + components.size() +
                '}';
    }
}
