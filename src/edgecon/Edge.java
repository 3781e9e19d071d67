// This is the auxiliary class for undirected edges, always stored with the smaller endpoint first.

package edgecon;

import java.util.Objects;

public class Edge implements Comparable<Edge> {
    private final int start;
    private final int end;

    public Edge(int node1, int node2) {
        this.start = Math.min(node1, node2);
        this.end = Math.max(node1, node2);
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    @Override
    public int compareTo(Edge o) {
        if (start != o.start)
            return Integer.compare(start, o.start);
        return Integer.compare(end, o.end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge)) return false;
        Edge edge = (Edge) o;
        return start == edge.start &&
                end == edge.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "(" + start + ", " + end + ")";
    }
}
