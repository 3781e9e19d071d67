// This is the key class for the propositional variables of the EdgeCon reduction.

package edgecon.sat;

import java.util.Objects;

public final class Proposition {
    public enum Family {
        TRANSLATOR, PARENT, LEVEL
    }

    private final Family family;
    private final int first, second, third;

    private Proposition(Family family, int first, int second, int third) {
        this.family = family;
        this.first = first;
        this.second = second;
        this.third = third;
    }

    // "the edge (node1, node2) carries the number-th translator", endpoints stored smaller first
    public static Proposition isIthTranslator(int node1, int node2, int number) {
        if (node1 < node2)
            return new Proposition(Family.TRANSLATOR, node1, node2, number);
        return new Proposition(Family.TRANSLATOR, node2, node1, number);
    }

    // "parent is the parent of child in the component tree"
    public static Proposition parent(int child, int parent) {
        return new Proposition(Family.PARENT, child, parent, 0);
    }

    // "component sits at the given level of the component tree"
    public static Proposition levelInSpanningTree(int level, int component) {
        return new Proposition(Family.LEVEL, component, level, 0);
    }

    public Family getFamily() {
        return family;
    }

    public int getFirst() {
        return first;
    }

    public int getSecond() {
        return second;
    }

    public int getThird() {
        return third;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Proposition)) return false;
        Proposition that = (Proposition) o;
        return family == that.family &&
                first == that.first &&
                second == that.second &&
                third == that.third;
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, first, second, third);
    }

    @Override
    public String toString() {
        switch (family) {
            case TRANSLATOR:
                return "x_[(" + first + "," + second + ")," + third + "]";
            case PARENT:
                return "p_[" + first + "," + second + "]";
            default:
                return "l_[" + first + "," + second + "]";
        }
    }
}
