package pl.marcinmilkowski.cqp_tree.translation;

import pl.marcinmilkowski.cqp_tree.query.Identifier;
import pl.marcinmilkowski.cqp_tree.query.OrderConstraint;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tokens connected by dependency edges or order constraints, together with
 * the strict partial order those constraints induce.
 *
 * Members are addressed by their index in {@link #getMembers()}.
 */
public class Component {
    private static final int NONE = -1;

    private final List<Identifier> members;
    private final List<OrderConstraint> constraints;
    private final Map<Identifier, Integer> indexOf = new HashMap<>();
    private final boolean[][] precedes;
    private final int[] immediateSuccessor;
    private final int[] immediatePredecessor;

    Component(List<Identifier> members, List<OrderConstraint> constraints, boolean[][] precedes,
              int[] immediateSuccessor, int[] immediatePredecessor) {
        this.members = List.copyOf(members);
        this.constraints = List.copyOf(constraints);
        this.precedes = precedes;
        this.immediateSuccessor = immediateSuccessor;
        this.immediatePredecessor = immediatePredecessor;
        for (int i = 0; i < this.members.size(); i++) {
            indexOf.put(this.members.get(i), i);
        }
    }

    public List<Identifier> getMembers() { return members; }

    public List<OrderConstraint> getConstraints() { return constraints; }

    public int size() { return members.size(); }

    public int indexOf(Identifier identifier) {
        Integer index = indexOf.get(identifier);
        return index == null ? NONE : index;
    }

    public boolean contains(Identifier identifier) {
        return indexOf.containsKey(identifier);
    }

    /**
     * True if member {@code i} must occur before member {@code j}, directly or
     * through a chain of constraints.
     */
    public boolean mustPrecede(int i, int j) {
        return precedes[i][j];
    }

    /** @return index of the member that must directly follow {@code i}, or -1 */
    public int immediateSuccessor(int i) {
        return immediateSuccessor[i];
    }

    /** @return index of the member that must directly precede {@code i}, or -1 */
    public int immediatePredecessor(int i) {
        return immediatePredecessor[i];
    }

    public boolean isUnordered() {
        return constraints.isEmpty();
    }

    static int[] emptyLinks(int size) {
        int[] links = new int[size];
        Arrays.fill(links, NONE);
        return links;
    }

    @Override
    public String toString() {
        return "Component(" + members + ", " + constraints.size() + " order constraint(s))";
    }
}
