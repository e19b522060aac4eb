package pl.marcinmilkowski.cqp_tree.translation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.cqp_tree.query.Dependency;
import pl.marcinmilkowski.cqp_tree.query.Identifier;
import pl.marcinmilkowski.cqp_tree.query.OrderConstraint;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups tokens into components and derives each component's partial order.
 *
 * Dependency edges connect tokens but impose no order. An order constraint
 * connects its endpoints as well, so a constraint between two dependency
 * trees merges them into one component.
 */
public class OrderingModel {
    private static final Logger logger = LoggerFactory.getLogger(OrderingModel.class);

    /**
     * @param identifiers all tokens of the query, in first-mention order
     * @return components ordered by their first member
     * @throws InconsistentOrderingException if the constraints of a component contradict each other
     */
    public List<Component> build(Set<Identifier> identifiers,
                                 List<Dependency> dependencies,
                                 List<OrderConstraint> constraints) {
        List<Identifier> order = new ArrayList<>(identifiers);
        Map<Identifier, Integer> position = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            position.put(order.get(i), i);
        }

        int[] parent = new int[order.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }
        for (Dependency dependency : dependencies) {
            if (dependency.governor() == dependency.dependent()) {
                throw new NotSupportedException("Token depends on itself: " + dependency.governor());
            }
            union(parent, position.get(dependency.governor()), position.get(dependency.dependent()));
        }
        for (OrderConstraint constraint : constraints) {
            union(parent, position.get(constraint.first()), position.get(constraint.second()));
        }

        Map<Integer, List<Identifier>> membersByRoot = new LinkedHashMap<>();
        for (int i = 0; i < order.size(); i++) {
            membersByRoot.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(order.get(i));
        }
        Map<Integer, List<OrderConstraint>> constraintsByRoot = new HashMap<>();
        for (OrderConstraint constraint : constraints) {
            int root = find(parent, position.get(constraint.first()));
            constraintsByRoot.computeIfAbsent(root, k -> new ArrayList<>()).add(constraint);
        }

        List<Component> components = new ArrayList<>();
        for (Map.Entry<Integer, List<Identifier>> entry : membersByRoot.entrySet()) {
            components.add(buildComponent(entry.getValue(),
                constraintsByRoot.getOrDefault(entry.getKey(), List.of())));
        }
        logger.debug("Built {} component(s) over {} token(s)", components.size(), order.size());
        return components;
    }

    private Component buildComponent(List<Identifier> members, List<OrderConstraint> constraints) {
        int n = members.size();
        Map<Identifier, Integer> local = new HashMap<>();
        for (int i = 0; i < n; i++) {
            local.put(members.get(i), i);
        }

        boolean[][] precedes = new boolean[n][n];
        int[] successor = Component.emptyLinks(n);
        int[] predecessor = Component.emptyLinks(n);
        OrderConstraint[] successorSource = new OrderConstraint[n];
        OrderConstraint[] predecessorSource = new OrderConstraint[n];

        for (OrderConstraint constraint : constraints) {
            int a = local.get(constraint.first());
            int b = local.get(constraint.second());
            precedes[a][b] = true;
            if (!constraint.isImmediate() || a == b) {
                continue;
            }
            if (successor[a] != -1 && successor[a] != b) {
                throw new InconsistentOrderingException(
                    "Token cannot be immediately followed by two different tokens",
                    List.of(successorSource[a], constraint));
            }
            if (predecessor[b] != -1 && predecessor[b] != a) {
                throw new InconsistentOrderingException(
                    "Token cannot immediately follow two different tokens",
                    List.of(predecessorSource[b], constraint));
            }
            successor[a] = b;
            successorSource[a] = constraint;
            predecessor[b] = a;
            predecessorSource[b] = constraint;
        }

        // Warshall's transitive closure
        for (int k = 0; k < n; k++) {
            for (int i = 0; i < n; i++) {
                if (!precedes[i][k]) {
                    continue;
                }
                for (int j = 0; j < n; j++) {
                    if (precedes[k][j]) {
                        precedes[i][j] = true;
                    }
                }
            }
        }

        List<OrderConstraint> cyclic = new ArrayList<>();
        for (OrderConstraint constraint : constraints) {
            int a = local.get(constraint.first());
            int b = local.get(constraint.second());
            if (precedes[b][a]) {
                cyclic.add(constraint);
            }
        }
        if (!cyclic.isEmpty()) {
            throw new InconsistentOrderingException("Order constraints form a cycle", cyclic);
        }

        return new Component(members, constraints, precedes, successor, predecessor);
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int rootA = find(parent, a);
        int rootB = find(parent, b);
        if (rootA == rootB) {
            return;
        }
        // keep the earlier-mentioned token as root
        if (rootA < rootB) {
            parent[rootB] = rootA;
        } else {
            parent[rootA] = rootB;
        }
    }
}
