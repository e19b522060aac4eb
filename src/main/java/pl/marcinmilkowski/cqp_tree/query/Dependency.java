package pl.marcinmilkowski.cqp_tree.query;

import java.util.List;
import java.util.Objects;

/**
 * Directed governor-to-dependent edge. Says nothing about surface order.
 */
public record Dependency(Identifier governor, Identifier dependent) {

    public Dependency {
        Objects.requireNonNull(governor, "governor");
        Objects.requireNonNull(dependent, "dependent");
    }

    public List<Identifier> referencedIdentifiers() {
        return List.of(governor, dependent);
    }
}
