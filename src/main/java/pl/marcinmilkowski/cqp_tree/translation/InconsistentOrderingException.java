package pl.marcinmilkowski.cqp_tree.translation;

import pl.marcinmilkowski.cqp_tree.query.OrderConstraint;

import java.util.List;

/**
 * The order constraints of one component cannot all be satisfied.
 */
public class InconsistentOrderingException extends TranslationException {
    private final List<OrderConstraint> conflictingConstraints;

    public InconsistentOrderingException(String message, List<OrderConstraint> conflictingConstraints) {
        super(message + ": " + conflictingConstraints);
        this.conflictingConstraints = List.copyOf(conflictingConstraints);
    }

    public List<OrderConstraint> getConflictingConstraints() { return conflictingConstraints; }
}
