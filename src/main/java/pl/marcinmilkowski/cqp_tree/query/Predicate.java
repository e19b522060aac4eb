package pl.marcinmilkowski.cqp_tree.query;

import java.util.Set;

/**
 * Boolean expression over token attributes.
 *
 * The set of variants is closed: {@link Conjunction}, {@link Disjunction},
 * {@link Negation}, {@link Presence}, {@link Absence} and {@link Comparison}.
 * Every compiler stage dispatches through {@link PredicateVisitor}, so a new
 * variant will not compile until each stage handles it.
 */
public interface Predicate {

    <R> R accept(PredicateVisitor<R> visitor);

    /**
     * Identifiers named anywhere in this expression, in order of appearance.
     */
    Set<Identifier> referencedIdentifiers();

    /**
     * Rewrite local attributes as attributes owned by {@code on}.
     */
    Predicate raiseFrom(Identifier on);

    /**
     * Rewrite attributes owned by {@code on} as local attributes.
     */
    Predicate lowerOnto(Identifier on);

    default Predicate and(Predicate other) {
        return new Conjunction(this, other);
    }

    default Predicate or(Predicate other) {
        return new Disjunction(this, other);
    }

    default Predicate negate() {
        return new Negation(this);
    }
}
