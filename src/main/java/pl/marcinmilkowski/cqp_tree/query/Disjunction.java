package pl.marcinmilkowski.cqp_tree.query;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * At least one operand must hold.
 */
public record Disjunction(Predicate left, Predicate right) implements Predicate {

    public Disjunction {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    /**
     * Left-fold the given predicates into nested disjunctions. A single
     * predicate is returned unchanged.
     */
    public static Predicate of(List<? extends Predicate> predicates) {
        if (predicates.isEmpty()) {
            throw new IllegalArgumentException("Cannot create an empty disjunction");
        }
        Iterator<? extends Predicate> it = predicates.iterator();
        Predicate result = it.next();
        while (it.hasNext()) {
            result = new Disjunction(result, it.next());
        }
        return result;
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitDisjunction(this);
    }

    @Override
    public Set<Identifier> referencedIdentifiers() {
        Set<Identifier> result = new LinkedHashSet<>(left.referencedIdentifiers());
        result.addAll(right.referencedIdentifiers());
        return result;
    }

    @Override
    public Disjunction raiseFrom(Identifier on) {
        return new Disjunction(left.raiseFrom(on), right.raiseFrom(on));
    }

    @Override
    public Disjunction lowerOnto(Identifier on) {
        return new Disjunction(left.lowerOnto(on), right.lowerOnto(on));
    }
}
