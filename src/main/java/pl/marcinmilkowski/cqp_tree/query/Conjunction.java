package pl.marcinmilkowski.cqp_tree.query;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Both operands must hold.
 */
public record Conjunction(Predicate left, Predicate right) implements Predicate {

    public Conjunction {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    /**
     * Left-fold the given predicates into nested conjunctions. A single
     * predicate is returned unchanged.
     */
    public static Predicate of(List<? extends Predicate> predicates) {
        if (predicates.isEmpty()) {
            throw new IllegalArgumentException("Cannot create an empty conjunction");
        }
        Iterator<? extends Predicate> it = predicates.iterator();
        Predicate result = it.next();
        while (it.hasNext()) {
            result = new Conjunction(result, it.next());
        }
        return result;
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitConjunction(this);
    }

    @Override
    public Set<Identifier> referencedIdentifiers() {
        Set<Identifier> result = new LinkedHashSet<>(left.referencedIdentifiers());
        result.addAll(right.referencedIdentifiers());
        return result;
    }

    @Override
    public Conjunction raiseFrom(Identifier on) {
        return new Conjunction(left.raiseFrom(on), right.raiseFrom(on));
    }

    @Override
    public Conjunction lowerOnto(Identifier on) {
        return new Conjunction(left.lowerOnto(on), right.lowerOnto(on));
    }
}
