package pl.marcinmilkowski.cqp_tree.query;

import java.util.Objects;
import java.util.Set;

public record Negation(Predicate operand) implements Predicate {

    public Negation {
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitNegation(this);
    }

    @Override
    public Set<Identifier> referencedIdentifiers() {
        return operand.referencedIdentifiers();
    }

    @Override
    public Negation raiseFrom(Identifier on) {
        return new Negation(operand.raiseFrom(on));
    }

    @Override
    public Negation lowerOnto(Identifier on) {
        return new Negation(operand.lowerOnto(on));
    }
}
