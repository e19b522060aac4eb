package pl.marcinmilkowski.cqp_tree.query;

import java.util.Objects;
import java.util.Set;

/**
 * The attribute has no value on its token.
 */
public record Absence(Attribute attribute) implements Predicate {

    public Absence {
        Objects.requireNonNull(attribute, "attribute");
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitAbsence(this);
    }

    @Override
    public Set<Identifier> referencedIdentifiers() {
        return attribute.referencedIdentifiers();
    }

    @Override
    public Absence raiseFrom(Identifier on) {
        return new Absence(attribute.raiseFrom(on));
    }

    @Override
    public Absence lowerOnto(Identifier on) {
        return new Absence(attribute.lowerOnto(on));
    }
}
