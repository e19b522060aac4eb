package pl.marcinmilkowski.cqp_tree.query;

import java.util.Objects;
import java.util.Set;

/**
 * The attribute has a value on its token.
 */
public record Presence(Attribute attribute) implements Predicate {

    public Presence {
        Objects.requireNonNull(attribute, "attribute");
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitPresence(this);
    }

    @Override
    public Set<Identifier> referencedIdentifiers() {
        return attribute.referencedIdentifiers();
    }

    @Override
    public Presence raiseFrom(Identifier on) {
        return new Presence(attribute.raiseFrom(on));
    }

    @Override
    public Presence lowerOnto(Identifier on) {
        return new Presence(attribute.lowerOnto(on));
    }
}
