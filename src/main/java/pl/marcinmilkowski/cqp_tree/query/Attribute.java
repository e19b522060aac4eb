package pl.marcinmilkowski.cqp_tree.query;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;

/**
 * Named attribute of a token. A null owner stands for the token the enclosing
 * predicate is placed on.
 */
public record Attribute(Identifier owner, String name) implements Operand {

    public Attribute {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Attribute name must not be blank");
        }
    }

    /**
     * Attribute of the token the predicate ends up on.
     */
    public static Attribute local(String name) {
        return new Attribute(null, name);
    }

    public static Attribute of(Identifier owner, String name) {
        return new Attribute(Objects.requireNonNull(owner, "owner"), name);
    }

    public boolean isLocal() {
        return owner == null;
    }

    @Override
    public <R> R accept(OperandVisitor<R> visitor) {
        return visitor.visitAttribute(this);
    }

    @Override
    public Set<Identifier> referencedIdentifiers() {
        return owner == null ? Collections.emptySet() : Set.of(owner);
    }

    @Override
    public Attribute raiseFrom(Identifier on) {
        return owner == null ? new Attribute(on, name) : this;
    }

    @Override
    public Attribute lowerOnto(Identifier on) {
        return owner == on ? new Attribute(null, name) : this;
    }
}
