package pl.marcinmilkowski.cqp_tree.query;

import java.util.List;
import java.util.Objects;

/**
 * Requires {@code first} to occur before {@code second} in every match.
 */
public record OrderConstraint(Identifier first, Identifier second, Kind kind) {

    public enum Kind {
        /** {@code second} is the very next token after {@code first}. */
        IMMEDIATE,
        /** {@code second} occurs somewhere after {@code first}. */
        GENERAL
    }

    public OrderConstraint {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        Objects.requireNonNull(kind, "kind");
    }

    public static OrderConstraint before(Identifier first, Identifier second) {
        return new OrderConstraint(first, second, Kind.GENERAL);
    }

    public static OrderConstraint immediatelyBefore(Identifier first, Identifier second) {
        return new OrderConstraint(first, second, Kind.IMMEDIATE);
    }

    public boolean isImmediate() {
        return kind == Kind.IMMEDIATE;
    }

    public List<Identifier> referencedIdentifiers() {
        return List.of(first, second);
    }

    @Override
    public String toString() {
        return first + (isImmediate() ? " immediately before " : " before ") + second;
    }
}
