package pl.marcinmilkowski.cqp_tree.query;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Compares two operands. When both sides are attributes of different tokens
 * this is a cross-token constraint.
 */
public record Comparison(Operand lhs, Operator operator, Operand rhs) implements Predicate {

    public enum Operator {
        EQUAL("="),
        NOT_EQUAL("!=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() { return symbol; }
    }

    public Comparison {
        Objects.requireNonNull(lhs, "lhs");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(rhs, "rhs");
    }

    public static Comparison equal(Operand lhs, Operand rhs) {
        return new Comparison(lhs, Operator.EQUAL, rhs);
    }

    public static Comparison notEqual(Operand lhs, Operand rhs) {
        return new Comparison(lhs, Operator.NOT_EQUAL, rhs);
    }

    /**
     * Shorthand for {@code name = "value"} on the token the predicate is placed on.
     */
    public static Comparison attributeEquals(String name, String literal) {
        return equal(Attribute.local(name), Value.literal(literal));
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public Set<Identifier> referencedIdentifiers() {
        Set<Identifier> result = new LinkedHashSet<>(lhs.referencedIdentifiers());
        result.addAll(rhs.referencedIdentifiers());
        return result;
    }

    @Override
    public Comparison raiseFrom(Identifier on) {
        return new Comparison(lhs.raiseFrom(on), operator, rhs.raiseFrom(on));
    }

    @Override
    public Comparison lowerOnto(Identifier on) {
        return new Comparison(lhs.lowerOnto(on), operator, rhs.lowerOnto(on));
    }
}
