package pl.marcinmilkowski.cqp_tree.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Front-end independent description of a dependency query.
 *
 * All collections keep insertion order, which is what makes the translated
 * pattern reproducible. Identifiers named by dependencies or order
 * constraints without a matching {@link Token} stand for unconstrained
 * tokens.
 */
public record Query(
    List<Token> tokens,
    List<Dependency> dependencies,
    List<Predicate> predicates,
    List<OrderConstraint> constraints
) {

    public Query {
        tokens = List.copyOf(tokens);
        dependencies = List.copyOf(dependencies);
        predicates = List.copyOf(predicates);
        constraints = List.copyOf(constraints);

        Set<Identifier> defined = new LinkedHashSet<>();
        for (Token token : tokens) {
            if (!defined.add(token.identifier())) {
                throw new IllegalArgumentException("Multiple tokens share identifier " + token.identifier());
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Every identifier the query mentions structurally: declared tokens first,
     * then dependency endpoints, then order-constraint endpoints.
     * Identifiers that only occur inside predicates are not included.
     */
    public Set<Identifier> knownIdentifiers() {
        Set<Identifier> result = new LinkedHashSet<>();
        for (Token token : tokens) {
            result.add(token.identifier());
        }
        for (Dependency dependency : dependencies) {
            result.addAll(dependency.referencedIdentifiers());
        }
        for (OrderConstraint constraint : constraints) {
            result.addAll(constraint.referencedIdentifiers());
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * Step-by-step construction, used by the front-ends.
     */
    public static class Builder {
        private final List<Token> tokens = new ArrayList<>();
        private final List<Dependency> dependencies = new ArrayList<>();
        private final List<Predicate> predicates = new ArrayList<>();
        private final List<OrderConstraint> constraints = new ArrayList<>();

        /**
         * Add a token with a fresh identifier.
         *
         * @param predicate local predicate, may be null
         * @return the new token's identifier
         */
        public Identifier token(Predicate predicate) {
            Identifier identifier = new Identifier();
            tokens.add(new Token(identifier, predicate));
            return identifier;
        }

        public Identifier token() {
            return token(null);
        }

        public Builder token(Identifier identifier, Predicate predicate) {
            tokens.add(new Token(identifier, predicate));
            return this;
        }

        public Builder dependency(Identifier governor, Identifier dependent) {
            dependencies.add(new Dependency(governor, dependent));
            return this;
        }

        public Builder predicate(Predicate predicate) {
            predicates.add(predicate);
            return this;
        }

        public Builder before(Identifier first, Identifier second) {
            constraints.add(OrderConstraint.before(first, second));
            return this;
        }

        public Builder immediatelyBefore(Identifier first, Identifier second) {
            constraints.add(OrderConstraint.immediatelyBefore(first, second));
            return this;
        }

        public Builder constraint(OrderConstraint constraint) {
            constraints.add(constraint);
            return this;
        }

        public Query build() {
            return new Query(tokens, dependencies, predicates, constraints);
        }
    }
}
