package pl.marcinmilkowski.cqp_tree.translation;

import pl.marcinmilkowski.cqp_tree.query.Identifier;
import pl.marcinmilkowski.cqp_tree.query.Predicate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of constraint placement: one merged predicate per token plus the
 * cross-token predicates whose placement depends on the final token order.
 *
 * Deferred predicates keep explicit owners on all of their attributes.
 */
public class PlacedConstraints {
    private final Set<Identifier> identifiers;
    private final Map<Identifier, Predicate> tokenPredicates;
    private final List<Predicate> deferredPredicates;

    public PlacedConstraints(Set<Identifier> identifiers,
                             Map<Identifier, Predicate> tokenPredicates,
                             List<Predicate> deferredPredicates) {
        this.identifiers = Collections.unmodifiableSet(identifiers);
        this.tokenPredicates = Collections.unmodifiableMap(new LinkedHashMap<>(tokenPredicates));
        this.deferredPredicates = List.copyOf(deferredPredicates);
    }

    /** All tokens of the query, in first-mention order. */
    public Set<Identifier> getIdentifiers() { return identifiers; }

    public Map<Identifier, Predicate> getTokenPredicates() { return tokenPredicates; }

    public List<Predicate> getDeferredPredicates() { return deferredPredicates; }

    /**
     * @return the merged predicate of a token, or null if it is unconstrained
     */
    public Predicate predicateOf(Identifier identifier) {
        return tokenPredicates.get(identifier);
    }
}
