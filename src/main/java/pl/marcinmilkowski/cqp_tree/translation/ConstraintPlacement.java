package pl.marcinmilkowski.cqp_tree.translation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.cqp_tree.query.Conjunction;
import pl.marcinmilkowski.cqp_tree.query.Identifier;
import pl.marcinmilkowski.cqp_tree.query.Predicate;
import pl.marcinmilkowski.cqp_tree.query.Query;
import pl.marcinmilkowski.cqp_tree.query.Token;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges token-local and free-floating predicates into one predicate per token.
 *
 * A predicate whose attributes all belong to one token is attached to that
 * token. Free-floating predicates come first in the merged conjunction,
 * followed by the ones declared on the token itself. Predicates over two or
 * more tokens are kept aside until a token order is known.
 */
public class ConstraintPlacement {
    private static final Logger logger = LoggerFactory.getLogger(ConstraintPlacement.class);

    public PlacedConstraints place(Query query) {
        Set<Identifier> known = query.knownIdentifiers();

        Map<Identifier, List<Predicate>> floating = new LinkedHashMap<>();
        Map<Identifier, List<Predicate>> declared = new LinkedHashMap<>();
        List<Predicate> deferred = new ArrayList<>();

        for (Predicate predicate : query.predicates()) {
            Set<Identifier> owners = ownersOf(predicate, known);
            if (owners.isEmpty()) {
                throw new NotSupportedException("Predicate is not attached to any token: " + predicate);
            }
            if (owners.size() == 1) {
                Identifier owner = owners.iterator().next();
                floating.computeIfAbsent(owner, k -> new ArrayList<>()).add(predicate.lowerOnto(owner));
            } else {
                deferred.add(predicate);
            }
        }

        for (Token token : query.tokens()) {
            if (!token.hasPredicate()) {
                continue;
            }
            // a predicate on token X naming only token Y belongs to Y
            Predicate raised = token.predicate().raiseFrom(token.identifier());
            Set<Identifier> owners = ownersOf(raised, known);
            if (owners.size() > 1) {
                deferred.add(raised);
                continue;
            }
            // constant predicates stay on the token they were declared on
            Identifier owner = owners.isEmpty() ? token.identifier() : owners.iterator().next();
            declared.computeIfAbsent(owner, k -> new ArrayList<>()).add(raised.lowerOnto(owner));
        }

        Map<Identifier, Predicate> merged = new LinkedHashMap<>();
        for (Identifier identifier : known) {
            List<Predicate> parts = new ArrayList<>(floating.getOrDefault(identifier, List.of()));
            parts.addAll(declared.getOrDefault(identifier, List.of()));
            if (!parts.isEmpty()) {
                merged.put(identifier, Conjunction.of(parts));
            }
        }

        logger.debug("Placed predicates on {} of {} tokens, {} cross-token predicate(s) deferred",
            merged.size(), known.size(), deferred.size());
        return new PlacedConstraints(known, merged, deferred);
    }

    private static Set<Identifier> ownersOf(Predicate predicate, Set<Identifier> known) {
        Set<Identifier> owners = predicate.referencedIdentifiers();
        List<Identifier> unknown = new ArrayList<>();
        for (Identifier owner : owners) {
            if (!known.contains(owner)) {
                unknown.add(owner);
            }
        }
        if (!unknown.isEmpty()) {
            throw new UnknownIdentifierException(predicate, unknown);
        }
        return owners;
    }
}
