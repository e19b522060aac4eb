package pl.marcinmilkowski.cqp_tree.translation;

import pl.marcinmilkowski.cqp_tree.query.Identifier;
import pl.marcinmilkowski.cqp_tree.query.Predicate;

import java.util.List;

/**
 * A predicate refers to a token the query does not know about.
 */
public class UnknownIdentifierException extends NotSupportedException {
    private final Predicate predicate;
    private final List<Identifier> unknownIdentifiers;

    public UnknownIdentifierException(Predicate predicate, List<Identifier> unknownIdentifiers) {
        super("Predicate refers to unknown token(s) " + unknownIdentifiers + ": " + predicate);
        this.predicate = predicate;
        this.unknownIdentifiers = List.copyOf(unknownIdentifiers);
    }

    public Predicate getPredicate() { return predicate; }
    public List<Identifier> getUnknownIdentifiers() { return unknownIdentifiers; }
}
