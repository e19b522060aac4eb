package pl.marcinmilkowski.cqp_tree.query;

import java.util.Objects;

/**
 * A token of the searched dependency structure.
 *
 * @param identifier handle of the token
 * @param predicate  local predicate, or null for "any token"
 */
public record Token(Identifier identifier, Predicate predicate) {

    public Token {
        Objects.requireNonNull(identifier, "identifier");
    }

    public Token(Identifier identifier) {
        this(identifier, null);
    }

    public boolean hasPredicate() {
        return predicate != null;
    }
}
