package pl.marcinmilkowski.cqp_tree.query;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Handle for one logical token of a query.
 *
 * Two identifiers are equal only if they are the same instance. The numeric id
 * exists for debugging output and carries no meaning otherwise.
 */
public final class Identifier {
    private static final AtomicInteger NEXT_ID = new AtomicInteger(0);

    private final int id;

    public Identifier() {
        this.id = NEXT_ID.getAndIncrement();
    }

    public int getId() { return id; }

    @Override
    public String toString() {
        return "Identifier(" + id + ")";
    }
}
