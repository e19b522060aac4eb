package pl.marcinmilkowski.cqp_tree.translation;

/**
 * Enumeration produced more candidate sequences than the caller allowed.
 */
public class CandidateLimitExceededException extends TranslationException {
    private final int limit;

    public CandidateLimitExceededException(int limit) {
        super("Query expands to more than " + limit + " candidate sequences");
        this.limit = limit;
    }

    public int getLimit() { return limit; }
}
