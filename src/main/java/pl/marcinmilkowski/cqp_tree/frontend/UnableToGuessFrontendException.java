package pl.marcinmilkowski.cqp_tree.frontend;

import pl.marcinmilkowski.cqp_tree.translation.TranslationException;

import java.util.List;

/**
 * No front-end, or more than one, accepted the input.
 */
public class UnableToGuessFrontendException extends TranslationException {
    private final List<String> matchingFrontends;

    public UnableToGuessFrontendException(List<String> matchingFrontends) {
        super(matchingFrontends.isEmpty()
            ? "Cannot guess front-end for query: no front-end accepts it"
            : "Cannot guess front-end for query: accepted by " + String.join(", ", matchingFrontends));
        this.matchingFrontends = List.copyOf(matchingFrontends);
    }

    public List<String> getMatchingFrontends() { return matchingFrontends; }

    public boolean noFrontendMatches() {
        return matchingFrontends.isEmpty();
    }
}
