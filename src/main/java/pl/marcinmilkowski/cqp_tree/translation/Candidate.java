package pl.marcinmilkowski.cqp_tree.translation;

import pl.marcinmilkowski.cqp_tree.query.Identifier;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One total order of all tokens of a query, with the gap allowed after each
 * token but the last.
 */
public record Candidate(List<Identifier> tokens, List<Gap> gaps) {

    public enum Gap {
        /** The next token follows immediately. */
        NONE,
        /** Any number of tokens may lie in between. */
        ANY
    }

    public Candidate {
        tokens = List.copyOf(tokens);
        gaps = List.copyOf(gaps);
        if (!tokens.isEmpty() && gaps.size() != tokens.size() - 1) {
            throw new IllegalArgumentException("Expected " + (tokens.size() - 1) + " gaps, got " + gaps.size());
        }
    }

    public int size() {
        return tokens.size();
    }

    /**
     * Map every token to its position in this candidate.
     */
    public Map<Identifier, Integer> positions() {
        Map<Identifier, Integer> positions = new HashMap<>();
        for (int i = 0; i < tokens.size(); i++) {
            positions.put(tokens.get(i), i);
        }
        return positions;
    }
}
