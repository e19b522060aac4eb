package pl.marcinmilkowski.cqp_tree.translation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.cqp_tree.query.Identifier;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Enumerates every token order a query can appear in.
 *
 * Each component contributes its linear extensions. Tokens of different
 * components interleave freely, except that nothing may be placed between
 * two tokens joined by an immediate constraint.
 *
 * Enumeration is lazy: extensions and interleavings are generated one at a
 * time, so a candidate limit applies before anything large is built. Every
 * call to {@link #iterator()} starts over.
 * Candidates come out in a fixed order: the extension of the first component
 * changes slowest, and for each choice of extensions the interleavings follow
 * in lexicographic order of their component sequence.
 */
public class LinearizationEnumerator implements Iterable<Candidate> {
    private static final Logger logger = LoggerFactory.getLogger(LinearizationEnumerator.class);

    private final List<Component> components;
    private final int candidateLimit;

    /**
     * @param components     components of the query, in output order
     * @param candidateLimit maximum number of candidates, 0 for no limit
     */
    public LinearizationEnumerator(List<Component> components, int candidateLimit) {
        if (candidateLimit < 0) {
            throw new IllegalArgumentException("Candidate limit must not be negative: " + candidateLimit);
        }
        this.components = List.copyOf(components);
        this.candidateLimit = candidateLimit;
    }

    public LinearizationEnumerator(List<Component> components) {
        this(components, 0);
    }

    @Override
    public Iterator<Candidate> iterator() {
        return new CandidateIterator();
    }

    /**
     * Collect all candidates into a list.
     */
    public List<Candidate> toList() {
        List<Candidate> result = new ArrayList<>();
        for (Candidate candidate : this) {
            result.add(candidate);
        }
        return result;
    }

    /**
     * Lazily enumerates the linear extensions of one component, as member
     * indices, by backtracking over an explicit stack.
     */
    static class ExtensionIterator implements Iterator<int[]> {
        private final Component component;
        private final int size;
        private final int[] current;
        private final boolean[] placed;
        /** Next member index to try at each depth. */
        private final int[] cursor;
        private int depth;
        private int[] next;
        private boolean exhausted;

        ExtensionIterator(Component component) {
            this.component = component;
            this.size = component.size();
            this.current = new int[size];
            this.placed = new boolean[size];
            this.cursor = new int[size];
        }

        @Override
        public boolean hasNext() {
            if (next == null && !exhausted) {
                next = advance();
                exhausted = next == null;
            }
            return next != null;
        }

        @Override
        public int[] next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int[] result = next;
            next = null;
            return result;
        }

        private int[] advance() {
            while (depth >= 0) {
                if (depth == size) {
                    int[] result = current.clone();
                    depth--;
                    if (depth >= 0) {
                        placed[current[depth]] = false;
                    }
                    return result;
                }
                int member = nextPlaceable(cursor[depth]);
                if (member == -1) {
                    cursor[depth] = 0;
                    depth--;
                    if (depth >= 0) {
                        placed[current[depth]] = false;
                    }
                    continue;
                }
                cursor[depth] = member + 1;
                placed[member] = true;
                current[depth] = member;
                depth++;
            }
            return null;
        }

        /** First member at or after {@code from} that may go at the current depth, or -1. */
        private int nextPlaceable(int from) {
            int forced = depth > 0 ? component.immediateSuccessor(current[depth - 1]) : -1;
            for (int i = from; i < size; i++) {
                if (placed[i]) {
                    continue;
                }
                if (forced != -1 ? i != forced : component.immediatePredecessor(i) != -1) {
                    continue;
                }
                if (predecessorsPlaced(i)) {
                    return i;
                }
            }
            return -1;
        }

        private boolean predecessorsPlaced(int member) {
            for (int j = 0; j < size; j++) {
                if (!placed[j] && component.mustPrecede(j, member)) {
                    return false;
                }
            }
            return true;
        }
    }

    /**
     * Extension sources positioned on their first extension.
     *
     * @throws InconsistentOrderingException if a component has no linear extension
     */
    private List<ExtensionIterator> startSources(int[][] chosen) {
        List<ExtensionIterator> sources = new ArrayList<>();
        for (int c = 0; c < components.size(); c++) {
            Component component = components.get(c);
            ExtensionIterator source = new ExtensionIterator(component);
            if (!source.hasNext()) {
                throw new InconsistentOrderingException(
                    "No token order satisfies all order constraints", component.getConstraints());
            }
            chosen[c] = source.next();
            sources.add(source);
        }
        logger.debug("Enumerating candidates over {} component(s)", components.size());
        return sources;
    }

    /**
     * Candidates in output order. Components are disjoint and each word is a
     * distinct permutation of the component multiset, so every candidate is
     * produced once and nothing needs to be remembered between them.
     */
    private class CandidateIterator implements Iterator<Candidate> {
        private final List<ExtensionIterator> sources;
        private final int[][] chosen;
        private final int[] word;
        private boolean started;
        private boolean exhausted;
        private Candidate next;
        private int produced;

        CandidateIterator() {
            this.chosen = new int[components.size()][];
            this.sources = startSources(chosen);
            int total = 0;
            for (Component component : components) {
                total += component.size();
            }
            this.word = new int[total];
            resetWord();
            this.exhausted = total == 0;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !exhausted) {
                next = advance();
                exhausted = next == null;
            }
            return next != null;
        }

        @Override
        public Candidate next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Candidate result = next;
            next = null;
            return result;
        }

        private Candidate advance() {
            while (true) {
                if (!started) {
                    started = true;
                } else if (!nextPermutation(word)) {
                    if (!nextChoice()) {
                        return null;
                    }
                    resetWord();
                }
                Candidate candidate = assemble();
                if (candidate == null) {
                    continue;
                }
                if (candidateLimit > 0 && produced == candidateLimit) {
                    throw new CandidateLimitExceededException(candidateLimit);
                }
                produced++;
                return candidate;
            }
        }

        /** Odometer over the chosen extension per component; the last component turns fastest. */
        private boolean nextChoice() {
            for (int c = chosen.length - 1; c >= 0; c--) {
                if (sources.get(c).hasNext()) {
                    chosen[c] = sources.get(c).next();
                    return true;
                }
                ExtensionIterator restarted = new ExtensionIterator(components.get(c));
                chosen[c] = restarted.next();
                sources.set(c, restarted);
            }
            return false;
        }

        private void resetWord() {
            int index = 0;
            for (int c = 0; c < components.size(); c++) {
                for (int k = 0; k < components.get(c).size(); k++) {
                    word[index++] = c;
                }
            }
        }

        /**
         * Build the token order described by the current word, or null if the
         * word puts a foreign token between an immediate pair.
         */
        private Candidate assemble() {
            int[] cursor = new int[components.size()];
            List<Identifier> tokens = new ArrayList<>(word.length);
            List<Candidate.Gap> gaps = new ArrayList<>(Math.max(0, word.length - 1));
            int previousComponent = -1;
            int previousMember = -1;
            for (int c : word) {
                Component component = components.get(c);
                int member = chosen[c][cursor[c]++];
                if (previousComponent != -1) {
                    int required = components.get(previousComponent).immediateSuccessor(previousMember);
                    if (required != -1 && (previousComponent != c || required != member)) {
                        return null;
                    }
                    gaps.add(required != -1 ? Candidate.Gap.NONE : Candidate.Gap.ANY);
                }
                tokens.add(component.getMembers().get(member));
                previousComponent = c;
                previousMember = member;
            }
            return new Candidate(tokens, gaps);
        }
    }

    /**
     * Rearranges {@code values} into the next permutation in lexicographic
     * order, treating equal values as indistinguishable.
     *
     * @return false if {@code values} was already the last permutation
     */
    static boolean nextPermutation(int[] values) {
        int i = values.length - 2;
        while (i >= 0 && values[i] >= values[i + 1]) {
            i--;
        }
        if (i < 0) {
            return false;
        }
        int j = values.length - 1;
        while (values[j] <= values[i]) {
            j--;
        }
        int tmp = values[i];
        values[i] = values[j];
        values[j] = tmp;
        Arrays.sort(values, i + 1, values.length);
        return true;
    }
}
