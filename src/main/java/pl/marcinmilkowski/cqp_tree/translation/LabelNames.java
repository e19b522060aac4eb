package pl.marcinmilkowski.cqp_tree.translation;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Generates CQP label names from an alphabet: a, b, ..., z, aa, ab, ...
 * Names CQP reserves for match anchors are skipped.
 */
public class LabelNames implements Iterator<String> {
    private static final Set<String> RESERVED = Set.of("match", "matchend", "target", "keyword");

    private final String alphabet;
    private long index;

    public LabelNames(String alphabet) {
        if (alphabet == null || alphabet.length() < 2) {
            throw new IllegalArgumentException("Label alphabet needs at least two characters");
        }
        this.alphabet = alphabet;
    }

    @Override
    public boolean hasNext() {
        return index < Long.MAX_VALUE;
    }

    @Override
    public String next() {
        while (hasNext()) {
            String name = nameAt(index++, alphabet);
            if (!RESERVED.contains(name)) {
                return name;
            }
        }
        throw new NoSuchElementException();
    }

    /**
     * Bijective base-k numeral of {@code index} over {@code alphabet}.
     */
    static String nameAt(long index, String alphabet) {
        int base = alphabet.length();
        StringBuilder sb = new StringBuilder();
        long n = index + 1;
        while (n > 0) {
            n--;
            sb.append(alphabet.charAt((int) (n % base)));
            n /= base;
        }
        return sb.reverse().toString();
    }
}
