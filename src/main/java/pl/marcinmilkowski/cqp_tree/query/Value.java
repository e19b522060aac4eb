package pl.marcinmilkowski.cqp_tree.query;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;

/**
 * Constant operand. The kind decides how the text is rendered in CQP.
 */
public record Value(String text, Kind kind) implements Operand {
    private static final String REGEX_SPECIAL = "\\.?*+|()[]{}^$";

    public enum Kind {
        /** Matched verbatim; regex metacharacters get escaped on output. */
        LITERAL,
        /** Case-sensitive regular expression. */
        REGEX,
        /** Case-insensitive regular expression ({@code %c} flag). */
        REGEX_IGNORE_CASE
    }

    public Value {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(kind, "kind");
    }

    public static Value literal(String text) {
        return new Value(text, Kind.LITERAL);
    }

    public static Value regex(String text) {
        return new Value(text, Kind.REGEX);
    }

    public static Value regexIgnoreCase(String text) {
        return new Value(text, Kind.REGEX_IGNORE_CASE);
    }

    @Override
    public <R> R accept(OperandVisitor<R> visitor) {
        return visitor.visitValue(this);
    }

    @Override
    public Set<Identifier> referencedIdentifiers() {
        return Collections.emptySet();
    }

    @Override
    public Value raiseFrom(Identifier on) {
        return this;
    }

    @Override
    public Value lowerOnto(Identifier on) {
        return this;
    }

    /**
     * Backslash-escape every regex metacharacter in {@code text}.
     */
    public static String escapeRegex(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (REGEX_SPECIAL.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
