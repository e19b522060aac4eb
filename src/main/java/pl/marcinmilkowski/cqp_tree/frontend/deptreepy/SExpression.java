package pl.marcinmilkowski.cqp_tree.frontend.deptreepy;

import java.util.List;
import java.util.StringJoiner;

/**
 * Node of a parsed S-expression: an atom or a parenthesized list.
 */
public record SExpression(String atom, List<SExpression> children) {

    public static SExpression atom(String text) {
        return new SExpression(text, List.of());
    }

    public static SExpression list(List<SExpression> children) {
        return new SExpression(null, List.copyOf(children));
    }

    public boolean isAtom() {
        return atom != null;
    }

    public boolean isAtom(String text) {
        return text.equals(atom);
    }

    public int size() {
        return children.size();
    }

    public SExpression get(int index) {
        return children.get(index);
    }

    public List<SExpression> tail(int from) {
        return children.subList(from, children.size());
    }

    @Override
    public String toString() {
        if (isAtom()) {
            return atom;
        }
        StringJoiner joiner = new StringJoiner(" ", "(", ")");
        for (SExpression child : children) {
            joiner.add(child.toString());
        }
        return joiner.toString();
    }
}
