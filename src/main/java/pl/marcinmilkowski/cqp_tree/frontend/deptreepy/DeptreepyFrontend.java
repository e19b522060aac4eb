package pl.marcinmilkowski.cqp_tree.frontend.deptreepy;

import pl.marcinmilkowski.cqp_tree.frontend.QueryFrontend;
import pl.marcinmilkowski.cqp_tree.query.Attribute;
import pl.marcinmilkowski.cqp_tree.query.Comparison;
import pl.marcinmilkowski.cqp_tree.query.Conjunction;
import pl.marcinmilkowski.cqp_tree.query.Disjunction;
import pl.marcinmilkowski.cqp_tree.query.Identifier;
import pl.marcinmilkowski.cqp_tree.query.Negation;
import pl.marcinmilkowski.cqp_tree.query.Predicate;
import pl.marcinmilkowski.cqp_tree.query.Query;
import pl.marcinmilkowski.cqp_tree.query.Value;
import pl.marcinmilkowski.cqp_tree.translation.NotSupportedException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Front-end for deptreepy tree patterns.
 *
 * Supported syntax:
 * - {@code (TREE_ root dependent...)}  root governs every dependent
 * - {@code (AND p...)}, {@code (OR p...)}, {@code (NOT p...)}
 * - {@code (FIELD value)}               field matches value
 * - {@code (FIELD IN v1 v2 ...)}        field matches one of the values
 *
 * Field names are lower-cased to match CQP attribute names; values are regexes.
 */
public class DeptreepyFrontend implements QueryFrontend {
    public static final String NAME = "deptreepy";

    private final SExpressionParser parser = new SExpressionParser();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Query translate(String input) {
        SExpression pattern = parser.parse(input);
        Query.Builder builder = Query.builder();
        convertTree(pattern, builder);
        return builder.build();
    }

    private Identifier convertTree(SExpression node, Query.Builder builder) {
        if (node.isAtom()) {
            throw new NotSupportedException("Expected a token pattern, found '" + node + "'");
        }
        if (node.size() == 1) {
            return convertTree(node.get(0), builder);
        }
        if (node.size() > 0 && node.get(0).isAtom("TREE")) {
            throw new NotSupportedException("Only TREE_ is supported for matching subtrees.");
        }
        if (node.size() > 0 && node.get(0).isAtom("TREE_")) {
            if (node.size() < 2) {
                throw new NotSupportedException("TREE_ needs a root pattern");
            }
            Identifier root = convertTree(node.get(1), builder);
            for (SExpression dependent : node.tail(2)) {
                builder.dependency(root, convertTree(dependent, builder));
            }
            return root;
        }
        return builder.token(convertPredicate(node));
    }

    private Predicate convertPredicate(SExpression node) {
        if (node.isAtom()) {
            throw new NotSupportedException("Expected a predicate, found '" + node + "'");
        }
        if (node.size() == 1) {
            return convertPredicate(node.get(0));
        }
        if (node.size() == 0) {
            throw new NotSupportedException("Empty predicate");
        }

        SExpression head = node.get(0);
        if (head.isAtom("AND")) {
            return Conjunction.of(convertAll(node.tail(1)));
        }
        if (head.isAtom("OR")) {
            return Disjunction.of(convertAll(node.tail(1)));
        }
        if (head.isAtom("NOT")) {
            return new Negation(Conjunction.of(convertAll(node.tail(1))));
        }
        if (node.size() >= 3 && node.get(1).isAtom("IN")) {
            List<Predicate> alternatives = new ArrayList<>();
            for (SExpression value : node.tail(2)) {
                alternatives.add(fieldMatches(head, value));
            }
            return Disjunction.of(alternatives);
        }
        if (node.size() == 2) {
            return fieldMatches(head, node.get(1));
        }
        throw new NotSupportedException("Unsupported predicate " + node);
    }

    private List<Predicate> convertAll(List<SExpression> nodes) {
        if (nodes.isEmpty()) {
            throw new NotSupportedException("Logical operator without operands");
        }
        List<Predicate> result = new ArrayList<>();
        for (SExpression node : nodes) {
            result.add(convertPredicate(node));
        }
        return result;
    }

    private static Predicate fieldMatches(SExpression field, SExpression value) {
        if (!field.isAtom()) {
            throw new NotSupportedException("When matching a field, the field must be a string.");
        }
        if (!value.isAtom()) {
            throw new NotSupportedException("When matching a field, the field value must be a string.");
        }
        String name = field.atom();
        if (name.endsWith("_")) {
            throw new NotSupportedException("Substring matching (" + name + ") is not supported.");
        }
        return Comparison.equal(Attribute.local(name.toLowerCase(Locale.ROOT)), Value.regex(value.atom()));
    }
}
