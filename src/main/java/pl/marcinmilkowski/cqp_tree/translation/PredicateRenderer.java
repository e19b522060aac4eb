package pl.marcinmilkowski.cqp_tree.translation;

import pl.marcinmilkowski.cqp_tree.query.Absence;
import pl.marcinmilkowski.cqp_tree.query.Attribute;
import pl.marcinmilkowski.cqp_tree.query.Comparison;
import pl.marcinmilkowski.cqp_tree.query.Conjunction;
import pl.marcinmilkowski.cqp_tree.query.Disjunction;
import pl.marcinmilkowski.cqp_tree.query.Identifier;
import pl.marcinmilkowski.cqp_tree.query.Negation;
import pl.marcinmilkowski.cqp_tree.query.OperandVisitor;
import pl.marcinmilkowski.cqp_tree.query.Predicate;
import pl.marcinmilkowski.cqp_tree.query.PredicateVisitor;
import pl.marcinmilkowski.cqp_tree.query.Presence;
import pl.marcinmilkowski.cqp_tree.query.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders predicates as the boolean expression inside a CQP token {@code [...]}.
 *
 * Attributes owned by another token are written as {@code label.attribute},
 * so every owner must have a label in the given map.
 */
public class PredicateRenderer implements PredicateVisitor<String>, OperandVisitor<String> {
    private static final int DISJUNCTION = 1;
    private static final int CONJUNCTION = 2;
    private static final int COMPARISON = 3;
    private static final int UNARY = 4;
    private static final int ATOM = 5;

    private final Map<Identifier, String> labels;

    public PredicateRenderer(Map<Identifier, String> labels) {
        this.labels = labels;
    }

    public String render(Predicate predicate) {
        return predicate.accept(this);
    }

    /**
     * Split nested conjunctions into their operands, left to right.
     */
    public static List<Predicate> conjuncts(Predicate predicate) {
        List<Predicate> result = new ArrayList<>();
        collectConjuncts(predicate, result);
        return result;
    }

    private static void collectConjuncts(Predicate predicate, List<Predicate> out) {
        if (predicate instanceof Conjunction) {
            Conjunction conjunction = (Conjunction) predicate;
            collectConjuncts(conjunction.left(), out);
            collectConjuncts(conjunction.right(), out);
        } else {
            out.add(predicate);
        }
    }

    /**
     * Render a list of conjuncts joined by {@code &}.
     */
    public String renderConjuncts(List<Predicate> predicates) {
        StringJoiner joiner = new StringJoiner(" & ");
        for (Predicate predicate : predicates) {
            joiner.add(junctionOperand(predicate, CONJUNCTION));
        }
        return joiner.toString();
    }

    @Override
    public String visitConjunction(Conjunction conjunction) {
        return renderConjuncts(conjuncts(conjunction));
    }

    @Override
    public String visitDisjunction(Disjunction disjunction) {
        List<Predicate> disjuncts = new ArrayList<>();
        collectDisjuncts(disjunction, disjuncts);
        StringJoiner joiner = new StringJoiner(" | ");
        for (Predicate predicate : disjuncts) {
            joiner.add(junctionOperand(predicate, DISJUNCTION));
        }
        return joiner.toString();
    }

    private static void collectDisjuncts(Predicate predicate, List<Predicate> out) {
        if (predicate instanceof Disjunction) {
            Disjunction disjunction = (Disjunction) predicate;
            collectDisjuncts(disjunction.left(), out);
            collectDisjuncts(disjunction.right(), out);
        } else {
            out.add(predicate);
        }
    }

    @Override
    public String visitNegation(Negation negation) {
        String operand = render(negation.operand());
        return precedence(negation.operand()) == ATOM ? "!" + operand : "!(" + operand + ")";
    }

    @Override
    public String visitPresence(Presence presence) {
        return visitAttribute(presence.attribute());
    }

    @Override
    public String visitAbsence(Absence absence) {
        return "!" + visitAttribute(absence.attribute());
    }

    @Override
    public String visitComparison(Comparison comparison) {
        return comparison.lhs().accept(this) + comparison.operator().getSymbol() + comparison.rhs().accept(this);
    }

    @Override
    public String visitAttribute(Attribute attribute) {
        if (attribute.isLocal()) {
            return attribute.name();
        }
        String label = labels.get(attribute.owner());
        if (label == null) {
            throw new IllegalStateException("No label assigned to " + attribute.owner());
        }
        return label + "." + attribute.name();
    }

    @Override
    public String visitValue(Value value) {
        switch (value.kind()) {
            case LITERAL:
                return quote(Value.escapeRegex(value.text()));
            case REGEX:
                return quote(value.text());
            case REGEX_IGNORE_CASE:
                return quote(value.text()) + "%c";
            default:
                throw new IllegalStateException("Unhandled value kind " + value.kind());
        }
    }

    private String junctionOperand(Predicate predicate, int junction) {
        int inner = precedence(predicate);
        String rendered = render(predicate);
        return inner == junction || inner >= COMPARISON ? rendered : "(" + rendered + ")";
    }

    private static int precedence(Predicate predicate) {
        return predicate.accept(new PredicateVisitor<Integer>() {
            @Override
            public Integer visitConjunction(Conjunction conjunction) { return CONJUNCTION; }

            @Override
            public Integer visitDisjunction(Disjunction disjunction) { return DISJUNCTION; }

            @Override
            public Integer visitNegation(Negation negation) { return UNARY; }

            @Override
            public Integer visitPresence(Presence presence) { return ATOM; }

            @Override
            public Integer visitAbsence(Absence absence) { return UNARY; }

            @Override
            public Integer visitComparison(Comparison comparison) { return COMPARISON; }
        });
    }

    private static String quote(String text) {
        return '"' + text.replace("\"", "\\\"") + '"';
    }
}
