package pl.marcinmilkowski.cqp_tree.translation;

import pl.marcinmilkowski.cqp_tree.config.TranslationConfig;
import pl.marcinmilkowski.cqp_tree.query.Attribute;
import pl.marcinmilkowski.cqp_tree.query.Comparison;
import pl.marcinmilkowski.cqp_tree.query.Dependency;
import pl.marcinmilkowski.cqp_tree.query.Identifier;
import pl.marcinmilkowski.cqp_tree.query.Predicate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Renders candidate token orders as CQP.
 *
 * References always point backwards: a dependency or a cross-token predicate
 * is asserted on whichever of its tokens comes last in the candidate, and the
 * earlier tokens are given labels to refer to.
 */
public class PatternEmitter {
    static final String UNBOUNDED_GAP = " []* ";
    static final String NO_GAP = " ";
    static final String ALTERNATIVE = " | ";

    private final String headAttribute;
    private final String positionAttribute;
    private final String labelAlphabet;

    public PatternEmitter(TranslationConfig config) {
        this.headAttribute = config.dependencyHeadAttribute();
        this.positionAttribute = config.positionAttribute();
        this.labelAlphabet = config.labelAlphabet();
    }

    /**
     * Render all candidates as one alternation.
     *
     * @throws IllegalArgumentException if there are no candidates
     */
    public String emit(PlacedConstraints placed, List<Dependency> dependencies, Iterable<Candidate> candidates) {
        Map<Identifier, String> labels = assignLabels(placed, dependencies);
        StringJoiner alternatives = new StringJoiner(ALTERNATIVE);
        int count = 0;
        for (Candidate candidate : candidates) {
            alternatives.add(emitCandidate(candidate, placed, dependencies, labels));
            count++;
        }
        if (count == 0) {
            throw new IllegalArgumentException("Nothing to emit: no candidate token order");
        }
        return alternatives.toString();
    }

    /**
     * Label names for every token that may be referred to, in query order.
     * Each candidate only prints the labels it actually uses.
     */
    Map<Identifier, String> assignLabels(PlacedConstraints placed, List<Dependency> dependencies) {
        Set<Identifier> referable = new HashSet<>();
        for (Dependency dependency : dependencies) {
            referable.addAll(dependency.referencedIdentifiers());
        }
        for (Predicate predicate : placed.getDeferredPredicates()) {
            referable.addAll(predicate.referencedIdentifiers());
        }

        LabelNames names = new LabelNames(labelAlphabet);
        Map<Identifier, String> labels = new LinkedHashMap<>();
        for (Identifier identifier : placed.getIdentifiers()) {
            if (referable.contains(identifier)) {
                labels.put(identifier, names.next());
            }
        }
        return labels;
    }

    String emitCandidate(Candidate candidate, PlacedConstraints placed,
                         List<Dependency> dependencies, Map<Identifier, String> labels) {
        Map<Identifier, Integer> positions = candidate.positions();
        Map<Identifier, List<Predicate>> assertions = new LinkedHashMap<>();
        Set<Identifier> referenced = new LinkedHashSet<>();

        for (Predicate predicate : placed.getDeferredPredicates()) {
            Identifier latest = null;
            for (Identifier owner : predicate.referencedIdentifiers()) {
                if (latest == null || positions.get(owner) > positions.get(latest)) {
                    latest = owner;
                }
            }
            for (Identifier owner : predicate.referencedIdentifiers()) {
                if (owner != latest) {
                    referenced.add(owner);
                }
            }
            assertions.computeIfAbsent(latest, k -> new ArrayList<>()).add(predicate.lowerOnto(latest));
        }

        for (Dependency dependency : dependencies) {
            Identifier governor = dependency.governor();
            Identifier dependent = dependency.dependent();
            Predicate reference;
            Identifier carrier;
            if (positions.get(dependent) > positions.get(governor)) {
                // dephead = gov.ref
                reference = Comparison.equal(Attribute.local(headAttribute), Attribute.of(governor, positionAttribute));
                carrier = dependent;
                referenced.add(governor);
            } else {
                // dep.dephead = ref
                reference = Comparison.equal(Attribute.of(dependent, headAttribute), Attribute.local(positionAttribute));
                carrier = governor;
                referenced.add(dependent);
            }
            assertions.computeIfAbsent(carrier, k -> new ArrayList<>()).add(reference);
        }

        PredicateRenderer renderer = new PredicateRenderer(labels);
        StringBuilder sb = new StringBuilder();
        List<Identifier> tokens = candidate.tokens();
        for (int i = 0; i < tokens.size(); i++) {
            if (i > 0) {
                sb.append(candidate.gaps().get(i - 1) == Candidate.Gap.NONE ? NO_GAP : UNBOUNDED_GAP);
            }
            Identifier token = tokens.get(i);
            if (referenced.contains(token)) {
                sb.append(labels.get(token)).append(':');
            }
            List<Predicate> conjuncts = new ArrayList<>();
            Predicate merged = placed.predicateOf(token);
            if (merged != null) {
                conjuncts.addAll(PredicateRenderer.conjuncts(merged));
            }
            conjuncts.addAll(assertions.getOrDefault(token, List.of()));
            sb.append('[').append(renderer.renderConjuncts(conjuncts)).append(']');
        }
        return sb.toString();
    }
}
