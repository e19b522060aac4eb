package pl.marcinmilkowski.cqp_tree.query;

public interface PredicateVisitor<R> {

    R visitConjunction(Conjunction conjunction);

    R visitDisjunction(Disjunction disjunction);

    R visitNegation(Negation negation);

    R visitPresence(Presence presence);

    R visitAbsence(Absence absence);

    R visitComparison(Comparison comparison);
}
