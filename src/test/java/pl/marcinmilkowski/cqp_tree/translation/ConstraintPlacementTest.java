package pl.marcinmilkowski.cqp_tree.translation;

import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.cqp_tree.query.Attribute;
import pl.marcinmilkowski.cqp_tree.query.Comparison;
import pl.marcinmilkowski.cqp_tree.query.Identifier;
import pl.marcinmilkowski.cqp_tree.query.Predicate;
import pl.marcinmilkowski.cqp_tree.query.Query;
import pl.marcinmilkowski.cqp_tree.query.Value;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConstraintPlacementTest {

    private final ConstraintPlacement placement = new ConstraintPlacement();
    private final PredicateRenderer renderer = new PredicateRenderer(Map.of());

    @Test
    void testFloatingPredicatesComeBeforeDeclaredOnes() {
        Query.Builder builder = Query.builder();
        Identifier a = builder.token(Comparison.attributeEquals("pos", "NOUN"));
        builder.predicate(Comparison.equal(Attribute.of(a, "lemma"), Value.literal("cat")));

        PlacedConstraints placed = placement.place(builder.build());

        assertEquals("lemma=\"cat\" & pos=\"NOUN\"", renderer.render(placed.predicateOf(a)));
        assertTrue(placed.getDeferredPredicates().isEmpty());
    }

    @Test
    void testCrossTokenPredicateIsDeferred() {
        Query.Builder builder = Query.builder();
        Identifier a = builder.token();
        Identifier b = builder.token();
        Predicate sameLemma = Comparison.equal(Attribute.of(a, "lemma"), Attribute.of(b, "lemma"));
        builder.predicate(sameLemma);

        PlacedConstraints placed = placement.place(builder.build());

        assertEquals(List.of(sameLemma), placed.getDeferredPredicates());
        assertNull(placed.predicateOf(a));
        assertNull(placed.predicateOf(b));
    }

    @Test
    void testDeclaredPredicateNamingOtherTokenMovesThere() {
        Query.Builder builder = Query.builder();
        Identifier b = new Identifier();
        Identifier a = builder.token(Comparison.equal(Attribute.of(b, "pos"), Value.literal("ADJ")));
        builder.token(b, null);

        PlacedConstraints placed = placement.place(builder.build());

        assertNull(placed.predicateOf(a));
        assertEquals("pos=\"ADJ\"", renderer.render(placed.predicateOf(b)));
    }

    @Test
    void testDeclaredPredicateOverTwoTokensIsDeferred() {
        Query.Builder builder = Query.builder();
        Identifier b = new Identifier();
        Identifier a = builder.token(Comparison.equal(Attribute.local("lemma"), Attribute.of(b, "lemma")));
        builder.token(b, null);

        PlacedConstraints placed = placement.place(builder.build());

        assertEquals(1, placed.getDeferredPredicates().size());
        assertEquals(List.of(a, b), List.copyOf(placed.getDeferredPredicates().get(0).referencedIdentifiers()));
    }

    @Test
    void testUnknownIdentifierRejected() {
        Query.Builder builder = Query.builder();
        builder.token();
        Identifier stranger = new Identifier();
        builder.predicate(Comparison.equal(Attribute.of(stranger, "pos"), Value.literal("NOUN")));

        UnknownIdentifierException e = assertThrows(UnknownIdentifierException.class,
            () -> placement.place(builder.build()));
        assertEquals(List.of(stranger), e.getUnknownIdentifiers());
        assertInstanceOf(NotSupportedException.class, e);
    }

    @Test
    void testFreePredicateWithoutOwnerRejected() {
        Query.Builder builder = Query.builder();
        builder.token();
        builder.predicate(Comparison.attributeEquals("pos", "NOUN"));

        assertThrows(NotSupportedException.class, () -> placement.place(builder.build()));
    }

    @Test
    void testFloatingAndDeclaredPredicatesPlaceAlike() {
        Identifier a = new Identifier();
        Query declared = Query.builder()
            .token(a, Comparison.attributeEquals("pos", "NOUN"))
            .build();
        Query floating = Query.builder()
            .token(a, null)
            .predicate(Comparison.equal(Attribute.of(a, "pos"), Value.literal("NOUN")))
            .build();

        assertEquals(placement.place(declared).predicateOf(a), placement.place(floating).predicateOf(a));
    }

    @Test
    void testFloatingPredicatePrecedesSecondDeclaredPredicate() {
        Identifier a = new Identifier();
        Query declaredBoth = Query.builder()
            .token(a, Comparison.attributeEquals("pos", "NOUN").and(Comparison.attributeEquals("lemma", "cat")))
            .build();
        Query floatingPos = Query.builder()
            .token(a, Comparison.attributeEquals("lemma", "cat"))
            .predicate(Comparison.equal(Attribute.of(a, "pos"), Value.literal("NOUN")))
            .build();

        Predicate expected = placement.place(declaredBoth).predicateOf(a);
        assertEquals(expected, placement.place(floatingPos).predicateOf(a));
        assertEquals("pos=\"NOUN\" & lemma=\"cat\"", renderer.render(expected));
    }

    @Test
    void testPlacementIsRepeatable() {
        Query.Builder builder = Query.builder();
        Identifier a = builder.token(Comparison.attributeEquals("pos", "NOUN"));
        Identifier b = builder.token(Comparison.attributeEquals("pos", "ADJ"));
        builder.predicate(Comparison.equal(Attribute.of(b, "lemma"), Value.regex("big.*")));
        builder.dependency(a, b);
        Query query = builder.build();

        PlacedConstraints first = placement.place(query);
        PlacedConstraints second = placement.place(query);

        assertEquals(first.getTokenPredicates(), second.getTokenPredicates());
        assertEquals(List.copyOf(first.getIdentifiers()), List.copyOf(second.getIdentifiers()));
    }
}
