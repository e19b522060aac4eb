package pl.marcinmilkowski.cqp_tree.translation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.cqp_tree.config.TranslationConfig;
import pl.marcinmilkowski.cqp_tree.query.Attribute;
import pl.marcinmilkowski.cqp_tree.query.Comparison;
import pl.marcinmilkowski.cqp_tree.query.Identifier;
import pl.marcinmilkowski.cqp_tree.query.Query;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CqpTranslatorTest {

    private final CqpTranslator translator = new CqpTranslator();

    private static Query nounGoverningAdjective() {
        Query.Builder builder = Query.builder();
        Identifier noun = builder.token(Comparison.attributeEquals("pos", "NOUN"));
        Identifier adj = builder.token(Comparison.attributeEquals("pos", "ADJ"));
        builder.dependency(noun, adj);
        return builder.build();
    }

    @Test
    @DisplayName("Dependency without order constraint gives both orders, each referring backwards")
    void testDependencyInBothOrders() {
        assertEquals(
            "a:[pos=\"NOUN\"] []* [pos=\"ADJ\" & dephead=a.ref]"
                + " | b:[pos=\"ADJ\"] []* [pos=\"NOUN\" & b.dephead=ref]",
            translator.translate(nounGoverningAdjective()));
    }

    @Test
    @DisplayName("The governor's label is referenced when the dependent comes later, and vice versa")
    void testDependencyDirectionDecidesReference() {
        Query.Builder builder = Query.builder();
        Identifier a = builder.token(Comparison.attributeEquals("pos", "NOUN"));
        Identifier b = builder.token(Comparison.attributeEquals("pos", "ADJ"));
        builder.dependency(b, a);

        assertEquals(
            "a:[pos=\"NOUN\"] []* [pos=\"ADJ\" & a.dephead=ref]"
                + " | b:[pos=\"ADJ\"] []* [pos=\"NOUN\" & dephead=b.ref]",
            translator.translate(builder.build()));
    }

    @Test
    void testLargeTreeReportsCandidateLimit() {
        Query.Builder builder = Query.builder();
        Identifier root = builder.token(Comparison.attributeEquals("pos", "VERB"));
        for (int i = 0; i < 11; i++) {
            builder.dependency(root, builder.token());
        }
        Query query = builder.build();

        assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
            assertThrows(CandidateLimitExceededException.class, () -> translator.translate(query, 10));
        });
    }

    @Test
    void testSingleToken() {
        Query.Builder builder = Query.builder();
        builder.token(Comparison.attributeEquals("pos", "NOUN"));

        assertEquals("[pos=\"NOUN\"]", translator.translate(builder.build()));
    }

    @Test
    void testUnconstrainedToken() {
        Query.Builder builder = Query.builder();
        builder.token();

        assertEquals("[]", translator.translate(builder.build()));
    }

    @Test
    void testIndependentTokensInterleave() {
        Query.Builder builder = Query.builder();
        builder.token(Comparison.attributeEquals("pos", "NOUN"));
        builder.token(Comparison.attributeEquals("pos", "ADJ"));

        assertEquals("[pos=\"NOUN\"] []* [pos=\"ADJ\"] | [pos=\"ADJ\"] []* [pos=\"NOUN\"]",
            translator.translate(builder.build()));
    }

    @Test
    void testImmediateOrderGivesAdjacentTokens() {
        Query.Builder builder = Query.builder();
        Identifier a = builder.token(Comparison.attributeEquals("pos", "ADJ"));
        Identifier b = builder.token(Comparison.attributeEquals("pos", "NOUN"));
        builder.immediatelyBefore(a, b);

        assertEquals("[pos=\"ADJ\"] [pos=\"NOUN\"]", translator.translate(builder.build()));
    }

    @Test
    void testOrderedDependency() {
        Query.Builder builder = Query.builder();
        Identifier noun = builder.token(Comparison.attributeEquals("pos", "NOUN"));
        Identifier adj = builder.token(Comparison.attributeEquals("pos", "ADJ"));
        builder.dependency(noun, adj).before(adj, noun);

        assertEquals("b:[pos=\"ADJ\"] []* [pos=\"NOUN\" & b.dephead=ref]", translator.translate(builder.build()));
    }

    @Test
    void testCrossTokenPredicateOnLaterToken() {
        Query.Builder builder = Query.builder();
        Identifier a = builder.token();
        Identifier b = builder.token();
        builder.predicate(Comparison.equal(Attribute.of(a, "lemma"), Attribute.of(b, "lemma")));
        builder.before(a, b);

        assertEquals("a:[] []* [a.lemma=lemma]", translator.translate(builder.build()));
    }

    @Test
    void testCycleRejected() {
        Query.Builder builder = Query.builder();
        Identifier a = builder.token();
        Identifier b = builder.token();
        builder.before(a, b).before(b, a);

        assertThrows(InconsistentOrderingException.class, () -> translator.translate(builder.build()));
    }

    @Test
    void testEmptyQueryRejected() {
        assertThrows(NotSupportedException.class, () -> translator.translate(Query.builder().build()));
    }

    @Test
    void testCandidateLimit() {
        Query.Builder builder = Query.builder();
        for (int i = 0; i < 4; i++) {
            builder.token();
        }
        Query query = builder.build();

        assertThrows(CandidateLimitExceededException.class, () -> translator.translate(query, 10));
        assertEquals(24, translator.translate(query, 0).split(" \\| ").length);
        assertThrows(CandidateLimitExceededException.class,
            () -> new CqpTranslator(TranslationConfig.defaults().withMaxCandidates(23)).translate(query));
    }

    @Test
    void testTranslationIsDeterministic() {
        Query query = nounGoverningAdjective();

        assertEquals(translator.translate(query), translator.translate(query));
        assertEquals(2, translator.linearizations(query).toList().size());
    }

    @Test
    void testConfiguredAttributeNames() {
        CqpTranslator custom = new CqpTranslator(new TranslationConfig("1.0", "head", "id", "xyz", 0));

        assertEquals(
            "x:[pos=\"NOUN\"] []* [pos=\"ADJ\" & head=x.id]"
                + " | y:[pos=\"ADJ\"] []* [pos=\"NOUN\" & y.head=id]",
            custom.translate(nounGoverningAdjective()));
    }
}
