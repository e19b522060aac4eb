package pl.marcinmilkowski.cqp_tree.translation;

import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.cqp_tree.query.Absence;
import pl.marcinmilkowski.cqp_tree.query.Attribute;
import pl.marcinmilkowski.cqp_tree.query.Comparison;
import pl.marcinmilkowski.cqp_tree.query.Identifier;
import pl.marcinmilkowski.cqp_tree.query.Negation;
import pl.marcinmilkowski.cqp_tree.query.Predicate;
import pl.marcinmilkowski.cqp_tree.query.Presence;
import pl.marcinmilkowski.cqp_tree.query.Value;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PredicateRendererTest {

    private final PredicateRenderer renderer = new PredicateRenderer(Map.of());

    private static Predicate eq(String attribute, String literal) {
        return Comparison.attributeEquals(attribute, literal);
    }

    @Test
    void testValueKinds() {
        assertEquals("word=\"e\\.g\\.\"", renderer.render(eq("word", "e.g.")));
        assertEquals("lemma=\"ca.*\"",
            renderer.render(Comparison.equal(Attribute.local("lemma"), Value.regex("ca.*"))));
        assertEquals("lemma=\"ca.*\"%c",
            renderer.render(Comparison.equal(Attribute.local("lemma"), Value.regexIgnoreCase("ca.*"))));
        assertEquals("word=\"a\\\"b\"", renderer.render(eq("word", "a\"b")));
    }

    @Test
    void testNotEqual() {
        assertEquals("pos!=\"NOUN\"",
            renderer.render(Comparison.notEqual(Attribute.local("pos"), Value.literal("NOUN"))));
    }

    @Test
    void testPresenceAndAbsence() {
        assertEquals("lemma", renderer.render(new Presence(Attribute.local("lemma"))));
        assertEquals("!lemma", renderer.render(new Absence(Attribute.local("lemma"))));
        assertEquals("!lemma", renderer.render(new Negation(new Presence(Attribute.local("lemma")))));
    }

    @Test
    void testNegatedComparisonIsParenthesized() {
        assertEquals("!(pos=\"NOUN\")", renderer.render(eq("pos", "NOUN").negate()));
    }

    @Test
    void testJunctionPrecedence() {
        Predicate nounOrAdj = eq("pos", "NOUN").or(eq("pos", "ADJ"));

        assertEquals("(pos=\"NOUN\" | pos=\"ADJ\") & lemma=\"x\"",
            renderer.render(nounOrAdj.and(eq("lemma", "x"))));
        assertEquals("(pos=\"NOUN\" & lemma=\"x\") | pos=\"ADJ\"",
            renderer.render(eq("pos", "NOUN").and(eq("lemma", "x")).or(eq("pos", "ADJ"))));
        assertEquals("pos=\"A\" | pos=\"B\" | pos=\"C\"",
            renderer.render(eq("pos", "A").or(eq("pos", "B")).or(eq("pos", "C"))));
    }

    @Test
    void testLabelledAttributes() {
        Identifier a = new Identifier();
        PredicateRenderer labelled = new PredicateRenderer(Map.of(a, "a"));

        assertEquals("dephead=a.ref",
            labelled.render(Comparison.equal(Attribute.local("dephead"), Attribute.of(a, "ref"))));
        assertThrows(IllegalStateException.class,
            () -> renderer.render(new Presence(Attribute.of(a, "lemma"))));
    }
}
