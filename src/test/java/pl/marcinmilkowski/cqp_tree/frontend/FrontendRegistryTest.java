package pl.marcinmilkowski.cqp_tree.frontend;

import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.cqp_tree.frontend.conllu.ConlluFrontend;
import pl.marcinmilkowski.cqp_tree.frontend.deptreepy.DeptreepyFrontend;
import pl.marcinmilkowski.cqp_tree.query.Query;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FrontendRegistryTest {

    private static final String CONLLU = "1\tthe\tthe\tDET\t_\t_\t2\tdet\t_\t_\n"
        + "2\tcat\tcat\tNOUN\t_\t_\t0\troot\t_\t_\n";

    private final FrontendRegistry registry = FrontendRegistry.withDefaults();

    @Test
    void testDefaultFrontends() {
        assertEquals(List.of("conllu", "deptreepy"), List.copyOf(registry.names()));
    }

    @Test
    void testGuessDeptreepy() {
        Map<String, Query> accepted = registry.guess("TREE_ (pos NOUN) (pos ADJ)");

        assertEquals(List.of(DeptreepyFrontend.NAME), List.copyOf(accepted.keySet()));
        assertEquals(2, registry.translate("TREE_ (pos NOUN) (pos ADJ)").tokens().size());
    }

    @Test
    void testGuessConllu() {
        assertEquals(List.of(ConlluFrontend.NAME), List.copyOf(registry.guess(CONLLU).keySet()));
        assertEquals(1, registry.translate(CONLLU).dependencies().size());
    }

    @Test
    void testNoFrontendAccepts() {
        UnableToGuessFrontendException e = assertThrows(UnableToGuessFrontendException.class,
            () -> registry.translate("(("));

        assertTrue(e.noFrontendMatches());
    }

    @Test
    void testSeveralFrontendsAccept() {
        FrontendRegistry ambiguous = new FrontendRegistry();
        ambiguous.register(new DeptreepyFrontend());
        ambiguous.register(new QueryFrontend() {
            @Override
            public String name() {
                return "anything";
            }

            @Override
            public Query translate(String input) {
                return Query.builder().build();
            }
        });

        UnableToGuessFrontendException e = assertThrows(UnableToGuessFrontendException.class,
            () -> ambiguous.translate("(pos NOUN)"));
        assertEquals(List.of("deptreepy", "anything"), e.getMatchingFrontends());
        assertFalse(e.noFrontendMatches());
    }

    @Test
    void testNamedFrontend() {
        assertEquals(2, registry.translate(CONLLU, "conllu").tokens().size());
        assertThrows(IllegalArgumentException.class, () -> registry.translate(CONLLU, "grew"));
        assertThrows(ParsingFailedException.class, () -> registry.translate(CONLLU + "x\n", "conllu"));
    }

    @Test
    void testDuplicateNameRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.register(new ConlluFrontend()));
    }
}
