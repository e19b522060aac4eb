package pl.marcinmilkowski.cqp_tree.frontend.deptreepy;

import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.cqp_tree.frontend.InputError;
import pl.marcinmilkowski.cqp_tree.frontend.ParsingFailedException;

import static org.junit.jupiter.api.Assertions.*;

class SExpressionParserTest {

    private final SExpressionParser parser = new SExpressionParser();

    @Test
    void testOuterParenthesesOptional() {
        assertEquals(parser.parse("(TREE_ (pos NOUN) (pos ADJ))").toString(),
            parser.parse("TREE_ (pos NOUN) (pos ADJ)").toString());
    }

    @Test
    void testNestedLists() {
        SExpression expression = parser.parse("(a (b c) \"d e\")");

        assertEquals(3, expression.size());
        assertTrue(expression.get(0).isAtom("a"));
        assertFalse(expression.get(1).isAtom());
        assertEquals("(b c)", expression.get(1).toString());
        assertEquals("d e", expression.get(2).atom());
    }

    @Test
    void testMissingClosingParenthesis() {
        ParsingFailedException e = assertThrows(ParsingFailedException.class, () -> parser.parse("(a\n  (b c"));

        InputError error = e.getErrors().get(0);
        assertEquals("line: 2, col: 3", error.position());
        assertEquals("Expected ')'", error.message());
    }

    @Test
    void testUnbalancedClosingParenthesis() {
        ParsingFailedException e = assertThrows(ParsingFailedException.class, () -> parser.parse("(a b))"));

        assertEquals("line: 1, col: 6", e.getErrors().get(0).position());
    }

    @Test
    void testUnterminatedString() {
        ParsingFailedException e = assertThrows(ParsingFailedException.class, () -> parser.parse("(a \"b)"));

        assertEquals("Unterminated string", e.getErrors().get(0).message());
    }
}
