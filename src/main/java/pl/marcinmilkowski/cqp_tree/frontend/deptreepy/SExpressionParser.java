package pl.marcinmilkowski.cqp_tree.frontend.deptreepy;

import pl.marcinmilkowski.cqp_tree.frontend.InputError;
import pl.marcinmilkowski.cqp_tree.frontend.ParsingFailedException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Parser for the nested-parenthesis syntax of deptreepy patterns.
 *
 * Atoms are runs of characters other than whitespace and parentheses, or
 * double-quoted strings (quotes removed). Outer parentheses are optional.
 */
public class SExpressionParser {

    public SExpression parse(String input) {
        String text = input.strip();
        if (!text.startsWith("(")) {
            text = "(" + text + ")";
        }

        Deque<List<SExpression>> open = new ArrayDeque<>();
        Deque<int[]> openPositions = new ArrayDeque<>();
        SExpression result = null;
        int line = 1;
        int column = 1;
        int i = 0;

        while (i < text.length()) {
            char c = text.charAt(i);
            if (result != null && !Character.isWhitespace(c)) {
                throw error(line, column, "Unexpected text after end of expression");
            }
            if (c == '(') {
                open.push(new ArrayList<>());
                openPositions.push(new int[] {line, column});
                i++;
                column++;
            } else if (c == ')') {
                if (open.isEmpty()) {
                    throw error(line, column, "Unbalanced ')'");
                }
                SExpression list = SExpression.list(open.pop());
                openPositions.pop();
                if (open.isEmpty()) {
                    result = list;
                } else {
                    open.peek().add(list);
                }
                i++;
                column++;
            } else if (c == '\n') {
                i++;
                line++;
                column = 1;
            } else if (Character.isWhitespace(c)) {
                i++;
                column++;
            } else if (c == '"') {
                int end = text.indexOf('"', i + 1);
                if (end < 0) {
                    throw error(line, column, "Unterminated string");
                }
                addAtom(open, text.substring(i + 1, end), line, column);
                column += end + 1 - i;
                i = end + 1;
            } else {
                int start = i;
                while (i < text.length() && !isDelimiter(text.charAt(i))) {
                    i++;
                }
                addAtom(open, text.substring(start, i), line, column);
                column += i - start;
            }
        }

        if (!open.isEmpty()) {
            int[] position = openPositions.peek();
            throw error(position[0], position[1], "Expected ')'");
        }
        return result;
    }

    private static void addAtom(Deque<List<SExpression>> open, String atom, int line, int column) {
        if (open.isEmpty()) {
            throw error(line, column, "Atom outside of parentheses");
        }
        open.peek().add(SExpression.atom(atom));
    }

    private static boolean isDelimiter(char c) {
        return c == '(' || c == ')' || c == '"' || Character.isWhitespace(c);
    }

    private static ParsingFailedException error(int line, int column, String message) {
        return new ParsingFailedException(new InputError("line: " + line + ", col: " + column, message));
    }
}
