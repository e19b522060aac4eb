package pl.marcinmilkowski.cqp_tree.frontend.conllu;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.cqp_tree.frontend.InputError;
import pl.marcinmilkowski.cqp_tree.frontend.ParsingFailedException;
import pl.marcinmilkowski.cqp_tree.frontend.QueryFrontend;
import pl.marcinmilkowski.cqp_tree.query.Attribute;
import pl.marcinmilkowski.cqp_tree.query.Comparison;
import pl.marcinmilkowski.cqp_tree.query.Identifier;
import pl.marcinmilkowski.cqp_tree.query.Query;
import pl.marcinmilkowski.cqp_tree.query.Value;
import pl.marcinmilkowski.cqp_tree.translation.NotSupportedException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds a query from an example sentence in CoNLL-U format.
 *
 * Only the first sentence is used. Every specified column becomes a
 * constraint on its token, HEAD becomes a dependency, and the MISC
 * annotations {@code ordered=Yes} and {@code subsequent=Yes} add order
 * constraints:
 * <pre>
 * 1	the	the	DET	_	_	2	det	_	_
 * 2	cat	cat	NOUN	_	Number=Sing	0	root	_	subsequent=Yes
 * </pre>
 * Underscore or asterisk leaves a column unconstrained.
 */
public class ConlluFrontend implements QueryFrontend {
    private static final Logger logger = LoggerFactory.getLogger(ConlluFrontend.class);

    public static final String NAME = "conllu";

    private static final int ID = 0;
    private static final int FORM = 1;
    private static final int LEMMA = 2;
    private static final int UPOS = 3;
    private static final int XPOS = 4;
    private static final int FEATS = 5;
    private static final int HEAD = 6;
    private static final int DEPREL = 7;
    private static final int MISC = 9;
    private static final int COLUMN_COUNT = 10;

    private static final String NO_VALUE = "_";
    private static final String UNSPECIFIED_VALUE = "*";

    /** Column index to corpus attribute name. */
    private static final Map<Integer, String> MAPPED_COLUMNS = new LinkedHashMap<>();
    static {
        MAPPED_COLUMNS.put(FORM, "word");
        MAPPED_COLUMNS.put(LEMMA, "lemma");
        MAPPED_COLUMNS.put(UPOS, "pos");
        MAPPED_COLUMNS.put(XPOS, "msd");
        MAPPED_COLUMNS.put(DEPREL, "deprel");
    }

    /** FEATS pairs are matched as members of this feature-set attribute. */
    private static final String FEATURE_SET_ATTRIBUTE = "ufeats";

    private static final String ORDERED = "ordered";
    private static final String SUBSEQUENT = "subsequent";
    private static final String ANCHORED = "anchored";
    private static final Set<String> RESERVED_ANNOTATIONS = Set.of(ORDERED, SUBSEQUENT, ANCHORED, "highlight");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Query translate(String input) {
        List<ConlluLine> lines = readFirstSentence(input);

        Map<String, Identifier> identifiers = new LinkedHashMap<>();
        for (ConlluLine line : lines) {
            identifiers.put(line.id(), new Identifier());
        }

        Query.Builder builder = Query.builder();
        Identifier previous = null;
        Identifier lastOrdered = null;
        for (ConlluLine line : lines) {
            Identifier token = identifiers.get(line.id());
            builder.token(token, null);

            for (Map.Entry<Integer, String> mapped : MAPPED_COLUMNS.entrySet()) {
                String value = line.column(mapped.getKey());
                if (isSpecified(value)) {
                    builder.predicate(Comparison.equal(Attribute.of(token, mapped.getValue()), Value.literal(value)));
                }
            }

            for (String feature : pairs(line.column(FEATS))) {
                String regex = ".*\\|" + Value.escapeRegex(feature) + "\\|.*";
                builder.predicate(Comparison.equal(Attribute.of(token, FEATURE_SET_ATTRIBUTE), Value.regex(regex)));
            }

            Map<String, String> misc = annotations(line);
            for (Map.Entry<String, String> annotation : misc.entrySet()) {
                if (!RESERVED_ANNOTATIONS.contains(annotation.getKey().toLowerCase(Locale.ROOT))) {
                    builder.predicate(Comparison.equal(Attribute.of(token, annotation.getKey()),
                        Value.literal(annotation.getValue())));
                }
            }
            if (isYes(misc, ANCHORED)) {
                throw new NotSupportedException("Anchoring tokens to the start or end of a region is not supported.");
            }
            if (isYes(misc, ORDERED)) {
                if (lastOrdered != null) {
                    builder.before(lastOrdered, token);
                }
                lastOrdered = token;
            }
            if (isYes(misc, SUBSEQUENT)) {
                if (previous == null) {
                    throw new NotSupportedException("First token cannot be subsequent to another token.");
                }
                builder.immediatelyBefore(previous, token);
            }

            String head = line.column(HEAD);
            if (UNSPECIFIED_VALUE.equals(head)) {
                throw new NotSupportedException("Having an underspecified dependency head is not supported.");
            }
            if (!NO_VALUE.equals(head) && !"0".equals(head)) {
                Identifier governor = identifiers.get(head);
                if (governor == null) {
                    throw new NotSupportedException("Dependency head \"" + head + "\" is not specified as part of file.");
                }
                builder.dependency(governor, token);
            }
            previous = token;
        }

        Query query = builder.build();
        logger.debug("Read {} token(s) and {} dependencies from CoNLL-U", query.tokens().size(),
            query.dependencies().size());
        return query;
    }

    private List<ConlluLine> readFirstSentence(String input) {
        List<ConlluLine> lines = new ArrayList<>();
        List<InputError> errors = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new StringReader(input))) {
            String text;
            int lineNumber = 0;
            while ((text = reader.readLine()) != null) {
                lineNumber++;
                if (text.isBlank()) {
                    if (!lines.isEmpty() || !errors.isEmpty()) {
                        break; // end of first sentence
                    }
                    continue;
                }
                if (text.startsWith("#")) {
                    continue;
                }
                String[] fields = text.split("\t", -1);
                if (fields.length != COLUMN_COUNT) {
                    errors.add(new InputError("line " + lineNumber,
                        "Expected " + COLUMN_COUNT + " tab-separated columns, found " + fields.length));
                    continue;
                }
                String id = fields[ID];
                // multi-word tokens (1-2) and empty nodes (1.1)
                if (id.contains("-") || id.contains(".")) {
                    continue;
                }
                if (!isInteger(id)) {
                    errors.add(new InputError("line " + lineNumber, "Invalid token ID '" + id + "'"));
                    continue;
                }
                if (lines.stream().anyMatch(l -> l.id().equals(id))) {
                    errors.add(new InputError("line " + lineNumber, "Duplicate token ID '" + id + "'"));
                    continue;
                }
                lines.add(new ConlluLine(lineNumber, fields));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read CoNLL-U input", e);
        }

        if (!errors.isEmpty()) {
            throw new ParsingFailedException(errors);
        }
        if (lines.isEmpty()) {
            throw new ParsingFailedException(new InputError(null, "No tokens were found in the CoNLL-U input."));
        }
        return lines;
    }

    private static Map<String, String> annotations(ConlluLine line) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String pair : pairs(line.column(MISC))) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                logger.debug("Ignoring MISC entry without value on line {}: {}", line.lineNumber(), pair);
                continue;
            }
            result.put(pair.substring(0, eq), pair.substring(eq + 1));
        }
        return result;
    }

    private static List<String> pairs(String column) {
        List<String> result = new ArrayList<>();
        if (!isSpecified(column)) {
            return result;
        }
        for (String pair : column.split("\\|")) {
            if (!pair.isBlank()) {
                result.add(pair.trim());
            }
        }
        return result;
    }

    private static boolean isYes(Map<String, String> annotations, String key) {
        for (Map.Entry<String, String> annotation : annotations.entrySet()) {
            if (annotation.getKey().equalsIgnoreCase(key)) {
                return "Yes".equalsIgnoreCase(annotation.getValue());
            }
        }
        return false;
    }

    private static boolean isSpecified(String value) {
        return value != null && !value.isEmpty() && !NO_VALUE.equals(value) && !UNSPECIFIED_VALUE.equals(value);
    }

    private static boolean isInteger(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * A token line of the sentence.
     */
    private record ConlluLine(int lineNumber, String[] fields) {

        String id() {
            return fields[ID];
        }

        String column(int index) {
            return fields[index].trim();
        }
    }
}
