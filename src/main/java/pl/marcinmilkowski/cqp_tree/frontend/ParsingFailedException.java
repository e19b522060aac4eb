package pl.marcinmilkowski.cqp_tree.frontend;

import pl.marcinmilkowski.cqp_tree.translation.TranslationException;

import java.util.List;

/**
 * Input does not conform to the front-end's syntax.
 */
public class ParsingFailedException extends TranslationException {
    private final List<InputError> errors;

    public ParsingFailedException(List<InputError> errors) {
        super("Parsing failed. Detected " + errors.size() + " error(s).");
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("Expected at least one InputError");
        }
        this.errors = List.copyOf(errors);
    }

    public ParsingFailedException(InputError error) {
        this(List.of(error));
    }

    public List<InputError> getErrors() { return errors; }
}
