package pl.marcinmilkowski.cqp_tree.translation;

/**
 * Base class of every error that ends a translation without output.
 */
public class TranslationException extends RuntimeException {

    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
