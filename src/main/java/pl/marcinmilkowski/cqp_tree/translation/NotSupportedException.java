package pl.marcinmilkowski.cqp_tree.translation;

/**
 * A recognized construct that cannot be represented or compiled.
 * The message names the construct.
 */
public class NotSupportedException extends TranslationException {

    public NotSupportedException(String construct) {
        super(construct);
    }
}
