package pl.marcinmilkowski.cqp_tree.frontend;

/**
 * One problem found while parsing front-end input.
 *
 * @param position where in the input the problem is, in front-end specific form; may be null
 * @param message  human-readable description
 */
public record InputError(String position, String message) {

    @Override
    public String toString() {
        return position == null ? message : position + ": " + message;
    }
}
