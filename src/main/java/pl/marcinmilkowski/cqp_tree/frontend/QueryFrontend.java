package pl.marcinmilkowski.cqp_tree.frontend;

import pl.marcinmilkowski.cqp_tree.query.Query;

/**
 * A surface syntax that can be turned into a {@link Query}.
 */
public interface QueryFrontend {

    /**
     * Name used to select this front-end, e.g. on the command line.
     */
    String name();

    /**
     * @throws ParsingFailedException if the input is malformed
     * @throws pl.marcinmilkowski.cqp_tree.translation.NotSupportedException
     *         if the input uses something a query cannot express
     */
    Query translate(String input);
}
