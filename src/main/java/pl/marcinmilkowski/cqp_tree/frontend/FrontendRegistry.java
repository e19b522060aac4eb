package pl.marcinmilkowski.cqp_tree.frontend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.cqp_tree.frontend.conllu.ConlluFrontend;
import pl.marcinmilkowski.cqp_tree.frontend.deptreepy.DeptreepyFrontend;
import pl.marcinmilkowski.cqp_tree.query.Query;
import pl.marcinmilkowski.cqp_tree.translation.NotSupportedException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Front-ends by name.
 */
public class FrontendRegistry {
    private static final Logger logger = LoggerFactory.getLogger(FrontendRegistry.class);

    private final Map<String, QueryFrontend> frontends = new LinkedHashMap<>();

    /**
     * Registry with every front-end shipped with cqp-tree.
     */
    public static FrontendRegistry withDefaults() {
        FrontendRegistry registry = new FrontendRegistry();
        registry.register(new ConlluFrontend());
        registry.register(new DeptreepyFrontend());
        return registry;
    }

    public void register(QueryFrontend frontend) {
        if (frontends.containsKey(frontend.name())) {
            throw new IllegalArgumentException("Another front-end named " + frontend.name() + " is already registered");
        }
        frontends.put(frontend.name(), frontend);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(frontends.keySet());
    }

    /**
     * Translate with the named front-end.
     *
     * @throws IllegalArgumentException if no front-end has that name
     */
    public Query translate(String input, String frontendName) {
        QueryFrontend frontend = frontends.get(frontendName);
        if (frontend == null) {
            throw new IllegalArgumentException("Unknown front-end: " + frontendName);
        }
        return frontend.translate(input);
    }

    /**
     * Translate with the only front-end that accepts the input.
     *
     * @throws UnableToGuessFrontendException if none or several accept it
     */
    public Query translate(String input) {
        Map<String, Query> accepted = guess(input);
        if (accepted.size() != 1) {
            throw new UnableToGuessFrontendException(new ArrayList<>(accepted.keySet()));
        }
        return accepted.values().iterator().next();
    }

    /**
     * Try every front-end on the input.
     *
     * @return the queries of all front-ends that accepted it, by front-end name
     */
    public Map<String, Query> guess(String input) {
        Map<String, Query> accepted = new LinkedHashMap<>();
        for (QueryFrontend frontend : frontends.values()) {
            try {
                accepted.put(frontend.name(), frontend.translate(input));
            } catch (ParsingFailedException | NotSupportedException e) {
                logger.debug("Front-end {} rejected input: {}", frontend.name(), e.getMessage());
            }
        }
        return accepted;
    }

    public List<QueryFrontend> frontends() {
        return List.copyOf(frontends.values());
    }
}
