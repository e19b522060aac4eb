package pl.marcinmilkowski.cqp_tree.translation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.cqp_tree.config.TranslationConfig;
import pl.marcinmilkowski.cqp_tree.query.Query;

import java.util.List;

/**
 * Translates a {@link Query} into a CQP pattern.
 *
 * Usage:
 * <pre>
 *   CqpTranslator translator = new CqpTranslator(TranslationConfigLoader.loadDefault());
 *   String cqp = translator.translate(query);
 * </pre>
 *
 * Instances hold no per-query state and may be shared between threads.
 */
public class CqpTranslator {
    private static final Logger logger = LoggerFactory.getLogger(CqpTranslator.class);

    private final TranslationConfig config;
    private final ConstraintPlacement placement = new ConstraintPlacement();
    private final OrderingModel orderingModel = new OrderingModel();
    private final PatternEmitter emitter;

    public CqpTranslator(TranslationConfig config) {
        this.config = config;
        this.emitter = new PatternEmitter(config);
    }

    public CqpTranslator() {
        this(TranslationConfig.defaults());
    }

    public TranslationConfig getConfig() { return config; }

    /**
     * @throws NotSupportedException          if the query uses something that cannot be compiled
     * @throws InconsistentOrderingException  if its order constraints contradict each other
     * @throws CandidateLimitExceededException if it expands to more alternatives than configured
     */
    public String translate(Query query) {
        return translate(query, config.maxCandidates());
    }

    /**
     * Translate with an explicit candidate limit (0 for none).
     */
    public String translate(Query query, int maxCandidates) {
        PlacedConstraints placed = placement.place(query);
        if (placed.getIdentifiers().isEmpty()) {
            throw new NotSupportedException("Query contains no tokens");
        }
        List<Component> components = orderingModel.build(
            placed.getIdentifiers(), query.dependencies(), query.constraints());
        LinearizationEnumerator candidates = new LinearizationEnumerator(components, maxCandidates);
        String cqp = emitter.emit(placed, query.dependencies(), candidates);
        logger.debug("Translated query with {} token(s) into {} characters of CQP",
            placed.getIdentifiers().size(), cqp.length());
        return cqp;
    }

    /**
     * Candidate token orders of a query, without rendering them.
     */
    public LinearizationEnumerator linearizations(Query query) {
        PlacedConstraints placed = placement.place(query);
        List<Component> components = orderingModel.build(
            placed.getIdentifiers(), query.dependencies(), query.constraints());
        return new LinearizationEnumerator(components, config.maxCandidates());
    }
}
