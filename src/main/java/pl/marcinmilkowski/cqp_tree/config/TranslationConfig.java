package pl.marcinmilkowski.cqp_tree.config;

import com.alibaba.fastjson2.JSONObject;

/**
 * Settings of the CQP pattern emitter.
 *
 * @param version                 config format version
 * @param dependencyHeadAttribute token attribute holding the position of the dependency head
 * @param positionAttribute       pseudo-attribute holding a token's own position
 * @param labelAlphabet           characters label names are built from
 * @param maxCandidates           upper bound on alternatives, 0 for none
 */
public record TranslationConfig(
    String version,
    String dependencyHeadAttribute,
    String positionAttribute,
    String labelAlphabet,
    int maxCandidates
) {
    public static final String DEFAULT_DEPENDENCY_HEAD_ATTRIBUTE = "dephead";
    public static final String DEFAULT_POSITION_ATTRIBUTE = "ref";
    public static final String DEFAULT_LABEL_ALPHABET = "abcdefghijklmnopqrstuvwxyz";
    public static final int DEFAULT_MAX_CANDIDATES = 10_000;

    public TranslationConfig {
        requireNonBlank(version, "version");
        requireNonBlank(dependencyHeadAttribute, "dependency_head_attribute");
        requireNonBlank(positionAttribute, "position_attribute");
        requireNonBlank(labelAlphabet, "label_alphabet");
        if (labelAlphabet.chars().distinct().count() != labelAlphabet.length() || labelAlphabet.length() < 2) {
            throw new IllegalArgumentException(
                "'label_alphabet' needs at least two distinct characters and no repeats: " + labelAlphabet);
        }
        if (maxCandidates < 0) {
            throw new IllegalArgumentException("'max_candidates' must not be negative: " + maxCandidates);
        }
    }

    /**
     * Built-in settings, identical to the bundled {@code cqp-tree.json}.
     */
    public static TranslationConfig defaults() {
        return new TranslationConfig("1.0", DEFAULT_DEPENDENCY_HEAD_ATTRIBUTE, DEFAULT_POSITION_ATTRIBUTE,
            DEFAULT_LABEL_ALPHABET, DEFAULT_MAX_CANDIDATES);
    }

    public TranslationConfig withMaxCandidates(int limit) {
        return new TranslationConfig(version, dependencyHeadAttribute, positionAttribute, labelAlphabet, limit);
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("version", version);
        obj.put("dependency_head_attribute", dependencyHeadAttribute);
        obj.put("position_attribute", positionAttribute);
        obj.put("label_alphabet", labelAlphabet);
        obj.put("max_candidates", maxCandidates);
        return obj;
    }

    private static void requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing '" + field + "' in translation config");
        }
    }
}
