package pl.marcinmilkowski.cqp_tree.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link TranslationConfig} from JSON.
 *
 * Expected JSON structure (every key but "version" is optional):
 * {
 *   "version": "1.0",
 *   "dependency_head_attribute": "dephead",
 *   "position_attribute": "ref",
 *   "label_alphabet": "abcdefghijklmnopqrstuvwxyz",
 *   "max_candidates": 10000
 * }
 */
public class TranslationConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(TranslationConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "/cqp-tree.json";

    private TranslationConfigLoader() {
    }

    /**
     * Load the configuration from a file.
     *
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the content is not a valid configuration
     */
    public static TranslationConfig load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("Translation config file not found: " + configPath);
        }
        TranslationConfig config = parse(Files.readString(configPath, StandardCharsets.UTF_8));
        logger.info("Loaded translation config version {} from {}", config.version(), configPath);
        return config;
    }

    /**
     * Load the configuration bundled with the application.
     */
    public static TranslationConfig loadDefault() {
        try (InputStream in = TranslationConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                logger.debug("No {} on classpath, using built-in defaults", DEFAULT_RESOURCE);
                return TranslationConfig.defaults();
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read default translation config " + DEFAULT_RESOURCE, e);
        }
    }

    public static TranslationConfig parse(String content) {
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Translation config is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Translation config is empty");
        }

        String version = root.getString("version");
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in translation config");
        }

        return new TranslationConfig(
            version,
            stringOrDefault(root, "dependency_head_attribute", TranslationConfig.DEFAULT_DEPENDENCY_HEAD_ATTRIBUTE),
            stringOrDefault(root, "position_attribute", TranslationConfig.DEFAULT_POSITION_ATTRIBUTE),
            stringOrDefault(root, "label_alphabet", TranslationConfig.DEFAULT_LABEL_ALPHABET),
            root.getIntValue("max_candidates", TranslationConfig.DEFAULT_MAX_CANDIDATES)
        );
    }

    private static String stringOrDefault(JSONObject root, String key, String defaultValue) {
        return root.containsKey(key) ? root.getString(key) : defaultValue;
    }
}
