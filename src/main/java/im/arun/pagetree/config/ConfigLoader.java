package im.arun.pagetree.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads {@link PageTreeConfig} and merges user overrides on top.
 *
 * <p>Base values come from the first source found: an explicit file path,
 * then {@code pagetree.yaml} on the classpath, then {@link PageTreeConfig}'s
 * own defaults.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String RESOURCE_NAME = "pagetree.yaml";

    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "on", "1");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "off", "0");

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final PageTreeConfig baseConfig;

    public ConfigLoader() {
        this(null);
    }

    /**
     * @param configPath YAML file to read base values from; when null or
     *                   missing the classpath resource is used
     */
    public ConfigLoader(String configPath) {
        PageTreeConfig fromFile = configPath == null ? null : readFile(Paths.get(configPath));
        PageTreeConfig base = fromFile != null ? fromFile : readResource();
        this.baseConfig = base != null ? base : new PageTreeConfig();
    }

    private PageTreeConfig readFile(Path path) {
        if (!Files.isRegularFile(path)) {
            logger.warn("Configuration file {} not found, falling back to {}", path, RESOURCE_NAME);
            return null;
        }
        try {
            logger.debug("Reading configuration from {}", path);
            return yamlMapper.readValue(path.toFile(), PageTreeConfig.class);
        } catch (IOException e) {
            logger.warn("Unreadable configuration file {}: {}", path, e.getMessage());
            return null;
        }
    }

    private PageTreeConfig readResource() {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                logger.warn("No {} on the classpath, using built-in defaults", RESOURCE_NAME);
                return null;
            }
            return yamlMapper.readValue(in, PageTreeConfig.class);
        } catch (IOException e) {
            logger.warn("Unreadable {}: {}", RESOURCE_NAME, e.getMessage());
            return null;
        }
    }

    public PageTreeConfig load() {
        return load(null);
    }

    /**
     * Returns a fresh copy of the base configuration with {@code userOptions}
     * applied. Keys may be camelCase or snake_case; unknown keys and values
     * of the wrong kind are logged and ignored.
     */
    public PageTreeConfig load(Map<String, Object> userOptions) {
        PageTreeConfig config = yamlMapper.convertValue(baseConfig, PageTreeConfig.class);
        if (userOptions != null) {
            userOptions.forEach((key, value) -> apply(config, key, value));
        }
        return config;
    }

    private void apply(PageTreeConfig config, String key, Object value) {
        switch (key) {
            case "default_page_type":
            case "defaultPageType":
                if (value instanceof String && !((String) value).isEmpty()) {
                    config.setDefaultPageType((String) value);
                } else {
                    logger.warn("Ignoring {}: expected a page type name, got {}", key, value);
                }
                break;
            case "pages_visible_by_default":
            case "pagesVisibleByDefault":
                config.setPagesVisibleByDefault(toFlag(key, value, config.isPagesVisibleByDefault()));
                break;
            case "pretty_print":
            case "prettyPrint":
                config.setPrettyPrint(toFlag(key, value, config.isPrettyPrint()));
                break;
            default:
                logger.warn("Unknown configuration key: {}", key);
        }
    }

    private static boolean toFlag(String key, Object value, boolean current) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String word = value == null ? "" : value.toString().trim().toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(word)) {
            return true;
        }
        if (FALSE_WORDS.contains(word)) {
            return false;
        }
        logger.warn("Ignoring {}: '{}' is not a yes/no value", key, value);
        return current;
    }
}
