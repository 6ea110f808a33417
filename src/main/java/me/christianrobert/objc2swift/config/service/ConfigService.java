package me.christianrobert.objc2swift.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory transformer settings, changeable at runtime through {@code /api/config}.
 *
 * <ul>
 *   <li>{@value #INDENT_WIDTH} - spaces per indentation level of the generated Swift (default 4)</li>
 *   <li>{@value #INCLUDE_AST} - whether results carry the parse tree when the caller does not say (default false)</li>
 * </ul>
 */
@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String INDENT_WIDTH = "swift.indent-width";
    public static final String INCLUDE_AST = "transformer.include-ast";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(INDENT_WIDTH, 4);
        configuration.put(INCLUDE_AST, false);

        log.info("Configuration service initialized with default values");
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    public Boolean getConfigValueAsBoolean(String key) {
        Object value = configuration.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return null;
    }

    public Integer getConfigValueAsInteger(String key) {
        return toInteger(configuration.get(key));
    }

    /**
     * Converts a raw config value to an integer. REST clients send numbers or numeric strings.
     *
     * @return Integer value, or null if missing or not numeric
     */
    public static Integer toInteger(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("Config value is not a number: {}", value);
                return null;
            }
        }
        return null;
    }

    public void setConfigValue(String key, Object value) {
        Object oldValue = configuration.put(key, value);
        log.debug("Config value set: {} = {} (was: {})", key, value, oldValue);
    }

    public boolean hasConfigKey(String key) {
        return configuration.containsKey(key);
    }

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }
}
