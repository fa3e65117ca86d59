package org.lemmadex.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Helpers shared by the typed service configurations.
 *
 * <p>Properties come from a classpath resource and are then overlaid with environment variables.
 * Missing required keys fail fast with {@link IllegalStateException}.</p>
 */
public final class PropertiesSupport {
    private PropertiesSupport() {}

    public static Properties loadWithEnvironment(String resourceName) {
        Properties properties = loadProperties(resourceName);
        properties.putAll(System.getenv());
        return properties;
    }

    public static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = PropertiesSupport.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resourceName, e);
        }
        return properties;
    }

    public static String requireString(Properties properties, String key) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            throw new IllegalStateException("Missing required configuration: " + key);
        }
        return value;
    }

    public static String optionalString(Properties properties, String key, String defaultValue) {
        String value = trimToNull(properties.getProperty(key));
        return value != null ? value : defaultValue;
    }

    public static int requireInt(Properties properties, String key) {
        String value = requireString(properties, key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for configuration '" + key + "': '" + value + "'", e);
        }
    }

    public static int optionalInt(Properties properties, String key, int defaultValue) {
        if (trimToNull(properties.getProperty(key)) == null) {
            return defaultValue;
        }
        return requireInt(properties, key);
    }

    public static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
