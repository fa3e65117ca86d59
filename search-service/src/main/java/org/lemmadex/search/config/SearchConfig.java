package org.lemmadex.search.config;

import org.lemmadex.core.config.IndexLocations;
import org.lemmadex.core.config.PropertiesSupport;

import java.util.Properties;

/**
 * Typed configuration for the Search Service.
 *
 * <p>Loads {@code application.properties}, then overlays environment variables. Missing required keys fail
 * fast with {@link IllegalStateException}.</p>
 */
public record SearchConfig(
    int serverPort,
    int maxResults,
    int defaultLimit,
    IndexLocations locations
) {
    /**
     * Loads configuration from classpath properties plus environment variables.
     *
     * @return a fully-initialized {@link SearchConfig}
     */
    public static SearchConfig load() {
        return from(PropertiesSupport.loadWithEnvironment("application.properties"));
    }

    public static SearchConfig from(Properties p) {
        int maxResults = PropertiesSupport.requireInt(p, "search.max.results");
        int defaultLimit = PropertiesSupport.requireInt(p, "search.default.limit");
        if (maxResults <= 0 || defaultLimit <= 0) {
            throw new IllegalStateException("search.max.results and search.default.limit must be positive");
        }
        return new SearchConfig(
            PropertiesSupport.requireInt(p, "server.port"),
            maxResults,
            defaultLimit,
            IndexLocations.from(p)
        );
    }
}
