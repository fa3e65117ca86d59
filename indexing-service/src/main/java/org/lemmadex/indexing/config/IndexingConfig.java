package org.lemmadex.indexing.config;

import org.lemmadex.core.config.IndexLocations;
import org.lemmadex.core.config.PropertiesSupport;

import java.util.Properties;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Typed configuration for the Indexing Service.
 *
 * <p>Loads {@code application.properties}, then overlays environment variables. Missing required keys fail
 * fast with {@link IllegalStateException}.</p>
 */
public record IndexingConfig(
    int serverPort,
    IndexLocations locations,
    Lemmas lemmas
) {
    /** Which lemmas the builder accepts. */
    public record Lemmas(int minLength, int maxLength, Pattern alphabet) {}

    /**
     * Loads configuration from classpath properties plus environment variables.
     *
     * @return a fully-initialized {@link IndexingConfig}
     */
    public static IndexingConfig load() {
        return from(PropertiesSupport.loadWithEnvironment("application.properties"));
    }

    public static IndexingConfig from(Properties p) {
        return new IndexingConfig(
            PropertiesSupport.requireInt(p, "server.port"),
            IndexLocations.from(p),
            readLemmas(p)
        );
    }

    private static Lemmas readLemmas(Properties p) {
        int min = PropertiesSupport.optionalInt(p, "index.lemma.min.length", 2);
        int max = PropertiesSupport.optionalInt(p, "index.lemma.max.length", 40);
        if (min < 1 || max < min) {
            throw new IllegalStateException("Invalid lemma length bounds: [" + min + ", " + max + "]");
        }
        String regex = PropertiesSupport.optionalString(p, "index.lemma.alphabet", "\\p{L}+");
        try {
            return new Lemmas(min, max, Pattern.compile(regex));
        } catch (PatternSyntaxException e) {
            throw new IllegalStateException("Invalid regular expression for 'index.lemma.alphabet': '" + regex + "'", e);
        }
    }
}
