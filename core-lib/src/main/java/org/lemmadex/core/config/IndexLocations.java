package org.lemmadex.core.config;

import java.nio.file.Path;
import java.util.Properties;

/**
 * Where the index artifacts live on disk.
 *
 * <p>If {@code DATA_VOLUME_PATH} is set, relative locations are resolved against it.</p>
 *
 * @param lemmaSourceDir directory holding one {@code page<N>} folder per document
 * @param indexFile      persisted inverted index
 * @param registryFile   optional document id to URL registry
 */
public record IndexLocations(Path lemmaSourceDir, Path indexFile, Path registryFile) {

    public static IndexLocations from(Properties p) {
        Path base = Path.of(PropertiesSupport.optionalString(p, "DATA_VOLUME_PATH", "."));
        return new IndexLocations(
            base.resolve(PropertiesSupport.requireString(p, "index.lemma.source.dir")),
            base.resolve(PropertiesSupport.requireString(p, "index.file")),
            base.resolve(PropertiesSupport.requireString(p, "index.registry.file"))
        );
    }
}
