package org.lemmadex.search.service;

import org.lemmadex.core.model.DocumentRegistry;
import org.lemmadex.core.model.InvertedIndex;
import org.lemmadex.core.model.Universe;
import org.lemmadex.search.indexer.InvertedIndexReader;
import org.lemmadex.search.model.SearchResponse;
import org.lemmadex.search.model.SearchResult;
import org.lemmadex.search.query.BooleanSearchEngine;
import org.lemmadex.search.repository.DocumentRegistryReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.SortedSet;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Serves boolean queries from the most recently loaded index snapshot.
 *
 * <p>{@link #reload()} reads the index and the registry again and swaps the snapshot atomically; searches
 * running at that moment finish against the snapshot they started with.</p>
 */
public class SearchService {
    private static final Logger logger = LoggerFactory.getLogger(SearchService.class);

    private final InvertedIndexReader indexReader;
    private final DocumentRegistryReader registryReader;
    private final int maxResults;
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>();

    private record Snapshot(BooleanSearchEngine engine, DocumentRegistry registry) {}

    public SearchService(InvertedIndexReader indexReader, DocumentRegistryReader registryReader, int maxResults) {
        this.indexReader = indexReader;
        this.registryReader = registryReader;
        this.maxResults = maxResults;
    }

    /**
     * Loads the index and the registry and makes them the active snapshot.
     *
     * @throws org.lemmadex.core.exception.SourceNotFoundException if the index file is missing
     */
    public void reload() throws IOException {
        InvertedIndex index = indexReader.load();
        DocumentRegistry registry = registryReader.load();
        Universe universe = Universe.resolve(registry, index);

        snapshot.set(new Snapshot(new BooleanSearchEngine(index, universe), registry));
        logger.info("Search snapshot ready: {} lemmas, {}", index.size(), universe);
    }

    public boolean isLoaded() {
        return snapshot.get() != null;
    }

    /**
     * @return ascending ids of every matching document
     */
    public SortedSet<Integer> searchIds(String query) {
        return current().engine().search(query);
    }

    /**
     * Runs the query and pairs each hit with its registered URL.
     *
     * @param limit maximum number of results to return; {@code null} or non-positive means {@code maxResults}
     */
    public SearchResponse search(String query, Integer limit) {
        Snapshot active = current();
        SortedSet<Integer> ids = active.engine().search(query);
        int resultLimit = (limit != null && limit > 0) ? Math.min(limit, maxResults) : maxResults;

        List<SearchResult> results = ids.stream()
                .limit(resultLimit)
                .map(id -> SearchResult.fromRegistry(id, active.registry()))
                .collect(Collectors.toList());

        logger.debug("Query '{}' matched {} documents", query, ids.size());
        return new SearchResponse(query, active.engine().explain(query), ids.size(), results.size(), results);
    }

    public String urlOf(int docId) {
        return current().registry().urlOf(docId);
    }

    public SearchStats getStats() {
        Snapshot active = snapshot.get();
        if (active == null) {
            return new SearchStats(false, 0, 0, 0, 0, 0.0);
        }
        InvertedIndex index = active.engine().getIndex();
        return new SearchStats(
                true,
                index.size(),
                index.totalPostings(),
                active.engine().getUniverse().size(),
                active.registry().size(),
                indexReader.getStats().sizeInMB()
        );
    }

    private Snapshot current() {
        Snapshot active = snapshot.get();
        if (active == null) {
            throw new IllegalStateException("Search index is not loaded");
        }
        return active;
    }

    public record SearchStats(
            boolean indexLoaded,
            int uniqueLemmas,
            long totalPostings,
            int universeSize,
            int registeredDocuments,
            double indexSizeMB
    ) {}
}
