package org.lemmadex.search.indexer;

import org.lemmadex.core.model.InvertedIndex;

import java.io.IOException;

public interface InvertedIndexReader {
	/**
	 * Load the index from storage
	 *
	 * @throws org.lemmadex.core.exception.SourceNotFoundException if the index has not been built yet
	 * @throws org.lemmadex.core.exception.IndexParseException if a document id is not an integer
	 */
	InvertedIndex load() throws IOException;

	/**
	 * Get the most recently loaded index, empty before the first load
	 */
	InvertedIndex getIndex();

	/**
	 * Check if index is loaded
	 */
	boolean isLoaded();

	/**
	 * Get index statistics
	 */
	IndexStats getStats();

	record IndexStats(int uniqueLemmas, long totalPostings, double sizeInMB) {}
}
