package org.lemmadex.indexing.indexer;

import org.lemmadex.core.model.InvertedIndex;

import java.io.IOException;
import java.nio.file.Path;

public interface InvertedIndexWriter {
	/**
	 * Add a lemma and a document containing it. Adding the same pair twice has no effect.
	 */
	void addLemma(String lemma, int docId);

	/**
	 * Save the index to storage
	 */
	void save() throws IOException;

	/**
	 * Immutable copy of what has been added so far
	 */
	InvertedIndex snapshot();

	/**
	 * Location the index is saved to
	 */
	Path getIndexPath();

	/**
	 * Get size of the saved index in MB
	 */
	double getSizeInMB();

	/**
	 * Clear the index
	 */
	void clear();
}
