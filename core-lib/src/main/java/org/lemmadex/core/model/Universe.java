package org.lemmadex.core.model;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Every document id a query session knows about; the complement base for NOT.
 *
 * @param docIds ascending, unmodifiable document ids
 * @param source where the ids came from
 */
public record Universe(SortedSet<Integer> docIds, Source source) {

	public enum Source {
		REGISTRY,
		INDEX
	}

	public Universe {
		docIds = Collections.unmodifiableSortedSet(new TreeSet<>(docIds));
	}

	/**
	 * Uses the registry when it lists at least one document, otherwise falls back to the union of all
	 * posting sets.
	 */
	public static Universe resolve(DocumentRegistry registry, InvertedIndex index) {
		if (!registry.isEmpty()) {
			return new Universe(registry.docIds(), Source.REGISTRY);
		}
		return new Universe(index.allDocIds(), Source.INDEX);
	}

	public int size() {
		return docIds.size();
	}

	@NotNull
	@Override
	public String toString() {
		return String.format("Universe{size=%d, source=%s}", docIds.size(), source);
	}
}
