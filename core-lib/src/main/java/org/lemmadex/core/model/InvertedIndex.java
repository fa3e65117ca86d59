package org.lemmadex.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Read-only mapping from lemma to the ascending set of document ids containing it.
 *
 * <p>Lemmas iterate in ascending lexicographic order and every posting set in ascending numeric
 * order, so iterating an instance reproduces the persisted layout.</p>
 */
public final class InvertedIndex {
	private static final InvertedIndex EMPTY = new InvertedIndex(new TreeMap<>());

	private final SortedMap<String, SortedSet<Integer>> postings;

	private InvertedIndex(SortedMap<String, SortedSet<Integer>> postings) {
		this.postings = Collections.unmodifiableSortedMap(postings);
	}

	public static InvertedIndex empty() {
		return EMPTY;
	}

	/**
	 * Copies the given mapping; later changes to the argument are not visible through the index.
	 */
	public static InvertedIndex of(Map<String, ? extends Iterable<Integer>> source) {
		SortedMap<String, SortedSet<Integer>> copy = new TreeMap<>();
		for (Map.Entry<String, ? extends Iterable<Integer>> entry : source.entrySet()) {
			SortedSet<Integer> ids = new TreeSet<>();
			entry.getValue().forEach(ids::add);
			copy.put(entry.getKey(), Collections.unmodifiableSortedSet(ids));
		}
		return new InvertedIndex(copy);
	}

	/**
	 * @return the posting set of the lemma, empty if the lemma is not indexed
	 */
	public SortedSet<Integer> postings(String lemma) {
		SortedSet<Integer> ids = postings.get(lemma);
		return ids != null ? ids : Collections.emptySortedSet();
	}

	public boolean contains(String lemma) {
		return postings.containsKey(lemma);
	}

	public SortedMap<String, SortedSet<Integer>> asMap() {
		return postings;
	}

	public int size() {
		return postings.size();
	}

	public boolean isEmpty() {
		return postings.isEmpty();
	}

	public long totalPostings() {
		return postings.values().stream().mapToLong(SortedSet::size).sum();
	}

	/**
	 * Union of every posting set.
	 */
	public SortedSet<Integer> allDocIds() {
		SortedSet<Integer> all = new TreeSet<>();
		postings.values().forEach(all::addAll);
		return all;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof InvertedIndex other)) return false;
		return postings.equals(other.postings);
	}

	@Override
	public int hashCode() {
		return postings.hashCode();
	}

	@Override
	public String toString() {
		return "InvertedIndex{lemmas=" + postings.size() + ", postings=" + totalPostings() + "}";
	}
}
