package org.lemmadex.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Known documents and the URL each one was fetched from.
 */
public final class DocumentRegistry {
	private static final DocumentRegistry EMPTY = new DocumentRegistry(new TreeMap<>());

	private final SortedMap<Integer, String> urls;

	private DocumentRegistry(SortedMap<Integer, String> urls) {
		this.urls = Collections.unmodifiableSortedMap(urls);
	}

	public static DocumentRegistry empty() {
		return EMPTY;
	}

	public static DocumentRegistry of(Map<Integer, String> urls) {
		return new DocumentRegistry(new TreeMap<>(urls));
	}

	/**
	 * @return the registered URL, or an empty string when the document is unknown or has none
	 */
	public String urlOf(int docId) {
		return urls.getOrDefault(docId, "");
	}

	public boolean isRegistered(int docId) {
		return urls.containsKey(docId);
	}

	public SortedSet<Integer> docIds() {
		return Collections.unmodifiableSortedSet(new TreeSet<>(urls.keySet()));
	}

	public int size() {
		return urls.size();
	}

	public boolean isEmpty() {
		return urls.isEmpty();
	}
}
