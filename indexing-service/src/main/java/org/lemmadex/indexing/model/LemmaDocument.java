package org.lemmadex.indexing.model;

import java.util.Set;

/**
 * One document as delivered by the lemma source: its id and the distinct lemmas it contains.
 */
public record LemmaDocument(int docId, Set<String> lemmas) {
	public LemmaDocument {
		lemmas = Set.copyOf(lemmas);
	}
}
