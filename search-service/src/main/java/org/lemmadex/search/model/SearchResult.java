package org.lemmadex.search.model;

import org.lemmadex.core.model.DocumentRegistry;

public record SearchResult(
		int docId,
		String url
) {
	public static SearchResult fromRegistry(int docId, DocumentRegistry registry) {
		return new SearchResult(docId, registry.urlOf(docId));
	}
}
