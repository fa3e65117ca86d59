package org.lemmadex.search.model;

import java.util.List;

public record SearchResponse(
		String query,
		String parsedQuery,
		int totalResults,
		int returnedResults,
		List<SearchResult> results
) {}
