package org.lemmadex.indexing.model;

/**
 * Outcome of one full index build.
 */
public record BuildReport(
		int documentsRead,
		int documentsWithLemmas,
		int uniqueLemmas,
		long totalPostings,
		int rejectedLemmas,
		String indexFile,
		long elapsedMillis
) {}
