package org.lemmadex.indexing.model;

public record IndexResponse(
		String index,
		BuildReport report,
		String message
) {
	public static IndexResponse rebuilt(BuildReport report) {
		return new IndexResponse("rebuilt", report, null);
	}

	public static IndexResponse failed(String message) {
		return new IndexResponse("failed", null, message);
	}
}
