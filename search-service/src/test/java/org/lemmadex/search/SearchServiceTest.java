package org.lemmadex.search;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lemmadex.core.exception.SourceNotFoundException;
import org.lemmadex.search.indexer.TextIndexReader;
import org.lemmadex.search.model.SearchResponse;
import org.lemmadex.search.model.SearchResult;
import org.lemmadex.search.repository.DocumentRegistryReader;
import org.lemmadex.search.service.SearchService;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SearchServiceTest {

	private static SearchService newService(Path dir, int maxResults) {
		return new SearchService(
				new TextIndexReader(dir.resolve("inverted_index.txt")),
				new DocumentRegistryReader(dir.resolve("index.txt")),
				maxResults);
	}

	private static void writeFixture(Path dir) throws Exception {
		Files.writeString(dir.resolve("inverted_index.txt"), "кот 1 2\nпёс 2 3\n", StandardCharsets.UTF_8);
		Files.writeString(dir.resolve("index.txt"),
				"1\thttps://example.org/1\n2\thttps://example.org/2\n3\thttps://example.org/3\n4\thttps://example.org/4\n",
				StandardCharsets.UTF_8);
	}

	@Test
	public void testSearchPairsIdsWithUrls(@TempDir Path tempDir) throws Exception {
		writeFixture(tempDir);
		SearchService service = newService(tempDir, 100);
		service.reload();

		SearchResponse response = service.search("кот OR пёс", null);

		assertEquals(3, response.totalResults());
		assertEquals(List.of(
				new SearchResult(1, "https://example.org/1"),
				new SearchResult(2, "https://example.org/2"),
				new SearchResult(3, "https://example.org/3")), response.results());
		assertEquals("кот OR пёс", response.parsedQuery());
	}

	@Test
	public void testNegationCoversRegisteredDocuments(@TempDir Path tempDir) throws Exception {
		writeFixture(tempDir);
		SearchService service = newService(tempDir, 100);
		service.reload();

		assertEquals(List.of(3, 4), List.copyOf(service.searchIds("NOT кот")));
	}

	@Test
	public void testLimitKeepsLowestIdsAndTotal(@TempDir Path tempDir) throws Exception {
		writeFixture(tempDir);
		SearchService service = newService(tempDir, 2);
		service.reload();

		SearchResponse limited = service.search("кот OR пёс", 1);
		assertEquals(3, limited.totalResults());
		assertEquals(1, limited.returnedResults());
		assertEquals(1, limited.results().get(0).docId());

		SearchResponse capped = service.search("кот OR пёс", 50);
		assertEquals(2, capped.returnedResults());
	}

	@Test
	public void testUnregisteredDocumentHasEmptyUrl(@TempDir Path tempDir) throws Exception {
		Files.writeString(tempDir.resolve("inverted_index.txt"), "кот 7\n", StandardCharsets.UTF_8);
		SearchService service = newService(tempDir, 100);
		service.reload();

		assertEquals(List.of(new SearchResult(7, "")), service.search("кот", null).results());
		assertEquals(1, service.getStats().universeSize());
		assertEquals(0, service.getStats().registeredDocuments());
	}

	@Test
	public void testReloadPicksUpRebuiltIndex(@TempDir Path tempDir) throws Exception {
		writeFixture(tempDir);
		SearchService service = newService(tempDir, 100);
		service.reload();
		assertTrue(service.searchIds("слон").isEmpty());

		Files.writeString(tempDir.resolve("inverted_index.txt"), "слон 4\n", StandardCharsets.UTF_8);
		service.reload();

		assertEquals(List.of(4), List.copyOf(service.searchIds("слон")));
		assertTrue(service.searchIds("кот").isEmpty());
	}

	@Test
	public void testSearchBeforeLoadFails(@TempDir Path tempDir) {
		SearchService service = newService(tempDir, 100);

		assertFalse(service.isLoaded());
		assertFalse(service.getStats().indexLoaded());
		assertThrows(SourceNotFoundException.class, service::reload);
		assertThrows(IllegalStateException.class, () -> service.searchIds("кот"));
	}
}
