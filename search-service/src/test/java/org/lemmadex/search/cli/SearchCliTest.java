package org.lemmadex.search.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lemmadex.search.indexer.TextIndexReader;
import org.lemmadex.search.repository.DocumentRegistryReader;
import org.lemmadex.search.service.SearchService;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class SearchCliTest {

	@TempDir
	Path tempDir;

	private SearchService service;
	private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
	private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

	@BeforeEach
	public void setUp() throws Exception {
		Files.writeString(tempDir.resolve("inverted_index.txt"), "кот 1 2\nпёс 2 3\n", StandardCharsets.UTF_8);
		Files.writeString(tempDir.resolve("index.txt"), "1\thttps://example.org/1\n2\thttps://example.org/2\n",
				StandardCharsets.UTF_8);
		service = new SearchService(
				new TextIndexReader(tempDir.resolve("inverted_index.txt")),
				new DocumentRegistryReader(tempDir.resolve("index.txt")),
				100);
		service.reload();
	}

	private String output() {
		return buffer.toString(StandardCharsets.UTF_8);
	}

	@Test
	public void testQueryFromArguments() throws Exception {
		SearchCli.run(new String[]{"кот", "AND", "пёс"}, new BufferedReader(new StringReader("")), out, service);

		assertTrue(output().contains("Found documents: 1"));
		assertTrue(output().contains("  2\thttps://example.org/2"));
	}

	@Test
	public void testQueryFromPrompt() throws Exception {
		SearchCli.run(new String[0], new BufferedReader(new StringReader("NOT кот\n")), out, service);

		assertTrue(output().contains("Query: "));
		assertTrue(output().contains("Found documents: 0"));
	}

	@Test
	public void testEmptyQuery() throws Exception {
		SearchCli.run(new String[0], new BufferedReader(new StringReader("")), out, service);

		assertTrue(output().endsWith("Empty query." + System.lineSeparator()));
		assertFalse(output().contains("Found documents"));
	}
}
