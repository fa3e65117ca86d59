package org.lemmadex.search;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lemmadex.core.model.DocumentRegistry;
import org.lemmadex.search.repository.DocumentRegistryReader;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentRegistryReaderTest {

	@Test
	public void testTabSeparatedEntries(@TempDir Path tempDir) throws Exception {
		Path registryFile = tempDir.resolve("index.txt");
		Files.writeString(registryFile,
				"1\thttps://ru.wikipedia.org/wiki/Кот\n"
						+ "\n"
						+ "3\thttps://example.org/a b\tc\n"
						+ "2\n",
				StandardCharsets.UTF_8);

		DocumentRegistry registry = new DocumentRegistryReader(registryFile).load();

		assertEquals(List.of(1, 2, 3), List.copyOf(registry.docIds()));
		assertEquals("https://ru.wikipedia.org/wiki/Кот", registry.urlOf(1));
		assertEquals("", registry.urlOf(2));
		assertEquals("https://example.org/a b\tc", registry.urlOf(3));
	}

	@Test
	public void testMalformedIdLinesAreSkipped(@TempDir Path tempDir) throws Exception {
		Path registryFile = tempDir.resolve("index.txt");
		Files.writeString(registryFile, "abc\thttps://example.org\n5\thttps://example.org/5\n", StandardCharsets.UTF_8);

		DocumentRegistry registry = new DocumentRegistryReader(registryFile).load();

		assertEquals(1, registry.size());
		assertTrue(registry.isRegistered(5));
	}

	@Test
	public void testMissingRegistryIsEmpty(@TempDir Path tempDir) throws Exception {
		DocumentRegistry registry = new DocumentRegistryReader(tempDir.resolve("index.txt")).load();

		assertTrue(registry.isEmpty());
	}
}
