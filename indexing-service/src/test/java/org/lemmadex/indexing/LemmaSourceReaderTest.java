package org.lemmadex.indexing;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lemmadex.core.exception.SourceNotFoundException;
import org.lemmadex.indexing.model.LemmaDocument;
import org.lemmadex.indexing.storage.LemmaSourceReader;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class LemmaSourceReaderTest {

	@Test
	public void testReadsFirstFieldOfEveryLine(@TempDir Path tempDir) throws Exception {
		LemmaSourceFixture.writePage(tempDir, 1,
				"кот кот коты котом",
				"",
				"Пёс псы",
				"   ",
				"дом");

		List<LemmaDocument> documents = new LemmaSourceReader(tempDir).readAll();

		assertEquals(1, documents.size());
		assertEquals(1, documents.get(0).docId());
		assertEquals(Set.of("кот", "пёс", "дом"), documents.get(0).lemmas());
	}

	@Test
	public void testDocumentsComeInNumericOrder(@TempDir Path tempDir) throws Exception {
		LemmaSourceFixture.writePage(tempDir, 10, "кот");
		LemmaSourceFixture.writePage(tempDir, 2, "пёс");
		LemmaSourceFixture.writePage(tempDir, 1, "дом");
		Files.createDirectories(tempDir.resolve("images"));
		Files.writeString(tempDir.resolve("page3"), "not a directory");

		List<LemmaDocument> documents = new LemmaSourceReader(tempDir).readAll();

		assertEquals(List.of(1, 2, 10), documents.stream().map(LemmaDocument::docId).toList());
	}

	@Test
	public void testFoldersWithSameIdAreMerged(@TempDir Path tempDir) throws Exception {
		Path page3 = LemmaSourceFixture.writePage(tempDir, 3, "кот кота");
		Path page03 = Files.createDirectories(tempDir.resolve("page03"));
		Files.writeString(page03.resolve("lemmas.txt"), "пёс пса\nкот\n", StandardCharsets.UTF_8);
		LemmaSourceReader reader = new LemmaSourceReader(tempDir);

		assertEquals(List.of(page03, page3), reader.listDocuments().get(3));

		List<LemmaDocument> documents = reader.readAll();
		assertEquals(1, documents.size());
		assertEquals(3, documents.get(0).docId());
		assertEquals(Set.of("кот", "пёс"), documents.get(0).lemmas());
	}

	@Test
	public void testMissingLemmaFileContributesNothing(@TempDir Path tempDir) throws Exception {
		Files.createDirectories(tempDir.resolve("page4"));

		List<LemmaDocument> documents = new LemmaSourceReader(tempDir).readAll();

		assertEquals(1, documents.size());
		assertTrue(documents.get(0).lemmas().isEmpty());
	}

	@Test
	public void testMissingSourceDirectory(@TempDir Path tempDir) {
		Path missing = tempDir.resolve("tokenized_pages");
		LemmaSourceReader reader = new LemmaSourceReader(missing);

		SourceNotFoundException e = assertThrows(SourceNotFoundException.class, reader::readAll);
		assertEquals(missing, e.getLocation());
	}
}
