package org.lemmadex.indexing.storage;

import org.lemmadex.core.exception.SourceNotFoundException;
import org.lemmadex.core.format.IndexFileFormat;
import org.lemmadex.indexing.model.LemmaDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.stream.Stream;

/**
 * Reads the per-document lemma files produced by the lemmatization step.
 *
 * <p>Expected layout: {@code <root>/page<N>/lemmas.txt} where {@code N} is the document id. Only the first
 * field of every line (the lemma itself) is used.</p>
 */
public class LemmaSourceReader {
	private static final Logger logger = LoggerFactory.getLogger(LemmaSourceReader.class);
	private final Path sourceDir;

	public LemmaSourceReader(Path sourceDir) {
		this.sourceDir = sourceDir;
	}

	public Path getSourceDir() {
		return sourceDir;
	}

	/**
	 * Find every document folder, keyed by document id in ascending order. Folders naming the same id
	 * ({@code page3} and {@code page03}) are all kept, ordered by name.
	 */
	public SortedMap<Integer, List<Path>> listDocuments() throws IOException {
		if (!Files.isDirectory(sourceDir)) {
			throw new SourceNotFoundException(sourceDir,
					"Lemma source directory not found: " + sourceDir + ". Run the lemmatization step first.");
		}

		SortedMap<Integer, List<Path>> documents = new TreeMap<>();
		try (Stream<Path> children = Files.list(sourceDir)) {
			children.filter(Files::isDirectory).forEach(dir -> {
				Matcher matcher = IndexFileFormat.PAGE_DIRECTORY.matcher(dir.getFileName().toString());
				if (!matcher.matches()) {
					return;
				}
				int docId;
				try {
					docId = Integer.parseInt(matcher.group(1));
				} catch (NumberFormatException e) {
					logger.warn("Document id out of range, skipping {}", dir);
					return;
				}
				documents.computeIfAbsent(docId, id -> new ArrayList<>()).add(dir);
			});
		}

		for (var entry : documents.entrySet()) {
			List<Path> dirs = entry.getValue();
			if (dirs.size() > 1) {
				dirs.sort(Comparator.comparing(dir -> dir.getFileName().toString()));
				logger.warn("Document {} is split over {} folders {}, merging their lemmas", entry.getKey(), dirs.size(), dirs);
			}
		}

		logger.info("Found {} documents in lemma source {}", documents.size(), sourceDir);
		return documents;
	}

	/**
	 * Read the distinct lemmas of one document folder. A folder without a lemma file contributes nothing.
	 */
	public Set<String> readLemmas(Path documentDir) throws IOException {
		Path lemmasFile = documentDir.resolve(IndexFileFormat.LEMMAS_FILENAME);
		if (!Files.isRegularFile(lemmasFile)) {
			logger.debug("No lemma file in {}, document contributes no lemmas", documentDir);
			return Collections.emptySet();
		}

		Set<String> lemmas = new LinkedHashSet<>();
		try (BufferedReader reader = Files.newBufferedReader(lemmasFile, StandardCharsets.UTF_8)) {
			String line;
			while ((line = reader.readLine()) != null) {
				if (line.isBlank()) {
					continue;
				}
				String[] fields = IndexFileFormat.splitFields(line);
				lemmas.add(fields[0].toLowerCase(Locale.ROOT));
			}
		}
		return lemmas;
	}

	/**
	 * Read every document in ascending id order
	 */
	public List<LemmaDocument> readAll() throws IOException {
		SortedMap<Integer, List<Path>> documents = listDocuments();
		List<LemmaDocument> result = new ArrayList<>(documents.size());
		for (var entry : documents.entrySet()) {
			Set<String> lemmas = new LinkedHashSet<>();
			for (Path dir : entry.getValue()) {
				lemmas.addAll(readLemmas(dir));
			}
			result.add(new LemmaDocument(entry.getKey(), lemmas));
		}
		return result;
	}
}
