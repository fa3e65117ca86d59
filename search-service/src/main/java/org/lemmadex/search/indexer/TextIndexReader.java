package org.lemmadex.search.indexer;

import org.lemmadex.core.exception.IndexParseException;
import org.lemmadex.core.exception.SourceNotFoundException;
import org.lemmadex.core.format.IndexFileFormat;
import org.lemmadex.core.model.InvertedIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

public class TextIndexReader implements InvertedIndexReader {
	private static final Logger logger = LoggerFactory.getLogger(TextIndexReader.class);
	private final Path indexPath;
	private volatile InvertedIndex index;

	public TextIndexReader(Path indexPath) {
		this.indexPath = indexPath;
		this.index = null;
	}

	@Override
	public InvertedIndex load() throws IOException {
		if (!Files.isRegularFile(indexPath)) {
			throw new SourceNotFoundException(indexPath,
					"Index file not found: " + indexPath + ". Build the index first.");
		}

		Map<String, SortedSet<Integer>> postings = new TreeMap<>();
		try (BufferedReader reader = Files.newBufferedReader(indexPath, StandardCharsets.UTF_8)) {
			String line;
			int lineNumber = 0;
			while ((line = reader.readLine()) != null) {
				lineNumber++;
				if (line.isBlank()) {
					continue;
				}
				parseLine(line, lineNumber, postings);
			}
		}

		InvertedIndex loaded = InvertedIndex.of(postings);
		index = loaded;
		logger.info("Loaded inverted index from {} ({} unique lemmas)", indexPath, loaded.size());
		return loaded;
	}

	private void parseLine(String line, int lineNumber, Map<String, SortedSet<Integer>> postings) throws IndexParseException {
		String[] fields = IndexFileFormat.splitFields(line);
		String lemma = fields[0].toLowerCase(Locale.ROOT);
		SortedSet<Integer> ids = postings.computeIfAbsent(lemma, k -> new TreeSet<>());
		for (int i = 1; i < fields.length; i++) {
			try {
				ids.add(Integer.parseInt(fields[i]));
			} catch (NumberFormatException e) {
				throw new IndexParseException(indexPath, lineNumber, line, e);
			}
		}
	}

	@Override
	public InvertedIndex getIndex() {
		InvertedIndex current = index;
		return current != null ? current : InvertedIndex.empty();
	}

	@Override
	public boolean isLoaded() {
		return index != null;
	}

	@Override
	public IndexStats getStats() {
		InvertedIndex current = index;
		if (current == null) {
			return new IndexStats(0, 0, 0.0);
		}

		double sizeInMB = 0.0;
		try {
			if (Files.exists(indexPath)) {
				sizeInMB = Files.size(indexPath) / (1024.0 * 1024.0);
			}
		} catch (IOException e) {
			logger.warn("Failed to get index file size", e);
		}

		return new IndexStats(current.size(), current.totalPostings(), sizeInMB);
	}
}
