package org.lemmadex.indexing.indexer;

import org.lemmadex.core.format.IndexFileFormat;
import org.lemmadex.core.model.InvertedIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Writes the index as plain text, one {@code <lemma> <docId> ...} line per lemma.
 *
 * <p>Lemmas and ids are kept in sorted collections, so two writers fed the same pairs in any order produce
 * byte-identical files.</p>
 */
public class TextIndexWriter implements InvertedIndexWriter {
	private static final Logger logger = LoggerFactory.getLogger(TextIndexWriter.class);
	private final TreeMap<String, SortedSet<Integer>> index;
	private final Path indexPath;

	public TextIndexWriter(Path indexPath) {
		this.indexPath = indexPath;
		this.index = new TreeMap<>();
	}

	@Override
	public void addLemma(String lemma, int docId) {
		lemma = lemma.toLowerCase(Locale.ROOT).trim();
		index.computeIfAbsent(lemma, k -> new TreeSet<>()).add(docId);
	}

	@Override
	public void save() throws IOException {
		Path parent = indexPath.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}

		Path tempFile = Files.createTempFile(parent, indexPath.getFileName().toString(), ".tmp");
		try {
			try (BufferedWriter writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
				for (Map.Entry<String, SortedSet<Integer>> entry : index.entrySet()) {
					writer.write(IndexFileFormat.formatLine(entry.getKey(), entry.getValue()));
					writer.write(IndexFileFormat.LINE_SEPARATOR);
				}
			}
			moveIntoPlace(tempFile);
		} finally {
			Files.deleteIfExists(tempFile);
		}

		logger.info("Saved inverted index to {} ({} unique lemmas, {} MB)",
				indexPath, index.size(), String.format("%.2f", getSizeInMB()));
	}

	private void moveIntoPlace(Path tempFile) throws IOException {
		try {
			Files.move(tempFile, indexPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			logger.debug("Atomic move not supported for {}, falling back to plain replace", indexPath);
			Files.move(tempFile, indexPath, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	@Override
	public InvertedIndex snapshot() {
		return InvertedIndex.of(index);
	}

	@Override
	public Path getIndexPath() {
		return indexPath;
	}

	@Override
	public double getSizeInMB() {
		try {
			if (Files.exists(indexPath)) {
				long bytes = Files.size(indexPath);
				return bytes / (1024.0 * 1024.0);
			}
		} catch (IOException e) {
			logger.warn("Failed to get index file size", e);
		}
		return 0.0;
	}

	@Override
	public void clear() {
		index.clear();
		logger.debug("Cleared in-memory inverted index");
	}
}
