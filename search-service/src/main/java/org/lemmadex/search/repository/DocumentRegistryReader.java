package org.lemmadex.search.repository;

import org.lemmadex.core.format.IndexFileFormat;
import org.lemmadex.core.model.DocumentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Loads the {@code <docId>\t<url>} registry written by the crawler.
 *
 * <p>The registry is optional: a missing file yields an empty registry.</p>
 */
public class DocumentRegistryReader {
	private static final Logger logger = LoggerFactory.getLogger(DocumentRegistryReader.class);
	private final Path registryPath;

	public DocumentRegistryReader(Path registryPath) {
		this.registryPath = registryPath;
	}

	public DocumentRegistry load() throws IOException {
		if (!Files.isRegularFile(registryPath)) {
			logger.info("Document registry {} not found, document ids will come from the index", registryPath);
			return DocumentRegistry.empty();
		}

		Map<Integer, String> urls = new HashMap<>();
		try (BufferedReader reader = Files.newBufferedReader(registryPath, StandardCharsets.UTF_8)) {
			String line;
			int lineNumber = 0;
			while ((line = reader.readLine()) != null) {
				lineNumber++;
				String trimmed = line.strip();
				if (!trimmed.isEmpty()) {
					parseLine(trimmed, lineNumber, urls);
				}
			}
		}

		logger.info("Loaded document registry from {} ({} documents)", registryPath, urls.size());
		return DocumentRegistry.of(urls);
	}

	private void parseLine(String line, int lineNumber, Map<Integer, String> urls) {
		String[] parts = line.split(IndexFileFormat.REGISTRY_SEPARATOR, 2);
		String url = parts.length == 2 ? parts[1].strip() : "";
		try {
			urls.put(Integer.parseInt(parts[0].strip()), url);
		} catch (NumberFormatException e) {
			logger.warn("Skipping registry line {} in {}: '{}'", lineNumber, registryPath, line);
		}
	}
}
