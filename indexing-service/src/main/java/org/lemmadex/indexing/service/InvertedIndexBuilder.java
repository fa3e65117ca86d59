package org.lemmadex.indexing.service;

import org.lemmadex.indexing.indexer.InvertedIndexWriter;
import org.lemmadex.indexing.model.LemmaDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Adds the lemmas of each document to an {@link InvertedIndexWriter}.
 *
 * <p>Lemmas are brought to Unicode NFC first, so a decomposed {@code й} (base letter plus combining breve)
 * is indexed as the single letter and passes the letters-only default alphabet. Lemmas outside the length
 * bounds or the alphabet are skipped and counted.</p>
 */
public class InvertedIndexBuilder {
	private static final Logger logger = LoggerFactory.getLogger(InvertedIndexBuilder.class);

	public static final int DEFAULT_MIN_LEMMA_LENGTH = 2;
	public static final int DEFAULT_MAX_LEMMA_LENGTH = 40;
	public static final Pattern DEFAULT_ALPHABET = Pattern.compile("\\p{L}+");

	private final InvertedIndexWriter indexWriter;
	private final int minLemmaLength;
	private final int maxLemmaLength;
	private final Pattern alphabet;
	private int rejectedLemmas;

	public InvertedIndexBuilder(InvertedIndexWriter indexWriter, int minLemmaLength, int maxLemmaLength, Pattern alphabet) {
		if (minLemmaLength < 1 || maxLemmaLength < minLemmaLength) {
			throw new IllegalArgumentException(
					"Invalid lemma length bounds [" + minLemmaLength + ", " + maxLemmaLength + "]");
		}
		this.indexWriter = indexWriter;
		this.minLemmaLength = minLemmaLength;
		this.maxLemmaLength = maxLemmaLength;
		this.alphabet = alphabet;
	}

	public InvertedIndexBuilder(InvertedIndexWriter indexWriter) {
		this(indexWriter, DEFAULT_MIN_LEMMA_LENGTH, DEFAULT_MAX_LEMMA_LENGTH, DEFAULT_ALPHABET);
	}

	/**
	 * Add every valid lemma of the document to the index
	 *
	 * @return number of lemmas accepted
	 */
	public int indexDocument(LemmaDocument document) {
		int accepted = 0;
		for (String raw : document.lemmas()) {
			String lemma = normalize(raw);
			if (isValidLemma(lemma)) {
				indexWriter.addLemma(lemma, document.docId());
				accepted++;
			} else {
				rejectedLemmas++;
				logger.debug("Rejected lemma '{}' in document {}", lemma, document.docId());
			}
		}

		logger.debug("Indexed document {} with {} lemmas", document.docId(), accepted);
		return accepted;
	}

	/**
	 * Check if a lemma is valid for indexing
	 */
	public boolean isValidLemma(String lemma) {
		if (lemma == null) {
			return false;
		}
		String normalized = normalize(lemma);
		if (normalized.length() < minLemmaLength || normalized.length() > maxLemmaLength) {
			return false;
		}
		return alphabet.matcher(normalized).matches();
	}

	static String normalize(String lemma) {
		return lemma == null ? null : Normalizer.normalize(lemma, Normalizer.Form.NFC);
	}

	public int getRejectedLemmas() {
		return rejectedLemmas;
	}

	public void resetCounters() {
		rejectedLemmas = 0;
	}
}
