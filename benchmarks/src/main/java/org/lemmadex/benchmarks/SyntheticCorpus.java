package org.lemmadex.benchmarks;

import org.lemmadex.indexing.model.LemmaDocument;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Deterministic pseudo-random documents for benchmarking. Lemma frequencies follow a rough Zipf curve so a
 * few lemmas have long posting lists and most have short ones.
 */
final class SyntheticCorpus {
	private static final String ALPHABET = "абвгдеёжзийклмнопрстуфхцчшщъыьэюя";

	private SyntheticCorpus() {}

	static List<String> vocabulary(int size, long seed) {
		Random random = new Random(seed);
		Set<String> words = new HashSet<>();
		while (words.size() < size) {
			int length = 3 + random.nextInt(8);
			StringBuilder word = new StringBuilder(length);
			for (int i = 0; i < length; i++) {
				word.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
			}
			words.add(word.toString());
		}
		return new ArrayList<>(words);
	}

	static List<LemmaDocument> documents(List<String> vocabulary, int documentCount, int lemmasPerDocument, long seed) {
		Random random = new Random(seed);
		List<LemmaDocument> documents = new ArrayList<>(documentCount);
		for (int docId = 1; docId <= documentCount; docId++) {
			Set<String> lemmas = new HashSet<>();
			for (int i = 0; i < lemmasPerDocument; i++) {
				double skew = Math.pow(random.nextDouble(), 3);
				lemmas.add(vocabulary.get((int) (skew * vocabulary.size())));
			}
			documents.add(new LemmaDocument(docId, lemmas));
		}
		return documents;
	}
}
