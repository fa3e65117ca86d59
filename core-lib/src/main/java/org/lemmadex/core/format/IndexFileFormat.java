package org.lemmadex.core.format;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Layout of the plain-text files shared by the indexing and search services.
 *
 * <ul>
 *   <li>Index: {@code <lemma> <docId> <docId> ...}, one lemma per line.</li>
 *   <li>Registry: {@code <docId>\t<url>}, one document per line.</li>
 *   <li>Lemma source: {@code <root>/page<N>/lemmas.txt}, lines {@code <lemma> <variant> ...}.</li>
 * </ul>
 */
public final class IndexFileFormat {
	public static final String FIELD_SEPARATOR = " ";
	public static final String REGISTRY_SEPARATOR = "\t";
	public static final String LINE_SEPARATOR = "\n";
	public static final String LEMMAS_FILENAME = "lemmas.txt";
	public static final Pattern PAGE_DIRECTORY = Pattern.compile("page(\\d+)");
	public static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private IndexFileFormat() {}

	/**
	 * Renders one index line. The ids must already be in ascending order.
	 */
	public static String formatLine(String lemma, Collection<Integer> docIds) {
		StringBuilder line = new StringBuilder(lemma);
		for (Integer docId : docIds) {
			line.append(FIELD_SEPARATOR).append(docId);
		}
		return line.toString();
	}

	/**
	 * Splits a trimmed, non-blank line on runs of whitespace.
	 */
	public static String[] splitFields(String line) {
		return WHITESPACE.split(line.strip());
	}
}
