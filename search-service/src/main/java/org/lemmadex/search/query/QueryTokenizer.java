package org.lemmadex.search.query;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Splits a raw query into terms, operators and parentheses.
 *
 * <p>Parentheses always stand alone. A word is an operator only when the whole word is {@code AND},
 * {@code OR} or {@code NOT} in any letter case, so {@code android} or {@code notebook} stay terms. Terms are
 * lower-cased and brought to Unicode NFC. Any Unicode space, including no-break spaces, separates words.</p>
 */
public final class QueryTokenizer {

	public List<Token> tokenize(String query) {
		if (query == null || query.isBlank()) {
			return Collections.emptyList();
		}

		List<Token> tokens = new ArrayList<>();
		int length = query.length();
		int pos = 0;
		while (pos < length) {
			char c = query.charAt(pos);
			if (isSeparator(c)) {
				pos++;
			} else if (c == '(') {
				tokens.add(Token.LPAREN);
				pos++;
			} else if (c == ')') {
				tokens.add(Token.RPAREN);
				pos++;
			} else {
				int end = pos;
				while (end < length && isWordChar(query.charAt(end))) {
					end++;
				}
				tokens.add(classify(query.substring(pos, end)));
				pos = end;
			}
		}
		return tokens;
	}

	private static boolean isWordChar(char c) {
		return c != '(' && c != ')' && !isSeparator(c);
	}

	private static boolean isSeparator(char c) {
		return Character.isWhitespace(c) || Character.isSpaceChar(c);
	}

	private static Token classify(String word) {
		String upper = word.toUpperCase(Locale.ROOT);
		switch (upper) {
			case "AND":
				return Token.AND;
			case "OR":
				return Token.OR;
			case "NOT":
				return Token.NOT;
			default:
				return Token.term(Normalizer.normalize(word.toLowerCase(Locale.ROOT), Normalizer.Form.NFC));
		}
	}
}
