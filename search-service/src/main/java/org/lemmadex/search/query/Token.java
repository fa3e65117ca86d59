package org.lemmadex.search.query;

/**
 * One lexical unit of a boolean query. Only {@link Type#TERM} tokens carry text.
 */
public record Token(Type type, String text) {

	public enum Type {
		TERM,
		AND,
		OR,
		NOT,
		LPAREN,
		RPAREN
	}

	public static final Token AND = new Token(Type.AND, null);
	public static final Token OR = new Token(Type.OR, null);
	public static final Token NOT = new Token(Type.NOT, null);
	public static final Token LPAREN = new Token(Type.LPAREN, null);
	public static final Token RPAREN = new Token(Type.RPAREN, null);

	public static Token term(String text) {
		return new Token(Type.TERM, text);
	}

	public boolean is(Type expected) {
		return type == expected;
	}

	@Override
	public String toString() {
		return type == Type.TERM ? "TERM(" + text + ")" : type.name();
	}
}
