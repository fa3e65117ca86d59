package org.lemmadex.search.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for boolean queries.
 *
 * <pre>
 * orExpr  := andExpr (OR andExpr)*
 * andExpr := primary (AND primary)*
 * primary := TERM | '(' orExpr ')' | NOT primary
 * </pre>
 *
 * <p>Parsing never fails. A missing closing parenthesis is closed at end of input, a position where a
 * primary was expected but an operator, {@code )} or end of input was found becomes {@link QueryNode.Empty}
 * (the offending token is left for the caller), and tokens remaining after the top-level expression are
 * ignored.</p>
 *
 * <p>A run of the same operator becomes one {@link QueryNode.And} or {@link QueryNode.Or} holding all of its
 * operands, so only parentheses and {@code NOT} add depth to the tree.</p>
 */
public final class QueryParser {

	public QueryNode parse(List<Token> tokens) {
		return new Cursor(tokens).orExpr();
	}

	private static final class Cursor {
		private final List<Token> tokens;
		private int pos;

		private Cursor(List<Token> tokens) {
			this.tokens = tokens;
		}

		private Token peek() {
			return pos < tokens.size() ? tokens.get(pos) : null;
		}

		private boolean at(Token.Type type) {
			Token next = peek();
			return next != null && next.is(type);
		}

		private Token consume() {
			return tokens.get(pos++);
		}

		QueryNode orExpr() {
			List<QueryNode> operands = new ArrayList<>();
			operands.add(andExpr());
			while (at(Token.Type.OR)) {
				consume();
				operands.add(andExpr());
			}
			return operands.size() == 1 ? operands.get(0) : new QueryNode.Or(operands);
		}

		QueryNode andExpr() {
			List<QueryNode> operands = new ArrayList<>();
			operands.add(primary());
			while (at(Token.Type.AND)) {
				consume();
				operands.add(primary());
			}
			return operands.size() == 1 ? operands.get(0) : new QueryNode.And(operands);
		}

		QueryNode primary() {
			Token next = peek();
			if (next == null) {
				return new QueryNode.Empty();
			}
			switch (next.type()) {
				case TERM:
					consume();
					return new QueryNode.Term(next.text());
				case LPAREN:
					consume();
					QueryNode inner = orExpr();
					if (at(Token.Type.RPAREN)) {
						consume();
					}
					return new QueryNode.Group(inner);
				case NOT:
					consume();
					return new QueryNode.Not(primary());
				default:
					return new QueryNode.Empty();
			}
		}
	}
}
