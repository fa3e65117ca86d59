package org.lemmadex.search.query;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Syntax tree of a parsed boolean query.
 *
 * <p>{@link #render()} produces text that parses back into an equal tree, except for {@link Empty} which
 * marks a place where a term was expected but none was found.</p>
 */
public sealed interface QueryNode
		permits QueryNode.Term, QueryNode.And, QueryNode.Or, QueryNode.Not, QueryNode.Group, QueryNode.Empty {

	String render();

	record Term(String lemma) implements QueryNode {
		@Override
		public String render() {
			return lemma;
		}
	}

	/**
	 * Intersection of a flat run of operands, {@code a AND b AND c} being one node with three operands.
	 */
	record And(List<QueryNode> operands) implements QueryNode {
		public And {
			operands = List.copyOf(operands);
		}

		public And(QueryNode... operands) {
			this(List.of(operands));
		}

		@Override
		public String render() {
			return operands.stream().map(QueryNode::render).collect(Collectors.joining(" AND "));
		}
	}

	/**
	 * Union of a flat run of operands.
	 */
	record Or(List<QueryNode> operands) implements QueryNode {
		public Or {
			operands = List.copyOf(operands);
		}

		public Or(QueryNode... operands) {
			this(List.of(operands));
		}

		@Override
		public String render() {
			return operands.stream().map(QueryNode::render).collect(Collectors.joining(" OR "));
		}
	}

	record Not(QueryNode operand) implements QueryNode {
		@Override
		public String render() {
			return "NOT " + operand.render();
		}
	}

	record Group(QueryNode inner) implements QueryNode {
		@Override
		public String render() {
			return "(" + inner.render() + ")";
		}
	}

	record Empty() implements QueryNode {
		@Override
		public String render() {
			return "<empty>";
		}
	}
}
