package org.lemmadex.search.query;

import org.lemmadex.core.model.InvertedIndex;
import org.lemmadex.core.model.Universe;

import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Evaluates a {@link QueryNode} tree with set algebra over one index and universe.
 */
public final class QueryEvaluator {
	private final InvertedIndex index;
	private final Universe universe;

	public QueryEvaluator(InvertedIndex index, Universe universe) {
		this.index = index;
		this.universe = universe;
	}

	/**
	 * @return a fresh, mutable set the caller may keep or modify
	 */
	public SortedSet<Integer> evaluate(QueryNode node) {
		if (node instanceof QueryNode.Term term) {
			return new TreeSet<>(index.postings(term.lemma()));
		}
		if (node instanceof QueryNode.And and) {
			SortedSet<Integer> result = null;
			for (QueryNode operand : and.operands()) {
				SortedSet<Integer> next = evaluate(operand);
				if (result == null) {
					result = next;
				} else {
					result.retainAll(next);
				}
				if (result.isEmpty()) {
					break;
				}
			}
			return result == null ? new TreeSet<>() : result;
		}
		if (node instanceof QueryNode.Or or) {
			SortedSet<Integer> result = new TreeSet<>();
			for (QueryNode operand : or.operands()) {
				result.addAll(evaluate(operand));
			}
			return result;
		}
		if (node instanceof QueryNode.Not not) {
			SortedSet<Integer> result = new TreeSet<>(universe.docIds());
			result.removeAll(evaluate(not.operand()));
			return result;
		}
		if (node instanceof QueryNode.Group group) {
			return evaluate(group.inner());
		}
		return new TreeSet<>();
	}
}
