package org.lemmadex.search.query;

import org.lemmadex.core.model.InvertedIndex;
import org.lemmadex.core.model.Universe;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;

/**
 * Answers boolean queries against one immutable index snapshot.
 *
 * <p>Instances hold no mutable state and may be shared between threads.</p>
 */
public final class BooleanSearchEngine {
	private final InvertedIndex index;
	private final Universe universe;
	private final QueryTokenizer tokenizer = new QueryTokenizer();
	private final QueryParser parser = new QueryParser();
	private final QueryEvaluator evaluator;

	public BooleanSearchEngine(InvertedIndex index, Universe universe) {
		this.index = index;
		this.universe = universe;
		this.evaluator = new QueryEvaluator(index, universe);
	}

	/**
	 * @return ascending ids of the matching documents, empty for a blank query
	 */
	public SortedSet<Integer> search(String query) {
		List<Token> tokens = tokenizer.tokenize(query);
		if (tokens.isEmpty()) {
			return Collections.emptySortedSet();
		}
		return Collections.unmodifiableSortedSet(evaluator.evaluate(parser.parse(tokens)));
	}

	public QueryNode parse(String query) {
		return parser.parse(tokenizer.tokenize(query));
	}

	/**
	 * How the query was understood, with operator precedence made explicit by the tree structure.
	 */
	public String explain(String query) {
		return parse(query).render();
	}

	public InvertedIndex getIndex() {
		return index;
	}

	public Universe getUniverse() {
		return universe;
	}
}
