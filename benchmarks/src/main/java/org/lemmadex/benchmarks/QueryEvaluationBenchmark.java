package org.lemmadex.benchmarks;

import org.lemmadex.core.model.DocumentRegistry;
import org.lemmadex.core.model.InvertedIndex;
import org.lemmadex.core.model.Universe;
import org.lemmadex.indexing.indexer.TextIndexWriter;
import org.lemmadex.indexing.model.LemmaDocument;
import org.lemmadex.indexing.service.InvertedIndexBuilder;
import org.lemmadex.search.query.BooleanSearchEngine;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for boolean query evaluation
 * Tests: single term, conjunction, disjunction, negation, nested query
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class QueryEvaluationBenchmark {

	private BooleanSearchEngine engine;
	private String common;
	private String frequent;
	private String rare;

	@Param({"1000", "10000"})
	private int documentCount;

	@Setup(Level.Trial)
	public void setup() {
		List<String> vocabulary = SyntheticCorpus.vocabulary(20_000, 1);
		TextIndexWriter writer = new TextIndexWriter(Path.of("unused.txt"));
		InvertedIndexBuilder builder = new InvertedIndexBuilder(writer);
		for (LemmaDocument document : SyntheticCorpus.documents(vocabulary, documentCount, 300, 2)) {
			builder.indexDocument(document);
		}

		InvertedIndex index = writer.snapshot();
		engine = new BooleanSearchEngine(index, Universe.resolve(DocumentRegistry.empty(), index));

		common = vocabulary.get(0);
		frequent = vocabulary.get(1);
		rare = vocabulary.get(vocabulary.size() - 1);
	}

	@Benchmark
	public void singleTerm(Blackhole blackhole) {
		blackhole.consume(engine.search(common));
	}

	@Benchmark
	public void conjunction(Blackhole blackhole) {
		blackhole.consume(engine.search(common + " AND " + frequent));
	}

	@Benchmark
	public void disjunction(Blackhole blackhole) {
		blackhole.consume(engine.search(common + " OR " + frequent + " OR " + rare));
	}

	@Benchmark
	public void negation(Blackhole blackhole) {
		blackhole.consume(engine.search("NOT " + common));
	}

	@Benchmark
	public void nestedQuery(Blackhole blackhole) {
		blackhole.consume(engine.search("(" + common + " AND NOT " + frequent + ") OR (" + rare + " AND " + common + ")"));
	}
}
