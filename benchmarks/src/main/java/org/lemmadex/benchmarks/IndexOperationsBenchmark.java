package org.lemmadex.benchmarks;

import org.lemmadex.core.model.InvertedIndex;
import org.lemmadex.indexing.indexer.TextIndexWriter;
import org.lemmadex.indexing.model.LemmaDocument;
import org.lemmadex.indexing.service.InvertedIndexBuilder;
import org.lemmadex.search.indexer.TextIndexReader;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Benchmarks for inverted index operations
 * Tests: build in memory, persist, load
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class IndexOperationsBenchmark {

	private Path workDir;
	private Path savedIndex;
	private List<LemmaDocument> documents;

	@Param({"100", "1000", "10000"})
	private int documentCount;

	@Setup(Level.Trial)
	public void setup() throws IOException {
		workDir = Files.createTempDirectory("lemmadex-bench-index");
		List<String> vocabulary = SyntheticCorpus.vocabulary(20_000, 1);
		documents = SyntheticCorpus.documents(vocabulary, documentCount, 300, 2);

		savedIndex = workDir.resolve("inverted_index.txt");
		TextIndexWriter writer = new TextIndexWriter(savedIndex);
		buildInto(writer);
		writer.save();

		System.out.println("Index ready: " + writer.snapshot().size() + " unique lemmas");
	}

	@TearDown(Level.Trial)
	public void tearDown() throws IOException {
		try (Stream<Path> paths = Files.walk(workDir)) {
			for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
				Files.deleteIfExists(path);
			}
		}
	}

	private void buildInto(TextIndexWriter writer) {
		InvertedIndexBuilder builder = new InvertedIndexBuilder(writer);
		for (LemmaDocument document : documents) {
			builder.indexDocument(document);
		}
	}

	/**
	 * Benchmark: Aggregate postings for every document in memory
	 */
	@Benchmark
	public void buildInMemory(Blackhole blackhole) {
		TextIndexWriter writer = new TextIndexWriter(workDir.resolve("unused.txt"));
		buildInto(writer);
		blackhole.consume(writer.snapshot().size());
	}

	/**
	 * Benchmark: Build and write the sorted text index
	 */
	@Benchmark
	public void buildAndSave(Blackhole blackhole) throws IOException {
		TextIndexWriter writer = new TextIndexWriter(workDir.resolve("rebuild.txt"));
		buildInto(writer);
		writer.save();
		blackhole.consume(writer.getSizeInMB());
	}

	/**
	 * Benchmark: Parse the persisted index
	 */
	@Benchmark
	public void loadIndex(Blackhole blackhole) throws IOException {
		InvertedIndex index = new TextIndexReader(savedIndex).load();
		blackhole.consume(index.totalPostings());
	}
}
