package org.lemmadex.indexing.service;

import org.lemmadex.core.model.InvertedIndex;
import org.lemmadex.indexing.indexer.InvertedIndexWriter;
import org.lemmadex.indexing.model.BuildReport;
import org.lemmadex.indexing.model.LemmaDocument;
import org.lemmadex.indexing.storage.LemmaSourceReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.util.List;

/**
 * Runs the batch build: reads the lemma source, aggregates postings and persists the index.
 */
public class IndexingService {
    private static final Logger logger = LoggerFactory.getLogger(IndexingService.class);

    private final LemmaSourceReader sourceReader;
    private final InvertedIndexBuilder indexBuilder;
    private final InvertedIndexWriter indexWriter;
    private volatile BuildReport lastBuild;

    public IndexingService(LemmaSourceReader sourceReader, InvertedIndexBuilder indexBuilder, InvertedIndexWriter indexWriter) {
        this.sourceReader = sourceReader;
        this.indexBuilder = indexBuilder;
        this.indexWriter = indexWriter;
    }

    /**
     * Rebuilds the whole index from scratch and saves it.
     *
     * @throws org.lemmadex.core.exception.SourceNotFoundException if the lemma source directory is missing
     */
    public synchronized BuildReport rebuildIndex() throws IOException {
        long start = System.currentTimeMillis();
        logger.info("Starting full index rebuild from {}", sourceReader.getSourceDir());

        List<LemmaDocument> documents = sourceReader.readAll();

        indexWriter.clear();
        indexBuilder.resetCounters();

        int withLemmas = 0;
        for (LemmaDocument document : documents) {
            if (indexBuilder.indexDocument(document) > 0) {
                withLemmas++;
            }
        }

        if (documents.isEmpty()) {
            logger.warn("Lemma source {} holds no documents, writing an empty index", sourceReader.getSourceDir());
        }

        indexWriter.save();
        InvertedIndex built = indexWriter.snapshot();

        BuildReport report = new BuildReport(
            documents.size(),
            withLemmas,
            built.size(),
            built.totalPostings(),
            indexBuilder.getRejectedLemmas(),
            indexWriter.getIndexPath().toString(),
            System.currentTimeMillis() - start
        );
        lastBuild = report;

        logger.info("Index rebuild complete: {} documents, {} unique lemmas, {} postings, {} rejected lemmas",
            report.documentsRead(), report.uniqueLemmas(), report.totalPostings(), report.rejectedLemmas());
        return report;
    }

    public boolean isIndexPresent() {
        return Files.isRegularFile(indexWriter.getIndexPath());
    }

    /**
     * Waits for a running rebuild, so the counts always describe one complete build.
     */
    public synchronized IndexStats getStats() {
        InvertedIndex current = indexWriter.snapshot();
        return new IndexStats(current.size(), current.totalPostings(), indexWriter.getSizeInMB(), isIndexPresent(), lastBuild);
    }

    public record IndexStats(int uniqueLemmas, long totalPostings, double indexSizeMB, boolean indexPresent, BuildReport lastBuild) {}
}
