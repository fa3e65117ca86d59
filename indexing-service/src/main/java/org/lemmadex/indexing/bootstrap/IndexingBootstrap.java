package org.lemmadex.indexing.bootstrap;

import org.lemmadex.indexing.config.IndexingConfig;
import org.lemmadex.indexing.indexer.TextIndexWriter;
import org.lemmadex.indexing.model.BuildReport;
import org.lemmadex.indexing.service.IndexingService;
import org.lemmadex.indexing.service.InvertedIndexBuilder;
import org.lemmadex.indexing.storage.LemmaSourceReader;
import org.lemmadex.indexing.web.IndexingHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.javalin.Javalin;

/**
 * Application bootstrapper for the Indexing Service.
 *
 * <p>With {@code --build} it performs a single rebuild and returns; otherwise it starts the HTTP API and
 * registers a JVM shutdown hook.</p>
 */
public final class IndexingBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(IndexingBootstrap.class);

    public static final String BUILD_FLAG = "--build";

    private IndexingBootstrap() {}

    /**
     * Starts the Indexing Service.
     *
     * <p>On failure, logs the error and exits with code {@code 1}.</p>
     */
    public static void run(String[] args) {
        try {
            IndexingConfig cfg = IndexingConfig.load();
            IndexingService service = buildService(cfg);
            if (isBuildOnly(args)) {
                runOnce(service);
            } else {
                start(cfg, service);
            }
        } catch (Exception e) {
            logger.error("Indexing Service failed", e);
            System.exit(1);
        }
    }

    static boolean isBuildOnly(String[] args) {
        for (String arg : args) {
            if (BUILD_FLAG.equals(arg)) {
                return true;
            }
        }
        return false;
    }

    public static IndexingService buildService(IndexingConfig cfg) {
        TextIndexWriter writer = new TextIndexWriter(cfg.locations().indexFile());
        InvertedIndexBuilder builder = new InvertedIndexBuilder(
            writer,
            cfg.lemmas().minLength(),
            cfg.lemmas().maxLength(),
            cfg.lemmas().alphabet()
        );
        return new IndexingService(new LemmaSourceReader(cfg.locations().lemmaSourceDir()), builder, writer);
    }

    private static void runOnce(IndexingService service) throws java.io.IOException {
        BuildReport report = service.rebuildIndex();
        logger.info("Inverted index written to {}", report.indexFile());
        logger.info("Unique lemmas: {}", report.uniqueLemmas());
    }

    private static void start(IndexingConfig cfg, IndexingService service) {
        Javalin app = IndexingHttpServer.start(cfg.serverPort(), service);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(app)));
        logger.info("Indexing Service started on port {}", cfg.serverPort());
    }

    private static void shutdown(Javalin app) {
        logger.info("Shutting down Indexing Service...");
        app.stop();
        logger.info("Indexing Service stopped.");
    }
}
