package org.lemmadex.search.bootstrap;

import org.lemmadex.search.config.SearchConfig;
import org.lemmadex.search.indexer.TextIndexReader;
import org.lemmadex.search.repository.DocumentRegistryReader;
import org.lemmadex.search.service.SearchService;
import org.lemmadex.search.web.SearchHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.javalin.Javalin;

/**
 * Application bootstrapper for the Search Service.
 *
 * <p>Loads configuration and the index, starts the HTTP API, and registers a JVM shutdown hook.</p>
 */
public final class SearchBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(SearchBootstrap.class);

    private SearchBootstrap() {}

    /**
     * Starts the Search Service.
     *
     * <p>On startup failure, logs the error and exits with code {@code 1}.</p>
     */
    public static void run() {
        try {
            start();
        } catch (Exception e) {
            logger.error("Failed to start Search Service", e);
            System.exit(1);
        }
    }

    private static void start() throws java.io.IOException {
        SearchConfig cfg = SearchConfig.load();
        SearchService service = buildService(cfg);
        service.reload();
        Javalin app = SearchHttpServer.start(cfg.serverPort(), service, cfg.defaultLimit());
        addShutdownHook(app);
        logger.info("Search Service started successfully.");
    }

    public static SearchService buildService(SearchConfig cfg) {
        return new SearchService(
            new TextIndexReader(cfg.locations().indexFile()),
            new DocumentRegistryReader(cfg.locations().registryFile()),
            cfg.maxResults()
        );
    }

    private static void addShutdownHook(Javalin app) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(app)));
    }

    private static void shutdown(Javalin app) {
        logger.info("Shutting down Search Service...");
        app.stop();
        logger.info("Search Service stopped.");
    }
}
