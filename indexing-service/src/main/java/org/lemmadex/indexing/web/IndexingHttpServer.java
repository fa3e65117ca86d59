package org.lemmadex.indexing.web;

import org.lemmadex.indexing.controller.IndexingController;
import org.lemmadex.indexing.service.IndexingService;

import io.javalin.Javalin;

/** HTTP server wiring for the Indexing Service. */
public final class IndexingHttpServer {
    private IndexingHttpServer() {}

    /**
     * Starts the Javalin HTTP server and registers routes.
     *
     * @param port port to bind
     * @param indexingService service backing the routes
     * @return started {@link Javalin} instance
     */
    public static Javalin start(int port, IndexingService indexingService) {
        Javalin app = Javalin.create(cfg -> cfg.showJavalinBanner = false).start(port);
        new IndexingController(indexingService).registerRoutes(app);
        return app;
    }
}
