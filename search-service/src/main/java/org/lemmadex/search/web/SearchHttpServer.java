package org.lemmadex.search.web;

import org.lemmadex.search.controller.SearchController;
import org.lemmadex.search.service.SearchService;

import io.javalin.Javalin;

/** HTTP server wiring for the Search Service. */
public final class SearchHttpServer {
    private SearchHttpServer() {}

    /**
     * Starts the Javalin HTTP server and registers the search routes.
     *
     * @param port port to bind, {@code 0} for any free port
     * @param searchService service backing the routes
     * @param defaultLimit result limit applied when a request names none
     * @return started {@link Javalin} instance
     */
    public static Javalin start(int port, SearchService searchService, int defaultLimit) {
        Javalin app = Javalin.create(cfg -> cfg.showJavalinBanner = false).start(port);
        new SearchController(searchService, defaultLimit).registerRoutes(app);
        return app;
    }
}
