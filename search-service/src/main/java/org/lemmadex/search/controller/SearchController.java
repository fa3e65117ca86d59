package org.lemmadex.search.controller;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.lemmadex.core.exception.SourceNotFoundException;
import org.lemmadex.search.model.SearchResponse;
import org.lemmadex.search.service.SearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

public class SearchController {
	private static final Logger logger = LoggerFactory.getLogger(SearchController.class);
	private static final Gson gson = new GsonBuilder()
			.setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
			.create();
	private final SearchService searchService;
	private final int defaultLimit;

	public SearchController(SearchService searchService, int defaultLimit) {
		this.searchService = searchService;
		this.defaultLimit = defaultLimit;
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.get("/health", this::handleHealth);

		app.get("/search", this::handleSearch);

		app.get("/stats", this::handleStats);

		app.post("/index/reload", this::handleReload);

		logger.info("Search routes registered");
	}

	/**
	 * GET /health
	 */
	private void handleHealth(Context ctx) {
		Map<String, Object> health = new HashMap<>();
		health.put("service", "search-service");
		health.put("status", "running");
		health.put("timestamp", System.currentTimeMillis());
		health.put("index_loaded", searchService.isLoaded());

		ctx.result(gson.toJson(health));
	}

	/**
	 * GET /search?q={query}&limit={limit}
	 * Evaluate a boolean query (AND, OR, NOT, parentheses)
	 */
	private void handleSearch(Context ctx) {
		String query = ctx.queryParam("q");
		String limitStr = ctx.queryParam("limit");

		Integer limit = defaultLimit;
		if (limitStr != null && !limitStr.isEmpty()) {
			try {
				limit = Integer.parseInt(limitStr);
			} catch (NumberFormatException e) {
				ctx.status(400).result(error("Invalid limit format. Must be an integer."));
				return;
			}
		}

		if (query == null || query.trim().isEmpty()) {
			ctx.status(400).result(error("Query parameter 'q' is required."));
			return;
		}

		if (!searchService.isLoaded()) {
			ctx.status(503).result(error("Search index is not loaded."));
			return;
		}

		logger.info("Search request: q='{}', limit={}", query, limit);
		SearchResponse response = searchService.search(query, limit);
		ctx.status(200).result(gson.toJson(response));
		logger.info("Returned {} of {} search results", response.returnedResults(), response.totalResults());
	}

	/**
	 * GET /stats
	 */
	private void handleStats(Context ctx) {
		SearchService.SearchStats stats = searchService.getStats();

		Map<String, Object> response = new HashMap<>();
		response.put("index_loaded", stats.indexLoaded());
		response.put("unique_lemmas", stats.uniqueLemmas());
		response.put("total_postings", stats.totalPostings());
		response.put("universe_size", stats.universeSize());
		response.put("registered_documents", stats.registeredDocuments());
		response.put("index_size_mb", String.format("%.2f", stats.indexSizeMB()));

		ctx.status(200).result(gson.toJson(response));
	}

	/**
	 * POST /index/reload
	 * Pick up a freshly built index without restarting
	 */
	private void handleReload(Context ctx) {
		try {
			searchService.reload();
			Map<String, Object> response = new HashMap<>();
			response.put("status", "reloaded");
			response.put("unique_lemmas", searchService.getStats().uniqueLemmas());
			ctx.status(200).result(gson.toJson(response));

		} catch (SourceNotFoundException e) {
			ctx.status(404).result(error(e.getMessage()));
			logger.warn("Reload impossible: {}", e.getMessage());

		} catch (IOException e) {
			ctx.status(500).result(error("Reload failed: " + e.getMessage()));
			logger.error("Index reload failed", e);
		}
	}

	private static String error(String message) {
		Map<String, String> error = new HashMap<>();
		error.put("error", message);
		return gson.toJson(error);
	}
}
