package org.lemmadex.indexing.controller;

import com.google.gson.Gson;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.lemmadex.core.exception.SourceNotFoundException;
import org.lemmadex.indexing.model.BuildReport;
import org.lemmadex.indexing.model.IndexResponse;
import org.lemmadex.indexing.service.IndexingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

public class IndexingController {
	private static final Logger logger = LoggerFactory.getLogger(IndexingController.class);
	private static final Gson gson = new Gson();
	private final IndexingService indexingService;

	public IndexingController(IndexingService indexingService) {
		this.indexingService = indexingService;
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.get("/health", this::handleHealth);

		app.post("/index/rebuild", this::handleIndexRebuild);

		app.get("/index/status", this::handleIndexStatus);

		logger.info("Indexing routes registered");
	}

	/**
	 * GET /health
	 */
	private void handleHealth(Context ctx) {
		Map<String, Object> health = new HashMap<>();
		health.put("service", "indexing-service");
		health.put("status", "running");
		health.put("timestamp", System.currentTimeMillis());
		health.put("index_present", indexingService.isIndexPresent());

		ctx.result(gson.toJson(health));
	}

	/**
	 * POST /index/rebuild
	 * Rebuild the whole index from the lemma source
	 */
	private void handleIndexRebuild(Context ctx) {
		try {
			logger.info("Received index rebuild request");
			BuildReport report = indexingService.rebuildIndex();
			ctx.status(200).result(gson.toJson(IndexResponse.rebuilt(report)));

		} catch (SourceNotFoundException e) {
			ctx.status(404).result(gson.toJson(IndexResponse.failed(e.getMessage())));
			logger.warn("Index rebuild impossible: {}", e.getMessage());

		} catch (IOException e) {
			ctx.status(500).result(gson.toJson(IndexResponse.failed("Rebuild failed: " + e.getMessage())));
			logger.error("Index rebuild failed", e);
		}
	}

	/**
	 * GET /index/status
	 */
	private void handleIndexStatus(Context ctx) {
		IndexingService.IndexStats stats = indexingService.getStats();

		Map<String, Object> response = new HashMap<>();
		response.put("unique_lemmas", stats.uniqueLemmas());
		response.put("total_postings", stats.totalPostings());
		response.put("index_size_mb", String.format("%.2f", stats.indexSizeMB()));
		response.put("index_present", stats.indexPresent());
		if (stats.lastBuild() != null) {
			response.put("last_build", stats.lastBuild());
		}

		ctx.status(200).result(gson.toJson(response));
	}
}
