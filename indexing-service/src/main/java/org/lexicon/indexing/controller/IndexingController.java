package org.lexicon.indexing.controller;

import com.google.gson.Gson;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.lexicon.core.analysis.AnalysisException;
import org.lexicon.core.codec.DocumentCodec;
import org.lexicon.core.codec.DocumentDecodeException;
import org.lexicon.core.model.Document;
import org.lexicon.indexing.document.DocumentNotFoundException;
import org.lexicon.indexing.protocol.PartitionReply;
import org.lexicon.indexing.protocol.PostingFilter;
import org.lexicon.indexing.service.IndexingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
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

		app.post("/documents", this::handleIndexDocument);
		app.get("/documents/{index}/{id}", this::handleGetDocument);
		app.delete("/documents/{index}/{id}", this::handleDeleteDocument);

		app.get("/stream/{index}/{field}/{term}", this::handleStream);
		app.get("/info/{index}/{field}/{term}", this::handleInfo);
		app.get("/info-range/{index}/{field}", this::handleInfoRange);

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
		health.put("stats", indexingService.getStats());
		respond(ctx, 200, health);
	}

	/**
	 * POST /documents
	 * Body: {"id": ..., "index": ..., "fields": {...}, "props": {...}}
	 */
	private void handleIndexDocument(Context ctx) {
		try {
			IndexingService.IndexResult result = indexingService.indexJson(ctx.body());
			respond(ctx, 200, result);
		} catch (DocumentDecodeException e) {
			logger.warn("Rejected document: {}", e.getMessage());
			respond(ctx, 400, error(e.getReason().name(), e.getMessage()));
		} catch (AnalysisException e) {
			logger.warn("Failed to analyze document: {}", e.getMessage());
			respond(ctx, 422, error("analysis_failed", e.getMessage()));
		} catch (IOException e) {
			logger.error("Failed to index document", e);
			respond(ctx, 500, error("store_failed", e.getMessage()));
		}
	}

	/**
	 * GET /documents/{index}/{id}
	 */
	private void handleGetDocument(Context ctx) {
		String index = ctx.pathParam("index");
		String id = ctx.pathParam("id");
		try {
			Document document = indexingService.getDocument(index, id);
			ctx.status(200).contentType("application/json").result(DocumentCodec.encode(document));
		} catch (DocumentNotFoundException e) {
			respond(ctx, 404, error("not_found", e.getMessage()));
		} catch (IOException e) {
			logger.error("Failed to fetch document {}/{}", index, id, e);
			respond(ctx, 500, error("store_failed", e.getMessage()));
		}
	}

	/**
	 * DELETE /documents/{index}/{id}
	 */
	private void handleDeleteDocument(Context ctx) {
		String index = ctx.pathParam("index");
		String id = ctx.pathParam("id");
		try {
			indexingService.deleteDocument(index, id);
			respond(ctx, 200, Map.of("status", "deleted", "index", index, "id", id));
		} catch (IOException e) {
			logger.error("Failed to delete document {}/{}", index, id, e);
			respond(ctx, 500, error("store_failed", e.getMessage()));
		}
	}

	/**
	 * GET /stream/{index}/{field}/{term}
	 * Optional query parameter {@code value} keeps only postings of that document.
	 */
	private void handleStream(Context ctx) {
		String value = ctx.queryParam("value");
		PostingFilter filter = value == null ? PostingFilter.ACCEPT_ALL : (docId, props) -> docId.equals(value);
		try {
			List<PartitionReply.StreamResult> results = indexingService.stream(
					ctx.pathParam("index"), ctx.pathParam("field"), ctx.pathParam("term"), filter);
			respond(ctx, 200, Map.of("count", results.size(), "results", results));
		} catch (IOException e) {
			logger.error("Stream failed", e);
			respond(ctx, 500, error("stream_failed", e.getMessage()));
		}
	}

	/**
	 * GET /info/{index}/{field}/{term}
	 */
	private void handleInfo(Context ctx) {
		try {
			respond(ctx, 200, indexingService.info(ctx.pathParam("index"), ctx.pathParam("field"), ctx.pathParam("term")));
		} catch (IOException e) {
			logger.error("Info failed", e);
			respond(ctx, 500, error("info_failed", e.getMessage()));
		}
	}

	/**
	 * GET /info-range/{index}/{field}?start=&end=&limit=
	 */
	private void handleInfoRange(Context ctx) {
		String start = ctx.queryParam("start");
		String end = ctx.queryParam("end");
		if (start == null || end == null) {
			respond(ctx, 400, error("bad_request", "start and end query parameters are required"));
			return;
		}

		try {
			String limitParam = ctx.queryParam("limit");
			int limit = limitParam == null ? 0 : Integer.parseInt(limitParam);
			respond(ctx, 200, indexingService.infoRange(ctx.pathParam("index"), ctx.pathParam("field"), start, end, limit));
		} catch (NumberFormatException e) {
			respond(ctx, 400, error("bad_request", "limit must be an integer"));
		} catch (IOException e) {
			logger.error("Info range failed", e);
			respond(ctx, 500, error("info_failed", e.getMessage()));
		}
	}

	private static void respond(Context ctx, int status, Object body) {
		ctx.status(status).contentType("application/json").result(gson.toJson(body));
	}

	private static Map<String, String> error(String status, String message) {
		Map<String, String> error = new HashMap<>();
		error.put("status", status);
		error.put("error", message);
		return error;
	}
}
