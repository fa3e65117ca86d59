package org.lemmadex.search.web;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.javalin.Javalin;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lemmadex.search.indexer.TextIndexReader;
import org.lemmadex.search.repository.DocumentRegistryReader;
import org.lemmadex.search.service.SearchService;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class SearchHttpServerTest {
	private final HttpClient client = HttpClient.newHttpClient();

	private static SearchService newService(Path dir) throws Exception {
		Files.writeString(dir.resolve("inverted_index.txt"), "кот 1 2\nпёс 2 3\n", StandardCharsets.UTF_8);
		Files.writeString(dir.resolve("index.txt"), "1\thttps://example.org/1\n2\thttps://example.org/2\n3\n",
				StandardCharsets.UTF_8);
		return new SearchService(
				new TextIndexReader(dir.resolve("inverted_index.txt")),
				new DocumentRegistryReader(dir.resolve("index.txt")),
				100);
	}

	private HttpResponse<String> send(Javalin app, String method, String pathAndQuery) throws Exception {
		HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + app.port() + pathAndQuery))
				.method(method, HttpRequest.BodyPublishers.noBody())
				.build();
		return client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
	}

	private HttpResponse<String> get(Javalin app, String pathAndQuery) throws Exception {
		return send(app, "GET", pathAndQuery);
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

	@Test
	public void testSearchRoundTripOverHttp(@TempDir Path tempDir) throws Exception {
		SearchService service = newService(tempDir);
		service.reload();
		Javalin app = SearchHttpServer.start(0, service, 1);
		try {
			HttpResponse<String> response = get(app, "/search?q=" + encode("кот OR пёс"));

			assertEquals(200, response.statusCode());
			JsonObject body = JsonParser.parseString(response.body()).getAsJsonObject();
			assertEquals("кот OR пёс", body.get("parsed_query").getAsString());
			assertEquals(3, body.get("total_results").getAsInt());
			assertEquals(1, body.get("returned_results").getAsInt());
			JsonArray results = body.getAsJsonArray("results");
			assertEquals(1, results.get(0).getAsJsonObject().get("doc_id").getAsInt());
			assertEquals("https://example.org/1", results.get(0).getAsJsonObject().get("url").getAsString());

			HttpResponse<String> narrowed = get(app, "/search?limit=10&q=" + encode("пёс AND NOT кот"));
			JsonObject only = JsonParser.parseString(narrowed.body()).getAsJsonObject();
			assertEquals(1, only.get("total_results").getAsInt());
			assertEquals("", only.getAsJsonArray("results").get(0).getAsJsonObject().get("url").getAsString());

			assertEquals(400, get(app, "/search").statusCode());
			assertEquals(400, get(app, "/search?q=kot&limit=many").statusCode());
		} finally {
			app.stop();
		}
	}

	@Test
	public void testSearchBeforeLoadIsUnavailable(@TempDir Path tempDir) throws Exception {
		Javalin app = SearchHttpServer.start(0, newService(tempDir), 100);
		try {
			assertEquals(503, get(app, "/search?q=" + encode("кот")).statusCode());

			assertEquals(200, get(app, "/health").statusCode());
			assertEquals(200, send(app, "POST", "/index/reload").statusCode());
			assertEquals(200, get(app, "/search?q=" + encode("кот")).statusCode());
		} finally {
			app.stop();
		}
	}
}
