package dev.foodmole.corpus.util;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Utility class for HTTP operations. Retrying is left to the callers, which know which failures
 * are worth another attempt.
 */
public class HttpUtils {

	private static final String USER_AGENT = "pmc-corpus/1.0";

	private final HttpClient httpClient;
	private final Duration requestTimeout;

	public HttpUtils(Duration requestTimeout) {
		this.httpClient = HttpClient.newBuilder()
				.followRedirects(HttpClient.Redirect.NORMAL)
				.connectTimeout(Duration.ofSeconds(30))
				.build();
		this.requestTimeout = requestTimeout;
	}

	/** Download content from a URL as raw bytes, failing on any non-2xx status */
	public byte[] downloadBytes(String url) throws IOException, InterruptedException {
		HttpRequest request = HttpRequest.newBuilder()
				.uri(URI.create(url))
				.timeout(requestTimeout)
				.header("User-Agent", USER_AGENT)
				.GET()
				.build();
		HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
		if (response.statusCode() < 200 || response.statusCode() >= 300) {
			throw new IOException("Failed to download content: " + url + " - HTTP status: " + response.statusCode());
		}
		return response.body();
	}

	/** Build a URL with URL-encoded query parameters, skipping null values */
	public static String withQuery(String baseUrl, Map<String, String> params) {
		String query = params.entrySet().stream()
				.filter(e -> e.getValue() != null)
				.map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
				.collect(Collectors.joining("&"));
		if (query.isEmpty()) {
			return baseUrl;
		}
		return baseUrl + (baseUrl.contains("?") ? "&" : "?") + query;
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}
}
