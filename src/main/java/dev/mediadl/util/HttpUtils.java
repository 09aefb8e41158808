package dev.mediadl.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/** Utility class for HTTP operations */
public class HttpUtils {

	/** Functional interface for operations that can throw IOException and InterruptedException */
	@FunctionalInterface
	private interface IOSupplier<T> {
		T get() throws IOException, InterruptedException;
	}

	private final HttpClient httpClient;
	private final Map<String, String> headers;
	private final int maxRetries;
	private final Duration initialBackoff;

	private static final int DEFAULT_MAX_RETRIES = 3;
	private static final Duration INITIAL_BACKOFF = Duration.ofSeconds(2);
	private static final String USER_AGENT = "mediadl/1.0";

	public HttpUtils() {
		this(Map.of(), DEFAULT_MAX_RETRIES, INITIAL_BACKOFF);
	}

	/**
	 * Create a client that sends extra headers with every request.
	 *
	 * @param headers Headers added to every request (for example a session cookie)
	 * @param maxRetries Number of attempts for requests failing with an I/O error
	 * @param initialBackoff Delay before the first retry, doubled on each further attempt
	 */
	public HttpUtils(Map<String, String> headers, int maxRetries, Duration initialBackoff) {
		this.httpClient = HttpClient.newBuilder()
				.followRedirects(HttpClient.Redirect.NORMAL)
				.connectTimeout(Duration.ofSeconds(30))
				.build();
		this.headers = Map.copyOf(headers);
		this.maxRetries = Math.max(1, maxRetries);
		this.initialBackoff = initialBackoff;
	}

	/**
	 * Open a streaming GET request, following redirects. The caller owns the response body and must
	 * close it. {@link HttpResponse#uri()} reports where the redirect chain ended.
	 */
	public HttpResponse<InputStream> open(String url) throws IOException, InterruptedException {
		return open(url, Map.of());
	}

	/**
	 * Open a streaming GET request with additional headers for this request only, for example a
	 * {@code Range} header to continue a partial download.
	 */
	public HttpResponse<InputStream> open(String url, Map<String, String> extraHeaders)
			throws IOException, InterruptedException {
		return retry(() -> {
			HttpRequest.Builder builder = request(url).GET();
			extraHeaders.forEach(builder::header);
			return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
		});
	}

	/**
	 * Send a HEAD request, following redirects. Used to learn the server's name for a file before
	 * downloading it.
	 *
	 * @param url The URL to inspect
	 * @return The final response; {@link HttpResponse#uri()} is where the redirect chain ended
	 */
	public HttpResponse<Void> head(String url) throws IOException, InterruptedException {
		return retry(() -> httpClient.send(
				request(url).method("HEAD", HttpRequest.BodyPublishers.noBody()).build(),
				HttpResponse.BodyHandlers.discarding()));
	}

	public static boolean isSuccess(int statusCode) {
		return statusCode >= 200 && statusCode < 300;
	}

	private HttpRequest.Builder request(String url) {
		URI uri = URI.create(url);
		HttpRequest.Builder builder = HttpRequest.newBuilder().uri(uri).header("User-Agent", USER_AGENT);
		headers.forEach(builder::header);
		return builder;
	}

	/**
	 * Retry an operation with exponential backoff
	 *
	 * @param operation The operation to retry
	 * @return The result of the operation
	 * @throws IOException If all retry attempts fail
	 * @throws InterruptedException If the thread is interrupted during backoff
	 */
	private <T> T retry(IOSupplier<T> operation) throws IOException, InterruptedException {
		IOException lastException = null;
		for (int attempt = 0; attempt < maxRetries; attempt++) {
			try {
				return operation.get();
			} catch (IOException e) {
				lastException = e;
				if (attempt < maxRetries - 1) {
					// Exponential backoff: 2s, 4s, 8s, ...
					long backoffMillis = initialBackoff.toMillis() * (1L << attempt);
					Thread.sleep(backoffMillis);
				}
			}
		}
		throw lastException;
	}
}
