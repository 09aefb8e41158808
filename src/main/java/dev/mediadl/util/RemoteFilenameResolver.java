package dev.mediadl.util;

import dev.mediadl.model.MediaType;
import java.io.IOException;
import java.net.http.HttpResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Names files the way the server does. A HEAD request is sent for each link and its
 * {@code Content-Disposition} header and final redirect location are used by
 * {@link FilenameInference}. When the request fails the name is inferred from the link alone.
 */
public class RemoteFilenameResolver {
	private static final Logger logger = LoggerFactory.getLogger(RemoteFilenameResolver.class);

	private final HttpUtils httpUtils;

	public RemoteFilenameResolver(HttpUtils httpUtils) {
		this.httpUtils = httpUtils;
	}

	public String resolve(String url, MediaType type) {
		try {
			HttpResponse<Void> response = httpUtils.head(url);
			if (HttpUtils.isSuccess(response.statusCode())) {
				return FilenameInference.infer(url, response.headers(), response.uri(), type);
			}
			logger.debug("HEAD {} returned {}, naming the file from the link", url, response.statusCode());
		} catch (IOException | IllegalArgumentException e) {
			logger.debug("HEAD {} failed, naming the file from the link: {}", url, e.getMessage());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
		return FilenameInference.infer(url, type);
	}
}
