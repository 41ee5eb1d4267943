package com.basecamp.sdk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link BasecampTransport} backed by the JDK {@link HttpClient}.
 *
 * <p>
 * Redirects are never followed, so a bearer token cannot leak to another origin through
 * a {@code Location} header.
 */
public class JdkHttpTransport implements BasecampTransport {

	private static final Logger logger = LoggerFactory.getLogger(JdkHttpTransport.class);

	private final HttpClient httpClient;

	private final Duration requestTimeout;

	public JdkHttpTransport(Duration timeout) {
		this(HttpClient.newBuilder()
			.connectTimeout(timeout)
			.followRedirects(HttpClient.Redirect.NEVER)
			.build(), timeout);
	}

	public JdkHttpTransport(HttpClient httpClient, Duration requestTimeout) {
		this.httpClient = httpClient;
		this.requestTimeout = requestTimeout;
	}

	@Override
	public TransportResponse execute(TransportRequest request) throws IOException, InterruptedException {
		HttpRequest.Builder builder = HttpRequest.newBuilder().uri(request.uri()).timeout(requestTimeout);
		request.headers().forEach(builder::header);

		HttpRequest.BodyPublisher publisher = request.hasBody() ? HttpRequest.BodyPublishers.ofByteArray(request.body())
				: HttpRequest.BodyPublishers.noBody();
		builder.method(request.method().name(), publisher);

		logger.debug("{} {}", request.method(), request.uri());
		long start = System.currentTimeMillis();
		try {
			HttpResponse<byte[]> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
			logger.debug("{} {} -> {} in {}ms ({} bytes)", request.method(), request.uri(), response.statusCode(),
					System.currentTimeMillis() - start, response.body().length);
			return new TransportResponse(response.statusCode(), response.headers().map(), response.body());
		}
		catch (IOException e) {
			logger.debug("{} {} failed after {}ms: {}", request.method(), request.uri(),
					System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

}
