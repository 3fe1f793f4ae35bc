package com.mineralink.harvester.fetch;

import static com.google.common.net.HttpHeaders.*;

import com.google.common.util.concurrent.RateLimiter;
import com.mineralink.harvester.config.HarvesterConfig;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;

/**
 * The seam between the harvester and the network: issues one GET and returns the status and body.
 * <p>
 * Classifying the response is left to callers so that a non-2xx status is never an exception here, only transport
 * failures are.
 */
@FunctionalInterface
public interface QueryClient {

  /**
   * Sends a GET request to {@code uri}.
   *
   * @throws IOException          on a connection failure or when {@code timeout} elapses
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  Response get(URI uri, Duration timeout) throws IOException, InterruptedException;

  /** Returns a client backed by the JDK HTTP client, configured from {@code config}. */
  static QueryClient create(HarvesterConfig config) {
    HttpClient client = HttpClient.newBuilder()
      .connectTimeout(config.httpTimeout())
      .followRedirects(HttpClient.Redirect.NORMAL)
      .build();
    QueryClient result = wrap(client, config.httpUserAgent());
    if (config.maxRequestsPerSecond() > 0) {
      result = rateLimited(result, RateLimiter.create(config.maxRequestsPerSecond()));
    }
    return result;
  }

  static QueryClient wrap(HttpClient client, String userAgent) {
    return (uri, timeout) -> {
      HttpRequest request = HttpRequest.newBuilder(uri)
        .timeout(timeout)
        .header(USER_AGENT, userAgent)
        .header(ACCEPT, "application/json")
        .header(ACCEPT_ENCODING, "gzip")
        .GET()
        .build();
      var response = client.send(request, BodyHandlers.ofInputStream());
      String encoding = response.headers().firstValue(CONTENT_ENCODING).orElse("");
      try (InputStream body = response.body()) {
        InputStream is = switch (encoding) {
          case "gzip" -> new GZIPInputStream(body);
          case "deflate" -> new InflaterInputStream(body);
          default -> body;
        };
        return new Response(response.statusCode(), new String(is.readAllBytes(), StandardCharsets.UTF_8));
      }
    };
  }

  /** Returns a client that waits for a permit from {@code limiter} before each request to {@code delegate}. */
  static QueryClient rateLimited(QueryClient delegate, RateLimiter limiter) {
    return (uri, timeout) -> {
      limiter.acquire();
      return delegate.get(uri, timeout);
    };
  }

  /** The status code and decoded body of a response. */
  record Response(int statusCode, String body) {

    public boolean isSuccess() {
      return statusCode >= 200 && statusCode < 300;
    }
  }
}
