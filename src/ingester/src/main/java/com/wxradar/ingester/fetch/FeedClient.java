package com.wxradar.ingester.fetch;

import com.wxradar.ingester.config.IngesterProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.zip.GZIPInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Downloads feed files, skipping the download when the upstream copy has not changed.
 *
 * <p>A HEAD probe is sent first; its {@code Last-Modified} header is compared with the caller's
 * last successful update. The HEAD probe and the whole GET exchange, body included, are each
 * bounded by the configured request timeout; the body is buffered before parsing starts.
 */
@Component
public class FeedClient {
  private static final Logger log = LoggerFactory.getLogger(FeedClient.class);
  private static final int HTTP_OK = 200;

  private final HttpClient httpClient;
  private final Duration requestTimeout;
  private final Counter successCounter;
  private final Counter notModifiedCounter;
  private final Counter httpErrorCounter;
  private final Counter exceptionCounter;

  public FeedClient(HttpClient httpClient, IngesterProperties properties, MeterRegistry meterRegistry) {
    this.httpClient = httpClient;
    this.requestTimeout = properties.http().requestTimeout();
    this.successCounter = outcomeCounter(meterRegistry, "success");
    this.notModifiedCounter = outcomeCounter(meterRegistry, "not_modified");
    this.httpErrorCounter = outcomeCounter(meterRegistry, "http_error");
    this.exceptionCounter = outcomeCounter(meterRegistry, "exception");
  }

  /**
   * Opens the feed body when it changed after {@code lastUpdated}.
   *
   * @param url feed URL; a {@code .gz} suffix means the body is gzip-compressed
   * @param lastUpdated start of the caller's last successful update
   * @return the body stream, which the caller must close, or empty when not modified
   * @throws FeedTransportException on network failure, timeout or non-200 status
   */
  public Optional<InputStream> fetchIfModified(String url, Instant lastUpdated) {
    URI uri = URI.create(url);
    try {
      HttpRequest head = HttpRequest.newBuilder(uri)
          .timeout(requestTimeout)
          .method("HEAD", HttpRequest.BodyPublishers.noBody())
          .build();
      HttpResponse<Void> headResponse = httpClient.send(head, HttpResponse.BodyHandlers.discarding());
      if (headResponse.statusCode() != HTTP_OK) {
        httpErrorCounter.increment();
        throw new FeedTransportException(
            String.format("HEAD request to %s resulted in code %d", url, headResponse.statusCode()));
      }
      Optional<Instant> lastModified = parseLastModified(url, headResponse.headers().firstValue("Last-Modified"));
      if (lastModified.isPresent() && !lastModified.get().isAfter(lastUpdated)) {
        notModifiedCounter.increment();
        log.debug("{} last modified {}, not newer than {}", url, lastModified.get(), lastUpdated);
        return Optional.empty();
      }

      HttpRequest get = HttpRequest.newBuilder(uri).timeout(requestTimeout).GET().build();
      HttpResponse<byte[]> response = sendWithDeadline(url, get);
      if (response.statusCode() != HTTP_OK) {
        httpErrorCounter.increment();
        throw new FeedTransportException(
            String.format("Request to %s resulted in code %d", url, response.statusCode()));
      }
      successCounter.increment();
      return Optional.of(decode(url, response));
    } catch (IOException ex) {
      exceptionCounter.increment();
      throw new FeedTransportException("Request to " + url + " failed: " + ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      exceptionCounter.increment();
      Thread.currentThread().interrupt();
      throw new FeedTransportException("Request to " + url + " interrupted", ex);
    }
  }

  private Optional<Instant> parseLastModified(String url, Optional<String> header) {
    if (header.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(ZonedDateTime.parse(header.get(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());
    } catch (DateTimeParseException ex) {
      httpErrorCounter.increment();
      throw new FeedTransportException(
          String.format("Cannot parse Last-Modified: %s (requested %s)", header.get(), url), ex);
    }
  }

  // The request timeout only covers the wait for headers; the deadline here also covers the body.
  private HttpResponse<byte[]> sendWithDeadline(String url, HttpRequest request)
      throws IOException, InterruptedException {
    CompletableFuture<HttpResponse<byte[]>> pending =
        httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
    try {
      return pending.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      pending.cancel(true);
      exceptionCounter.increment();
      throw new FeedTransportException(
          String.format("Request to %s timed out after %s", url, requestTimeout), ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      if (cause instanceof IOException io) {
        throw io;
      }
      exceptionCounter.increment();
      throw new FeedTransportException("Request to " + url + " failed: " + cause.getMessage(), cause);
    }
  }

  private InputStream decode(String url, HttpResponse<byte[]> response) throws IOException {
    InputStream body = new ByteArrayInputStream(response.body());
    String encoding = response.headers().firstValue("Content-Encoding").orElse("");
    boolean gzipped = url.toLowerCase(Locale.ROOT).endsWith(".gz") || "gzip".equalsIgnoreCase(encoding);
    return gzipped ? new GZIPInputStream(body) : body;
  }

  private static Counter outcomeCounter(MeterRegistry meterRegistry, String outcome) {
    return Counter.builder("ingester.feed.http.requests.total")
        .description("Feed HTTP requests (by outcome)")
        .tag("outcome", outcome)
        .register(meterRegistry);
  }
}
