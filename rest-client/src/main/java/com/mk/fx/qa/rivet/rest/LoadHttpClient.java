package com.mk.fx.qa.rivet.rest;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import javax.net.ssl.SSLException;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link Transport} backed by {@link HttpClient}. Relative request URLs are resolved against an
 * optional base URL, and global headers are sent with every request unless the request overrides
 * them. This implementation does not include retry logic.
 */
@Slf4j
public class LoadHttpClient implements Transport, AutoCloseable {

  /** Default connection timeout in seconds. */
  public static final int DEFAULT_CONNECTION_TIMEOUT_SECONDS = 5;

  /** The underlying Java HTTP client. */
  private final HttpClient httpClient;

  /** Global headers to be included in all requests. */
  private final Map<String, String> headers;

  /** Base URL for relative requests, empty when requests always carry absolute URLs. */
  private final String baseUrl;

  /** Creates a client without base URL or global headers. */
  public LoadHttpClient() {
    this(null, DEFAULT_CONNECTION_TIMEOUT_SECONDS, Map.of());
  }

  /**
   * Constructs a client.
   *
   * @param baseUrl base URL for relative request URLs, may be {@code null}
   * @param connTimeOutSeconds connection timeout in seconds
   * @param headers global headers to include in all requests
   */
  public LoadHttpClient(String baseUrl, int connTimeOutSeconds, Map<String, String> headers) {
    this.baseUrl = normalizeBaseUrl(baseUrl);
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(Math.max(1, connTimeOutSeconds)))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    this.headers = headers != null ? Map.copyOf(headers) : Map.of();

    log.info(
        "LoadHttpClient initialised - Base URL: {}, Connection timeout: {}s",
        this.baseUrl.isEmpty() ? "<none>" : this.baseUrl,
        connTimeOutSeconds);
  }

  @Override
  public RestResponseData send(Request request, Duration timeout)
      throws TransportException, InterruptedException {
    Objects.requireNonNull(request, "Request cannot be null");
    Objects.requireNonNull(timeout, "timeout");

    var httpRequest = buildHttpRequest(request, timeout);
    log.debug("Executing {} request to {}", request.getMethod(), httpRequest.uri());

    var startTime = System.nanoTime();
    try {
      var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      var duration = (System.nanoTime() - startTime) / 1_000_000;
      log.debug("Request completed in {} ms with status {}", duration, response.statusCode());
      return buildResponseData(response, duration);
    } catch (HttpConnectTimeoutException e) {
      throw new TransportException(
          TransportException.Kind.CONNECTION, "Connection timed out: " + e.getMessage(), e);
    } catch (HttpTimeoutException e) {
      throw new TransportException(
          TransportException.Kind.TIMEOUT,
          "Request timed out after " + timeout.toMillis() + "ms",
          e);
    } catch (ConnectException | UnknownHostException | SSLException e) {
      throw new TransportException(
          TransportException.Kind.CONNECTION, "Connection failed: " + describe(e), e);
    } catch (IOException e) {
      throw new TransportException(
          TransportException.Kind.CONNECTION, "I/O error: " + describe(e), e);
    }
  }

  /**
   * Builds an HTTP request from the given request.
   *
   * @throws TransportException when the URL or method cannot be expressed as an HTTP request
   */
  private HttpRequest buildHttpRequest(Request request, Duration timeout)
      throws TransportException {
    if (request.getMethod() == null) {
      throw new TransportException(TransportException.Kind.PROTOCOL, "Request method is required");
    }
    try {
      var url = resolveUrl(request.getUrl());
      if (request.getQuery() != null && !request.getQuery().isEmpty()) {
        url += (url.contains("?") ? "&" : "?") + buildQueryString(request.getQuery());
      }

      var requestBuilder = HttpRequest.newBuilder().uri(URI.create(url)).timeout(timeout);

      // global headers
      headers.forEach(requestBuilder::header);

      // request-specific headers override
      if (request.getHeaders() != null) {
        request.getHeaders().forEach(requestBuilder::setHeader);
      }

      if (request.getBody() != null) {
        requestBuilder.method(
            request.getMethod().name(), HttpRequest.BodyPublishers.ofString(request.getBody()));
      } else {
        requestBuilder.method(request.getMethod().name(), HttpRequest.BodyPublishers.noBody());
      }
      return requestBuilder.build();
    } catch (IllegalArgumentException e) {
      throw new TransportException(
          TransportException.Kind.PROTOCOL, "Invalid request: " + e.getMessage(), e);
    }
  }

  private RestResponseData buildResponseData(HttpResponse<String> response, long durationMs) {
    var result = new RestResponseData();
    result.setStatusCode(response.statusCode());
    result.setHeaders(
        response.headers().map().entrySet().stream()
            .collect(Collectors.toMap(Map.Entry::getKey, e -> String.join(",", e.getValue()))));
    result.setBody(response.body());
    result.setResponseTimeMs(durationMs);
    return result;
  }

  private String resolveUrl(String url) {
    if (url == null || url.isBlank()) {
      throw new IllegalArgumentException("Request URL is required");
    }
    var trimmed = url.trim();
    if (trimmed.startsWith("http://") || trimmed.startsWith("https://") || baseUrl.isEmpty()) {
      return trimmed;
    }
    return baseUrl + (trimmed.startsWith("/") ? trimmed : "/" + trimmed);
  }

  private String buildQueryString(Map<String, String> query) {
    return query.entrySet().stream()
        .filter(e -> e.getKey() != null && e.getValue() != null)
        .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
        .collect(Collectors.joining("&"));
  }

  private String encode(String value) {
    return value != null ? URLEncoder.encode(value, StandardCharsets.UTF_8) : "";
  }

  private static String describe(Exception e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }

  private static String normalizeBaseUrl(String baseUrl) {
    if (baseUrl == null || baseUrl.isBlank()) {
      return "";
    }
    var trimmed = baseUrl.trim();
    return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
  }

  @Override
  public void close() {
    // HttpClient on JDK 17 has no close(); its executor threads are daemon threads.
  }
}
