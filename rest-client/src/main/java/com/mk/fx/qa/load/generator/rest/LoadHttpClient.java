package com.mk.fx.qa.load.generator.rest;

import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link TransportPort} backed by {@link HttpClient}. One instance keeps its own connection pool,
 * so each worker should own one. Responses are read to completion and their bodies discarded.
 * This implementation does not include retry logic and never throws for transport errors.
 */
@Slf4j
public class LoadHttpClient implements TransportPort, AutoCloseable {

    /** Default connection timeout in seconds. */
    private static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 3;

    private static final String DEFAULT_SCHEME = "http://";

    /** The underlying Java HTTP client. */
    private final HttpClient httpClient;

    /** Timeout applied to establishing a connection. */
    private final Duration connectTimeout;

    /** Constructs a LoadHttpClient with the default connection timeout. */
    public LoadHttpClient() {
        this(Duration.ofSeconds(DEFAULT_CONNECT_TIMEOUT_SECONDS));
    }

    /**
     * Constructs a LoadHttpClient with a specified connection timeout.
     *
     * @param connectTimeout connection timeout, usually the per-request timeout
     */
    public LoadHttpClient(Duration connectTimeout) {
        this.connectTimeout = validateTimeout(connectTimeout);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(this.connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();

        log.debug("LoadHttpClient initialised - Connection timeout: {}", this.connectTimeout);
    }

    /**
     * Executes a synchronous GET request.
     *
     * @param host target host, e.g. {@code 10.0.0.5} or {@code localhost:8080}
     * @param path request path
     * @param timeout request timeout
     * @return the status code, or the failure when no response was received
     */
    @Override
    public TransportResult get(String host, String path, Duration timeout) {
        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(host, path, timeout);
        } catch (IllegalArgumentException | NullPointerException e) {
            log.debug("Cannot build GET request for host={} path={}: {}", host, path, e.getMessage());
            return TransportResult.failed(new TransportFailure(FailureType.PROTOCOL_ERROR, e.getMessage()));
        }

        try {
            var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.discarding());
            log.trace("GET {} completed with status {}", httpRequest.uri(), response.statusCode());
            return TransportResult.response(response.statusCode());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("GET {} interrupted", httpRequest.uri());
            return TransportResult.failed(TransportFailure.from(e));
        } catch (Exception e) {
            var failure = TransportFailure.from(e);
            log.debug("GET {} failed ({}): {}", httpRequest.uri(), failure.type(), failure.message());
            return TransportResult.failed(failure);
        }
    }

    /**
     * Builds a GET request for {@code host} and {@code path}.
     *
     * @throws IllegalArgumentException if the host is blank or the resulting URI is invalid
     * @throws NullPointerException if the host is null
     */
    private HttpRequest buildHttpRequest(String host, String path, Duration timeout) {
        var uri = URI.create(buildUrl(host, path));
        var builder = HttpRequest.newBuilder()
                .uri(uri)
                .header("User-Agent", "http-load-generator/1.0")
                .GET();
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            builder.timeout(timeout);
        }
        return builder.build();
    }

    /**
     * Joins host and path into an absolute URL, prefixing {@code http://} when the host carries no
     * scheme.
     *
     * @throws IllegalArgumentException if the host is blank
     */
    public static String buildUrl(String host, String path) {
        Objects.requireNonNull(host, "Host cannot be null");
        var trimmed = host.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Host cannot be empty");
        }
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        var base = trimmed.contains("://") ? trimmed : DEFAULT_SCHEME + trimmed;
        if (path == null || path.isEmpty()) {
            return base + "/";
        }
        return path.startsWith("/") ? base + path : base + "/" + path;
    }

    private static Duration validateTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "Connection timeout cannot be null");
        Preconditions.checkArgument(
                !timeout.isZero() && !timeout.isNegative(), "Connection timeout must be positive: %s", timeout);
        return timeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    @Override
    public void close() {
        // HttpClient on JDK 17 has no close(); its pooled connections go with the instance
        log.trace("LoadHttpClient released");
    }
}
