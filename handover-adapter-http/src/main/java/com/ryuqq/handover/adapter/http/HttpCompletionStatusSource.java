package com.ryuqq.handover.adapter.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.handover.core.exception.JobQueryException;
import com.ryuqq.handover.core.spi.CompletionReport;
import com.ryuqq.handover.core.spi.CompletionStatusSource;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Reads a completion report from an arbitrary status URL.
 *
 * <p>The URL must answer with {@code {"status": ..., "subject": ..., "body": ...}}.
 * Transport failures and non-2xx answers are retryable; an unreadable body is a
 * malformed-response failure.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class HttpCompletionStatusSource implements CompletionStatusSource {

    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final JobStatusParser parser;

    public HttpCompletionStatusSource() {
        this(HttpClient.newBuilder().connectTimeout(HttpJobClientConfig.DEFAULT_CONNECT_TIMEOUT).build(),
            HttpJobClientConfig.DEFAULT_REQUEST_TIMEOUT);
    }

    public HttpCompletionStatusSource(HttpClient httpClient, Duration requestTimeout) {
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        if (requestTimeout == null) {
            throw new IllegalArgumentException("requestTimeout cannot be null");
        }
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
        this.parser = new JobStatusParser(new ObjectMapper());
    }

    @Override
    public CompletionReport fetch(String statusUrl) {
        if (statusUrl == null || statusUrl.isBlank()) {
            throw new IllegalArgumentException("statusUrl cannot be null or blank");
        }
        HttpRequest request = HttpRequest.newBuilder(URI.create(statusUrl))
            .timeout(requestTimeout)
            .header("Accept", "application/json")
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new JobQueryException("Status URL unreachable: " + statusUrl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobQueryException("Interrupted while reading " + statusUrl, e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new JobQueryException("Status URL " + statusUrl + " returned HTTP " + response.statusCode());
        }
        return parser.parseCompletion(response.body());
    }
}
