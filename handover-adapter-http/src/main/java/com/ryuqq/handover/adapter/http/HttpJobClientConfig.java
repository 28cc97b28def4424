package com.ryuqq.handover.adapter.http;

import java.net.URI;
import java.time.Duration;

/**
 * Connection settings for one job service endpoint.
 *
 * @param baseUri service root; jobs live under {@code {baseUri}/jobs}
 * @param connectTimeout TCP connect timeout
 * @param requestTimeout per-request timeout
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record HttpJobClientConfig(
    URI baseUri,
    Duration connectTimeout,
    Duration requestTimeout
) {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    public HttpJobClientConfig {
        if (baseUri == null) {
            throw new IllegalArgumentException("baseUri cannot be null");
        }
        if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
    }

    public static HttpJobClientConfig of(String baseUri) {
        if (baseUri == null || baseUri.isBlank()) {
            throw new IllegalArgumentException("baseUri cannot be null or blank");
        }
        return new HttpJobClientConfig(URI.create(baseUri), DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT);
    }

    public HttpJobClientConfig withRequestTimeout(Duration requestTimeout) {
        return new HttpJobClientConfig(baseUri, connectTimeout, requestTimeout);
    }

    /**
     * @return {@code {baseUri}/jobs} without a doubled slash
     */
    URI jobsUri() {
        String base = baseUri.toString();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + "/jobs");
    }
}
