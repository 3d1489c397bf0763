package com.delta.catalogcrawler.crawl.model;

import java.time.Duration;

/**
 * Outcome of one logical GET, after retries. Either a status code with body or an error code, never both.
 */
public record HttpFetchResult(
    String requestedUrl,
    String finalUrl,
    int statusCode,
    String body,
    Duration retryAfter,
    int attempts,
    Duration elapsed,
    String errorCode,
    String errorMessage
) {
    public static HttpFetchResult response(
        String requestedUrl,
        String finalUrl,
        int statusCode,
        String body,
        Duration retryAfter,
        int attempts,
        Duration elapsed
    ) {
        return new HttpFetchResult(requestedUrl, finalUrl, statusCode, body, retryAfter, attempts, elapsed, null, null);
    }

    public static HttpFetchResult failure(String requestedUrl, int attempts, Duration elapsed, String errorCode, String errorMessage) {
        return new HttpFetchResult(requestedUrl, null, 0, null, null, attempts, elapsed, errorCode, errorMessage);
    }

    public boolean isSuccessful() {
        return errorCode == null && statusCode >= 200 && statusCode < 300;
    }

    public String finalUrlOrRequested() {
        return finalUrl == null ? requestedUrl : finalUrl;
    }
}
