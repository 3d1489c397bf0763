package com.delta.catalogcrawler.crawl.http;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.concurrent.CancelToken;
import com.delta.catalogcrawler.crawl.model.HttpFetchResult;
import com.delta.catalogcrawler.crawl.util.FetchErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * GET client shared by every catalog fetch. Limits global and per-host parallelism, spaces requests to the same
 * host, retries transient failures with jittered backoff and gives up as soon as the run's cancel token fires.
 */
@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);
    private static final Duration RATE_LIMIT_COOLDOWN = Duration.ofSeconds(30);
    private static final Duration PERMIT_POLL = Duration.ofMillis(200);

    private final CrawlerProperties properties;
    private final HttpClient client;
    private final Semaphore globalPermits;
    private final Map<String, HostGate> hosts = new ConcurrentHashMap<>();

    public PoliteHttpClient(
        CrawlerProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalPermits = new Semaphore(properties.getGlobalConcurrency());
    }

    public HttpFetchResult get(String url, String accept, CancelToken cancelToken) {
        CancelToken token = cancelToken == null ? CancelToken.create() : cancelToken;
        Instant startedAt = Instant.now();
        URI uri = toUri(url);
        if (uri == null) {
            return HttpFetchResult.failure(url, 0, elapsedSince(startedAt), FetchErrorClassifier.INVALID_URL, "not an absolute http(s) URL");
        }
        HostGate gate = hosts.computeIfAbsent(uri.getHost().toLowerCase(Locale.ROOT), host -> new HostGate(properties.getPerHostConcurrency()));
        int maxAttempts = 1 + properties.getRequestMaxRetries();
        HttpFetchResult result = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (token.isCancelled()) {
                return HttpFetchResult.failure(url, attempt - 1, elapsedSince(startedAt), FetchErrorClassifier.ABORTED, token.reason());
            }
            result = sendOnce(url, uri, accept, gate, attempt, startedAt, token);
            if (attempt == maxAttempts || !FetchErrorClassifier.isRetryable(result)) {
                return result;
            }
            Duration pause = backoff(attempt, result.retryAfter());
            log.debug("GET {} attempt {}/{} gave status={} error={}, retrying in {} ms",
                url, attempt, maxAttempts, result.statusCode(), result.errorCode(), pause.toMillis());
            if (!token.sleep(pause)) {
                return HttpFetchResult.failure(url, attempt, elapsedSince(startedAt), FetchErrorClassifier.ABORTED, token.reason());
            }
        }
        return result;
    }

    private HttpFetchResult sendOnce(
        String url,
        URI uri,
        String accept,
        HostGate gate,
        int attempt,
        Instant startedAt,
        CancelToken token
    ) {
        boolean global = false;
        boolean host = false;
        try {
            global = acquire(globalPermits, token);
            host = global && acquire(gate.permits, token);
            if (!host || !gate.awaitTurn(properties.getPerHostDelayMs(), token)) {
                return HttpFetchResult.failure(url, attempt, elapsedSince(startedAt), FetchErrorClassifier.ABORTED, token.reason());
            }
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", CrawlerProperties.normalizeUserAgent(properties.getUserAgent()))
                .header("Accept", accept == null || accept.isBlank() ? "*/*" : accept)
                .GET()
                .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            Duration retryAfter = retryAfter(response);
            if (response.statusCode() == 403 || response.statusCode() == 429) {
                gate.pushBack(retryAfter == null ? RATE_LIMIT_COOLDOWN : retryAfter);
            } else if (retryAfter != null) {
                gate.pushBack(retryAfter);
            }
            return HttpFetchResult.response(
                url,
                response.uri().toString(),
                response.statusCode(),
                response.body(),
                retryAfter,
                attempt,
                elapsedSince(startedAt)
            );
        } catch (HttpTimeoutException e) {
            return HttpFetchResult.failure(url, attempt, elapsedSince(startedAt), FetchErrorClassifier.TIMEOUT, e.getMessage());
        } catch (IOException e) {
            return HttpFetchResult.failure(url, attempt, elapsedSince(startedAt), FetchErrorClassifier.IO_ERROR, String.valueOf(e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HttpFetchResult.failure(url, attempt, elapsedSince(startedAt), FetchErrorClassifier.INTERRUPTED, "interrupted");
        } catch (RuntimeException e) {
            return HttpFetchResult.failure(url, attempt, elapsedSince(startedAt), FetchErrorClassifier.HTTP_ERROR, e.getMessage());
        } finally {
            if (host) {
                gate.permits.release();
            }
            if (global) {
                globalPermits.release();
            }
        }
    }

    private static boolean acquire(Semaphore semaphore, CancelToken token) throws InterruptedException {
        while (!token.isCancelled()) {
            if (semaphore.tryAcquire(PERMIT_POLL.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    private Duration backoff(int attempt, Duration retryAfter) {
        long base = properties.getRequestRetryBaseDelayMs();
        long cap = properties.getRequestRetryMaxDelayMs();
        long delay = base * (1L << Math.min(attempt - 1, 16));
        if (cap > 0) {
            delay = Math.min(delay, cap);
        }
        if (delay > 1) {
            delay = delay / 2 + ThreadLocalRandom.current().nextLong(delay / 2);
        }
        Duration pause = Duration.ofMillis(Math.max(0, delay));
        if (retryAfter != null && retryAfter.compareTo(pause) > 0) {
            return cap > 0 ? Duration.ofMillis(Math.min(retryAfter.toMillis(), cap)) : retryAfter;
        }
        return pause;
    }

    private static Duration retryAfter(HttpResponse<?> response) {
        return response.headers().firstValue("Retry-After")
            .map(String::trim)
            .filter(value -> value.matches("\\d{1,6}"))
            .map(value -> Duration.ofSeconds(Long.parseLong(value)))
            .orElse(null);
    }

    private static URI toUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            boolean http = "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
            return http && uri.getHost() != null ? uri : null;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static Duration elapsedSince(Instant startedAt) {
        return Duration.between(startedAt, Instant.now());
    }

    private static final class HostGate {
        private final Semaphore permits;
        private Instant nextAllowed = Instant.EPOCH;

        private HostGate(int concurrency) {
            this.permits = new Semaphore(concurrency);
        }

        /** Waits until the host's spacing allows another request; false if cancelled while waiting. */
        boolean awaitTurn(int spacingMs, CancelToken token) {
            Duration wait;
            synchronized (this) {
                Instant now = Instant.now();
                Instant slot = nextAllowed.isAfter(now) ? nextAllowed : now;
                nextAllowed = slot.plusMillis(spacingMs);
                wait = Duration.between(now, slot);
            }
            return wait.isZero() || wait.isNegative() || token.sleep(wait);
        }

        synchronized void pushBack(Duration cooldown) {
            Instant candidate = Instant.now().plus(cooldown);
            if (candidate.isAfter(nextAllowed)) {
                nextAllowed = candidate;
            }
        }
    }
}
