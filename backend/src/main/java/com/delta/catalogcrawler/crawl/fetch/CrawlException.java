package com.delta.catalogcrawler.crawl.fetch;

/**
 * Failure of a single fetch, parse or setup step, tagged with its {@link CrawlErrorKind}.
 */
public class CrawlException extends RuntimeException {
    private final CrawlErrorKind kind;

    public CrawlException(CrawlErrorKind kind, String message) {
        super(message);
        this.kind = kind == null ? CrawlErrorKind.UNKNOWN : kind;
    }

    public CrawlException(CrawlErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind == null ? CrawlErrorKind.UNKNOWN : kind;
    }

    public CrawlErrorKind kind() {
        return kind;
    }

    public boolean isAborted() {
        return kind == CrawlErrorKind.ABORTED;
    }

    public static CrawlException aborted(String reason) {
        return new CrawlException(CrawlErrorKind.ABORTED, "aborted: " + (reason == null ? "cancelled" : reason));
    }

    public static CrawlException initialization(String message) {
        return new CrawlException(CrawlErrorKind.INITIALIZATION, message);
    }
}
