package com.delta.catalogcrawler.crawl.util;

import com.delta.catalogcrawler.crawl.fetch.CrawlErrorKind;
import com.delta.catalogcrawler.crawl.fetch.CrawlException;
import com.delta.catalogcrawler.crawl.model.HttpFetchResult;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

public final class FetchErrorClassifier {
  public static final String TIMEOUT = "timeout";
  public static final String IO_ERROR = "io_error";
  public static final String INTERRUPTED = "interrupted";
  public static final String ABORTED = "aborted";
  public static final String HTTP_ERROR = "http_error";
  public static final String INVALID_URL = "invalid_url";

  private FetchErrorClassifier() {}

  public static CrawlErrorKind fromHttpResult(HttpFetchResult result) {
    if (result == null) {
      return CrawlErrorKind.UNKNOWN;
    }
    if (result.errorCode() != null) {
      return fromErrorCode(result.errorCode());
    }
    return fromHttpStatus(result.statusCode());
  }

  public static CrawlErrorKind fromErrorCode(String errorCode) {
    if (errorCode == null || errorCode.isBlank()) {
      return CrawlErrorKind.UNKNOWN;
    }
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.contains(TIMEOUT)) {
      return CrawlErrorKind.TIMEOUT;
    }
    if (code.equals(INTERRUPTED) || code.equals(ABORTED)) {
      return CrawlErrorKind.ABORTED;
    }
    if (code.equals(IO_ERROR) || code.equals(HTTP_ERROR) || code.equals(INVALID_URL)) {
      return CrawlErrorKind.NAVIGATION;
    }
    return CrawlErrorKind.UNKNOWN;
  }

  public static CrawlErrorKind fromHttpStatus(int status) {
    if (status == 408) {
      return CrawlErrorKind.TIMEOUT;
    }
    if (status >= 200 && status < 300) {
      return CrawlErrorKind.UNKNOWN;
    }
    return CrawlErrorKind.NAVIGATION;
  }

  public static CrawlErrorKind fromThrowable(Throwable error) {
    Throwable current = unwrap(error);
    if (current instanceof CrawlException crawlException) {
      return crawlException.kind();
    }
    if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
      return CrawlErrorKind.TIMEOUT;
    }
    if (current instanceof InterruptedException
        || current instanceof CancellationException
        || (current instanceof InterruptedIOException && !(current instanceof SocketTimeoutException))) {
      return CrawlErrorKind.ABORTED;
    }
    if (current instanceof IOException) {
      return CrawlErrorKind.NAVIGATION;
    }
    return CrawlErrorKind.UNKNOWN;
  }

  public static CrawlException toCrawlException(Throwable error, String context) {
    Throwable current = unwrap(error);
    if (current instanceof CrawlException crawlException) {
      return crawlException;
    }
    String message = current == null ? "unknown error" : current.getClass().getSimpleName() + ": " + current.getMessage();
    return new CrawlException(fromThrowable(current), context + ": " + message, current);
  }

  public static boolean isRetryable(HttpFetchResult result) {
    if (result == null) {
      return false;
    }
    String errorCode = result.errorCode();
    if (errorCode != null && !errorCode.isBlank()) {
      return !errorCode.equals(INVALID_URL) && !errorCode.equals(INTERRUPTED) && !errorCode.equals(ABORTED);
    }
    int status = result.statusCode();
    return status == 408 || status == 429 || status >= 500;
  }

  public static boolean allowsFallback(CrawlErrorKind kind) {
    if (kind == null) {
      return false;
    }
    return switch (kind) {
      case NAVIGATION, TIMEOUT, UNKNOWN -> true;
      default -> false;
    };
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
