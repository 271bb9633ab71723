package io.lingualearn.core.resilience;

import io.lingualearn.core.error.EmbeddingProviderException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a failure is worth another attempt.
 *
 * <p>Transient: HTTP 429, 500, 502, 503, 504 and timeouts. Non-retryable: invalid input,
 * content-policy rejections and HTTP 400/401/403. The non-retryable check wins.
 */
public final class RetryClassifier {
    private static final Set<Integer> TRANSIENT_STATUS = Set.of(429, 500, 502, 503, 504);
    private static final Set<Integer> FATAL_STATUS = Set.of(400, 401, 403);
    // a bare number is not a status: it must follow "http"/"status"/"code" or precede its reason phrase
    private static final Pattern STATUS_IN_MESSAGE = Pattern.compile(
        "\\b(?:http|status|code)[\\s:=/]*(?:429|500|502|503|504)\\b"
            + "|\\b(?:429 too many requests|500 internal server error|502 bad gateway"
            + "|503 service unavailable|504 gateway timeout)\\b");
    private static final Pattern RETRY_AFTER_IN_MESSAGE =
        Pattern.compile("retry after (\\d{1,9}) second", Pattern.CASE_INSENSITIVE);
    static final Duration MAX_RETRY_AFTER = Duration.ofMinutes(5);
    private static final Set<String> FATAL_MARKERS = Set.of("invalid_prompt", "content_policy", "violating");

    public boolean isTransient(Throwable error) {
        for (Throwable current = error; current != null; current = next(current)) {
            if (current instanceof EmbeddingProviderException provider
                && TRANSIENT_STATUS.contains(provider.statusCode())) {
                return true;
            }
            if (current instanceof InterruptedIOException || current instanceof TimeoutException) {
                return true;
            }
            String message = lower(current);
            if (STATUS_IN_MESSAGE.matcher(message).find() || message.contains("timeout") || message.contains("timed out")) {
                return true;
            }
        }
        return false;
    }

    public boolean isNonRetryable(Throwable error) {
        if (error instanceof CancellationException) {
            return true;
        }
        for (Throwable current = error; current != null; current = next(current)) {
            if (current instanceof EmbeddingProviderException provider
                && FATAL_STATUS.contains(provider.statusCode())) {
                return true;
            }
            String message = lower(current);
            for (String marker : FATAL_MARKERS) {
                if (message.contains(marker)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Server-supplied wait hint, from a {@link RetryAfterAware} error or a
     * "retry after N seconds" message, capped at {@link #MAX_RETRY_AFTER}. Hints too long to parse
     * are ignored.
     */
    public Optional<Duration> retryAfter(Throwable error) {
        for (Throwable current = error; current != null; current = next(current)) {
            if (current instanceof RetryAfterAware aware && aware.retryAfter().isPresent()) {
                return aware.retryAfter().map(RetryClassifier::capped);
            }
            Matcher matcher = RETRY_AFTER_IN_MESSAGE.matcher(current.getMessage() == null ? "" : current.getMessage());
            if (matcher.find()) {
                return Optional.of(capped(Duration.ofSeconds(Long.parseLong(matcher.group(1)))));
            }
        }
        return Optional.empty();
    }

    private static Duration capped(Duration hint) {
        if (hint.isNegative()) {
            return Duration.ZERO;
        }
        return hint.compareTo(MAX_RETRY_AFTER) > 0 ? MAX_RETRY_AFTER : hint;
    }

    private static Throwable next(Throwable current) {
        Throwable cause = current.getCause();
        return cause == current ? null : cause;
    }

    private static String lower(Throwable error) {
        return error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
    }
}
