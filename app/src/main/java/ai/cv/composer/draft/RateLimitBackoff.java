package ai.cv.composer.draft;

import dev.langchain4j.exception.RateLimitException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Recognises rate-limited model calls and computes the pause before the next attempt. A delay suggested by the
 * provider ("retry in 12s", {@code "retryDelay": "12s"}) wins over the exponential schedule.
 */
final class RateLimitBackoff {

    private static final Pattern SUGGESTED_DELAY =
            Pattern.compile("(?:retry in |retryDelay\"?:\\s*\")(\\d+(?:\\.\\d+)?)s", Pattern.CASE_INSENSITIVE);

    private final int initialBackoffSeconds;
    private final int maxBackoffSeconds;
    private final double jitterFactor;

    RateLimitBackoff(int initialBackoffSeconds, int maxBackoffSeconds, double jitterFactor) {
        if (initialBackoffSeconds < 1) {
            throw new IllegalArgumentException("initialBackoffSeconds must be at least 1");
        }
        if (maxBackoffSeconds < initialBackoffSeconds) {
            throw new IllegalArgumentException("maxBackoffSeconds must be at least initialBackoffSeconds");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
        }
        this.initialBackoffSeconds = initialBackoffSeconds;
        this.maxBackoffSeconds = maxBackoffSeconds;
        this.jitterFactor = jitterFactor;
    }

    boolean isRateLimited(Throwable failure) {
        return causes(failure).anyMatch(cause -> cause instanceof RateLimitException || mentionsQuota(cause.getMessage()));
    }

    /**
     * Pause after the given failed attempt, counted from 1.
     */
    Duration delayAfter(int failedAttempt, Throwable failure) {
        return suggestedDelay(failure).orElseGet(() -> scheduledDelay(failedAttempt));
    }

    private Optional<Duration> suggestedDelay(Throwable failure) {
        return causes(failure)
                .map(Throwable::getMessage)
                .filter(Objects::nonNull)
                .map(SUGGESTED_DELAY::matcher)
                .filter(Matcher::find)
                .map(matcher -> Duration.ofMillis((long) (Double.parseDouble(matcher.group(1)) * 1000)))
                .findFirst();
    }

    private Duration scheduledDelay(int failedAttempt) {
        int doublings = Math.min(Math.max(failedAttempt - 1, 0), 20);
        long seconds = Math.min((long) initialBackoffSeconds << doublings, maxBackoffSeconds);
        double jitter = jitterFactor == 0.0 ? 1.0 : 1.0 + ThreadLocalRandom.current().nextDouble(-jitterFactor, jitterFactor);
        return Duration.ofSeconds(Math.max(1, Math.round(seconds * jitter)));
    }

    private static boolean mentionsQuota(String message) {
        return message != null && (message.contains("429") || message.contains("RESOURCE_EXHAUSTED"));
    }

    private static Stream<Throwable> causes(Throwable failure) {
        return Stream.iterate(failure, Objects::nonNull, Throwable::getCause);
    }
}
