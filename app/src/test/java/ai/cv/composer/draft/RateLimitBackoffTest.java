package ai.cv.composer.draft;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.exception.RateLimitException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class RateLimitBackoffTest {

    private final RateLimitBackoff backoff = new RateLimitBackoff(2, 10, 0.0);

    @Test
    void recognisesRateLimitsAnywhereInTheCauseChain() {
        assertThat(backoff.isRateLimited(new DraftGenerationException("x", new RateLimitException("slow down")))).isTrue();
        assertThat(backoff.isRateLimited(new DraftGenerationException("x", new RuntimeException("HTTP 429")))).isTrue();
        assertThat(backoff.isRateLimited(new RuntimeException("status RESOURCE_EXHAUSTED"))).isTrue();
        assertThat(backoff.isRateLimited(new DraftGenerationException("x", new RuntimeException("timeout")))).isFalse();
    }

    @Test
    void doublesDelayUpToTheCap() {
        Throwable failure = new RuntimeException("429");

        assertThat(backoff.delayAfter(1, failure)).isEqualTo(Duration.ofSeconds(2));
        assertThat(backoff.delayAfter(2, failure)).isEqualTo(Duration.ofSeconds(4));
        assertThat(backoff.delayAfter(3, failure)).isEqualTo(Duration.ofSeconds(8));
        assertThat(backoff.delayAfter(4, failure)).isEqualTo(Duration.ofSeconds(10));
        assertThat(backoff.delayAfter(40, failure)).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void prefersProviderSuggestedDelay() {
        Throwable failure = new DraftGenerationException("x",
                new RuntimeException("RESOURCE_EXHAUSTED {\"retryDelay\": \"17s\"}"));

        assertThat(backoff.delayAfter(1, failure)).isEqualTo(Duration.ofSeconds(17));
    }

    @Test
    void jitterStaysWithinBounds() {
        RateLimitBackoff jittered = new RateLimitBackoff(10, 10, 0.3);

        for (int i = 0; i < 50; i++) {
            assertThat(jittered.delayAfter(1, new RuntimeException("429")).toSeconds()).isBetween(7L, 13L);
        }
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new RateLimitBackoff(0, 10, 0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RateLimitBackoff(5, 4, 0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RateLimitBackoff(1, 4, 1.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
