package ai.cv.composer.draft;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the model-facing CV operations for a {@link DraftMode}: drafting the markup, reviewing the CV and asking for
 * missing information. Rate-limited calls are retried with capped exponential backoff. A blank draft falls back to
 * the source text; blank feedback is an error.
 */
public class DraftService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DraftService.class);

    /**
     * Blocks the calling thread between retry attempts.
     */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final DraftGeneratorFactory generatorFactory;
    private final int maxAttempts;
    private final RateLimitBackoff backoff;
    private final Sleeper sleeper;

    public DraftService(DraftGeneratorFactory generatorFactory) {
        this(generatorFactory, 4, 2, 30, 0.3);
    }

    public DraftService(DraftGeneratorFactory generatorFactory,
                        int maxAttempts, int initialBackoffSeconds, int maxBackoffSeconds, double jitterFactor) {
        this(generatorFactory, maxAttempts, initialBackoffSeconds, maxBackoffSeconds, jitterFactor,
                duration -> Thread.sleep(duration.toMillis()));
    }

    DraftService(DraftGeneratorFactory generatorFactory,
                 int maxAttempts, int initialBackoffSeconds, int maxBackoffSeconds, double jitterFactor,
                 Sleeper sleeper) {
        this.generatorFactory = Objects.requireNonNull(generatorFactory, "generatorFactory");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.backoff = new RateLimitBackoff(initialBackoffSeconds, maxBackoffSeconds, jitterFactor);
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public String draft(DraftRequest request, DraftMode mode) {
        Objects.requireNonNull(request, "request");
        DraftGenerator generator = generatorFactory.select(mode);
        LOGGER.info("Drafting {} CV in {} using {} mode", request.cvFormat(), request.language(), mode);
        String markup = callWithRetry("draft", () -> generator.generate(request));
        if (markup == null || markup.isBlank()) {
            LOGGER.warn("Received blank draft in {} mode; falling back to source text", mode);
            return request.sourceText();
        }
        LOGGER.debug("Draft markup:\n{}", markup);
        return markup;
    }

    public String review(DraftRequest request, DraftMode mode) {
        Objects.requireNonNull(request, "request");
        CvAdvisor advisor = generatorFactory.selectAdvisor(mode);
        LOGGER.info("Reviewing CV using {} mode", mode);
        return requireFeedback("review", callWithRetry("review", () -> advisor.review(request)));
    }

    public String missingInformation(DraftRequest request, DraftMode mode) {
        Objects.requireNonNull(request, "request");
        CvAdvisor advisor = generatorFactory.selectAdvisor(mode);
        LOGGER.info("Checking CV for missing sections in {} using {} mode", request.language(), mode);
        return requireFeedback("missing information check",
                callWithRetry("missing information check", () -> advisor.missingInformation(request)));
    }

    public String perform(CvAction action, DraftRequest request, DraftMode mode) {
        return switch (Objects.requireNonNull(action, "action")) {
            case DRAFT -> draft(request, mode);
            case REVIEW -> review(request, mode);
            case MISSING_INFO -> missingInformation(request, mode);
        };
    }

    private String callWithRetry(String operation, Supplier<String> call) {
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (DraftGenerationException ex) {
                if (!backoff.isRateLimited(ex)) {
                    throw ex;
                }
                if (attempt >= maxAttempts) {
                    LOGGER.error("CV {} still rate limited after {} attempts", operation, maxAttempts);
                    throw ex;
                }
                Duration delay = backoff.delayAfter(attempt, ex);
                LOGGER.warn("CV {} rate limited on attempt {}/{}; waiting {} ms", operation, attempt, maxAttempts,
                        delay.toMillis());
                pause(delay, ex);
            }
        }
    }

    private void pause(Duration delay, DraftGenerationException pending) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            pending.addSuppressed(interrupted);
            throw pending;
        }
    }

    private static String requireFeedback(String operation, String feedback) {
        if (feedback == null || feedback.isBlank()) {
            throw new DraftGenerationException("Model returned an empty CV " + operation, null);
        }
        return feedback.strip();
    }
}
