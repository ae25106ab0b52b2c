package ai.cv.composer.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Model provider settings and retry policy for the draft stage.
 */
public record GeneratorConfig(LlmProvider provider,
                              String modelName,
                              Optional<String> baseUrl,
                              int maxRetryAttempts,
                              int initialBackoffSeconds,
                              int maxBackoffSeconds) {

    public GeneratorConfig {
        provider = Objects.requireNonNull(provider, "provider");
        modelName = requireNonBlank(modelName, "modelName");
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
        if (maxRetryAttempts < 1) {
            throw new IllegalArgumentException("maxRetryAttempts must be at least 1");
        }
        if (initialBackoffSeconds < 1 || maxBackoffSeconds < initialBackoffSeconds) {
            throw new IllegalArgumentException("Backoff must be positive and maxBackoffSeconds >= initialBackoffSeconds");
        }
    }

    public boolean isOllama() {
        return provider == LlmProvider.OLLAMA;
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
