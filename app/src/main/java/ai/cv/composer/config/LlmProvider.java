package ai.cv.composer.config;

import java.util.Locale;

/**
 * Supported large language model providers, each with the model used when {@code LLM_MODEL} is unset.
 */
public enum LlmProvider {
    GEMINI("gemini-1.5-flash"),
    OLLAMA("llama3.1:8b");

    private final String defaultModel;

    LlmProvider(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public String defaultModel() {
        return defaultModel;
    }

    public boolean needsApiKey() {
        return this == GEMINI;
    }

    public static LlmProvider from(String value) {
        if (value == null || value.isBlank()) {
            return OLLAMA;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (LlmProvider provider : values()) {
            if (provider.name().equals(normalized)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unsupported LLM provider: " + value);
    }
}
