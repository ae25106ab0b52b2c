package ai.cv.composer.draft;

import java.util.Locale;

/**
 * How the markup draft is obtained: from the language model, from the input unchanged, or from a canned mock.
 */
public enum DraftMode {
    PRODUCTION,
    PASS_THROUGH,
    MOCK;

    public static DraftMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PASS_THROUGH;
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (DraftMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported draft mode: " + raw);
    }
}
